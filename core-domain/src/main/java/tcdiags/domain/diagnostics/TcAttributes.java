package tcdiags.domain.diagnostics;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Bolsa inmutable de valores calculados para un TC, indexada por nombre.
 */
public final class TcAttributes {

    @Getter
    private final String tcId;
    private final Map<String, DiagnosticValue> values;

    private TcAttributes(String tcId, Map<String, DiagnosticValue> values) {
        this.tcId = tcId;
        this.values = Collections.unmodifiableMap(values);
    }

    public static Builder builder(String tcId) {
        return new Builder(tcId);
    }

    public Map<String, DiagnosticValue> values() {
        return values;
    }

    public Optional<DiagnosticValue> find(String name) {
        return Optional.ofNullable(values.get(name));
    }

    public DiagnosticValue get(String name) {
        DiagnosticValue value = values.get(name);
        if (value == null) {
            throw new NoSuchElementException("El TC " + tcId + " no tiene el atributo '" + name + "'.");
        }
        return value;
    }

    public double scalar(String name) {
        return get(name).scalar();
    }

    public static final class Builder {
        private final String tcId;
        private final Map<String, DiagnosticValue> values = new LinkedHashMap<>();

        private Builder(String tcId) {
            this.tcId = tcId;
        }

        public Builder put(DiagnosticValue value) {
            if (values.containsKey(value.name())) {
                throw new IllegalStateException("Atributo duplicado '" + value.name() + "' para el TC " + tcId);
            }
            values.put(value.name(), value);
            return this;
        }

        public Builder scalar(String name, String units, String description, double value) {
            return put(DiagnosticValue.scalar(name, units, description, value));
        }

        public TcAttributes build() {
            return new TcAttributes(tcId, new LinkedHashMap<>(values));
        }
    }
}
