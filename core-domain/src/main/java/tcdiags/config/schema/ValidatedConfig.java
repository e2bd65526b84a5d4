package tcdiags.config.schema;

import lombok.Getter;
import tcdiags.domain.exception.ConfigException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Resultado tipado de una validación. Contiene exactamente las claves del esquema.
 */
public final class ValidatedConfig {

    @Getter
    private final String schemaName;
    private final Map<String, Object> values;
    private final Set<String> defaulted;
    @Getter
    private final String validationTable;

    ValidatedConfig(String schemaName, Map<String, Object> values, Set<String> defaulted, String validationTable) {
        this.schemaName = schemaName;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        this.defaulted = Set.copyOf(defaulted);
        this.validationTable = validationTable;
    }

    public Set<String> keys() {
        return values.keySet();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public boolean isDefaulted(String key) {
        return defaulted.contains(key);
    }

    public boolean has(String key) {
        return values.get(key) != null;
    }

    public String getString(String key) {
        return (String) require(key);
    }

    public double getDouble(String key) {
        return (Double) require(key);
    }

    public int getInt(String key) {
        return (Integer) require(key);
    }

    public boolean getBoolean(String key) {
        return (Boolean) require(key);
    }

    @SuppressWarnings("unchecked")
    public List<Double> getDoubleList(String key) {
        return (List<Double>) require(key);
    }

    @SuppressWarnings("unchecked")
    public List<String> getStringList(String key) {
        return (List<String>) require(key);
    }

    @SuppressWarnings("unchecked")
    public List<Map<String, Double>> getNumberMapList(String key) {
        return (List<Map<String, Double>>) require(key);
    }

    private Object require(String key) {
        if (!values.containsKey(key)) {
            throw new ConfigException(String.format(
                    "La clave '%s' no está declarada en el esquema '%s'.", key, schemaName));
        }
        Object value = values.get(key);
        if (value == null) {
            throw new ConfigException(String.format(
                    "La clave '%s' del esquema '%s' no tiene valor.", key, schemaName));
        }
        return value;
    }
}
