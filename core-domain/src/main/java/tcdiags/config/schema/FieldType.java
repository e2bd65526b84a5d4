package tcdiags.config.schema;

import tcdiags.domain.exception.ConfigException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Tipos admitidos en un esquema de configuración y sus reglas de coerción.
 * <p>
 * Las coerciones son deliberadamente estrechas: cadena → número, cadena → booleano,
 * número entero → int y escalar → lista de un elemento. Cualquier otra conversión
 * es un {@link ConfigException}.
 */
public enum FieldType {

    STRING {
        @Override
        Object coerceValue(String key, Object raw) {
            if (raw instanceof String || raw instanceof Number || raw instanceof Boolean) {
                return raw.toString();
            }
            throw mismatch(key, raw);
        }
    },

    DOUBLE {
        @Override
        Object coerceValue(String key, Object raw) {
            return toDouble(key, raw);
        }
    },

    INTEGER {
        @Override
        Object coerceValue(String key, Object raw) {
            double value = toDouble(key, raw);
            if (Double.isNaN(value) || Double.isInfinite(value) || value != Math.rint(value)) {
                throw new ConfigException(String.format(
                        "La clave '%s' requiere un entero y recibió '%s'.", key, raw));
            }
            return (int) value;
        }
    },

    BOOLEAN {
        @Override
        Object coerceValue(String key, Object raw) {
            if (raw instanceof Boolean) {
                return raw;
            }
            if (raw instanceof String s) {
                String normalized = s.trim().toLowerCase(Locale.ROOT);
                if (normalized.equals("true") || normalized.equals("yes")) {
                    return Boolean.TRUE;
                }
                if (normalized.equals("false") || normalized.equals("no")) {
                    return Boolean.FALSE;
                }
            }
            throw mismatch(key, raw);
        }
    },

    DOUBLE_LIST {
        @Override
        Object coerceValue(String key, Object raw) {
            List<Double> out = new ArrayList<>();
            for (Object item : asCollection(raw)) {
                out.add(toDouble(key, item));
            }
            return List.copyOf(out);
        }
    },

    STRING_LIST {
        @Override
        Object coerceValue(String key, Object raw) {
            List<String> out = new ArrayList<>();
            for (Object item : asCollection(raw)) {
                out.add((String) STRING.coerceValue(key, item));
            }
            return List.copyOf(out);
        }
    },

    /**
     * Lista de bloques clave → número (ej: capas {@code {top, bottom}}).
     */
    NUMBER_MAP_LIST {
        @Override
        Object coerceValue(String key, Object raw) {
            List<Map<String, Double>> out = new ArrayList<>();
            for (Object item : asCollection(raw)) {
                if (!(item instanceof Map<?, ?> map)) {
                    throw mismatch(key, item);
                }
                Map<String, Double> block = new LinkedHashMap<>();
                for (Map.Entry<?, ?> entry : map.entrySet()) {
                    block.put(String.valueOf(entry.getKey()), toDouble(key, entry.getValue()));
                }
                out.add(Map.copyOf(block));
            }
            return List.copyOf(out);
        }
    };

    abstract Object coerceValue(String key, Object raw);

    /**
     * Convierte el valor crudo al tipo declarado.
     *
     * @throws ConfigException si el valor no es coercible.
     */
    public Object coerce(String key, Object raw) {
        if (raw == null) {
            throw new ConfigException(String.format("La clave '%s' tiene un valor nulo (tipo %s).", key, this));
        }
        return coerceValue(key, raw);
    }

    private static double toDouble(String key, Object raw) {
        if (raw instanceof Number n) {
            return n.doubleValue();
        }
        if (raw instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                throw new ConfigException(String.format(
                        "La clave '%s' requiere un número y recibió '%s'.", key, raw), e);
            }
        }
        throw new ConfigException(String.format(
                "La clave '%s' requiere un número y recibió %s.", key, raw.getClass().getSimpleName()));
    }

    private static Collection<?> asCollection(Object raw) {
        if (raw instanceof Collection<?> c) {
            return c;
        }
        return List.of(raw);
    }

    private static ConfigException mismatch(String key, Object raw) {
        return new ConfigException(String.format(
                "El valor '%s' (%s) de la clave '%s' no es coercible al tipo declarado.",
                raw, raw.getClass().getSimpleName(), key));
    }
}
