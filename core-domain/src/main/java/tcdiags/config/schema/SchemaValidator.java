package tcdiags.config.schema;

import lombok.extern.slf4j.Slf4j;
import tcdiags.domain.exception.ConfigException;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Valida un bloque de configuración crudo contra un {@link Schema}.
 * <p>
 * Claves obligatorias ausentes → {@link ConfigException}. Claves opcionales ausentes
 * reciben su valor por defecto (aviso WARN). Claves no declaradas se descartan.
 * La tabla de validación resultante se registra a nivel INFO.
 */
@Slf4j
public class SchemaValidator {

    public ValidatedConfig validate(Schema schema, Map<String, ?> raw) {
        Map<String, ?> input = raw == null ? Map.of() : raw;
        Map<String, Object> values = new LinkedHashMap<>();
        Set<String> defaulted = new HashSet<>();

        for (FieldSchema field : schema.getFields()) {
            String key = field.name();
            if (!input.containsKey(key) || input.get(key) == null) {
                if (field.required()) {
                    throw new ConfigException(String.format(
                            "Falta la clave obligatoria '%s' en el bloque '%s'.", key, schema.getName()));
                }
                log.warn("[{}] Clave '{}' ausente. Se usa el valor por defecto: {}",
                        schema.getName(), key, field.defaultValue());
                values.put(key, field.defaultValue() == null ? null : field.type().coerce(key, field.defaultValue()));
                defaulted.add(key);
            } else {
                values.put(key, field.type().coerce(key, input.get(key)));
            }
        }

        for (String key : input.keySet()) {
            if (!schema.declares(key)) {
                log.warn("[{}] Clave '{}' no declarada en el esquema. Se descarta.", schema.getName(), key);
            }
        }

        String table = renderTable(schema, values, defaulted);
        log.info("Validación del bloque '{}':\n{}", schema.getName(), table);
        return new ValidatedConfig(schema.getName(), values, defaulted, table);
    }

    private static String renderTable(Schema schema, Map<String, Object> values, Set<String> defaulted) {
        int keyWidth = "clave".length();
        for (String key : values.keySet()) {
            keyWidth = Math.max(keyWidth, key.length());
        }
        String format = "%-" + keyWidth + "s | %-16s | %-8s | %s%n";
        StringBuilder sb = new StringBuilder();
        sb.append(String.format(format, "clave", "tipo", "origen", "valor"));
        sb.append("-".repeat(keyWidth + 40)).append(System.lineSeparator());
        for (FieldSchema field : schema.getFields()) {
            sb.append(String.format(format,
                    field.name(),
                    field.type(),
                    defaulted.contains(field.name()) ? "defecto" : "entrada",
                    values.get(field.name())));
        }
        return sb.toString();
    }
}
