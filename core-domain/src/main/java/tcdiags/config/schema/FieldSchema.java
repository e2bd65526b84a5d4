package tcdiags.config.schema;

/**
 * Declaración de una clave de configuración: tipo, obligatoriedad y valor por defecto.
 */
public record FieldSchema(String name, FieldType type, boolean required, Object defaultValue, String description) {

    public static FieldSchema required(String name, FieldType type, String description) {
        return new FieldSchema(name, type, true, null, description);
    }

    public static FieldSchema optional(String name, FieldType type, Object defaultValue, String description) {
        return new FieldSchema(name, type, false, defaultValue, description);
    }
}
