package tcdiags.config.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Conjunto ordenado de {@link FieldSchema} con nombre.
 */
public final class Schema {

    private final String name;
    private final Map<String, FieldSchema> fields;

    private Schema(String name, Map<String, FieldSchema> fields) {
        this.name = name;
        this.fields = Collections.unmodifiableMap(fields);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public List<FieldSchema> getFields() {
        return new ArrayList<>(fields.values());
    }

    public boolean declares(String key) {
        return fields.containsKey(key);
    }

    public static final class Builder {
        private final String name;
        private final Map<String, FieldSchema> fields = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder required(String key, FieldType type, String description) {
            fields.put(key, FieldSchema.required(key, type, description));
            return this;
        }

        public Builder optional(String key, FieldType type, Object defaultValue, String description) {
            fields.put(key, FieldSchema.optional(key, type, defaultValue, description));
            return this;
        }

        public Schema build() {
            return new Schema(name, new LinkedHashMap<>(fields));
        }
    }
}
