package tcdiags.config;

import lombok.Builder;
import lombok.With;
import tcdiags.config.schema.ValidatedConfig;

import java.util.List;

/**
 * Variable calculada a partir de otras variables ya resueltas.
 * Una lista {@code inputs} vacía significa "usar los nombres por defecto del método".
 */
@Builder
@With
public record DerivedVariableSpec(String name, String method, List<String> inputs, String units)
        implements VariableSpec {

    public DerivedVariableSpec {
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
    }

    public static DerivedVariableSpec from(String name, ValidatedConfig config) {
        return new DerivedVariableSpec(name, config.getString("method"),
                config.getStringList("inputs"), config.getString("units"));
    }
}
