package tcdiags.config;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import tcdiags.config.schema.ValidatedConfig;

/**
 * Parámetros de la aplicación de contenido calorífico oceánico (tcohc).
 */
@Value
@Builder
@With
public class OceanHeatContentConfig {

    /** Paso de integración [m]. */
    @Builder.Default
    double deltaz = 1.0;

    /** Profundidad asignada cuando la isoterma no se alcanza. */
    @Builder.Default
    double fillValue = 0.0;

    @Builder.Default
    InterpolationType interpType = InterpolationType.LINEAR;

    /** Isoterma objetivo [°C]. */
    @Builder.Default
    double isotherm = 26.0;

    boolean writeOutput;

    String outputFile;

    public static OceanHeatContentConfig from(ValidatedConfig config) {
        return OceanHeatContentConfig.builder()
                .deltaz(config.getDouble("deltaz"))
                .fillValue(config.getDouble("fill_value"))
                .interpType(InterpolationType.parse(config.getString("interp_type")))
                .isotherm(config.getDouble("isotherm"))
                .writeOutput(config.getBoolean("write_output"))
                .outputFile(config.getString("output_file"))
                .build();
    }
}
