package tcdiags.config;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import tcdiags.config.schema.ValidatedConfig;

/**
 * Parámetros de la aplicación de intensidad potencial (tcpi).
 */
@Value
@Builder
@With
public class PotentialIntensityConfig {

    /**
     * Presión a nivel del mar máxima admitida [hPa]. Columnas por encima devuelven NaN.
     */
    @Builder.Default
    double mslpMax = 2000.0;

    /**
     * Altura de orografía máxima [m]. Columnas con zsfc mayor devuelven NaN.
     */
    @Builder.Default
    double zmax = 0.0;

    boolean writeOutput;

    String outputFile;

    public static PotentialIntensityConfig from(ValidatedConfig config) {
        return PotentialIntensityConfig.builder()
                .mslpMax(config.getDouble("mslp_max"))
                .zmax(config.getDouble("zmax"))
                .writeOutput(config.getBoolean("write_output"))
                .outputFile(config.getString("output_file"))
                .build();
    }
}
