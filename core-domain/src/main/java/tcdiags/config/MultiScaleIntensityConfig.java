package tcdiags.config;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import tcdiags.config.schema.ValidatedConfig;

/**
 * Parámetros de la aplicación de intensidad multiescala (tcmsi).
 */
@Value
@Builder
@With
public class MultiScaleIntensityConfig {

    /** Resolución radial [m]. */
    @Builder.Default
    double drho = 100000.0;

    /** Resolución azimutal [grados]. */
    @Builder.Default
    double dphi = 45.0;

    /** Radio máximo [m]. */
    @Builder.Default
    double maxRadius = 1000000.0;

    @Builder.Default
    int maxWn = 3;

    boolean writeOutput;

    String outputFile;

    public double getDphiRadians() {
        return Math.toRadians(dphi);
    }

    public static MultiScaleIntensityConfig from(ValidatedConfig config) {
        return MultiScaleIntensityConfig.builder()
                .drho(config.getDouble("drho"))
                .dphi(config.getDouble("dphi"))
                .maxRadius(config.getDouble("max_radius"))
                .maxWn(config.getInt("max_wn"))
                .writeOutput(config.getBoolean("write_output"))
                .outputFile(config.getString("output_file"))
                .build();
    }
}
