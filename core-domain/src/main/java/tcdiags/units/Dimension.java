package tcdiags.units;

/**
 * Dimensiones físicas que maneja el pipeline.
 */
public enum Dimension {
    TEMPERATURE,
    PRESSURE,
    LENGTH,
    SPEED,
    MASS_RATIO,
    ANGLE,
    INVERSE_TIME,
    DIFFUSIVITY,
    ENERGY_PER_AREA,
    ENERGY_PER_VOLUME,
    DIMENSIONLESS
}
