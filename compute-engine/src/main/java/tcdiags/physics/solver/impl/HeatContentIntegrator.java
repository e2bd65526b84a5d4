package tcdiags.physics.solver.impl;

import tcdiags.domain.exception.ConfigException;

/**
 * Integración del potencial calorífico (TCHP) entre la superficie y la isoterma.
 * <pre>
 *   TCHP = Σ ρ cp (T(z_mid) - T_iso) Δz
 * </pre>
 * con pasos {@code deltaz} desde la profundidad más somera y el último paso prorrateado
 * para terminar exactamente en la isoterma.
 */
public class HeatContentIntegrator {

    /** Densidad del agua de mar [kg m^-3]. */
    public static final double SEAWATER_DENSITY = 1025.0;
    /** Calor específico del agua de mar [J kg^-1 K^-1]. */
    public static final double SEAWATER_HEAT_CAPACITY = 3993.0;
    /** J/m^2 → kJ/cm^2. */
    public static final double J_M2_TO_KJ_CM2 = 1.0e-7;

    private final double deltaz;

    public HeatContentIntegrator(double deltaz) {
        if (!(deltaz > 0.0)) {
            throw new ConfigException("deltaz debe ser positivo; recibido " + deltaz);
        }
        this.deltaz = deltaz;
    }

    /**
     * @param temperature    Perfil de temperatura [°C o K, coherente con la isoterma].
     * @param depth          Profundidades [m], crecientes.
     * @param isothermDepth  Profundidad de la isoterma [m].
     * @param isotherm       Temperatura de la isoterma.
     * @return TCHP [J/m^2].
     */
    public double integrate(double[] temperature, double[] depth, double isothermDepth, double isotherm) {
        double z = depth[0];
        double total = 0.0;
        while (z < isothermDepth) {
            double step = Math.min(deltaz, isothermDepth - z);
            double mid = z + 0.5 * step;
            double t = VerticalInterpolator.interpolateColumn(temperature, depth, mid);
            if (!Double.isNaN(t)) {
                total += SEAWATER_DENSITY * SEAWATER_HEAT_CAPACITY * (t - isotherm) * step;
            }
            z += step;
        }
        return total;
    }

    /**
     * Contenido calorífico por nivel relativo a la isoterma [J/m^3]; cero bajo la isoterma.
     */
    public static double[] levelContent(double[] temperature, double[] depth, double isothermDepth, double isotherm) {
        double[] out = new double[temperature.length];
        for (int k = 0; k < out.length; k++) {
            if (depth[k] <= isothermDepth && !Double.isNaN(temperature[k])) {
                out[k] = SEAWATER_DENSITY * SEAWATER_HEAT_CAPACITY * (temperature[k] - isotherm);
            }
        }
        return out;
    }
}
