package tcdiags.physics.solver.impl;

import tcdiags.config.InterpolationType;

/**
 * Profundidad a la que un perfil de temperatura cruza una isoterma.
 * <p>
 * Se toma el primer par de niveles que acota la isoterma desde la superficie. Nunca
 * extrapola: si no hay par que la acote, devuelve el valor de relleno.
 */
public class IsothermLocator {

    /**
     * @param temperature Perfil de temperatura (nivel 0 en superficie).
     * @param depth       Profundidades de los niveles [m].
     * @param target      Isoterma, en las unidades del perfil.
     * @param type        Esquema de inversión.
     * @param fillValue   Valor devuelto si la isoterma no queda acotada.
     */
    public double locate(double[] temperature, double[] depth, double target, InterpolationType type,
                         double fillValue) {
        int bracket = findBracket(temperature, target);
        if (bracket < 0) {
            return fillValue;
        }
        double t0 = temperature[bracket];
        double t1 = temperature[bracket + 1];
        double d0 = depth[bracket];
        double d1 = depth[bracket + 1];
        switch (type) {
            case PREVIOUS:
                return d0;
            case NEXT:
                return d1;
            case NEAREST:
                return Math.abs(t0 - target) <= Math.abs(t1 - target) ? d0 : d1;
            case LINEAR:
            default:
                if (t1 == t0) {
                    return d0;
                }
                return d0 + (target - t0) * (d1 - d0) / (t1 - t0);
        }
    }

    /**
     * Índice k del primer par (k, k+1) que acota {@code target}, o -1.
     */
    public static int findBracket(double[] temperature, double target) {
        for (int k = 0; k < temperature.length - 1; k++) {
            double t0 = temperature[k];
            double t1 = temperature[k + 1];
            if (Double.isNaN(t0) || Double.isNaN(t1)) {
                continue;
            }
            if ((t0 >= target && target >= t1) || (t0 <= target && target <= t1)) {
                return k;
            }
        }
        return -1;
    }
}
