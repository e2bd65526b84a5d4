package tcdiags.physics.derived;

import tcdiags.domain.exception.ConfigException;
import tcdiags.domain.grid.GeoField;

import java.util.Arrays;
import java.util.List;

/**
 * Propiedades del agua de mar (TEOS-10).
 * <p>
 * La salinidad absoluta se obtiene de la práctica sin la anomalía regional del atlas
 * (SAAR = 0), como hace TEOS-10 fuera de la cobertura del atlas. La temperatura
 * conservativa usa el polinomio de 75 términos de la entalpía potencial.
 */
public final class Seawater {

    /** Razón entre la salinidad de referencia y la práctica de la composición estándar [g/kg]. */
    public static final double UPS = 35.16504 / 35.0;

    /** Capacidad calorífica de la entalpía potencial [J/(kg K)]. */
    public static final double CP0 = 3991.86795711963;

    private static final double SFAC = 0.0248826675584615;

    private Seawater() {
    }

    /**
     * Salinidad absoluta [g/kg] a partir de la práctica.
     */
    public static double absoluteSalinity(double practicalSalinity) {
        return UPS * practicalSalinity;
    }

    /**
     * Temperatura conservativa [°C] a partir de la salinidad absoluta [g/kg] y la
     * temperatura potencial [°C].
     */
    public static double conservativeTemperature(double absoluteSalinity, double potentialTemperature) {
        if (Double.isNaN(absoluteSalinity) || Double.isNaN(potentialTemperature)) {
            return Double.NaN;
        }
        double x2 = SFAC * Math.max(absoluteSalinity, 0.0);
        double x = Math.sqrt(x2);
        double y = potentialTemperature * 0.025;

        double potentialEnthalpy = 61.01362420681071 + y * (168776.46138048015
                + y * (-2735.2785605119625 + y * (2574.2164453821433
                + y * (-1536.6644434977543 + y * (545.7340497931629
                + (-50.91091728474331 - 18.30489878927802 * y) * y)))))
                + x2 * (268.5520265845071 + y * (-12019.028203559312
                + y * (3734.858026725145 + y * (-2046.7671145057618
                + y * (465.28655623826234 + (-0.6370820302376359
                - 10.650848542359153 * y) * y))))
                + x * (937.2099110620707 + y * (588.1802812170108
                + y * (248.39476522971285 + (-3.871557904936333
                - 2.6268019854268356 * y) * y))
                + x * (-1687.914374187449 + x * (246.9598888781377
                + x * (123.59576582457964 - 48.5891069025409 * x))
                + y * (936.3206544460336
                + y * (-942.7827304544439 + y * (369.4389437509002
                + (-33.83664947895248 - 9.987880382780322 * y) * y))))));
        return potentialEnthalpy / CP0;
    }

    /**
     * Presión del agua de mar [dbar] a una profundidad [m, positiva hacia abajo] y
     * latitud [grados] (Saunders, 1981).
     */
    public static double pressureFromDepth(double depth, double latitude) {
        double sin = Math.sin(Math.toRadians(latitude));
        double c1 = (5.92 + 5.25 * sin * sin) * 1.0e-3;
        return ((1.0 - c1) - Math.sqrt((1.0 - c1) * (1.0 - c1) - 8.84e-6 * depth)) / 4.42e-6;
    }

    /**
     * Método {@code seawater_from_depth}.
     *
     * @param inputs [profundidades (m, nivel × lat × lon), latitud (grados, lat × lon o 1-D)]
     */
    public static GeoField seawaterPressure(String name, List<GeoField> inputs) {
        GeoField depth = inputs.get(0);
        GeoField latitude = inputs.get(1);
        if (depth.rank() != 3) {
            throw new ConfigException(String.format(
                    "seawater_from_depth: '%s' debe ser 3-D; forma %s.", depth.getName(),
                    Arrays.toString(depth.shape())));
        }
        int ny = depth.ny();
        int nx = depth.nx();
        int plane = ny * nx;
        boolean perRow = latitude.size() == ny && latitude.size() != plane;
        if (!perRow && latitude.size() != plane) {
            throw new ConfigException(String.format(
                    "seawater_from_depth: la latitud '%s' %s no es compatible con '%s' %s.",
                    latitude.getName(), Arrays.toString(latitude.shape()),
                    depth.getName(), Arrays.toString(depth.shape())));
        }
        double[] out = new double[depth.size()];
        for (int k = 0; k < depth.nz(); k++) {
            for (int c = 0; c < plane; c++) {
                double lat = perRow ? latitude.get(c / nx) : latitude.get(c);
                out[k * plane + c] = pressureFromDepth(depth.get(k * plane + c), lat);
            }
        }
        return GeoField.of(name, "dbar", depth.shape(), out);
    }
}
