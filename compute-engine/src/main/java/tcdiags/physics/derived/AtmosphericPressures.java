package tcdiags.physics.derived;

import lombok.extern.slf4j.Slf4j;
import tcdiags.domain.exception.ConfigException;
import tcdiags.domain.grid.GeoField;

import java.util.List;

/**
 * Perfiles y reducciones de presión.
 */
@Slf4j
public final class AtmosphericPressures {

    /** Constante de los gases para aire seco [J kg^-1 K^-1]. */
    public static final double RD = 287.04;
    /** Gravedad [m s^-2]. */
    public static final double G = 9.80665;
    /** Gradiente térmico estándar [K m^-1]. */
    public static final double LAPSE_RATE = 0.0065;

    private AtmosphericPressures() {
    }

    /**
     * Integra el grosor isobárico desde la cima hacia abajo.
     * El nivel 0 (superficie) toma la presión de superficie; el nivel superior conserva
     * su grosor como presión de interfaz.
     *
     * @param inputs [grosor (Pa, nivel × lat × lon), presión de superficie (Pa, lat × lon)]
     */
    public static GeoField fromThickness(String name, List<GeoField> inputs) {
        GeoField thickness = inputs.get(0);
        GeoField surface = inputs.get(1);
        requireRank(thickness, 3, "pressure_from_thickness");
        requirePlane(thickness, surface, "pressure_from_thickness");

        int nz = thickness.nz();
        int plane = thickness.ny() * thickness.nx();
        double[] dp = thickness.toArray();
        double[] p = dp.clone();
        log.info("Calculando el perfil de presión de dimensión {}x{}x{}.", nz, thickness.ny(), thickness.nx());

        for (int c = 0; c < plane; c++) {
            p[c] = surface.get(c);
        }
        for (int z = nz - 2; z > 0; z--) {
            for (int c = 0; c < plane; c++) {
                p[z * plane + c] = p[(z + 1) * plane + c] + dp[z * plane + c];
            }
        }
        return GeoField.of(name, "Pa", thickness.shape(), p);
    }

    /**
     * Reduce la presión de superficie a nivel del mar con la temperatura virtual del nivel más bajo.
     * <pre>
     *   Tv    = T (1 + 0.61 q)
     *   Tmed  = Tv + 0.5 Γ z
     *   pslp  = psfc exp(g z / (Rd Tmed))
     * </pre>
     *
     * @param inputs [psfc (Pa), zsfc (m), T (K), q (kg/kg)]; T y q pueden ser 2-D o 3-D.
     */
    public static GeoField toSeaLevel(String name, List<GeoField> inputs) {
        GeoField psfc = inputs.get(0);
        GeoField zsfc = inputs.get(1);
        GeoField temperature = inputs.get(2);
        GeoField humidity = inputs.get(3);
        requirePlane(temperature, psfc, "pressure_to_sealevel");
        requirePlane(temperature, zsfc, "pressure_to_sealevel");
        requirePlane(temperature, humidity, "pressure_to_sealevel");

        int ny = psfc.ny();
        int nx = psfc.nx();
        double[] out = new double[ny * nx];
        for (int j = 0; j < ny; j++) {
            for (int i = 0; i < nx; i++) {
                int c = j * nx + i;
                double z = zsfc.get(c);
                double tv = temperature.get(0, j, i) * (1.0 + 0.61 * humidity.get(0, j, i));
                double tMean = tv + 0.5 * LAPSE_RATE * z;
                out[c] = psfc.get(c) * Math.exp(G * z / (RD * tMean));
            }
        }
        return GeoField.of(name, "Pa", new int[]{ny, nx}, out);
    }

    static void requireRank(GeoField field, int rank, String method) {
        if (field.rank() != rank) {
            throw new ConfigException(String.format(
                    "%s requiere '%s' de rango %d y recibió rango %d.", method, field.getName(), rank, field.rank()));
        }
    }

    static void requirePlane(GeoField a, GeoField b, String method) {
        if (a.ny() != b.ny() || a.nx() != b.nx()) {
            throw new ConfigException(String.format(
                    "%s: las mallas horizontales de '%s' (%dx%d) y '%s' (%dx%d) no coinciden.",
                    method, a.getName(), a.ny(), a.nx(), b.getName(), b.ny(), b.nx()));
        }
    }
}
