package tcdiags.physics.derived;

import tcdiags.domain.grid.GeoField;

import java.util.List;

import static tcdiags.physics.derived.AtmosphericPressures.G;
import static tcdiags.physics.derived.AtmosphericPressures.LAPSE_RATE;
import static tcdiags.physics.derived.AtmosphericPressures.RD;

/**
 * Alturas a partir de la presión con la atmósfera estándar de EE. UU.
 */
public final class AtmosphericHeights {

    public static final double T0 = 288.15;
    public static final double P0 = 101325.0;

    private AtmosphericHeights() {
    }

    /**
     * {@code z = (T0/Γ) (1 - (p/p0)^(Rd Γ / g))}
     */
    public static double standardHeight(double pressure) {
        return (T0 / LAPSE_RATE) * (1.0 - Math.pow(pressure / P0, RD * LAPSE_RATE / G));
    }

    /**
     * @param inputs [presión (Pa)]
     */
    public static GeoField fromPressure(String name, List<GeoField> inputs) {
        GeoField pressure = inputs.get(0);
        double[] p = pressure.toArray();
        double[] z = new double[p.length];
        for (int i = 0; i < p.length; i++) {
            z[i] = standardHeight(p[i]);
        }
        return GeoField.of(name, "m", pressure.shape(), z);
    }
}
