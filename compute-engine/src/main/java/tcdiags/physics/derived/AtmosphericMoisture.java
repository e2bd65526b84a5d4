package tcdiags.physics.derived;

import tcdiags.domain.grid.GeoField;

import java.util.List;

/**
 * Conversiones de humedad.
 */
public final class AtmosphericMoisture {

    private AtmosphericMoisture() {
    }

    /**
     * Razón de mezcla {@code w = q / (1 - q)}.
     *
     * @param inputs [humedad específica (kg/kg)]
     */
    public static GeoField mixingRatio(String name, List<GeoField> inputs) {
        GeoField q = inputs.get(0);
        double[] values = q.toArray();
        double[] w = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            w[i] = values[i] / (1.0 - values[i]);
        }
        return GeoField.of(name, "kg/kg", q.shape(), w);
    }
}
