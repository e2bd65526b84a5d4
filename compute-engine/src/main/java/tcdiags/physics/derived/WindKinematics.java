package tcdiags.physics.derived;

import tcdiags.domain.exception.ConfigException;
import tcdiags.domain.grid.GeoField;

import java.util.List;

/**
 * Magnitudes del viento.
 */
public final class WindKinematics {

    private WindKinematics() {
    }

    /**
     * @param inputs [u (m/s), v (m/s)] con la misma forma.
     */
    public static GeoField magnitude(String name, List<GeoField> inputs) {
        GeoField u = inputs.get(0);
        GeoField v = inputs.get(1);
        if (u.size() != v.size()) {
            throw new ConfigException(String.format(
                    "wind_magnitude: '%s' y '%s' tienen tamaños distintos.", u.getName(), v.getName()));
        }
        double[] speed = new double[u.size()];
        for (int i = 0; i < speed.length; i++) {
            speed[i] = Math.hypot(u.get(i), v.get(i));
        }
        return GeoField.of(name, "m/s", u.shape(), speed);
    }
}
