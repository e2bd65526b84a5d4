package tcdiags.physics.derived;

import tcdiags.domain.exception.ConfigException;
import tcdiags.domain.grid.GeoField;

import java.util.Arrays;
import java.util.List;

/**
 * Profundidades de los niveles oceánicos.
 */
public final class OceanDepths {

    private OceanDepths() {
    }

    /**
     * Difunde el perfil 1-D de profundidades a la malla 3-D de la temperatura oceánica.
     *
     * @param inputs [profundidades (m, 1-D o ya 3-D), temperatura oceánica (nivel × lat × lon)]
     */
    public static GeoField fromProfile(String name, List<GeoField> inputs) {
        GeoField depths = inputs.get(0);
        GeoField temperature = inputs.get(1);
        int[] shape = temperature.shape();
        if (depths.rank() == temperature.rank() && depths.size() == temperature.size()) {
            return GeoField.of(name, "m", shape, depths.toArray());
        }
        if (depths.rank() != 1 || temperature.rank() != 3 || depths.size() != temperature.nz()) {
            throw new ConfigException(String.format(
                    "depth_from_profile: el perfil '%s' (%d niveles) no es compatible con '%s' %s.",
                    depths.getName(), depths.size(), temperature.getName(), Arrays.toString(shape)));
        }
        int plane = temperature.ny() * temperature.nx();
        double[] out = new double[temperature.size()];
        for (int k = 0; k < depths.size(); k++) {
            Arrays.fill(out, k * plane, (k + 1) * plane, depths.get(k));
        }
        return GeoField.of(name, "m", shape, out);
    }
}
