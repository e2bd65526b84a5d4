package tcdiags.domain.grid;

import tcdiags.domain.exception.ConfigException;

/**
 * Extensión y resolución de la malla polar centrada en el TC.
 *
 * @param maxRadius Radio máximo [m], incluido.
 * @param dradius   Paso radial [m].
 * @param dazimuth  Paso azimutal [rad].
 */
public record PolarGridSpec(double maxRadius, double dradius, double dazimuth) {

    public PolarGridSpec {
        if (!(dradius > 0.0) || !(maxRadius >= 0.0)) {
            throw new ConfigException(String.format(
                    "Malla polar inválida: max_radius=%s, dradius=%s.", maxRadius, dradius));
        }
        if (!(dazimuth > 0.0) || dazimuth > 2.0 * Math.PI) {
            throw new ConfigException("Malla polar inválida: dazimuth=" + dazimuth + " rad.");
        }
    }

    public double[] radii() {
        int n = (int) Math.floor(maxRadius / dradius + 1.0e-9) + 1;
        double[] out = new double[n];
        for (int r = 0; r < n; r++) {
            out[r] = r * dradius;
        }
        return out;
    }

    public double[] azimuths() {
        int n = (int) Math.ceil(2.0 * Math.PI / dazimuth - 1.0e-9);
        double[] out = new double[n];
        for (int a = 0; a < n; a++) {
            out[a] = a * dazimuth;
        }
        return out;
    }
}
