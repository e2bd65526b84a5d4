package tcdiags.physics.solver.impl;

import lombok.extern.slf4j.Slf4j;
import tcdiags.domain.exception.ConfigException;
import tcdiags.domain.grid.GeoField;

/**
 * Interpolación lineal por columnas respecto a una coordenada vertical (presión o altura).
 */
@Slf4j
public class VerticalInterpolator {

    /**
     * Interpola {@code values} a cada nivel objetivo. NaN fuera del rango de la columna.
     *
     * @return Array [objetivo][lat × lon].
     */
    public double[][] toLevels(GeoField values, GeoField coordinate, double[] targets) {
        requireSameShape(values, coordinate);
        int plane = values.ny() * values.nx();
        double[][] out = new double[targets.length][plane];
        for (int t = 0; t < targets.length; t++) {
            out[t] = toLevel(values, coordinate, targets[t], false);
        }
        return out;
    }

    /**
     * Interpola a un único nivel objetivo.
     *
     * @param fallbackToLowest Si es true, las columnas que no acotan el objetivo toman el nivel 0.
     */
    public double[] toLevel(GeoField values, GeoField coordinate, double target, boolean fallbackToLowest) {
        requireSameShape(values, coordinate);
        int nz = values.nz();
        int ny = values.ny();
        int nx = values.nx();
        double[] out = new double[ny * nx];
        int fallbacks = 0;
        double[] column = new double[nz];
        double[] coord = new double[nz];
        for (int j = 0; j < ny; j++) {
            for (int i = 0; i < nx; i++) {
                for (int k = 0; k < nz; k++) {
                    column[k] = values.get(k, j, i);
                    coord[k] = coordinate.get(k, j, i);
                }
                double value = interpolateColumn(column, coord, target);
                if (Double.isNaN(value) && fallbackToLowest) {
                    value = column[0];
                    fallbacks++;
                }
                out[j * nx + i] = value;
            }
        }
        if (fallbacks > 0) {
            log.warn("'{}': {} columnas no acotan el nivel {}; se usa el nivel más bajo.",
                    values.getName(), fallbacks, target);
        }
        return out;
    }

    /**
     * Interpolación lineal en una columna con coordenada monótona (creciente o decreciente).
     */
    public static double interpolateColumn(double[] values, double[] coord, double target) {
        for (int k = 0; k < coord.length - 1; k++) {
            double c0 = coord[k];
            double c1 = coord[k + 1];
            if (Double.isNaN(c0) || Double.isNaN(c1)) {
                continue;
            }
            boolean bracketed = (c0 <= target && target <= c1) || (c1 <= target && target <= c0);
            if (bracketed) {
                if (c1 == c0) {
                    return values[k];
                }
                double w = (target - c0) / (c1 - c0);
                return values[k] + w * (values[k + 1] - values[k]);
            }
        }
        if (coord.length == 1 && coord[0] == target) {
            return values[0];
        }
        return Double.NaN;
    }

    private static void requireSameShape(GeoField values, GeoField coordinate) {
        if (values.nz() != coordinate.nz() || values.ny() != coordinate.ny() || values.nx() != coordinate.nx()) {
            throw new ConfigException(String.format(
                    "Interpolación vertical: '%s' y '%s' no comparten forma.", values, coordinate));
        }
    }
}
