package tcdiags.physics.projection;

import tcdiags.domain.grid.GeoGrid;

/**
 * Interpolación bilineal sobre una malla lat/lon rectilínea.
 * <p>
 * Admite latitudes ascendentes o descendentes. Las longitudes del punto se llevan al
 * rango de la malla; en mallas globales se interpola a través del meridiano de corte.
 * Fuera del dominio, o con algún vértice NaN, devuelve NaN.
 */
public class BilinearInterpolator {

    private final double[] lats;
    private final double[] lons;
    private final boolean ascendingLat;
    private final boolean periodic;
    private final int nx;

    public BilinearInterpolator(GeoGrid grid) {
        this.nx = grid.nx();
        this.lats = new double[grid.ny()];
        this.lons = new double[nx];
        for (int j = 0; j < lats.length; j++) {
            lats[j] = grid.rowLatitude(j);
        }
        for (int i = 0; i < nx; i++) {
            lons[i] = grid.columnLongitude(i);
        }
        this.ascendingLat = grid.isLatitudeAscending();
        double dlon = nx > 1 ? lons[1] - lons[0] : 0.0;
        this.periodic = nx > 1 && Math.abs(lons[nx - 1] - lons[0] + dlon - 360.0) < 1.0e-6 * 360.0 + 1.0e-9;
    }

    /**
     * @param plane Valores lat × lon aplanados (fila-mayor).
     */
    public double interpolate(double[] plane, double lat, double lon) {
        double fy = latitudeIndex(lat);
        if (Double.isNaN(fy)) {
            return Double.NaN;
        }
        double lonInRange = wrap(lon);
        int i0;
        int i1;
        double tx;
        if (lonInRange <= lons[nx - 1]) {
            double fx = axisIndex(lons, lonInRange, true);
            if (Double.isNaN(fx)) {
                return Double.NaN;
            }
            i0 = Math.min((int) Math.floor(fx), Math.max(nx - 2, 0));
            i1 = Math.min(i0 + 1, nx - 1);
            tx = fx - i0;
        } else if (periodic) {
            double span = lons[0] + 360.0 - lons[nx - 1];
            i0 = nx - 1;
            i1 = 0;
            tx = (lonInRange - lons[nx - 1]) / span;
        } else {
            return Double.NaN;
        }

        int j0 = Math.min((int) Math.floor(fy), Math.max(lats.length - 2, 0));
        int j1 = Math.min(j0 + 1, lats.length - 1);
        double ty = fy - j0;

        double v00 = plane[j0 * nx + i0];
        double v01 = plane[j0 * nx + i1];
        double v10 = plane[j1 * nx + i0];
        double v11 = plane[j1 * nx + i1];
        return (1 - ty) * ((1 - tx) * v00 + tx * v01) + ty * ((1 - tx) * v10 + tx * v11);
    }

    private double latitudeIndex(double lat) {
        return axisIndex(lats, lat, ascendingLat);
    }

    private double wrap(double lon) {
        double out = lon;
        while (out < lons[0]) {
            out += 360.0;
        }
        while (out >= lons[0] + 360.0) {
            out -= 360.0;
        }
        return out;
    }

    /**
     * Índice fraccionario de {@code x} en un eje monótono, NaN fuera de rango.
     */
    static double axisIndex(double[] axis, double x, boolean ascending) {
        int n = axis.length;
        if (n == 1) {
            return x == axis[0] ? 0.0 : Double.NaN;
        }
        double first = axis[0];
        double last = axis[n - 1];
        double min = Math.min(first, last);
        double max = Math.max(first, last);
        if (x < min || x > max) {
            return Double.NaN;
        }
        int lo = 0;
        int hi = n - 1;
        while (hi - lo > 1) {
            int mid = (lo + hi) >>> 1;
            boolean below = ascending ? axis[mid] <= x : axis[mid] >= x;
            if (below) {
                lo = mid;
            } else {
                hi = mid;
            }
        }
        double span = axis[hi] - axis[lo];
        return span == 0.0 ? lo : lo + (x - axis[lo]) / span;
    }
}
