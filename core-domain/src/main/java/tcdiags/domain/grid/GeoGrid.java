package tcdiags.domain.grid;

import java.util.Arrays;

/**
 * Malla geográfica 2-D (lat × lon) en grados, almacenada en orden fila-mayor.
 */
public final class GeoGrid {

    private final int ny;
    private final int nx;
    private final double[] lat;
    private final double[] lon;

    private GeoGrid(int ny, int nx, double[] lat, double[] lon) {
        this.ny = ny;
        this.nx = nx;
        this.lat = lat;
        this.lon = lon;
    }

    /**
     * Crea la malla a partir de arrays ya 2-D (aplanados) de tamaño ny*nx.
     */
    public static GeoGrid of(int ny, int nx, double[] lat2d, double[] lon2d) {
        if (lat2d.length != ny * nx || lon2d.length != ny * nx) {
            throw new IllegalArgumentException(String.format(
                    "Coordenadas incompatibles con la malla %dx%d: lat=%d, lon=%d.",
                    ny, nx, lat2d.length, lon2d.length));
        }
        return new GeoGrid(ny, nx, lat2d.clone(), lon2d.clone());
    }

    /**
     * Difunde ejes 1-D de latitud y longitud a la malla 2-D.
     */
    public static GeoGrid fromAxes(double[] lat1d, double[] lon1d) {
        int ny = lat1d.length;
        int nx = lon1d.length;
        double[] lat = new double[ny * nx];
        double[] lon = new double[ny * nx];
        for (int j = 0; j < ny; j++) {
            for (int i = 0; i < nx; i++) {
                lat[j * nx + i] = lat1d[j];
                lon[j * nx + i] = lon1d[i];
            }
        }
        return new GeoGrid(ny, nx, lat, lon);
    }

    public int ny() {
        return ny;
    }

    public int nx() {
        return nx;
    }

    public double latAt(int j, int i) {
        return lat[j * nx + i];
    }

    public double lonAt(int j, int i) {
        return lon[j * nx + i];
    }

    /**
     * Latitud representativa de la fila j (primera columna).
     */
    public double rowLatitude(int j) {
        return lat[j * nx];
    }

    /**
     * Longitud representativa de la columna i (primera fila).
     */
    public double columnLongitude(int i) {
        return lon[i];
    }

    public boolean isLatitudeAscending() {
        return ny < 2 || rowLatitude(ny - 1) > rowLatitude(0);
    }

    public double[] latitudes() {
        return lat.clone();
    }

    public double[] longitudes() {
        return lon.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GeoGrid other)) {
            return false;
        }
        return ny == other.ny && nx == other.nx
                && Arrays.equals(lat, other.lat) && Arrays.equals(lon, other.lon);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * ny + nx) + Arrays.hashCode(lat);
    }

    @Override
    public String toString() {
        return "GeoGrid[" + ny + "x" + nx + "]";
    }
}
