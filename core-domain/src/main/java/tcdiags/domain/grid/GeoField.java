package tcdiags.domain.grid;

import lombok.Getter;

import java.util.Arrays;
import java.util.Optional;

/**
 * Array numérico N-dimensional etiquetado con unidades.
 * <p>
 * Convención de ejes: los dos últimos son (lat, lon) cuando el campo es geográfico;
 * el primero de un campo 3-D es el vertical, con el nivel 0 como el más bajo.
 * Inmutable: el array interno nunca se expone.
 */
public final class GeoField {

    @Getter
    private final String name;
    @Getter
    private final String units;
    private final int[] shape;
    private final double[] data;
    private final GeoGrid grid;

    private GeoField(String name, String units, int[] shape, double[] data, GeoGrid grid) {
        this.name = name;
        this.units = units;
        this.shape = shape;
        this.data = data;
        this.grid = grid;
    }

    public static GeoField of(String name, String units, int[] shape, double[] data) {
        return of(name, units, shape, data, null);
    }

    public static GeoField of(String name, String units, int[] shape, double[] data, GeoGrid grid) {
        int size = 1;
        for (int n : shape) {
            if (n < 0) {
                throw new IllegalArgumentException("Dimensión negativa en la forma de '" + name + "'.");
            }
            size *= n;
        }
        if (size != data.length) {
            throw new IllegalArgumentException(String.format(
                    "La forma %s de '%s' no coincide con %d valores.", Arrays.toString(shape), name, data.length));
        }
        if (grid != null && shape.length >= 2
                && (shape[shape.length - 2] != grid.ny() || shape[shape.length - 1] != grid.nx())) {
            throw new IllegalArgumentException(String.format(
                    "La malla %s no coincide con la forma %s de '%s'.", grid, Arrays.toString(shape), name));
        }
        return new GeoField(name, units, shape.clone(), data.clone(), grid);
    }

    public int rank() {
        return shape.length;
    }

    public int[] shape() {
        return shape.clone();
    }

    public int size() {
        return data.length;
    }

    public int dim(int axis) {
        return shape[axis];
    }

    public Optional<GeoGrid> grid() {
        return Optional.ofNullable(grid);
    }

    /**
     * Número de niveles verticales (1 para campos 2-D).
     */
    public int nz() {
        return shape.length >= 3 ? shape[shape.length - 3] : 1;
    }

    public int ny() {
        return shape.length >= 2 ? shape[shape.length - 2] : 1;
    }

    public int nx() {
        return shape[shape.length - 1];
    }

    public double get(int flatIndex) {
        return data[flatIndex];
    }

    /**
     * Valor en (nivel, fila, columna) de un campo 3-D, o (fila, columna) de un 2-D si k = 0.
     */
    public double get(int k, int j, int i) {
        return data[(k * ny() + j) * nx() + i];
    }

    public double get2d(int j, int i) {
        return data[j * nx() + i];
    }

    /**
     * Nivel k como array aplanado lat × lon.
     */
    public double[] level(int k) {
        int plane = ny() * nx();
        return Arrays.copyOfRange(data, k * plane, (k + 1) * plane);
    }

    /**
     * Columna vertical en (j, i).
     */
    public double[] column(int j, int i) {
        double[] out = new double[nz()];
        for (int k = 0; k < out.length; k++) {
            out[k] = get(k, j, i);
        }
        return out;
    }

    public double[] toArray() {
        return data.clone();
    }

    public GeoField withGrid(GeoGrid newGrid) {
        return of(name, units, shape, data, newGrid);
    }

    public GeoField withName(String newName) {
        return new GeoField(newName, units, shape, data, grid);
    }

    /**
     * Nuevo campo con los mismos metadatos de malla y otros valores/unidades.
     */
    public GeoField withData(double[] newData, String newUnits) {
        return of(name, newUnits, shape, newData, grid);
    }

    @Override
    public String toString() {
        return String.format("GeoField[%s, %s, %s]", name, units, Arrays.toString(shape));
    }
}
