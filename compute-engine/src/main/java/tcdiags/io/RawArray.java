package tcdiags.io;

import java.util.Arrays;

/**
 * Array crudo leído de una fuente de malla, antes de cualquier transformación.
 */
public record RawArray(int[] shape, double[] data) {

    public RawArray {
        long size = 1;
        for (int n : shape) {
            size *= n;
        }
        if (size != data.length) {
            throw new IllegalArgumentException(String.format(
                    "La forma %s no coincide con %d valores.", Arrays.toString(shape), data.length));
        }
    }

    public int rank() {
        return shape.length;
    }
}
