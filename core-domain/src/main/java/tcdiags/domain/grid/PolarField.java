package tcdiags.domain.grid;

import lombok.Getter;

/**
 * Campo en coordenadas (radio, azimut) alrededor de un TC.
 * Las celdas fuera del dominio fuente contienen {@link #MISSING}.
 */
public final class PolarField {

    public static final double MISSING = Double.NaN;

    @Getter
    private final String name;
    @Getter
    private final String units;
    @Getter
    private final TcFix tcFix;
    private final double[] radial;
    private final double[] azimuth;
    private final double[][] values;

    public PolarField(String name, String units, TcFix tcFix, double[] radial, double[] azimuth, double[][] values) {
        if (values.length != radial.length) {
            throw new IllegalArgumentException("Filas del campo polar distintas al número de radios.");
        }
        this.name = name;
        this.units = units;
        this.tcFix = tcFix;
        this.radial = radial.clone();
        this.azimuth = azimuth.clone();
        this.values = new double[values.length][];
        for (int r = 0; r < values.length; r++) {
            if (values[r].length != azimuth.length) {
                throw new IllegalArgumentException("Anillo " + r + " con número de azimuts incorrecto.");
            }
            this.values[r] = values[r].clone();
        }
    }

    public int nRadii() {
        return radial.length;
    }

    public int nAzimuths() {
        return azimuth.length;
    }

    public double radiusAt(int r) {
        return radial[r];
    }

    public double azimuthAt(int a) {
        return azimuth[a];
    }

    public double get(int r, int a) {
        return values[r][a];
    }

    public double[] ring(int r) {
        return values[r].clone();
    }

    public double[] radial() {
        return radial.clone();
    }

    public double[] azimuth() {
        return azimuth.clone();
    }

    public double[][] toArray() {
        double[][] copy = new double[values.length][];
        for (int r = 0; r < values.length; r++) {
            copy[r] = values[r].clone();
        }
        return copy;
    }

    public boolean ringHasMissing(int r) {
        for (double v : values[r]) {
            if (Double.isNaN(v)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Mismo soporte polar con otros valores.
     */
    public PolarField withValues(String newName, double[][] newValues) {
        return new PolarField(newName, units, tcFix, radial, azimuth, newValues);
    }
}
