package tcdiags.units;

/**
 * Unidad física expresada como transformación afín a la unidad SI de su dimensión.
 * <p>
 * {@code valorSI = valor * scale + offset}. El offset sólo es distinto de cero en
 * temperaturas (°C → K).
 *
 * @param symbol    Símbolo canónico de la unidad (ej: "hPa").
 * @param dimension Dimensión física.
 * @param scale     Factor multiplicativo hacia SI.
 * @param offset    Desplazamiento aditivo hacia SI.
 */
public record Unit(String symbol, Dimension dimension, double scale, double offset) {

    public double toSi(double value) {
        return value * scale + offset;
    }

    public double fromSi(double value) {
        return (value - offset) / scale;
    }

    public boolean isCompatibleWith(Unit other) {
        return dimension == other.dimension;
    }

    @Override
    public String toString() {
        return symbol;
    }
}
