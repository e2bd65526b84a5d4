package tcdiags.domain.warning;

/**
 * Columnas en las que la isoterma objetivo no queda acotada por el perfil y se
 * sustituye por el valor de relleno.
 *
 * @param source        Aplicación que localizó la isoterma.
 * @param isotherm      Temperatura objetivo (°C).
 * @param columnCount   Número de columnas rellenadas.
 * @param fillValue     Valor de relleno aplicado.
 */
public record IsothermNotFoundWarning(
        String source,
        double isotherm,
        int columnCount,
        double fillValue
) implements DiagnosticWarning {

    @Override
    public String message() {
        return String.format("Isoterma de %.2f°C no acotada en %d columnas; se usa el valor de relleno %s.",
                isotherm, columnCount, fillValue);
    }
}
