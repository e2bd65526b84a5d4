package tcdiags.domain.warning;

/**
 * El número de coeficientes SVD pedido supera el rango disponible en la ventana
 * y se ha reducido.
 *
 * @param source            Aplicación que filtró el campo.
 * @param tcId              Identificador del ciclón cuya ventana se filtró.
 * @param requestedCoeffs   Coeficientes pedidos por configuración.
 * @param availableRank     Rango efectivo de la ventana.
 */
public record RankDeficiencyWarning(
        String source,
        String tcId,
        int requestedCoeffs,
        int availableRank
) implements DiagnosticWarning {

    @Override
    public String message() {
        return String.format("TC %s: ncoeffs=%d supera el rango disponible %d; se reduce a %d.",
                tcId, requestedCoeffs, availableRank, availableRank);
    }
}
