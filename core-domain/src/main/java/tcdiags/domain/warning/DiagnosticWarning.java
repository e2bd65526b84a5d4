package tcdiags.domain.warning;

/**
 * Incidencia no fatal registrada durante el cálculo.
 * <p>
 * Las advertencias no detienen la ejecución; se acumulan en el {@link WarningLog}
 * de la ejecución y se exponen en el informe final.
 */
public interface DiagnosticWarning {

    /** Etapa o aplicación que originó la advertencia. */
    String source();

    /** Mensaje legible que nombra el campo y la política aplicada. */
    String message();
}
