package tcdiags.physics.diagnostics;

import tcdiags.domain.diagnostics.Application;
import tcdiags.domain.diagnostics.ApplicationResult;

/**
 * Aplicación de diagnóstico ejecutable por el orquestador.
 */
public interface TcDiagnostic {

    Application application();

    /**
     * Ejecuta la aplicación sobre las variables resueltas y los TC del contexto.
     *
     * @throws tcdiags.domain.exception.TcDiagsException si la aplicación no puede completarse.
     */
    ApplicationResult run(DiagnosticContext context);

    /**
     * Ruta del resumen en disco, o nulo si no se debe escribir. {@code %s} se sustituye por el TC.
     */
    String outputFile();
}
