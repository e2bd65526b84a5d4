package tcdiags.domain.exception;

/**
 * Raíz de la jerarquía de errores del pipeline de diagnósticos.
 * <p>
 * Todas las excepciones son no comprobadas: cada etapa las lanza lo más cerca
 * posible de su origen y el orquestador decide qué aplicación aborta.
 */
public abstract class TcDiagsException extends RuntimeException {

    protected TcDiagsException(String message) {
        super(message);
    }

    protected TcDiagsException(String message, Throwable cause) {
        super(message, cause);
    }
}
