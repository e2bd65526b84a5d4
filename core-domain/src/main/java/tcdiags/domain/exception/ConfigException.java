package tcdiags.domain.exception;

/**
 * Violación del esquema de configuración, combinación de parámetros inválida
 * o violación de Nyquist en el análisis espectral.
 * <p>
 * Fatal para la aplicación afectada, no para toda la ejecución.
 */
public class ConfigException extends TcDiagsException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
