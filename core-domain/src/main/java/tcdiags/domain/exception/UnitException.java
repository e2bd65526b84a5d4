package tcdiags.domain.exception;

/**
 * Cadena de unidades no reconocida o conversión entre dimensiones incompatibles.
 * <p>
 * Fatal para toda la ejecución: la aritmética posterior asume unidades consistentes.
 */
public class UnitException extends TcDiagsException {

    public UnitException(String message) {
        super(message);
    }
}
