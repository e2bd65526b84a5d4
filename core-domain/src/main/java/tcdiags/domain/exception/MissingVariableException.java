package tcdiags.domain.exception;

import lombok.Getter;

/**
 * El array solicitado no existe en la fuente (o no se pudo leer).
 */
@Getter
public class MissingVariableException extends TcDiagsException {

    private final String variableName;

    public MissingVariableException(String variableName, String message) {
        super(message);
        this.variableName = variableName;
    }

    public MissingVariableException(String variableName, String message, Throwable cause) {
        super(message, cause);
        this.variableName = variableName;
    }
}
