package tcdiags.io;

import tcdiags.domain.exception.MissingVariableException;

/**
 * Archivo de análisis abierto. Se adquiere por lectura de variable y se cierra enseguida.
 */
public interface GridFile extends AutoCloseable {

    boolean hasVariable(String variableName);

    /**
     * @throws MissingVariableException si el array no existe en el archivo.
     */
    RawArray read(String variableName);

    @Override
    void close();
}
