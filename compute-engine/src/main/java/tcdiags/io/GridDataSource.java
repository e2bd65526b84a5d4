package tcdiags.io;

import tcdiags.domain.exception.MissingVariableException;

/**
 * Acceso a los archivos de análisis atmosféricos/oceánicos.
 */
public interface GridDataSource {

    /**
     * Abre el archivo en {@code path}.
     *
     * @throws MissingVariableException si el archivo no puede abrirse (la causa queda adjunta).
     */
    GridFile open(String path);
}
