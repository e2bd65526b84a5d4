package tcdiags.io;

import lombok.extern.slf4j.Slf4j;
import tcdiags.domain.exception.MissingVariableException;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Fuente de mallas en JSON:
 * <pre>
 * {"variables": {"nombre": {"shape": [ny, nx], "data": [...]}}}
 * </pre>
 * Las rutas relativas se resuelven contra {@code baseDirectory}.
 */
@Slf4j
public class JsonGridDataSource implements GridDataSource {

    private final JsonFileHandler fileHandler;
    private final Path baseDirectory;

    public JsonGridDataSource(Path baseDirectory) {
        this(new JsonFileHandler(), baseDirectory);
    }

    public JsonGridDataSource(JsonFileHandler fileHandler, Path baseDirectory) {
        this.fileHandler = fileHandler;
        this.baseDirectory = baseDirectory;
    }

    @Override
    public GridFile open(String path) {
        Path resolved = baseDirectory == null ? Path.of(path) : baseDirectory.resolve(path);
        try {
            GridDocument document = fileHandler.readFromFile(resolved.toString(), GridDocument.class);
            log.debug("Archivo de malla abierto: {} ({} variables)", resolved,
                    document.variables() == null ? 0 : document.variables().size());
            return new DocumentGridFile(resolved.toString(), document);
        } catch (IOException e) {
            throw new MissingVariableException(path, "No se pudo abrir el archivo de malla " + resolved, e);
        }
    }

    public record GridVariable(int[] shape, double[] data) {
    }

    public record GridDocument(Map<String, GridVariable> variables) {
    }

    private static final class DocumentGridFile implements GridFile {
        private final String path;
        private final Map<String, GridVariable> variables;

        private DocumentGridFile(String path, GridDocument document) {
            this.path = path;
            this.variables = document.variables() == null ? Map.of() : document.variables();
        }

        @Override
        public boolean hasVariable(String variableName) {
            return variables.containsKey(variableName);
        }

        @Override
        public RawArray read(String variableName) {
            GridVariable variable = variables.get(variableName);
            if (variable == null) {
                throw new MissingVariableException(variableName,
                        "La variable '" + variableName + "' no existe en " + path);
            }
            int[] shape = variable.shape() == null ? new int[]{variable.data().length} : variable.shape();
            return new RawArray(shape.clone(), variable.data().clone());
        }

        @Override
        public void close() {
            log.trace("Cerrando {}", path);
        }
    }
}
