package tcdiags.io;

import tcdiags.domain.exception.MissingVariableException;

import java.util.HashMap;
import java.util.Map;

/**
 * Fuente de mallas en memoria, indexada por ruta y nombre de variable.
 */
public class InMemoryGridDataSource implements GridDataSource {

    private final Map<String, Map<String, RawArray>> files = new HashMap<>();

    public InMemoryGridDataSource put(String path, String variableName, int[] shape, double[] data) {
        files.computeIfAbsent(path, p -> new HashMap<>()).put(variableName, new RawArray(shape.clone(), data.clone()));
        return this;
    }

    @Override
    public GridFile open(String path) {
        Map<String, RawArray> variables = files.get(path);
        if (variables == null) {
            throw new MissingVariableException(path, "No existe ningún archivo en memoria con la ruta " + path);
        }
        return new GridFile() {
            @Override
            public boolean hasVariable(String variableName) {
                return variables.containsKey(variableName);
            }

            @Override
            public RawArray read(String variableName) {
                RawArray array = variables.get(variableName);
                if (array == null) {
                    throw new MissingVariableException(variableName,
                            "La variable '" + variableName + "' no existe en " + path);
                }
                return new RawArray(array.shape().clone(), array.data().clone());
            }

            @Override
            public void close() {
            }
        };
    }
}
