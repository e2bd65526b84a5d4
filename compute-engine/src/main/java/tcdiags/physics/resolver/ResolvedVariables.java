package tcdiags.physics.resolver;

import tcdiags.domain.exception.MissingVariableException;
import tcdiags.domain.exception.TcDiagsException;
import tcdiags.domain.grid.GeoField;
import tcdiags.domain.grid.GeoGrid;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Mapa de sólo lectura de las variables resueltas de una ejecución y de los fallos
 * por variable. Las aplicaciones que requieren una variable fallida reciben el error original.
 */
public final class ResolvedVariables {

    private final Map<String, GeoField> fields;
    private final Map<String, TcDiagsException> failures;
    private final GeoGrid grid;

    public ResolvedVariables(Map<String, GeoField> fields, Map<String, TcDiagsException> failures, GeoGrid grid) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
        this.grid = grid;
    }

    public static ResolvedVariables of(Map<String, GeoField> fields, GeoGrid grid) {
        return new ResolvedVariables(fields, Map.of(), grid);
    }

    /**
     * Devuelve la variable o relanza el error que impidió resolverla.
     */
    public GeoField require(String name) {
        GeoField field = fields.get(name);
        if (field != null) {
            return field;
        }
        TcDiagsException failure = failures.get(name);
        if (failure != null) {
            throw failure;
        }
        throw new MissingVariableException(name, "La variable '" + name + "' no está declarada en las entradas.");
    }

    public Optional<GeoField> find(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    public boolean contains(String name) {
        return fields.containsKey(name);
    }

    public Map<String, GeoField> asMap() {
        return fields;
    }

    public Map<String, TcDiagsException> failures() {
        return failures;
    }

    public Set<String> names() {
        return fields.keySet();
    }

    public Optional<GeoGrid> grid() {
        return Optional.ofNullable(grid);
    }

    public GeoGrid requireGrid() {
        if (grid == null) {
            throw new MissingVariableException(InputResolver.LATITUDE,
                    "No hay malla geográfica: se requieren las variables 'latitude' y 'longitude'.");
        }
        return grid;
    }
}
