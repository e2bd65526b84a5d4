package tcdiags.physics.resolver;

import lombok.extern.slf4j.Slf4j;
import tcdiags.config.DerivedVariableSpec;
import tcdiags.config.FileVariableSpec;
import tcdiags.config.VariableSpec;
import tcdiags.domain.exception.ConfigException;
import tcdiags.domain.exception.DependencyException;
import tcdiags.domain.exception.MissingVariableException;
import tcdiags.domain.exception.TcDiagsException;
import tcdiags.domain.exception.UnitException;
import tcdiags.domain.grid.GeoField;
import tcdiags.domain.grid.GeoGrid;
import tcdiags.physics.derived.DependencyGraph;
import tcdiags.physics.derived.DerivedFieldEvaluator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resuelve todas las variables de entrada de una ejecución: primero las de archivo,
 * después las derivadas en orden topológico.
 * <p>
 * Los fallos por variable quedan registrados y sólo abortan las aplicaciones que
 * necesitan esa variable. Un error de unidades es fatal para la ejecución.
 */
@Slf4j
public class InputResolver {

    public static final String LATITUDE = "latitude";
    public static final String LONGITUDE = "longitude";

    private final VariableResolver variableResolver;
    private final DerivedFieldEvaluator derivedEvaluator;

    public InputResolver(VariableResolver variableResolver, DerivedFieldEvaluator derivedEvaluator) {
        this.variableResolver = variableResolver;
        this.derivedEvaluator = derivedEvaluator;
    }

    public ResolvedVariables resolveAll(Map<String, VariableSpec> specs) {
        Map<String, GeoField> fields = new LinkedHashMap<>();
        Map<String, TcDiagsException> failures = new LinkedHashMap<>();
        List<DerivedVariableSpec> derived = new ArrayList<>();

        // La latitud fija la convención flip_lat antes que el resto de campos.
        List<FileVariableSpec> fileSpecs = new ArrayList<>();
        for (VariableSpec spec : specs.values()) {
            if (spec instanceof FileVariableSpec file) {
                if (LATITUDE.equals(file.name())) {
                    fileSpecs.add(0, file);
                } else {
                    fileSpecs.add(file);
                }
            } else if (spec instanceof DerivedVariableSpec d) {
                derived.add(d);
            }
        }

        log.info("Resolviendo {} variables de archivo y {} derivadas.", fileSpecs.size(), derived.size());
        for (FileVariableSpec spec : fileSpecs) {
            try {
                GeoField field = LATITUDE.equals(spec.name())
                        ? variableResolver.resolveLatitudeAxis(spec)
                        : variableResolver.resolve(spec);
                fields.put(spec.name(), field);
            } catch (UnitException e) {
                log.error("Error de unidades en '{}': la ejecución no puede continuar.", spec.name());
                throw e;
            } catch (MissingVariableException | ConfigException e) {
                log.error("No se pudo resolver la variable '{}': {}", spec.name(), e.getMessage());
                failures.put(spec.name(), e);
            }
        }

        GeoGrid grid = buildGrid(fields, failures);

        DependencyGraph.Plan plan = DependencyGraph.plan(derived, fields.keySet());
        plan.unresolvable().forEach((name, error) -> {
            log.error("Variable derivada '{}' no evaluable: {}", name, error.getMessage());
            failures.put(name, error);
        });
        for (DerivedVariableSpec spec : plan.order()) {
            try {
                fields.put(spec.name(), derivedEvaluator.evaluate(spec, fields));
            } catch (UnitException e) {
                log.error("Error de unidades en la variable derivada '{}'.", spec.name());
                throw e;
            } catch (ConfigException | DependencyException e) {
                log.error("No se pudo evaluar la variable derivada '{}': {}", spec.name(), e.getMessage());
                failures.put(spec.name(), e);
            }
        }

        if (grid != null) {
            for (Map.Entry<String, GeoField> entry : fields.entrySet()) {
                entry.setValue(attachGrid(entry.getValue(), grid));
            }
        }

        log.info("Variables resueltas: {}. Fallidas: {}.", fields.keySet(), failures.keySet());
        return new ResolvedVariables(fields, failures, grid);
    }

    private static GeoGrid buildGrid(Map<String, GeoField> fields, Map<String, TcDiagsException> failures) {
        GeoField lat = fields.get(LATITUDE);
        GeoField lon = fields.get(LONGITUDE);
        if (lat == null || lon == null) {
            log.warn("Sin coordenadas 'latitude'/'longitude': los campos no tendrán malla geográfica.");
            return null;
        }
        try {
            GeoGrid grid = VariableResolver.broadcastCoordinates(lat, lon);
            log.info("Malla geográfica de la ejecución: {}", grid);
            return grid;
        } catch (ConfigException e) {
            log.error("Coordenadas no válidas: {}", e.getMessage());
            failures.put(LATITUDE, e);
            return null;
        }
    }

    private static GeoField attachGrid(GeoField field, GeoGrid grid) {
        if (field.rank() >= 2 && field.ny() == grid.ny() && field.nx() == grid.nx()) {
            return field.withGrid(grid);
        }
        return field;
    }
}
