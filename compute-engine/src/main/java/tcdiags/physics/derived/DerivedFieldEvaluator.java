package tcdiags.physics.derived;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tcdiags.config.DerivedVariableSpec;
import tcdiags.domain.exception.ConfigException;
import tcdiags.domain.exception.DependencyException;
import tcdiags.domain.grid.GeoField;
import tcdiags.units.Unit;
import tcdiags.units.UnitSystem;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Evalúa variables derivadas sobre las ya resueltas.
 * <p>
 * Las entradas se convierten al contrato de unidades del método y el resultado a las
 * unidades declaradas por la especificación.
 */
@Slf4j
@RequiredArgsConstructor
public class DerivedFieldEvaluator {

    private final UnitSystem unitSystem;

    /**
     * @throws DependencyException si alguna entrada no está en {@code resolved}.
     */
    public GeoField evaluate(DerivedVariableSpec spec, Map<String, GeoField> resolved) {
        DerivedMethod method = DerivedMethod.fromKey(spec.method());
        Unit declared = unitSystem.parse(spec.units());
        List<String> names = spec.inputs().isEmpty() ? method.defaultInputs() : spec.inputs();
        if (names.size() != method.arity()) {
            throw new ConfigException(String.format(
                    "La variable '%s' declara %d entradas pero el método %s requiere %d: %s.",
                    spec.name(), names.size(), method.key(), method.arity(), method.defaultInputs()));
        }

        List<String> missing = names.stream().filter(n -> !resolved.containsKey(n)).toList();
        if (!missing.isEmpty()) {
            throw new DependencyException(missing, String.format(
                    "La variable derivada '%s' requiere entradas no resueltas: %s.", spec.name(), missing));
        }

        List<GeoField> inputs = new ArrayList<>(names.size());
        for (int i = 0; i < names.size(); i++) {
            GeoField field = resolved.get(names.get(i));
            inputs.add(toUnit(field, method.inputUnits().get(i)));
        }

        log.debug("Evaluando '{}' con {} sobre {}", spec.name(), method.key(), names);
        GeoField computed = method.computation().compute(spec.name(), inputs);

        double[] values = unitSystem.convert(computed.toArray(), method.outputUnit(), declared);
        GeoField result = GeoField.of(spec.name(), spec.units(), computed.shape(), values);
        log.info("Variable derivada '{}' calculada ({}).", spec.name(), method.key());
        return result;
    }

    /**
     * Evalúa todas las especificaciones en orden topológico estricto.
     */
    public Map<String, GeoField> evaluateAll(List<DerivedVariableSpec> specs, Map<String, GeoField> resolved) {
        Map<String, GeoField> out = new LinkedHashMap<>(resolved);
        for (DerivedVariableSpec spec : DependencyGraph.order(specs, resolved.keySet())) {
            out.put(spec.name(), evaluate(spec, out));
        }
        return out;
    }

    private GeoField toUnit(GeoField field, Unit target) {
        Unit source = unitSystem.parse(field.getUnits());
        if (source.equals(target)) {
            return field;
        }
        return field.withData(unitSystem.convert(field.toArray(), source, target), target.symbol());
    }
}
