package tcdiags.physics.derived;

import lombok.extern.slf4j.Slf4j;
import tcdiags.config.DerivedVariableSpec;
import tcdiags.domain.exception.DependencyException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Orden topológico (Kahn) de las variables derivadas sobre el grafo de entradas declaradas.
 */
@Slf4j
public final class DependencyGraph {

    private DependencyGraph() {
    }

    /**
     * Plan de evaluación: las especificaciones evaluables en orden y las que no pueden
     * resolverse, con su error.
     */
    public record Plan(List<DerivedVariableSpec> order, Map<String, DependencyException> unresolvable) {
    }

    /**
     * Orden estricto: falla con la primera dependencia imposible.
     *
     * @throws DependencyException nombrando la entrada ausente o las variables del ciclo.
     */
    public static List<DerivedVariableSpec> order(Collection<DerivedVariableSpec> specs, Set<String> available) {
        Plan plan = plan(specs, available);
        if (!plan.unresolvable().isEmpty()) {
            throw plan.unresolvable().values().iterator().next();
        }
        return plan.order();
    }

    /**
     * Calcula el orden de evaluación tolerando fallos: cada variable no evaluable
     * (entrada ausente, entrada no evaluable o ciclo) se registra aparte.
     *
     * @param specs     Variables derivadas.
     * @param available Nombres ya resueltos (variables de archivo).
     */
    public static Plan plan(Collection<DerivedVariableSpec> specs, Set<String> available) {
        Map<String, DerivedVariableSpec> byName = new LinkedHashMap<>();
        for (DerivedVariableSpec spec : specs) {
            byName.put(spec.name(), spec);
        }

        Map<String, DependencyException> unresolvable = new LinkedHashMap<>();
        Map<String, Integer> pending = new HashMap<>();
        Map<String, List<String>> dependants = new HashMap<>();

        for (DerivedVariableSpec spec : byName.values()) {
            int count = 0;
            for (String input : effectiveInputs(spec)) {
                if (available.contains(input)) {
                    continue;
                }
                if (!byName.containsKey(input)) {
                    unresolvable.put(spec.name(), new DependencyException(List.of(input), String.format(
                            "La variable derivada '%s' requiere la entrada '%s', que nunca se resuelve.",
                            spec.name(), input)));
                    continue;
                }
                dependants.computeIfAbsent(input, k -> new ArrayList<>()).add(spec.name());
                count++;
            }
            pending.put(spec.name(), count);
        }

        Deque<String> ready = new ArrayDeque<>();
        for (DerivedVariableSpec spec : byName.values()) {
            if (pending.get(spec.name()) == 0 && !unresolvable.containsKey(spec.name())) {
                ready.add(spec.name());
            }
        }

        List<DerivedVariableSpec> order = new ArrayList<>();
        Set<String> done = new LinkedHashSet<>();
        while (!ready.isEmpty()) {
            String name = ready.poll();
            order.add(byName.get(name));
            done.add(name);
            for (String dependant : dependants.getOrDefault(name, List.of())) {
                int left = pending.merge(dependant, -1, Integer::sum);
                if (left == 0 && !unresolvable.containsKey(dependant)) {
                    ready.add(dependant);
                }
            }
        }

        // Lo que queda sin evaluar depende de algo no evaluable o forma un ciclo.
        List<String> stuck = new ArrayList<>();
        for (String name : byName.keySet()) {
            if (!done.contains(name) && !unresolvable.containsKey(name)) {
                stuck.add(name);
            }
        }
        Map<String, DependencyException> stuckFailures = new LinkedHashMap<>();
        for (String name : stuck) {
            List<String> blockers = new ArrayList<>();
            for (String input : effectiveInputs(byName.get(name))) {
                if (!available.contains(input) && !done.contains(input)) {
                    blockers.add(input);
                }
            }
            String message = reachesItself(name, byName, available, done)
                    ? String.format("La variable derivada '%s' forma parte de un ciclo de dependencias: %s.",
                            name, stuck)
                    : String.format("La variable derivada '%s' depende de entradas no resolubles: %s.",
                            name, blockers);
            stuckFailures.put(name, new DependencyException(blockers, message));
        }
        unresolvable.putAll(stuckFailures);

        if (!unresolvable.isEmpty()) {
            log.debug("Variables derivadas no evaluables: {}", unresolvable.keySet());
        }
        return new Plan(List.copyOf(order), unresolvable);
    }

    private static boolean reachesItself(String start, Map<String, DerivedVariableSpec> byName,
                                         Set<String> available, Set<String> done) {
        Deque<String> stack = new ArrayDeque<>();
        Set<String> seen = new LinkedHashSet<>();
        stack.push(start);
        while (!stack.isEmpty()) {
            DerivedVariableSpec spec = byName.get(stack.pop());
            if (spec == null) {
                continue;
            }
            for (String input : effectiveInputs(spec)) {
                if (available.contains(input) || done.contains(input)) {
                    continue;
                }
                if (input.equals(start)) {
                    return true;
                }
                if (seen.add(input)) {
                    stack.push(input);
                }
            }
        }
        return false;
    }

    static List<String> effectiveInputs(DerivedVariableSpec spec) {
        if (!spec.inputs().isEmpty()) {
            return spec.inputs();
        }
        return DerivedMethod.fromKey(spec.method()).defaultInputs();
    }
}
