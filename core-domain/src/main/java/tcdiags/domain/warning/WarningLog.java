package tcdiags.domain.warning;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Registro de advertencias de una ejecución del orquestador.
 * <p>
 * Ciclo de vida: una instancia por ejecución. No es thread-safe; el pipeline es
 * secuencial.
 */
@Slf4j
public class WarningLog {

    private final List<DiagnosticWarning> warnings = new ArrayList<>();

    public void record(DiagnosticWarning warning) {
        log.warn("[{}] {}", warning.source(), warning.message());
        warnings.add(warning);
    }

    public List<DiagnosticWarning> all() {
        return Collections.unmodifiableList(warnings);
    }

    public <T extends DiagnosticWarning> List<T> ofType(Class<T> type) {
        return warnings.stream().filter(type::isInstance).map(type::cast).toList();
    }

    public boolean isEmpty() {
        return warnings.isEmpty();
    }
}
