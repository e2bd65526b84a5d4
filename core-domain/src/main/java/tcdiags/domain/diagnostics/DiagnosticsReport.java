package tcdiags.domain.diagnostics;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import tcdiags.domain.warning.DiagnosticWarning;

import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Resultado completo de una ejecución del orquestador.
 */
@Value
@Builder
public class DiagnosticsReport {

    @Singular
    Map<Application, ApplicationResult> results;

    @Singular
    List<DiagnosticWarning> warnings;

    public ApplicationResult result(Application application) {
        ApplicationResult result = results.get(application);
        if (result == null) {
            throw new NoSuchElementException("La aplicación " + application.key() + " no se solicitó en esta ejecución.");
        }
        return result;
    }

    public TcAttributes attributes(Application application, String tcId) {
        TcAttributes attributes = result(application).getPerTc().get(tcId);
        if (attributes == null) {
            throw new NoSuchElementException("Sin atributos de " + application.key() + " para el TC " + tcId);
        }
        return attributes;
    }
}
