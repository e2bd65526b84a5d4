package tcdiags.domain.diagnostics;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import tcdiags.domain.grid.GeoField;

import java.util.Map;

/**
 * Resultado de una aplicación: campos de malla y atributos por TC, o el error que la abortó.
 */
@Value
@Builder
public class ApplicationResult {

    public enum Status { SUCCEEDED, FAILED }

    Application application;

    Status status;

    @Singular
    Map<String, GeoField> gridFields;

    @Singular("tc")
    Map<String, TcAttributes> perTc;

    /** Mensaje del error que abortó la aplicación, nulo si terminó bien. */
    String failure;

    public static ApplicationResult failed(Application application, String message) {
        return ApplicationResult.builder()
                .application(application)
                .status(Status.FAILED)
                .failure(message)
                .build();
    }

    public boolean succeeded() {
        return status == Status.SUCCEEDED;
    }
}
