package tcdiags.domain.exception;

import lombok.Getter;

import java.util.List;

/**
 * Una variable derivada depende de entradas que nunca se resuelven
 * (nodo ausente, entrada fallida o ciclo en el grafo de dependencias).
 */
@Getter
public class DependencyException extends TcDiagsException {

    /** Nombres de las entradas que no se pudieron satisfacer. */
    private final List<String> unresolvedInputs;

    public DependencyException(List<String> unresolvedInputs, String message) {
        super(message);
        this.unresolvedInputs = List.copyOf(unresolvedInputs);
    }
}
