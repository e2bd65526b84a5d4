package tcdiags.domain.diagnostics;

import lombok.Builder;
import lombok.Value;
import tcdiags.domain.grid.PolarField;

import java.util.List;

/**
 * Descomposición azimutal de un campo polar.
 * <p>
 * {@code components.get(k)} es la componente real del número de onda k.
 * Se cumple {@code Σ components + residual == original} salvo redondeo.
 */
@Value
@Builder
public class WavenumberSpectrum {

    PolarField original;

    List<PolarField> components;

    /** Suma de las componentes 0..maxWn. */
    PolarField truncated;

    PolarField residual;

    /** Máximo global del campo original y su posición. */
    double maxMagnitude;
    double radiusOfMax;
    double azimuthOfMax;

    /** Máximo de cada componente, indexado por número de onda. */
    List<Double> componentMaxima;

    public int maxWn() {
        return components.size() - 1;
    }
}
