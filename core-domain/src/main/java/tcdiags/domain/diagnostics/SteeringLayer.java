package tcdiags.domain.diagnostics;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Medias de capa de las componentes del viento entre {@code top} y {@code bottom} [Pa].
 */
@Value
@Builder
public class SteeringLayer {

    double top;
    double bottom;

    WindPair total;
    WindPair rotational;
    WindPair divergent;
    WindPair harmonic;

    /** Viento total filtrado por SVD. */
    WindPair filtered;

    @Singular
    Map<String, SteeringVector> steeringVectors;
}
