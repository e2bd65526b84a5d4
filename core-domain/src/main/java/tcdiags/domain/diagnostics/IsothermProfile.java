package tcdiags.domain.diagnostics;

import lombok.Builder;
import lombok.Value;
import tcdiags.domain.grid.GeoField;

/**
 * Profundidad de la isoterma y TCHP por columna.
 */
@Value
@Builder
public class IsothermProfile {

    double isotherm;

    /** Profundidad de la isoterma [m] o el valor de relleno. */
    GeoField depth;

    /** Potencial calorífico del TC [kJ/cm^2]. */
    GeoField tchp;

    /** Contenido calorífico por nivel relativo a la isoterma [J/m^3]. */
    GeoField ohc;

    int filledColumns;
}
