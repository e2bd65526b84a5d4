package tcdiags.domain.grid;

import lombok.Builder;
import lombok.With;

import java.time.Instant;

/**
 * Posición del centro de un ciclón tropical.
 *
 * @param tcId      Identificador del TC (ej: "09L").
 * @param lat       Latitud del centro [grados].
 * @param lon       Longitud del centro [grados].
 * @param validTime Tiempo de validez (opcional, puede ser nulo).
 */
@Builder
@With
public record TcFix(String tcId, double lat, double lon, Instant validTime) {

    public TcFix {
        if (tcId == null || tcId.isBlank()) {
            throw new IllegalArgumentException("El identificador del TC no puede estar vacío.");
        }
        if (lat < -90.0 || lat > 90.0) {
            throw new IllegalArgumentException("Latitud fuera de rango para " + tcId + ": " + lat);
        }
    }

    public static TcFix of(String tcId, double lat, double lon) {
        return new TcFix(tcId, lat, lon, null);
    }
}
