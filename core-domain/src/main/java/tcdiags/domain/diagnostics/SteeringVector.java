package tcdiags.domain.diagnostics;

/**
 * Vector director de un TC [m/s].
 */
public record SteeringVector(String tcId, double u, double v) {

    public double speed() {
        return Math.hypot(u, v);
    }

    /**
     * Rumbo hacia el que empuja el flujo, en grados desde el norte en sentido horario.
     */
    public double heading() {
        double deg = Math.toDegrees(Math.atan2(u, v));
        return deg < 0.0 ? deg + 360.0 : deg;
    }
}
