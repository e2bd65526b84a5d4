package tcdiags.physics.projection;

/**
 * Geometría de círculo máximo sobre una Tierra esférica.
 */
public final class GreatCircle {

    /** Radio medio terrestre [m]. */
    public static final double EARTH_RADIUS = 6371008.8;

    private GreatCircle() {
    }

    /**
     * Punto de destino desde (lat0, lon0) recorriendo {@code distance} metros con rumbo
     * {@code bearing} (radianes, horario desde el norte).
     *
     * @return {lat, lon} en grados, longitud en [-180, 180).
     */
    public static double[] destination(double lat0, double lon0, double bearing, double distance) {
        double phi1 = Math.toRadians(lat0);
        double lambda1 = Math.toRadians(lon0);
        double delta = distance / EARTH_RADIUS;

        double sinPhi2 = Math.sin(phi1) * Math.cos(delta) + Math.cos(phi1) * Math.sin(delta) * Math.cos(bearing);
        sinPhi2 = Math.max(-1.0, Math.min(1.0, sinPhi2));
        double phi2 = Math.asin(sinPhi2);
        double lambda2 = lambda1 + Math.atan2(
                Math.sin(bearing) * Math.sin(delta) * Math.cos(phi1),
                Math.cos(delta) - Math.sin(phi1) * sinPhi2);

        return new double[]{Math.toDegrees(phi2), normalizeLongitude(Math.toDegrees(lambda2))};
    }

    /**
     * Distancia de círculo máximo (haversine) en metros.
     */
    public static double distance(double lat1, double lon1, double lat2, double lon2) {
        double phi1 = Math.toRadians(lat1);
        double phi2 = Math.toRadians(lat2);
        double dPhi = phi2 - phi1;
        double dLambda = Math.toRadians(lon2 - lon1);
        double a = Math.sin(dPhi / 2) * Math.sin(dPhi / 2)
                + Math.cos(phi1) * Math.cos(phi2) * Math.sin(dLambda / 2) * Math.sin(dLambda / 2);
        return 2.0 * EARTH_RADIUS * Math.atan2(Math.sqrt(a), Math.sqrt(Math.max(0.0, 1.0 - a)));
    }

    public static double normalizeLongitude(double lon) {
        double out = ((lon + 180.0) % 360.0 + 360.0) % 360.0 - 180.0;
        return out == 180.0 ? -180.0 : out;
    }
}
