package tcdiags.domain.diagnostics;

import tcdiags.domain.grid.GeoField;

/**
 * Componentes zonal y meridional de un viento sobre la misma malla.
 */
public record WindPair(GeoField u, GeoField v) {

    public WindPair {
        if (u.size() != v.size()) {
            throw new IllegalArgumentException("Las componentes u y v deben tener el mismo tamaño.");
        }
    }
}
