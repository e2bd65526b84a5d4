package tcdiags.physics.projection;

import lombok.extern.slf4j.Slf4j;
import tcdiags.domain.exception.ConfigException;
import tcdiags.domain.grid.GeoField;
import tcdiags.domain.grid.GeoGrid;
import tcdiags.domain.grid.PolarField;
import tcdiags.domain.grid.PolarGridSpec;
import tcdiags.domain.grid.TcFix;

/**
 * Proyecta un campo geográfico a la malla polar (radio, azimut) centrada en un TC.
 * Función pura de (campo, TC, malla).
 */
@Slf4j
public class TcRelativeProjector {

    public PolarField project(GeoField field, TcFix tcFix, PolarGridSpec gridSpec) {
        if (field.rank() != 2) {
            throw new ConfigException(String.format(
                    "La proyección polar requiere un campo 2-D; '%s' tiene rango %d.", field.getName(), field.rank()));
        }
        GeoGrid grid = field.grid().orElseThrow(() -> new ConfigException(
                "El campo '" + field.getName() + "' no tiene malla geográfica asociada."));

        double[] radii = gridSpec.radii();
        double[] azimuths = gridSpec.azimuths();
        double[] plane = field.toArray();
        BilinearInterpolator interpolator = new BilinearInterpolator(grid);

        double[][] values = new double[radii.length][azimuths.length];
        int missing = 0;
        for (int r = 0; r < radii.length; r++) {
            for (int a = 0; a < azimuths.length; a++) {
                double[] dest = GreatCircle.destination(tcFix.lat(), tcFix.lon(), azimuths[a], radii[r]);
                double value = interpolator.interpolate(plane, dest[0], dest[1]);
                values[r][a] = Double.isNaN(value) ? PolarField.MISSING : value;
                if (Double.isNaN(value)) {
                    missing++;
                }
            }
        }
        if (missing > 0) {
            log.debug("Proyección de '{}' para {}: {} celdas fuera del dominio.", field.getName(), tcFix.tcId(), missing);
        }
        return new PolarField(field.getName(), field.getUnits(), tcFix, radii, azimuths, values);
    }
}
