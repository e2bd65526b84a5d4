package tcdiags.physics.resolver;

import lombok.extern.slf4j.Slf4j;
import tcdiags.config.FileVariableSpec;
import tcdiags.domain.exception.ConfigException;
import tcdiags.domain.exception.MissingVariableException;
import tcdiags.domain.grid.GeoField;
import tcdiags.domain.grid.GeoGrid;
import tcdiags.io.GridDataSource;
import tcdiags.io.GridFile;
import tcdiags.io.RawArray;
import tcdiags.units.UnitSystem;

/**
 * Lee variables de archivo y aplica las transformaciones declaradas:
 * squeeze, inversión de ejes y escalado afín.
 * <p>
 * Todas las variables con eje de latitud de una ejecución deben compartir el mismo
 * {@code flip_lat}; el primer campo fija la convención. Una instancia por ejecución.
 */
@Slf4j
public class VariableResolver {

    private final GridDataSource dataSource;
    private final UnitSystem unitSystem;

    private Boolean flipLatConvention;
    private String conventionOwner;

    public VariableResolver(GridDataSource dataSource, UnitSystem unitSystem) {
        this.dataSource = dataSource;
        this.unitSystem = unitSystem;
    }

    /**
     * Resuelve un campo (1-D, 2-D lat × lon o 3-D nivel × lat × lon).
     * En arrays 1-D {@code flip_lat} no aplica.
     */
    public GeoField resolve(FileVariableSpec spec) {
        return resolve(spec, false);
    }

    /**
     * Resuelve la coordenada de latitud. Si es 1-D, {@code flip_lat} invierte su único eje.
     */
    public GeoField resolveLatitudeAxis(FileVariableSpec spec) {
        return resolve(spec, true);
    }

    private GeoField resolve(FileVariableSpec spec, boolean latitudeAxis) {
        // Unidades primero: un error de unidades es fatal para toda la ejecución.
        unitSystem.parse(spec.units());

        RawArray raw;
        try (GridFile file = dataSource.open(spec.path())) {
            if (!file.hasVariable(spec.variableName())) {
                throw new MissingVariableException(spec.name(), String.format(
                        "La variable '%s' (array '%s') no existe en %s.", spec.name(), spec.variableName(), spec.path()));
            }
            raw = file.read(spec.variableName());
        }

        int[] shape = raw.shape().clone();
        double[] data = raw.data();

        if (spec.squeeze()) {
            shape = squeeze(spec, shape);
        }

        boolean latBearing = shape.length >= 2 || (latitudeAxis && shape.length == 1);
        if (latBearing) {
            checkLatConvention(spec);
        }
        if (spec.flipLat()) {
            if (shape.length >= 2) {
                data = reverseAxis(data, shape, shape.length - 2);
            } else if (latitudeAxis) {
                data = reverseAxis(data, shape, 0);
            } else {
                log.debug("flip_lat ignorado en '{}': array 1-D sin eje de latitud.", spec.name());
            }
        }
        if (spec.flipZ()) {
            if (shape.length < 3) {
                throw new ConfigException(String.format(
                        "La variable '%s' declara flip_z pero tiene rango %d (se requiere nivel × lat × lon).",
                        spec.name(), shape.length));
            }
            data = reverseAxis(data, shape, shape.length - 3);
        }

        double mult = spec.scaleMult();
        double add = spec.scaleAdd();
        if (mult != 1.0 || add != 0.0) {
            double[] scaled = new double[data.length];
            for (int i = 0; i < data.length; i++) {
                scaled[i] = data[i] * mult + add;
            }
            data = scaled;
        }

        GeoField field = GeoField.of(spec.name(), spec.units(), shape, data);
        log.debug("Variable resuelta: {}", field);
        return field;
    }

    /**
     * Difunde coordenadas 1-D a la malla 2-D. Si ya son 2-D sólo se empaquetan.
     */
    public static GeoGrid broadcastCoordinates(GeoField latitude, GeoField longitude) {
        if (latitude.rank() == 1 && longitude.rank() == 1) {
            return GeoGrid.fromAxes(latitude.toArray(), longitude.toArray());
        }
        if (latitude.rank() == 2 && longitude.rank() == 2
                && latitude.ny() == longitude.ny() && latitude.nx() == longitude.nx()) {
            return GeoGrid.of(latitude.ny(), latitude.nx(), latitude.toArray(), longitude.toArray());
        }
        throw new ConfigException(String.format(
                "Coordenadas incompatibles: latitude %s, longitude %s.", latitude, longitude));
    }

    private void checkLatConvention(FileVariableSpec spec) {
        if (flipLatConvention == null) {
            flipLatConvention = spec.flipLat();
            conventionOwner = spec.name();
            return;
        }
        if (flipLatConvention != spec.flipLat()) {
            throw new ConfigException(String.format(
                    "La variable '%s' declara flip_lat=%s pero '%s' fijó flip_lat=%s; "
                            + "todas las variables de la ejecución deben compartir la orientación de latitud.",
                    spec.name(), spec.flipLat(), conventionOwner, flipLatConvention));
        }
    }

    private static int[] squeeze(FileVariableSpec spec, int[] shape) {
        int axis = spec.squeezeAxis();
        if (axis < 0 || axis >= shape.length) {
            throw new ConfigException(String.format(
                    "squeeze_axis=%d fuera de rango para '%s' (rango %d).", axis, spec.name(), shape.length));
        }
        if (shape[axis] != 1) {
            log.debug("squeeze omitido en '{}': el eje {} tiene longitud {}.", spec.name(), axis, shape[axis]);
            return shape;
        }
        int[] out = new int[shape.length - 1];
        for (int i = 0, o = 0; i < shape.length; i++) {
            if (i != axis) {
                out[o++] = shape[i];
            }
        }
        return out;
    }

    /**
     * Invierte el array (fila-mayor) a lo largo de {@code axis}.
     */
    static double[] reverseAxis(double[] data, int[] shape, int axis) {
        int outer = 1;
        for (int i = 0; i < axis; i++) {
            outer *= shape[i];
        }
        int n = shape[axis];
        int inner = 1;
        for (int i = axis + 1; i < shape.length; i++) {
            inner *= shape[i];
        }
        double[] out = new double[data.length];
        for (int o = 0; o < outer; o++) {
            for (int k = 0; k < n; k++) {
                int src = (o * n + k) * inner;
                int dst = (o * n + (n - 1 - k)) * inner;
                System.arraycopy(data, src, out, dst, inner);
            }
        }
        return out;
    }
}
