package tcdiags.config.schema;

import tcdiags.domain.exception.ConfigException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static tcdiags.config.schema.FieldType.BOOLEAN;
import static tcdiags.config.schema.FieldType.DOUBLE;
import static tcdiags.config.schema.FieldType.DOUBLE_LIST;
import static tcdiags.config.schema.FieldType.INTEGER;
import static tcdiags.config.schema.FieldType.NUMBER_MAP_LIST;
import static tcdiags.config.schema.FieldType.STRING;
import static tcdiags.config.schema.FieldType.STRING_LIST;

/**
 * Registro de esquemas de una ejecución. Se crea por ejecución y se pasa
 * explícitamente a quien valide bloques de configuración.
 */
public final class SchemaRegistry {

    public static final String FILE_VARIABLE = "file_variable";
    public static final String DERIVED_VARIABLE = "derived_variable";
    public static final String TCPI = "tcpi";
    public static final String TCMSI = "tcmsi";
    public static final String TCSTEERING = "tcsteering";
    public static final String TCOHC = "tcohc";
    public static final String TC_FIX = "tc_fix";

    private final Map<String, Schema> schemas = new LinkedHashMap<>();

    public static SchemaRegistry standard() {
        SchemaRegistry registry = new SchemaRegistry();

        registry.register(Schema.builder(FILE_VARIABLE)
                .required("source", STRING, "Origen de la variable (file).")
                .required("path", STRING, "Ruta del archivo de análisis.")
                .required("variable_name", STRING, "Nombre del array dentro del archivo.")
                .required("units", STRING, "Unidades declaradas.")
                .optional("squeeze", BOOLEAN, false, "Elimina el eje indicado si su longitud es 1.")
                .optional("squeeze_axis", INTEGER, 0, "Eje a eliminar.")
                .optional("flip_lat", BOOLEAN, false, "Invierte el eje de latitud.")
                .optional("flip_z", BOOLEAN, false, "Invierte el eje vertical.")
                .optional("scale_mult", DOUBLE, 1.0, "Factor multiplicativo.")
                .optional("scale_add", DOUBLE, 0.0, "Término aditivo.")
                .build());

        registry.register(Schema.builder(DERIVED_VARIABLE)
                .required("source", STRING, "Origen de la variable (derived).")
                .required("method", STRING, "Método de derivación.")
                .required("units", STRING, "Unidades declaradas.")
                .optional("inputs", STRING_LIST, List.of(), "Nombres de las variables de entrada.")
                .build());

        registry.register(Schema.builder(TCPI)
                .optional("mslp_max", DOUBLE, 2000.0, "Presión a nivel del mar máxima admitida [hPa].")
                .optional("zmax", DOUBLE, 0.0, "Altura de orografía máxima admitida [m].")
                .optional("write_output", BOOLEAN, false, "Escribe el resumen en disco.")
                .optional("output_file", STRING, "./tcdiags.tcpi.json", "Ruta de salida.")
                .build());

        registry.register(Schema.builder(TCMSI)
                .optional("drho", DOUBLE, 100000.0, "Resolución radial [m].")
                .optional("dphi", DOUBLE, 45.0, "Resolución azimutal [grados].")
                .optional("max_radius", DOUBLE, 1000000.0, "Radio máximo [m].")
                .optional("max_wn", INTEGER, 3, "Número de onda máximo retenido.")
                .optional("write_output", BOOLEAN, false, "Escribe el resumen en disco.")
                .optional("output_file", STRING, "./tcdiags.tcmsi.%s.json", "Ruta de salida (%s = TC).")
                .build());

        registry.register(Schema.builder(TCSTEERING)
                .optional("isolevels", DOUBLE_LIST,
                        List.of(100000.0, 90000.0, 80000.0, 70000.0, 60000.0,
                                50000.0, 40000.0, 30000.0, 20000.0, 10000.0),
                        "Niveles isobáricos de análisis [Pa].")
                .optional("distance", DOUBLE, 1600000.0, "Radio de la región del TC [m].")
                .optional("ddist", DOUBLE, 100000.0, "Anchura de la rampa de relajación [m].")
                .optional("ncoeffs", INTEGER, 10, "Tripletes singulares retenidos.")
                .optional("layers", NUMBER_MAP_LIST, List.of(), "Capas {top, bottom} [Pa].")
                .optional("write_output", BOOLEAN, false, "Escribe el resumen en disco.")
                .optional("output_file", STRING, "./tcdiags.tcsteering.json", "Ruta de salida.")
                .build());

        registry.register(Schema.builder(TCOHC)
                .optional("deltaz", DOUBLE, 1.0, "Paso de integración vertical [m].")
                .optional("fill_value", DOUBLE, 0.0, "Profundidad asignada a columnas sin isoterma.")
                .optional("interp_type", STRING, "linear", "Interpolación: linear, nearest, previous, next.")
                .optional("isotherm", DOUBLE, 26.0, "Isoterma objetivo [°C].")
                .optional("write_output", BOOLEAN, false, "Escribe el resumen en disco.")
                .optional("output_file", STRING, "./tcdiags.tcohc.json", "Ruta de salida.")
                .build());

        registry.register(Schema.builder(TC_FIX)
                .required("lat_deg", DOUBLE, "Latitud del centro [grados].")
                .required("lon_deg", DOUBLE, "Longitud del centro [grados].")
                .optional("valid_time", STRING, null, "Tiempo de validez ISO-8601.")
                .build());

        return registry;
    }

    public void register(Schema schema) {
        schemas.put(schema.getName(), schema);
    }

    public Schema get(String name) {
        Schema schema = schemas.get(name);
        if (schema == null) {
            throw new ConfigException("No existe ningún esquema registrado con el nombre '" + name + "'.");
        }
        return schema;
    }

    public Set<String> names() {
        return schemas.keySet();
    }
}
