package tcdiags.config;

import lombok.Builder;
import lombok.With;
import tcdiags.config.schema.ValidatedConfig;

/**
 * Variable leída directamente de un archivo de análisis.
 *
 * @param name         Nombre lógico.
 * @param path         Ruta del archivo.
 * @param variableName Nombre del array dentro del archivo.
 * @param squeeze      Si es true, elimina {@code squeezeAxis} cuando su longitud es 1.
 * @param squeezeAxis  Eje candidato a eliminar.
 * @param flipLat      Invierte el eje de latitud.
 * @param flipZ        Invierte el eje vertical (tras invertir, el nivel 0 es el más bajo).
 * @param scaleMult    Factor multiplicativo.
 * @param scaleAdd     Término aditivo.
 * @param units        Unidades declaradas.
 */
@Builder
@With
public record FileVariableSpec(
        String name,
        String path,
        String variableName,
        boolean squeeze,
        int squeezeAxis,
        boolean flipLat,
        boolean flipZ,
        double scaleMult,
        double scaleAdd,
        String units) implements VariableSpec {

    public static FileVariableSpec from(String name, ValidatedConfig config) {
        return FileVariableSpec.builder()
                .name(name)
                .path(config.getString("path"))
                .variableName(config.getString("variable_name"))
                .squeeze(config.getBoolean("squeeze"))
                .squeezeAxis(config.getInt("squeeze_axis"))
                .flipLat(config.getBoolean("flip_lat"))
                .flipZ(config.getBoolean("flip_z"))
                .scaleMult(config.getDouble("scale_mult"))
                .scaleAdd(config.getDouble("scale_add"))
                .units(config.getString("units"))
                .build();
    }
}
