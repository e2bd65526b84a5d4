package tcdiags.config;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.With;
import tcdiags.config.schema.ValidatedConfig;
import tcdiags.domain.exception.ConfigException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Parámetros de la aplicación de flujo director (tcsteering).
 */
@Value
@Builder
@With
public class SteeringFlowConfig {

    /** Niveles isobáricos de análisis [Pa]. */
    @Singular
    List<Double> isolevels;

    /** Radio de la región del TC [m]. */
    @Builder.Default
    double distance = 1600000.0;

    /** Anchura de la rampa de relajación [m]. */
    @Builder.Default
    double ddist = 100000.0;

    @Builder.Default
    int ncoeffs = 10;

    /**
     * Capas explícitas. Vacío significa una única capa profunda con todos los niveles.
     */
    @Singular
    List<LayerBounds> layers;

    boolean writeOutput;

    String outputFile;

    /**
     * Capas efectivas de la ejecución.
     */
    public List<LayerBounds> effectiveLayers() {
        if (!layers.isEmpty()) {
            return layers;
        }
        double top = isolevels.stream().mapToDouble(Double::doubleValue).min().orElse(Double.NaN);
        double bottom = isolevels.stream().mapToDouble(Double::doubleValue).max().orElse(Double.NaN);
        return List.of(new LayerBounds(top, bottom));
    }

    public static SteeringFlowConfig from(ValidatedConfig config) {
        List<LayerBounds> layers = new ArrayList<>();
        for (Map<String, Double> block : config.getNumberMapList("layers")) {
            Double top = block.get("top");
            Double bottom = block.get("bottom");
            if (top == null || bottom == null) {
                throw new ConfigException("Cada capa de 'tcsteering.layers' requiere las claves 'top' y 'bottom'.");
            }
            layers.add(new LayerBounds(top, bottom));
        }
        List<Double> isolevels = config.getDoubleList("isolevels");
        if (isolevels.size() < 2) {
            throw new ConfigException("'tcsteering.isolevels' requiere al menos dos niveles.");
        }
        double lowest = isolevels.stream().mapToDouble(Double::doubleValue).min().orElseThrow();
        double highest = isolevels.stream().mapToDouble(Double::doubleValue).max().orElseThrow();
        for (LayerBounds layer : layers) {
            if (!(layer.top() < highest && layer.bottom() > lowest)) {
                throw new ConfigException(String.format(
                        "La capa %.1f-%.1f Pa no se solapa con los niveles de análisis (%.1f-%.1f Pa).",
                        layer.top(), layer.bottom(), lowest, highest));
            }
        }
        return SteeringFlowConfig.builder()
                .isolevels(isolevels)
                .distance(config.getDouble("distance"))
                .ddist(config.getDouble("ddist"))
                .ncoeffs(config.getInt("ncoeffs"))
                .layers(layers)
                .writeOutput(config.getBoolean("write_output"))
                .outputFile(config.getString("output_file"))
                .build();
    }

    /**
     * Rango isobárico de una capa [Pa]. {@code top} es la presión menor.
     */
    public record LayerBounds(double top, double bottom) {
        public LayerBounds {
            if (!(top < bottom)) {
                throw new ConfigException(String.format(
                        "Capa inválida: top (%.1f Pa) debe ser menor que bottom (%.1f Pa).", top, bottom));
            }
        }
    }
}
