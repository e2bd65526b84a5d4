package tcdiags.physics.derived;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tcdiags.config.DerivedVariableSpec;
import tcdiags.domain.exception.ConfigException;
import tcdiags.domain.exception.DependencyException;
import tcdiags.domain.grid.GeoField;
import tcdiags.units.UnitSystem;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@Slf4j
class DerivedFieldEvaluatorTest {

    private DerivedFieldEvaluator evaluator;

    @BeforeEach
    void setUp() {
        evaluator = new DerivedFieldEvaluator(UnitSystem.standard());
    }

    private static GeoField plane(String name, String units, double... values) {
        return GeoField.of(name, units, new int[]{1, values.length}, values);
    }

    @Test
    @DisplayName("La razón de mezcla se calcula como q/(1-q) convirtiendo g/kg al contrato kg/kg")
    void spfhToMxrt_shouldConvertInputUnits() {
        DerivedVariableSpec spec = new DerivedVariableSpec("mixing_ratio", "spfh_to_mxrt", List.of(), "g/kg");
        Map<String, GeoField> resolved = Map.of("specific_humidity", plane("specific_humidity", "g/kg", 20.0, 0.0));

        GeoField w = evaluator.evaluate(spec, resolved);

        assertThat(w.getUnits()).isEqualTo("g/kg");
        assertEquals(1000.0 * 0.02 / 0.98, w.get(0), 1e-9);
        assertEquals(0.0, w.get(1), 0.0);
    }

    @Test
    @DisplayName("La magnitud del viento admite entradas en nudos")
    void windMagnitude_shouldConvertKnots() {
        DerivedVariableSpec spec = new DerivedVariableSpec("wind_magnitude", "wind_magnitude", List.of(), "m/s");
        Map<String, GeoField> resolved = Map.of(
                "uwind", plane("uwind", "m/s", 3.0),
                "vwind", plane("vwind", "kt", 4.0 / 0.514444));

        assertEquals(5.0, evaluator.evaluate(spec, resolved).get(0), 1e-9);
    }

    @Test
    @DisplayName("Sin altura de superficie la presión reducida coincide con la de superficie")
    void pressureToSeaLevel_atSeaLevel_shouldKeepSurfacePressure() {
        DerivedVariableSpec spec = new DerivedVariableSpec("sea_level_pressure", "pressure_to_sealevel",
                List.of(), "hPa");
        Map<String, GeoField> resolved = Map.of(
                "surface_pressure", plane("surface_pressure", "Pa", 101000.0, 90000.0),
                "surface_height", plane("surface_height", "m", 0.0, 1000.0),
                "temperature", plane("temperature", "K", 300.0, 290.0),
                "specific_humidity", plane("specific_humidity", "kg/kg", 0.015, 0.010));

        GeoField slp = evaluator.evaluate(spec, resolved);

        assertEquals(1010.0, slp.get(0), 1e-9);
        assertThat(slp.get(1)).isBetween(990.0, 1020.0);
    }

    @Test
    @DisplayName("Las profundidades 1-D se difunden a la malla de la temperatura oceánica")
    void depthFromProfile_shouldBroadcast() {
        DerivedVariableSpec spec = new DerivedVariableSpec("depth", "depth_from_profile", List.of(), "m");
        Map<String, GeoField> resolved = Map.of(
                "depth_profile", GeoField.of("depth_profile", "m", new int[]{3}, new double[]{0, 10, 20}),
                "ocean_temperature", GeoField.of("ocean_temperature", "degC", new int[]{3, 1, 2},
                        new double[]{28, 28, 27, 27, 25, 25}));

        GeoField depth = evaluator.evaluate(spec, resolved);

        assertThat(depth.shape()).containsExactly(3, 1, 2);
        assertEquals(20.0, depth.get(2, 0, 1), 0.0);
    }

    @Test
    @DisplayName("La presión del agua de mar se deriva de la profundidad y la latitud en dbar")
    void seawaterFromDepth_shouldConvertToDeclaredUnit() {
        DerivedVariableSpec spec = new DerivedVariableSpec("seawater_pressure", "seawater_from_depth", List.of(), "dbar");
        Map<String, GeoField> resolved = Map.of(
                "depth", GeoField.of("depth", "km", new int[]{2, 1, 1}, new double[]{0.0, 1.0}),
                "latitude", GeoField.of("latitude", "degree", new int[]{1, 1}, new double[]{30.0}));

        GeoField pressure = evaluator.evaluate(spec, resolved);

        assertThat(pressure.getUnits()).isEqualTo("dbar");
        assertEquals(0.0, pressure.get(0, 0, 0), 1e-9);
        assertEquals(Seawater.pressureFromDepth(1000.0, 30.0), pressure.get(1, 0, 0), 1e-9);
    }

    @Test
    @DisplayName("Una entrada no resuelta lanza DependencyException nombrándola")
    void evaluate_unresolvedInput_shouldNameIt() {
        DerivedVariableSpec spec = new DerivedVariableSpec("pressure", "pressure_from_thickness",
                List.of("dpres", "psfc"), "Pa");
        Map<String, GeoField> resolved = Map.of("dpres", plane("dpres", "Pa", 1.0));

        DependencyException ex = assertThrows(DependencyException.class, () -> evaluator.evaluate(spec, resolved));
        log.info("Mensaje: {}", ex.getMessage());
        assertThat(ex.getUnresolvedInputs()).containsExactly("psfc");
    }

    @Test
    @DisplayName("Un número de entradas distinto de la aridad del método es un error de configuración")
    void evaluate_wrongArity_shouldThrow() {
        DerivedVariableSpec spec = new DerivedVariableSpec("height", "height_from_pressure",
                List.of("pressure", "extra"), "m");

        assertThrows(ConfigException.class, () -> evaluator.evaluate(spec, Map.of()));
    }

    @Test
    @DisplayName("evaluateAll encadena derivadas en orden")
    void evaluateAll_shouldChain() {
        List<DerivedVariableSpec> specs = List.of(
                new DerivedVariableSpec("height", "height_from_pressure", List.of(), "km"),
                new DerivedVariableSpec("pressure", "pressure_from_thickness", List.of(), "Pa"));
        Map<String, GeoField> resolved = Map.of(
                "pressure_thickness", GeoField.of("pressure_thickness", "Pa", new int[]{2, 1, 1},
                        new double[]{0.0, 50000.0}),
                "surface_pressure", GeoField.of("surface_pressure", "Pa", new int[]{1, 1},
                        new double[]{AtmosphericHeights.P0}));

        Map<String, GeoField> out = evaluator.evaluateAll(specs, resolved);

        GeoField height = out.get("height");
        assertEquals(0.0, height.get(0, 0, 0), 1e-9);
        assertEquals(AtmosphericHeights.standardHeight(50000.0) / 1000.0, height.get(1, 0, 0), 1e-9);
    }
}
