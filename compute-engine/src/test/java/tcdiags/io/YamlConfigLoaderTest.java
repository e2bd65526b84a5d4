package tcdiags.io;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tcdiags.config.DerivedVariableSpec;
import tcdiags.config.FileVariableSpec;
import tcdiags.config.SteeringFlowConfig;
import tcdiags.config.VariableSpec;
import tcdiags.config.schema.ValidatedConfig;
import tcdiags.domain.diagnostics.Application;
import tcdiags.domain.exception.ConfigException;
import tcdiags.domain.grid.TcFix;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@Slf4j
class YamlConfigLoaderTest {

    @TempDir
    Path tempDir;

    private YamlConfigLoader loader;

    @BeforeEach
    void setUp() {
        loader = new YamlConfigLoader();
    }

    @Test
    @DisplayName("Las variables de archivo y derivadas se distinguen por 'source', 'derived' o 'method'")
    void loadInputs_shouldBuildFileAndDerivedSpecs() throws IOException {
        Path yaml = tempDir.resolve("inputs.yaml");
        Files.writeString(yaml, """
                io_module: ignorado
                uwind:
                  path: gfs.json
                  variable_name: ugrd
                  units: mps
                  flip_lat: true
                  flip_z: true
                  squeeze: true
                longitude:
                  path: gfs.json
                  variable_name: lon
                  scale_add: -360.0
                  units: degree
                pressure:
                  derived: true
                  method: pressure_from_thickness
                  units: pascals
                mixing_ratio:
                  method: spfh_to_mxrt
                  inputs: [spfh]
                  units: kg/kg
                """);

        Map<String, VariableSpec> specs = loader.loadInputs(yaml);

        assertThat(specs).containsOnlyKeys("uwind", "longitude", "pressure", "mixing_ratio");
        FileVariableSpec uwind = (FileVariableSpec) specs.get("uwind");
        assertThat(uwind.flipLat()).isTrue();
        assertThat(uwind.flipZ()).isTrue();
        assertEquals(1.0, uwind.scaleMult(), 0.0, "scale_mult toma el valor por defecto.");
        assertEquals(-360.0, ((FileVariableSpec) specs.get("longitude")).scaleAdd(), 0.0);

        DerivedVariableSpec pressure = (DerivedVariableSpec) specs.get("pressure");
        assertThat(pressure.method()).isEqualTo("pressure_from_thickness");
        assertThat(pressure.inputs()).isEmpty();
        assertThat(((DerivedVariableSpec) specs.get("mixing_ratio")).inputs()).containsExactly("spfh");
    }

    @Test
    @DisplayName("Un método de derivación desconocido es un error de configuración")
    void parseInputs_unknownMethod_shouldThrow() {
        Map<String, Object> document = Map.of("rareza", Map.of("method", "no_existe", "units", "m"));

        ConfigException ex = assertThrows(ConfigException.class, () -> loader.parseInputs(document));
        log.info("Mensaje: {}", ex.getMessage());
        assertThat(ex.getMessage()).contains("no_existe");
    }

    @Test
    @DisplayName("Las posiciones de TC se leen de tcid -> {lat_deg, lon_deg}")
    void loadTcFixes_shouldParseCenters() throws IOException {
        Path yaml = tempDir.resolve("tcinfo.yaml");
        Files.writeString(yaml, """
                09L:
                  lat_deg: 25.4
                  lon_deg: -71.2
                14W:
                  lat_deg: 18.0
                  lon_deg: 135.5
                  valid_time: "2016-10-01T00:00:00Z"
                """);

        List<TcFix> fixes = loader.loadTcFixes(yaml);

        assertThat(fixes).extracting(TcFix::tcId).containsExactly("09L", "14W");
        assertEquals(25.4, fixes.get(0).lat(), 1e-12);
        assertThat(fixes.get(0).validTime()).isNull();
        assertThat(fixes.get(1).validTime()).isNotNull();
    }

    @Test
    @DisplayName("Un TC sin lon_deg lanza ConfigException nombrando la clave")
    void parseTcFixes_missingLongitude_shouldThrow() {
        Map<String, Object> document = Map.of("09L", Map.of("lat_deg", 25.0));

        ConfigException ex = assertThrows(ConfigException.class, () -> loader.parseTcFixes(document));
        assertThat(ex.getMessage()).contains("lon_deg");
    }

    @Test
    @DisplayName("Los bloques de aplicación se validan y los desconocidos se ignoran")
    void loadApplications_shouldValidateKnownBlocks() throws IOException {
        Path yaml = tempDir.resolve("apps.yaml");
        Files.writeString(yaml, """
                tcsteering:
                  isolevels: [85000, 70000, 50000, 20000]
                  ncoeffs: 4
                  layers:
                    - {top: 20000, bottom: 85000}
                    - {top: 50000, bottom: 85000}
                tcohc:
                plotting:
                  enabled: true
                """);

        Map<Application, ValidatedConfig> apps = loader.loadApplications(yaml);

        assertThat(apps).containsOnlyKeys(Application.TCSTEERING, Application.TCOHC);
        SteeringFlowConfig steering = SteeringFlowConfig.from(apps.get(Application.TCSTEERING));
        assertThat(steering.getIsolevels()).containsExactly(85000.0, 70000.0, 50000.0, 20000.0);
        assertThat(steering.getNcoeffs()).isEqualTo(4);
        assertThat(steering.effectiveLayers()).hasSize(2);
        assertEquals(26.0, apps.get(Application.TCOHC).getDouble("isotherm"), 0.0);
    }

    @Test
    @DisplayName("Un documento inexistente lanza ConfigException")
    void readDocument_missingFile_shouldThrow() {
        assertThrows(ConfigException.class, () -> loader.readDocument(tempDir.resolve("no_existe.yaml")));
    }
}
