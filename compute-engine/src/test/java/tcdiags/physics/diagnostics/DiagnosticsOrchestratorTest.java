package tcdiags.physics.diagnostics;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tcdiags.config.OceanHeatContentConfig;
import tcdiags.config.PotentialIntensityConfig;
import tcdiags.config.schema.SchemaRegistry;
import tcdiags.config.schema.SchemaValidator;
import tcdiags.config.schema.ValidatedConfig;
import tcdiags.domain.diagnostics.Application;
import tcdiags.domain.diagnostics.ApplicationResult;
import tcdiags.domain.diagnostics.DiagnosticsReport;
import tcdiags.domain.grid.GeoField;
import tcdiags.domain.grid.GeoGrid;
import tcdiags.domain.grid.TcFix;
import tcdiags.domain.warning.IsothermNotFoundWarning;
import tcdiags.factory.DiagnosticFactory;
import tcdiags.io.DiagnosticsReportWriter;
import tcdiags.physics.resolver.ResolvedVariables;
import tcdiags.physics.solver.impl.BisterEmanuelPotentialIntensitySolver;
import tcdiags.physics.solver.impl.IsothermLocator;
import tcdiags.units.UnitSystem;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Slf4j
@ExtendWith(MockitoExtension.class)
class DiagnosticsOrchestratorTest {

    private static final double[] WARM = {28.0, 27.0, 26.5, 25.0, 20.0};
    private static final double[] COLD = {24.0, 23.0, 22.0, 21.0, 20.0};
    private static final double[] DEPTHS = {0.0, 25.0, 50.0, 75.0, 100.0};

    @Mock
    private DiagnosticsReportWriter reportWriter;

    private DiagnosticsOrchestrator orchestrator;
    private ResolvedVariables variables;
    private List<TcFix> fixes;

    @BeforeEach
    void setUp() {
        orchestrator = new DiagnosticsOrchestrator(UnitSystem.standard(), new DiagnosticFactory(), reportWriter);

        GeoGrid grid = GeoGrid.fromAxes(new double[]{10.0, 11.0, 12.0}, new double[]{130.0, 131.0, 132.0});
        int nz = DEPTHS.length;
        double[] temperature = new double[nz * 9];
        double[] depth = new double[nz * 9];
        for (int k = 0; k < nz; k++) {
            for (int c = 0; c < 9; c++) {
                // La columna (0, 0) no alcanza la isoterma de 26 °C.
                temperature[k * 9 + c] = c == 0 ? COLD[k] : WARM[k];
                depth[k * 9 + c] = DEPTHS[k];
            }
        }
        Map<String, GeoField> fields = new LinkedHashMap<>();
        fields.put("ocean_temperature", GeoField.of("ocean_temperature", "degC", new int[]{nz, 3, 3}, temperature, grid));
        fields.put("depth", GeoField.of("depth", "m", new int[]{nz, 3, 3}, depth, grid));
        variables = ResolvedVariables.of(fields, grid);
        fixes = List.of(TcFix.of("14W", 11.0, 131.0));
    }

    private OceanHeatContentDiagnostic ohc(boolean writeOutput) {
        return new OceanHeatContentDiagnostic(OceanHeatContentConfig.builder()
                .deltaz(5.0)
                .fillValue(-999.0)
                .writeOutput(writeOutput)
                .outputFile("salida/tcohc.json")
                .build(), new IsothermLocator());
    }

    private PotentialIntensityDiagnostic pi() {
        return new PotentialIntensityDiagnostic(PotentialIntensityConfig.builder().build(),
                new BisterEmanuelPotentialIntensitySolver());
    }

    @Test
    @DisplayName("Una aplicación sin sus variables falla sin impedir que las demás terminen")
    void runDiagnostics_missingVariable_shouldFailOnlyThatApplication() {
        DiagnosticsReport report = orchestrator.runDiagnostics(variables, fixes, List.of(pi(), ohc(false)));

        ApplicationResult tcpi = report.result(Application.TCPI);
        assertThat(tcpi.succeeded()).isFalse();
        assertThat(tcpi.getFailure()).contains("temperature");

        ApplicationResult tcohc = report.result(Application.TCOHC);
        assertThat(tcohc.succeeded()).isTrue();
        assertEquals(58.333, report.attributes(Application.TCOHC, "14W").scalar("isotherm_depth"), 1e-3);
        assertThat(report.attributes(Application.TCOHC, "14W").scalar("tchp")).isPositive();
        assertThat(tcohc.getGridFields()).containsKeys("isotherm_depth", "tchp", "ohc");
    }

    @Test
    @DisplayName("Las columnas sin isoterma reciben el relleno y generan una advertencia en el informe")
    void runDiagnostics_unboundedIsotherm_shouldReportWarning() {
        DiagnosticsReport report = orchestrator.runDiagnostics(variables, fixes, List.of(ohc(false)));

        GeoField isothermDepth = report.result(Application.TCOHC).getGridFields().get("isotherm_depth");
        assertThat(isothermDepth.get2d(0, 0)).isEqualTo(-999.0);
        assertThat(report.result(Application.TCOHC).getGridFields().get("tchp").get2d(0, 0)).isEqualTo(0.0);

        assertThat(report.getWarnings()).hasSize(1);
        IsothermNotFoundWarning warning = (IsothermNotFoundWarning) report.getWarnings().get(0);
        assertThat(warning.columnCount()).isEqualTo(1);
        assertThat(warning.source()).isEqualTo("tcohc");
        log.info("Advertencia registrada: {}", warning.message());
    }

    @Test
    @DisplayName("Una profundidad con forma distinta de la temperatura hace fallar sólo tcohc")
    void runDiagnostics_depthShapeMismatch_shouldFailOnlyOceanHeatContent() {
        Map<String, GeoField> fields = new LinkedHashMap<>(variables.asMap());
        GeoGrid grid = variables.requireGrid();
        fields.put("depth", GeoField.of("depth", "m", new int[]{2, 3, 3}, new double[18], grid));
        ResolvedVariables mismatched = ResolvedVariables.of(fields, grid);

        DiagnosticsReport report = orchestrator.runDiagnostics(mismatched, fixes, List.of(ohc(false), pi()));

        assertThat(report.result(Application.TCOHC).succeeded()).isFalse();
        assertThat(report.result(Application.TCOHC).getFailure()).contains("misma forma");
        assertThat(report.getResults()).hasSize(2);
    }

    @Test
    @DisplayName("Con write_output se delega la escritura del resumen")
    void runDiagnostics_writeOutput_shouldCallWriter() throws IOException {
        when(reportWriter.write(any(ApplicationResult.class), eq("salida/tcohc.json")))
                .thenReturn(List.of("salida/tcohc.json"));

        DiagnosticsReport report = orchestrator.runDiagnostics(variables, fixes, List.of(ohc(true)));

        assertThat(report.result(Application.TCOHC).succeeded()).isTrue();
        verify(reportWriter).write(any(ApplicationResult.class), eq("salida/tcohc.json"));
    }

    @Test
    @DisplayName("Un error de escritura aborta sólo la aplicación que escribía")
    void runDiagnostics_writeFailure_shouldFailApplication() throws IOException {
        when(reportWriter.write(any(ApplicationResult.class), any(String.class)))
                .thenThrow(new IOException("disco lleno"));

        DiagnosticsReport report = orchestrator.runDiagnostics(variables, fixes, List.of(ohc(true), pi()));

        assertThat(report.result(Application.TCOHC).succeeded()).isFalse();
        assertThat(report.result(Application.TCOHC).getFailure()).contains("No se pudo escribir");
        assertThat(report.result(Application.TCPI).succeeded()).isFalse();
    }

    @Test
    @DisplayName("Los bloques validados se convierten en aplicaciones a través de la factoría")
    void run_validatedBlocks_shouldBuildApplications() throws IOException {
        SchemaRegistry registry = SchemaRegistry.standard();
        SchemaValidator validator = new SchemaValidator();
        Map<Application, ValidatedConfig> applications = new LinkedHashMap<>();
        applications.put(Application.TCOHC, validator.validate(registry.get(SchemaRegistry.TCOHC),
                Map.of("deltaz", 5.0, "isotherm", 26.0, "interp_type", "previous")));
        applications.put(Application.TCMSI, validator.validate(registry.get(SchemaRegistry.TCMSI), Map.of()));

        DiagnosticsReport report = orchestrator.run(variables, fixes, applications);

        assertThat(report.getResults()).hasSize(2);
        assertThat(report.result(Application.TCOHC).succeeded()).isTrue();
        assertThat(report.attributes(Application.TCOHC, "14W").scalar("isotherm_depth")).isEqualTo(50.0);
        assertThat(report.result(Application.TCMSI).succeeded()).isFalse();
        verify(reportWriter, never()).write(any(), any());
    }
}
