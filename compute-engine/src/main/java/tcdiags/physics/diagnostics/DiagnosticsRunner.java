package tcdiags.physics.diagnostics;

import lombok.extern.slf4j.Slf4j;
import tcdiags.config.VariableSpec;
import tcdiags.config.schema.ValidatedConfig;
import tcdiags.domain.diagnostics.Application;
import tcdiags.domain.diagnostics.DiagnosticsReport;
import tcdiags.domain.grid.TcFix;
import tcdiags.factory.DiagnosticFactory;
import tcdiags.io.DiagnosticsReportWriter;
import tcdiags.io.GridDataSource;
import tcdiags.io.YamlConfigLoader;
import tcdiags.physics.derived.DerivedFieldEvaluator;
import tcdiags.physics.resolver.InputResolver;
import tcdiags.physics.resolver.ResolvedVariables;
import tcdiags.physics.resolver.VariableResolver;
import tcdiags.units.UnitSystem;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Ejecución completa a partir de los tres documentos YAML: variables de entrada,
 * posiciones de los TC y bloques de aplicación.
 * <p>
 * Orden: carga de configuración, resolución de variables (archivo y derivadas) y
 * ejecución de las aplicaciones.
 */
@Slf4j
public class DiagnosticsRunner {

    private final YamlConfigLoader configLoader;
    private final InputResolver inputResolver;
    private final DiagnosticsOrchestrator orchestrator;

    public DiagnosticsRunner(YamlConfigLoader configLoader, InputResolver inputResolver,
                             DiagnosticsOrchestrator orchestrator) {
        this.configLoader = configLoader;
        this.inputResolver = inputResolver;
        this.orchestrator = orchestrator;
    }

    /**
     * Ensambla el pipeline estándar sobre una fuente de mallas.
     */
    public static DiagnosticsRunner standard(GridDataSource dataSource) {
        UnitSystem units = UnitSystem.standard();
        return new DiagnosticsRunner(
                new YamlConfigLoader(),
                new InputResolver(new VariableResolver(dataSource, units), new DerivedFieldEvaluator(units)),
                new DiagnosticsOrchestrator(units, new DiagnosticFactory(), new DiagnosticsReportWriter()));
    }

    public DiagnosticsReport run(Path inputsYaml, Path tcFixesYaml, Path applicationsYaml) {
        log.info("Iniciando diagnósticos: entradas={}, TC={}, aplicaciones={}", inputsYaml, tcFixesYaml, applicationsYaml);
        Map<String, VariableSpec> specs = configLoader.loadInputs(inputsYaml);
        List<TcFix> fixes = configLoader.loadTcFixes(tcFixesYaml);
        Map<Application, ValidatedConfig> applications = configLoader.loadApplications(applicationsYaml);
        return run(specs, fixes, applications);
    }

    public DiagnosticsReport run(Map<String, VariableSpec> specs, List<TcFix> fixes,
                                 Map<Application, ValidatedConfig> applications) {
        ResolvedVariables variables = inputResolver.resolveAll(specs);
        if (!variables.failures().isEmpty()) {
            log.warn("Variables sin resolver: {}", variables.failures().keySet());
        }
        return orchestrator.run(variables, fixes, applications);
    }
}
