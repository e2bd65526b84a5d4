package tcdiags.physics.diagnostics;

import lombok.extern.slf4j.Slf4j;
import tcdiags.config.schema.ValidatedConfig;
import tcdiags.domain.diagnostics.Application;
import tcdiags.domain.diagnostics.ApplicationResult;
import tcdiags.domain.diagnostics.DiagnosticsReport;
import tcdiags.domain.exception.ConfigException;
import tcdiags.domain.exception.TcDiagsException;
import tcdiags.domain.grid.TcFix;
import tcdiags.domain.warning.WarningLog;
import tcdiags.factory.DiagnosticFactory;
import tcdiags.io.DiagnosticsReportWriter;
import tcdiags.physics.resolver.ResolvedVariables;
import tcdiags.units.UnitSystem;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Ejecuta las aplicaciones solicitadas sobre las variables resueltas y los TC.
 * <p>
 * Cada aplicación es independiente: un {@link TcDiagsException}, ya sea al construirla
 * a partir de su bloque o al ejecutarla, aborta sólo esa aplicación y queda registrado
 * en el informe como fallo.
 */
@Slf4j
public class DiagnosticsOrchestrator {

    private final UnitSystem units;
    private final DiagnosticFactory factory;
    private final DiagnosticsReportWriter reportWriter;

    public DiagnosticsOrchestrator(UnitSystem units, DiagnosticFactory factory, DiagnosticsReportWriter reportWriter) {
        this.units = units;
        this.factory = factory;
        this.reportWriter = reportWriter;
    }

    /**
     * Construye y ejecuta cada aplicación configurada.
     */
    public DiagnosticsReport run(ResolvedVariables variables, List<TcFix> fixes,
                                 Map<Application, ValidatedConfig> applications) {
        Run run = new Run(variables, fixes);
        applications.forEach((application, config) ->
                run.execute(application, () -> factory.create(application, config)));
        return run.finish();
    }

    /**
     * Ejecuta aplicaciones ya construidas.
     */
    public DiagnosticsReport runDiagnostics(ResolvedVariables variables, List<TcFix> fixes,
                                            List<TcDiagnostic> diagnostics) {
        Run run = new Run(variables, fixes);
        for (TcDiagnostic diagnostic : diagnostics) {
            run.execute(diagnostic.application(), () -> diagnostic);
        }
        return run.finish();
    }

    private final class Run {
        private final WarningLog warnings = new WarningLog();
        private final DiagnosticContext context;
        private final DiagnosticsReport.DiagnosticsReportBuilder report = DiagnosticsReport.builder();

        Run(ResolvedVariables variables, List<TcFix> fixes) {
            this.context = DiagnosticContext.builder()
                    .variables(variables)
                    .fixes(fixes)
                    .units(units)
                    .warnings(warnings)
                    .build();
        }

        void execute(Application application, Supplier<TcDiagnostic> diagnosticSupplier) {
            String key = application.key();
            log.info("=== Aplicación {}: {} ===", key, application.description());
            long t0 = System.nanoTime();
            ApplicationResult result;
            try {
                TcDiagnostic diagnostic = diagnosticSupplier.get();
                result = diagnostic.run(context);
                String outputFile = diagnostic.outputFile();
                if (outputFile != null) {
                    write(result, outputFile);
                }
                log.info("Aplicación {} completada en {} ms.", key, (System.nanoTime() - t0) / 1_000_000);
            } catch (TcDiagsException e) {
                log.error("La aplicación {} se ha abortado: {}", key, e.getMessage(), e);
                result = ApplicationResult.failed(application, e.getMessage());
            }
            report.result(application, result);
        }

        DiagnosticsReport finish() {
            report.warnings(warnings.all());
            DiagnosticsReport built = report.build();
            long failed = built.getResults().values().stream().filter(r -> !r.succeeded()).count();
            log.info("Ejecución terminada: {} aplicaciones, {} fallidas, {} advertencias.",
                    built.getResults().size(), failed, built.getWarnings().size());
            return built;
        }
    }

    private void write(ApplicationResult result, String outputFile) {
        try {
            reportWriter.write(result, outputFile);
        } catch (IOException e) {
            throw new ConfigException("No se pudo escribir el resumen de "
                    + result.getApplication().key() + " en " + outputFile, e);
        }
    }
}
