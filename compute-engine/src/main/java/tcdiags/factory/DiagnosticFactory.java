package tcdiags.factory;

import lombok.extern.slf4j.Slf4j;
import tcdiags.config.MultiScaleIntensityConfig;
import tcdiags.config.OceanHeatContentConfig;
import tcdiags.config.PotentialIntensityConfig;
import tcdiags.config.SteeringFlowConfig;
import tcdiags.config.schema.ValidatedConfig;
import tcdiags.domain.diagnostics.Application;
import tcdiags.physics.diagnostics.MultiScaleIntensityDiagnostic;
import tcdiags.physics.diagnostics.OceanHeatContentDiagnostic;
import tcdiags.physics.diagnostics.PotentialIntensityDiagnostic;
import tcdiags.physics.diagnostics.SteeringFlowDiagnostic;
import tcdiags.physics.diagnostics.TcDiagnostic;
import tcdiags.physics.projection.TcRelativeProjector;
import tcdiags.physics.solver.impl.BisterEmanuelPotentialIntensitySolver;
import tcdiags.physics.solver.impl.DftSpectralDecomposer;
import tcdiags.physics.solver.impl.FiniteDifferenceWindPartitionSolver;
import tcdiags.physics.solver.impl.IsothermLocator;
import tcdiags.physics.solver.impl.SvdSpatialFilter;
import tcdiags.physics.solver.impl.VerticalInterpolator;

/**
 * Construye cada aplicación de diagnóstico con sus solvers a partir de su bloque validado.
 */
@Slf4j
public class DiagnosticFactory {

    public TcDiagnostic create(Application application, ValidatedConfig config) {
        log.debug("Construyendo la aplicación {} con el bloque validado {}.", application.key(), config.keys());
        switch (application) {
            case TCPI:
                return new PotentialIntensityDiagnostic(PotentialIntensityConfig.from(config),
                        new BisterEmanuelPotentialIntensitySolver());
            case TCMSI:
                return new MultiScaleIntensityDiagnostic(MultiScaleIntensityConfig.from(config),
                        new TcRelativeProjector(), new DftSpectralDecomposer(), new VerticalInterpolator());
            case TCSTEERING:
                return new SteeringFlowDiagnostic(SteeringFlowConfig.from(config), new VerticalInterpolator(),
                        new SvdSpatialFilter(application.key()), new FiniteDifferenceWindPartitionSolver());
            case TCOHC:
                return new OceanHeatContentDiagnostic(OceanHeatContentConfig.from(config), new IsothermLocator());
            default:
                throw new IllegalArgumentException("Aplicación sin implementación: " + application);
        }
    }
}
