package tcdiags.physics.diagnostics;

import lombok.extern.slf4j.Slf4j;
import tcdiags.config.MultiScaleIntensityConfig;
import tcdiags.domain.diagnostics.Application;
import tcdiags.domain.diagnostics.ApplicationResult;
import tcdiags.domain.diagnostics.DiagnosticValue;
import tcdiags.domain.diagnostics.TcAttributes;
import tcdiags.domain.diagnostics.WavenumberSpectrum;
import tcdiags.domain.grid.GeoField;
import tcdiags.domain.grid.GeoGrid;
import tcdiags.domain.grid.PolarField;
import tcdiags.domain.grid.PolarGridSpec;
import tcdiags.domain.grid.TcFix;
import tcdiags.physics.derived.WindKinematics;
import tcdiags.physics.projection.GreatCircle;
import tcdiags.physics.projection.TcRelativeProjector;
import tcdiags.physics.solver.SpectralDecomposer;
import tcdiags.physics.solver.impl.VerticalInterpolator;
import tcdiags.units.UnitSystem;
import tcdiags.utils.SummaryTable;

import java.util.List;

/**
 * Intensidad multiescala del viento a 10 m (tcmsi), según Vukicevic et al. (2014).
 * <p>
 * El viento a 10 m se obtiene de {@code wind_magnitude} (o de {@code uwind}/{@code vwind})
 * interpolado a 10 m con {@code height}; se proyecta alrededor de cada TC y se descompone
 * en números de onda azimutales.
 */
@Slf4j
public class MultiScaleIntensityDiagnostic implements TcDiagnostic {

    public static final String WIND_MAGNITUDE = "wind_magnitude";
    public static final String UWIND = "uwind";
    public static final String VWIND = "vwind";
    public static final String HEIGHT = "height";

    static final double TARGET_HEIGHT = 10.0;

    private final MultiScaleIntensityConfig config;
    private final TcRelativeProjector projector;
    private final SpectralDecomposer decomposer;
    private final VerticalInterpolator interpolator;

    public MultiScaleIntensityDiagnostic(MultiScaleIntensityConfig config, TcRelativeProjector projector,
                                         SpectralDecomposer decomposer, VerticalInterpolator interpolator) {
        this.config = config;
        this.projector = projector;
        this.decomposer = decomposer;
        this.interpolator = interpolator;
    }

    @Override
    public Application application() {
        return Application.TCMSI;
    }

    @Override
    public String outputFile() {
        return config.isWriteOutput() ? config.getOutputFile() : null;
    }

    @Override
    public ApplicationResult run(DiagnosticContext context) {
        GeoField wind10m = tenMeterWind(context);
        PolarGridSpec gridSpec = new PolarGridSpec(config.getMaxRadius(), config.getDrho(), config.getDphiRadians());

        ApplicationResult.ApplicationResultBuilder result = ApplicationResult.builder()
                .application(application())
                .status(ApplicationResult.Status.SUCCEEDED)
                .gridField("wnd10m", wind10m);

        SummaryTable intensity = new SummaryTable("TC", "vmax [m/s]", "rmw [km]", "head_rmw [deg]",
                "lat_rmw", "lon_rmw");
        SummaryTable spectral = new SummaryTable("TC", "wn0_msi", "wn1_msi", "wn0p1_msi", "epsi_msi");

        for (TcFix fix : context.getFixes()) {
            PolarField polar = projector.project(wind10m, fix, gridSpec);
            WavenumberSpectrum spectrum = decomposer.decompose(polar, config.getMaxWn());
            TcAttributes attributes = summarise(fix, spectrum);
            result.tc(fix.tcId(), attributes);

            intensity.row(fix.tcId(), attributes.scalar("vmax"), attributes.scalar("rmw") / 1000.0,
                    attributes.scalar("head_rmw"), attributes.scalar("lat_rmw"), attributes.scalar("lon_rmw"));
            spectral.row(fix.tcId(), attributes.scalar("wn0_msi"), attributes.scalar("wn1_msi"),
                    attributes.scalar("wn0p1_msi"), attributes.scalar("epsi_msi"));
        }
        log.info("[{}] Intensidad del viento a 10 m:\n{}", application().key(), intensity);
        log.info("[{}] Intensidad multiescala por número de onda:\n{}", application().key(), spectral);
        return result.build();
    }

    /**
     * Viento a 10 m como campo 2-D con malla.
     */
    GeoField tenMeterWind(DiagnosticContext context) {
        GeoField speed;
        if (context.getVariables().contains(WIND_MAGNITUDE)) {
            speed = context.require(WIND_MAGNITUDE, UnitSystem.METER_PER_SECOND);
        } else {
            speed = WindKinematics.magnitude(WIND_MAGNITUDE, List.of(
                    context.require(UWIND, UnitSystem.METER_PER_SECOND),
                    context.require(VWIND, UnitSystem.METER_PER_SECOND)));
        }
        GeoGrid grid = context.grid();
        int[] shape = {speed.ny(), speed.nx()};
        if (speed.rank() == 2) {
            return GeoField.of("wnd10m", UnitSystem.METER_PER_SECOND.symbol(), shape, speed.toArray(), grid);
        }
        GeoField height = context.require(HEIGHT, UnitSystem.METER, 3);
        double[] plane = interpolator.toLevel(speed, height, TARGET_HEIGHT, true);
        return GeoField.of("wnd10m", UnitSystem.METER_PER_SECOND.symbol(), shape, plane, grid);
    }

    /**
     * Resumen escalar de la descomposición de un TC. El radio de viento máximo se sitúa
     * en el máximo de |wn0 + wn1|.
     */
    TcAttributes summarise(TcFix fix, WavenumberSpectrum spectrum) {
        PolarField wn0 = spectrum.getComponents().get(0);
        PolarField wn1 = spectrum.maxWn() >= 1 ? spectrum.getComponents().get(1) : null;

        double wn0p1 = Double.NaN;
        int rIdx = -1;
        int aIdx = -1;
        for (int r = 0; r < wn0.nRadii(); r++) {
            for (int a = 0; a < wn0.nAzimuths(); a++) {
                double value = Math.abs(wn0.get(r, a) + (wn1 != null ? wn1.get(r, a) : 0.0));
                if (!Double.isNaN(value) && (Double.isNaN(wn0p1) || value > wn0p1)) {
                    wn0p1 = value;
                    rIdx = r;
                    aIdx = a;
                }
            }
        }

        double rmw = Double.NaN;
        double head = Double.NaN;
        double latRmw = Double.NaN;
        double lonRmw = Double.NaN;
        if (rIdx >= 0) {
            rmw = wn0.radiusAt(rIdx);
            double azimuth = wn0.azimuthAt(aIdx);
            head = Math.toDegrees(azimuth);
            double[] position = GreatCircle.destination(fix.lat(), fix.lon(), azimuth, rmw);
            latRmw = position[0];
            lonRmw = position[1];
        }

        double vmax = spectrum.getMaxMagnitude();
        double wn0Max = spectrum.getComponentMaxima().get(0);
        double wn1Max = wn1 != null ? spectrum.getComponentMaxima().get(1) : 0.0;

        return TcAttributes.builder(fix.tcId())
                .scalar("vmax", "m/s", "Viento máximo a 10 m", vmax)
                .scalar("rmw", "m", "Radio de viento máximo", rmw)
                .scalar("head_rmw", "degree", "Azimut del radio de viento máximo", head)
                .scalar("lat_rmw", "degree", "Latitud del viento máximo", latRmw)
                .scalar("lon_rmw", "degree", "Longitud del viento máximo", lonRmw)
                .scalar("wn0_msi", "m/s", "Viento máximo del número de onda 0", wn0Max)
                .scalar("wn1_msi", "m/s", "Viento máximo del número de onda 1", wn1Max)
                .scalar("wn0p1_msi", "m/s", "Viento máximo de los números de onda 0 + 1", wn0p1)
                .scalar("epsi_msi", "m/s", "Viento residual", vmax - wn0p1)
                .put(DiagnosticValue.polar("wnd10m", "Viento a 10 m en coordenadas polares", spectrum.getOriginal()))
                .put(DiagnosticValue.polar("wn0p1", "Suma de los números de onda 0 y 1",
                        wn1 != null ? sum(wn0, wn1) : wn0))
                .build();
    }

    private static PolarField sum(PolarField a, PolarField b) {
        double[][] values = new double[a.nRadii()][a.nAzimuths()];
        for (int r = 0; r < a.nRadii(); r++) {
            for (int c = 0; c < a.nAzimuths(); c++) {
                values[r][c] = a.get(r, c) + b.get(r, c);
            }
        }
        return a.withValues("wn0p1", values);
    }
}
