package tcdiags.physics.diagnostics;

import lombok.extern.slf4j.Slf4j;
import tcdiags.config.PotentialIntensityConfig;
import tcdiags.domain.diagnostics.Application;
import tcdiags.domain.diagnostics.ApplicationResult;
import tcdiags.domain.diagnostics.TcAttributes;
import tcdiags.domain.grid.GeoField;
import tcdiags.domain.grid.GeoGrid;
import tcdiags.domain.grid.TcFix;
import tcdiags.physics.solver.PotentialIntensitySolver;
import tcdiags.physics.solver.PotentialIntensitySolver.Result;
import tcdiags.units.UnitSystem;
import tcdiags.utils.SummaryTable;

/**
 * Intensidad potencial por columna (tcpi).
 * <p>
 * Entradas: {@code temperature}, {@code pressure}, {@code mixing_ratio},
 * {@code sea_level_pressure} y {@code surface_height}. La SST es
 * {@code sea_surface_temperature} si está declarada; si no, el nivel más bajo de
 * {@code temperature}.
 */
@Slf4j
public class PotentialIntensityDiagnostic implements TcDiagnostic {

    public static final String TEMPERATURE = "temperature";
    public static final String PRESSURE = "pressure";
    public static final String MIXING_RATIO = "mixing_ratio";
    public static final String SEA_LEVEL_PRESSURE = "sea_level_pressure";
    public static final String SURFACE_HEIGHT = "surface_height";
    public static final String SST = "sea_surface_temperature";

    private final PotentialIntensityConfig config;
    private final PotentialIntensitySolver solver;

    public PotentialIntensityDiagnostic(PotentialIntensityConfig config, PotentialIntensitySolver solver) {
        this.config = config;
        this.solver = solver;
    }

    @Override
    public Application application() {
        return Application.TCPI;
    }

    @Override
    public String outputFile() {
        return config.isWriteOutput() ? config.getOutputFile() : null;
    }

    @Override
    public ApplicationResult run(DiagnosticContext context) {
        GeoField temperature = context.require(TEMPERATURE, UnitSystem.KELVIN, 3);
        GeoField pressure = context.require(PRESSURE, UnitSystem.PASCAL, 3);
        GeoField mixingRatio = context.require(MIXING_RATIO, UnitSystem.KG_PER_KG, 3);
        GeoField pslp = context.require(SEA_LEVEL_PRESSURE, UnitSystem.PASCAL, 2);
        GeoField zsfc = context.require(SURFACE_HEIGHT, UnitSystem.METER, 2);
        double[] sst = context.getVariables().contains(SST)
                ? context.require(SST, UnitSystem.KELVIN, 2).toArray()
                : temperature.level(0);
        GeoGrid grid = context.grid();

        int ny = temperature.ny();
        int nx = temperature.nx();
        double[] vmax = new double[ny * nx];
        double[] pmin = new double[ny * nx];
        double[] tout = new double[ny * nx];
        double[] pout = new double[ny * nx];
        double mslpMaxPa = config.getMslpMax() * 100.0;
        int masked = 0;
        int undefined = 0;

        log.info("[{}] Calculando la intensidad potencial en {} columnas ({}).",
                application().key(), ny * nx, solver.getName());
        for (int j = 0; j < ny; j++) {
            for (int i = 0; i < nx; i++) {
                int idx = j * nx + i;
                Result result;
                if (zsfc.get(idx) > config.getZmax() || pslp.get(idx) > mslpMaxPa) {
                    result = Result.UNDEFINED;
                    masked++;
                } else {
                    result = solver.solve(sst[idx], pslp.get(idx), pressure.column(j, i),
                            temperature.column(j, i), mixingRatio.column(j, i));
                    if (!result.isDefined()) {
                        undefined++;
                    }
                }
                vmax[idx] = result.vmax();
                pmin[idx] = result.pmin();
                tout[idx] = result.tout();
                pout[idx] = result.pout();
            }
        }
        log.info("[{}] Columnas enmascaradas por zmax/mslp_max: {}; sin solución: {}.",
                application().key(), masked, undefined);

        int[] shape = {ny, nx};
        GeoField vmaxField = GeoField.of("vmax", "m/s", shape, vmax, grid);
        GeoField pminField = GeoField.of("pmin", "Pa", shape, pmin, grid);
        GeoField toutField = GeoField.of("tout", "K", shape, tout, grid);
        GeoField poutField = GeoField.of("pout", "Pa", shape, pout, grid);

        ApplicationResult.ApplicationResultBuilder result = ApplicationResult.builder()
                .application(application())
                .status(ApplicationResult.Status.SUCCEEDED)
                .gridField("vmax", vmaxField)
                .gridField("pmin", pminField)
                .gridField("tout", toutField)
                .gridField("pout", poutField);

        SummaryTable table = new SummaryTable("TC", "vmax [m/s]", "pmin [hPa]", "tout [K]", "pout [hPa]");
        for (TcFix fix : context.getFixes()) {
            double v = context.sampleAtCenter(vmax, fix);
            double p = context.sampleAtCenter(pmin, fix);
            double t = context.sampleAtCenter(tout, fix);
            double po = context.sampleAtCenter(pout, fix);
            result.tc(fix.tcId(), TcAttributes.builder(fix.tcId())
                    .scalar("vmax", "m/s", "Intensidad potencial máxima", v)
                    .scalar("pmin", "Pa", "Presión mínima potencial", p)
                    .scalar("tout", "K", "Temperatura de salida", t)
                    .scalar("pout", "Pa", "Presión de salida", po)
                    .build());
            table.row(fix.tcId(), v, p / 100.0, t, po / 100.0);
        }
        log.info("[{}] Intensidad potencial en el centro de cada TC:\n{}", application().key(), table);
        return result.build();
    }
}
