package tcdiags.physics.diagnostics;

import lombok.extern.slf4j.Slf4j;
import tcdiags.config.OceanHeatContentConfig;
import tcdiags.domain.diagnostics.Application;
import tcdiags.domain.diagnostics.ApplicationResult;
import tcdiags.domain.diagnostics.IsothermProfile;
import tcdiags.domain.diagnostics.TcAttributes;
import tcdiags.domain.exception.ConfigException;
import tcdiags.domain.grid.GeoField;
import tcdiags.domain.grid.GeoGrid;
import tcdiags.domain.grid.TcFix;
import tcdiags.domain.warning.IsothermNotFoundWarning;
import tcdiags.physics.derived.Seawater;
import tcdiags.physics.solver.impl.HeatContentIntegrator;
import tcdiags.physics.solver.impl.IsothermLocator;
import tcdiags.units.UnitSystem;
import tcdiags.utils.SummaryTable;

import java.util.Arrays;

/**
 * Profundidad de la isoterma y potencial calorífico del TC (tcohc), según Leipper y Volgenau (1972).
 * <p>
 * Entradas: {@code ocean_temperature} y {@code depth} (3-D, nivel 0 en superficie). Con
 * {@code salinity} (salinidad práctica) la temperatura se interpreta como potencial y se
 * pasa a conservativa (TEOS-10) antes de buscar la isoterma; se añaden {@code asaln} y
 * {@code ctemp} a los campos de salida.
 */
@Slf4j
public class OceanHeatContentDiagnostic implements TcDiagnostic {

    public static final String OCEAN_TEMPERATURE = "ocean_temperature";
    public static final String DEPTH = "depth";
    public static final String SALINITY = "salinity";

    private final OceanHeatContentConfig config;
    private final IsothermLocator locator;
    private final HeatContentIntegrator integrator;

    public OceanHeatContentDiagnostic(OceanHeatContentConfig config, IsothermLocator locator) {
        this.config = config;
        this.locator = locator;
        this.integrator = new HeatContentIntegrator(config.getDeltaz());
    }

    @Override
    public Application application() {
        return Application.TCOHC;
    }

    @Override
    public String outputFile() {
        return config.isWriteOutput() ? config.getOutputFile() : null;
    }

    @Override
    public ApplicationResult run(DiagnosticContext context) {
        GeoField temperature = context.require(OCEAN_TEMPERATURE, UnitSystem.CELSIUS, 3);
        GeoField depthField = context.require(DEPTH, UnitSystem.METER, 3);
        requireSameShape(depthField, temperature);

        GeoField asaln = null;
        if (context.getVariables().contains(SALINITY)) {
            GeoField salinity = context.require(SALINITY, UnitSystem.DIMENSIONLESS, 3);
            requireSameShape(salinity, temperature);
            asaln = absoluteSalinity(salinity, context.grid());
            temperature = conservativeTemperature(asaln, temperature, context.grid());
        } else {
            log.info("[{}] Sin '{}': se usa '{}' directamente.", application().key(), SALINITY, OCEAN_TEMPERATURE);
        }

        IsothermProfile profile = profile(temperature, depthField, context.grid());
        if (profile.getFilledColumns() > 0) {
            context.getWarnings().record(new IsothermNotFoundWarning(application().key(),
                    config.getIsotherm(), profile.getFilledColumns(), config.getFillValue()));
        }

        ApplicationResult.ApplicationResultBuilder result = ApplicationResult.builder()
                .application(application())
                .status(ApplicationResult.Status.SUCCEEDED)
                .gridField("isotherm_depth", profile.getDepth())
                .gridField("tchp", profile.getTchp())
                .gridField("ohc", profile.getOhc());
        if (asaln != null) {
            result.gridField("asaln", asaln).gridField("ctemp", temperature);
        }

        double[] depth = profile.getDepth().toArray();
        double[] tchp = profile.getTchp().toArray();
        SummaryTable table = new SummaryTable("TC", "isoterma [m]", "tchp [kJ/cm^2]");
        for (TcFix fix : context.getFixes()) {
            double d = context.sampleAtCenter(depth, fix);
            double h = context.sampleAtCenter(tchp, fix);
            result.tc(fix.tcId(), TcAttributes.builder(fix.tcId())
                    .scalar("isotherm_depth", "m", "Profundidad de la isoterma de " + config.getIsotherm() + " degC", d)
                    .scalar("tchp", "kJ/cm^2", "Potencial calorífico del TC", h)
                    .build());
            table.row(fix.tcId(), d, h);
        }
        log.info("[{}] Contenido calorífico en el centro de cada TC:\n{}", application().key(), table);
        return result.build();
    }

    /**
     * Isoterma, TCHP y contenido por nivel de cada columna. Las columnas sin isoterma
     * reciben el valor de relleno y TCHP nulo.
     */
    IsothermProfile profile(GeoField temperature, GeoField depth, GeoGrid grid) {
        int nz = temperature.nz();
        int ny = temperature.ny();
        int nx = temperature.nx();
        double[] isoDepth = new double[ny * nx];
        double[] tchp = new double[ny * nx];
        double[] ohc = new double[nz * ny * nx];
        int filled = 0;

        for (int j = 0; j < ny; j++) {
            for (int i = 0; i < nx; i++) {
                int idx = j * nx + i;
                double[] t = temperature.column(j, i);
                double[] z = depth.column(j, i);
                if (IsothermLocator.findBracket(t, config.getIsotherm()) < 0) {
                    isoDepth[idx] = config.getFillValue();
                    filled++;
                    continue;
                }
                double d = locator.locate(t, z, config.getIsotherm(), config.getInterpType(), config.getFillValue());
                isoDepth[idx] = d;
                tchp[idx] = integrator.integrate(t, z, d, config.getIsotherm()) * HeatContentIntegrator.J_M2_TO_KJ_CM2;
                double[] levels = HeatContentIntegrator.levelContent(t, z, d, config.getIsotherm());
                for (int k = 0; k < nz; k++) {
                    ohc[(k * ny + j) * nx + i] = levels[k];
                }
            }
        }
        log.info("[{}] Isoterma de {} degC: {} de {} columnas sin acotar.", application().key(),
                config.getIsotherm(), filled, ny * nx);

        int[] shape2d = {ny, nx};
        return IsothermProfile.builder()
                .isotherm(config.getIsotherm())
                .depth(GeoField.of("isotherm_depth", "m", shape2d, isoDepth, grid))
                .tchp(GeoField.of("tchp", "kJ/cm^2", shape2d, tchp, grid))
                .ohc(GeoField.of("ohc", "J/m^3", new int[]{nz, ny, nx}, ohc, grid))
                .filledColumns(filled)
                .build();
    }

    static GeoField absoluteSalinity(GeoField salinity, GeoGrid grid) {
        double[] sp = salinity.toArray();
        double[] sa = new double[sp.length];
        for (int n = 0; n < sp.length; n++) {
            sa[n] = Seawater.absoluteSalinity(sp[n]);
        }
        return GeoField.of("asaln", "g/kg", salinity.shape(), sa, grid);
    }

    static GeoField conservativeTemperature(GeoField absoluteSalinity, GeoField potentialTemperature, GeoGrid grid) {
        double[] sa = absoluteSalinity.toArray();
        double[] pt = potentialTemperature.toArray();
        double[] ct = new double[pt.length];
        for (int n = 0; n < pt.length; n++) {
            ct[n] = Seawater.conservativeTemperature(sa[n], pt[n]);
        }
        return GeoField.of("ctemp", "degC", potentialTemperature.shape(), ct, grid);
    }

    private static void requireSameShape(GeoField field, GeoField temperature) {
        if (!Arrays.equals(field.shape(), temperature.shape())) {
            throw new ConfigException(String.format("'%s' %s y '%s' %s deben tener la misma forma.",
                    field.getName(), Arrays.toString(field.shape()),
                    temperature.getName(), Arrays.toString(temperature.shape())));
        }
    }
}
