package tcdiags.physics.diagnostics;

import lombok.extern.slf4j.Slf4j;
import tcdiags.config.SteeringFlowConfig;
import tcdiags.config.SteeringFlowConfig.LayerBounds;
import tcdiags.domain.diagnostics.Application;
import tcdiags.domain.diagnostics.ApplicationResult;
import tcdiags.domain.diagnostics.SteeringLayer;
import tcdiags.domain.diagnostics.SteeringVector;
import tcdiags.domain.diagnostics.TcAttributes;
import tcdiags.domain.diagnostics.WindPair;
import tcdiags.domain.grid.GeoField;
import tcdiags.domain.grid.GeoGrid;
import tcdiags.domain.grid.TcFix;
import tcdiags.physics.projection.GreatCircle;
import tcdiags.physics.solver.WindPartitionSolver;
import tcdiags.physics.solver.WindPartitionSolver.Partition;
import tcdiags.physics.solver.impl.SvdSpatialFilter;
import tcdiags.physics.solver.impl.VerticalInterpolator;
import tcdiags.units.UnitSystem;
import tcdiags.utils.SummaryTable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Flujo director de los TC (tcsteering).
 * <p>
 * Pasos por nivel isobárico: interpolación vertical de u y v, filtro SVD alrededor de
 * cada TC y partición de Helmholtz del viento filtrado. Después se calculan las medias
 * de capa ponderadas en presión y, por TC, el vector director como media areal del
 * viento filtrado dentro de {@code distance}.
 * <p>
 * El viento total de cada capa es el viento filtrado, de modo que
 * armónico = total - rotacional - divergente también en las medias de capa.
 */
@Slf4j
public class SteeringFlowDiagnostic implements TcDiagnostic {

    public static final String UWIND = "uwind";
    public static final String VWIND = "vwind";
    public static final String PRESSURE = "pressure";

    private final SteeringFlowConfig config;
    private final VerticalInterpolator interpolator;
    private final SvdSpatialFilter filter;
    private final WindPartitionSolver partitionSolver;

    public SteeringFlowDiagnostic(SteeringFlowConfig config, VerticalInterpolator interpolator,
                                  SvdSpatialFilter filter, WindPartitionSolver partitionSolver) {
        this.config = config;
        this.interpolator = interpolator;
        this.filter = filter;
        this.partitionSolver = partitionSolver;
    }

    @Override
    public Application application() {
        return Application.TCSTEERING;
    }

    @Override
    public String outputFile() {
        return config.isWriteOutput() ? config.getOutputFile() : null;
    }

    /**
     * Componentes del viento en cada nivel isobárico, arrays [nivel][lat × lon].
     */
    record LevelWinds(double[] levels, double[][] uFiltered, double[][] vFiltered, Partition[] partitions) {
    }

    @Override
    public ApplicationResult run(DiagnosticContext context) {
        GeoGrid grid = context.grid();
        LevelWinds winds = levelWinds(context);
        List<SteeringLayer> layers = layers(winds, grid, context.getFixes());

        int nz = winds.levels().length;
        int[] shape3d = {nz, grid.ny(), grid.nx()};
        ApplicationResult.ApplicationResultBuilder result = ApplicationResult.builder()
                .application(application())
                .status(ApplicationResult.Status.SUCCEEDED)
                .gridField("psi", stack("psi", "m^2/s", shape3d, winds, Partition::psi, grid))
                .gridField("chi", stack("chi", "m^2/s", shape3d, winds, Partition::chi, grid))
                .gridField("vort", stack("vort", "1/s", shape3d, winds, Partition::vort, grid))
                .gridField("divg", stack("divg", "1/s", shape3d, winds, Partition::divg, grid));

        for (SteeringLayer layer : layers) {
            String label = layerLabel(layer.getTop(), layer.getBottom());
            putPair(result, "total", label, layer.getTotal());
            putPair(result, "rot", label, layer.getRotational());
            putPair(result, "div", label, layer.getDivergent());
            putPair(result, "harm", label, layer.getHarmonic());
            putPair(result, "filt", label, layer.getFiltered());
        }

        SummaryTable table = new SummaryTable("TC", "capa", "u [m/s]", "v [m/s]", "velocidad [m/s]", "rumbo [deg]");
        for (TcFix fix : context.getFixes()) {
            TcAttributes.Builder attributes = TcAttributes.builder(fix.tcId());
            for (SteeringLayer layer : layers) {
                String label = layerLabel(layer.getTop(), layer.getBottom());
                SteeringVector vector = layer.getSteeringVectors().get(fix.tcId());
                attributes.scalar("usteer_" + label, "m/s", "Flujo director zonal " + label, vector.u())
                        .scalar("vsteer_" + label, "m/s", "Flujo director meridional " + label, vector.v())
                        .scalar("speed_" + label, "m/s", "Velocidad del flujo director " + label, vector.speed())
                        .scalar("heading_" + label, "degree", "Rumbo del flujo director " + label, vector.heading());
                table.row(fix.tcId(), label, vector.u(), vector.v(), vector.speed(), vector.heading());
            }
            result.tc(fix.tcId(), attributes.build());
        }
        log.info("[{}] Flujo director por TC y capa:\n{}", application().key(), table);
        return result.build();
    }

    /**
     * Interpola el viento a los niveles de análisis, lo filtra y lo particiona.
     */
    LevelWinds levelWinds(DiagnosticContext context) {
        GeoField u = context.require(UWIND, UnitSystem.METER_PER_SECOND, 3);
        GeoField v = context.require(VWIND, UnitSystem.METER_PER_SECOND, 3);
        GeoField pressure = context.require(PRESSURE, UnitSystem.PASCAL, 3);
        GeoGrid grid = context.grid();

        double[] levels = config.getIsolevels().stream().mapToDouble(Double::doubleValue).toArray();
        double[][] uLevels = interpolator.toLevels(u, pressure, levels);
        double[][] vLevels = interpolator.toLevels(v, pressure, levels);
        double[][] uFiltered = new double[levels.length][];
        double[][] vFiltered = new double[levels.length][];
        Partition[] partitions = new Partition[levels.length];

        for (int k = 0; k < levels.length; k++) {
            log.debug("[{}] Nivel {} Pa: filtro SVD y partición del viento.", application().key(), levels[k]);
            uFiltered[k] = filter.filter(uLevels[k], grid, context.getFixes(), config.getDistance(),
                    config.getDdist(), config.getNcoeffs(), context.getWarnings());
            vFiltered[k] = filter.filter(vLevels[k], grid, context.getFixes(), config.getDistance(),
                    config.getDdist(), config.getNcoeffs(), context.getWarnings());
            partitions[k] = partitionSolver.partition(uFiltered[k], vFiltered[k], grid);
        }
        log.info("[{}] {} niveles isobáricos procesados con {}.", application().key(), levels.length,
                partitionSolver.getName());
        return new LevelWinds(levels, uFiltered, vFiltered, partitions);
    }

    /**
     * Medias de capa de cada componente y vector director por TC.
     */
    List<SteeringLayer> layers(LevelWinds winds, GeoGrid grid, List<TcFix> fixes) {
        int nz = winds.levels().length;
        double[][] urot = new double[nz][];
        double[][] vrot = new double[nz][];
        double[][] udiv = new double[nz][];
        double[][] vdiv = new double[nz][];
        double[][] uharm = new double[nz][];
        double[][] vharm = new double[nz][];
        for (int k = 0; k < nz; k++) {
            Partition p = winds.partitions()[k];
            urot[k] = p.urot();
            vrot[k] = p.vrot();
            udiv[k] = p.udiv();
            vdiv[k] = p.vdiv();
            uharm[k] = p.uharm(winds.uFiltered()[k]);
            vharm[k] = p.vharm(winds.vFiltered()[k]);
        }

        List<SteeringLayer> layers = new ArrayList<>();
        for (LayerBounds bounds : config.effectiveLayers()) {
            String label = layerLabel(bounds.top(), bounds.bottom());
            WindPair filtered = pair("filt", label, grid,
                    layerMean(winds.uFiltered(), winds.levels(), bounds),
                    layerMean(winds.vFiltered(), winds.levels(), bounds));

            SteeringLayer.SteeringLayerBuilder layer = SteeringLayer.builder()
                    .top(bounds.top())
                    .bottom(bounds.bottom())
                    .total(pair("total", label, grid, filtered.u().toArray(), filtered.v().toArray()))
                    .rotational(pair("rot", label, grid,
                            layerMean(urot, winds.levels(), bounds), layerMean(vrot, winds.levels(), bounds)))
                    .divergent(pair("div", label, grid,
                            layerMean(udiv, winds.levels(), bounds), layerMean(vdiv, winds.levels(), bounds)))
                    .harmonic(pair("harm", label, grid,
                            layerMean(uharm, winds.levels(), bounds), layerMean(vharm, winds.levels(), bounds)))
                    .filtered(filtered);

            for (TcFix fix : fixes) {
                double us = areaMean(filtered.u().toArray(), grid, fix, config.getDistance());
                double vs = areaMean(filtered.v().toArray(), grid, fix, config.getDistance());
                layer.steeringVector(fix.tcId(), new SteeringVector(fix.tcId(), us, vs));
            }
            layers.add(layer.build());
        }
        return layers;
    }

    /**
     * Media trapezoidal en presión sobre [top, bottom]. Los tramos entre niveles se
     * recortan a la capa interpolando linealmente en presión los extremos. Por columna
     * se ignoran los tramos con algún extremo NaN.
     */
    static double[] layerMean(double[][] values, double[] levels, LayerBounds bounds) {
        Integer[] order = new Integer[levels.length];
        for (int k = 0; k < order.length; k++) {
            order[k] = k;
        }
        Arrays.sort(order, (a, b) -> Double.compare(levels[b], levels[a]));

        int plane = values[0].length;
        double[] out = new double[plane];
        for (int idx = 0; idx < plane; idx++) {
            double sum = 0.0;
            double weight = 0.0;
            for (int n = 0; n < order.length - 1; n++) {
                int k0 = order[n];
                int k1 = order[n + 1];
                double p0 = levels[k0];
                double p1 = levels[k1];
                double lower = Math.min(p0, bounds.bottom());
                double upper = Math.max(p1, bounds.top());
                if (!(lower > upper)) {
                    continue;
                }
                double a = values[k0][idx];
                double b = values[k1][idx];
                if (Double.isNaN(a) || Double.isNaN(b)) {
                    continue;
                }
                double va = a + (b - a) * (p0 - lower) / (p0 - p1);
                double vb = a + (b - a) * (p0 - upper) / (p0 - p1);
                double dp = lower - upper;
                sum += 0.5 * (va + vb) * dp;
                weight += dp;
            }
            out[idx] = weight > 0.0 ? sum / weight : Double.NaN;
        }
        return out;
    }

    /**
     * Media ponderada por cos(lat) de los puntos a menos de {@code distance} del TC.
     */
    static double areaMean(double[] plane, GeoGrid grid, TcFix fix, double distance) {
        double sum = 0.0;
        double weight = 0.0;
        for (int j = 0; j < grid.ny(); j++) {
            for (int i = 0; i < grid.nx(); i++) {
                double value = plane[j * grid.nx() + i];
                if (Double.isNaN(value)) {
                    continue;
                }
                double lat = grid.latAt(j, i);
                if (GreatCircle.distance(fix.lat(), fix.lon(), lat, grid.lonAt(j, i)) <= distance) {
                    double w = Math.cos(Math.toRadians(lat));
                    sum += w * value;
                    weight += w;
                }
            }
        }
        return weight > 0.0 ? sum / weight : Double.NaN;
    }

    static String layerLabel(double top, double bottom) {
        return String.format(Locale.ROOT, "%.0f-%.0fhPa", top / 100.0, bottom / 100.0);
    }

    private static WindPair pair(String component, String label, GeoGrid grid, double[] u, double[] v) {
        int[] shape = {grid.ny(), grid.nx()};
        return new WindPair(
                GeoField.of("u" + component + "_" + label, "m/s", shape, u, grid),
                GeoField.of("v" + component + "_" + label, "m/s", shape, v, grid));
    }

    private static void putPair(ApplicationResult.ApplicationResultBuilder result, String component, String label,
                                WindPair pair) {
        result.gridField("u" + component + "_" + label, pair.u());
        result.gridField("v" + component + "_" + label, pair.v());
    }

    private interface PartitionArray {
        double[] of(Partition partition);
    }

    private static GeoField stack(String name, String units, int[] shape, LevelWinds winds,
                                  PartitionArray accessor, GeoGrid grid) {
        int plane = shape[1] * shape[2];
        double[] data = new double[shape[0] * plane];
        for (int k = 0; k < shape[0]; k++) {
            System.arraycopy(accessor.of(winds.partitions()[k]), 0, data, k * plane, plane);
        }
        return GeoField.of(name, units, shape, data, grid);
    }
}
