package tcdiags.physics.solver.impl;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tcdiags.domain.grid.GeoGrid;
import tcdiags.physics.projection.GreatCircle;
import tcdiags.physics.solver.WindPartitionSolver.Partition;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

@Slf4j
class FiniteDifferenceWindPartitionSolverTest {

    private static final int N = 41;
    private static final double STEP = 0.25;
    private static final double AMPLITUDE = 1.0e7;

    private FiniteDifferenceWindPartitionSolver solver;
    private GeoGrid grid;
    private double dy;
    private double[] dx;

    @BeforeEach
    void setUp() {
        solver = new FiniteDifferenceWindPartitionSolver();
        double[] lats = new double[N];
        double[] lons = new double[N];
        for (int k = 0; k < N; k++) {
            lats[k] = -5.0 + STEP * k;
            lons[k] = 140.0 + STEP * k;
        }
        grid = GeoGrid.fromAxes(lats, lons);
        dy = GreatCircle.EARTH_RADIUS * Math.toRadians(STEP);
        dx = new double[N];
        for (int j = 0; j < N; j++) {
            dx[j] = GreatCircle.EARTH_RADIUS * Math.cos(Math.toRadians(lats[j])) * Math.toRadians(STEP);
        }
    }

    private static double relativeRms(double[] actual, double[] expected) {
        double err = 0.0;
        double norm = 0.0;
        for (int c = 0; c < actual.length; c++) {
            err += (actual[c] - expected[c]) * (actual[c] - expected[c]);
            norm += expected[c] * expected[c];
        }
        return Math.sqrt(err / norm);
    }

    private static double norm(double[] values) {
        double sum = 0.0;
        for (double x : values) {
            sum += x * x;
        }
        return Math.sqrt(sum);
    }

    @Test
    @DisplayName("Un viento puramente rotacional se recupera en la parte rotacional")
    void partition_analyticStreamfunction_shouldRecoverRotationalWind() {
        double[] u = new double[N * N];
        double[] v = new double[N * N];
        double ly = (N - 1) * dy;
        for (int j = 0; j < N; j++) {
            double lx = (N - 1) * dx[j];
            for (int i = 0; i < N; i++) {
                double ax = Math.PI * i / (N - 1);
                double ay = Math.PI * j / (N - 1);
                u[j * N + i] = -AMPLITUDE * Math.PI / ly * Math.sin(ax) * Math.cos(ay);
                v[j * N + i] = AMPLITUDE * Math.PI / lx * Math.cos(ax) * Math.sin(ay);
            }
        }

        Partition partition = solver.partition(u, v, grid);

        double errU = relativeRms(partition.urot(), u);
        double errV = relativeRms(partition.vrot(), v);
        log.info("Error RMS relativo de la parte rotacional: u={} v={}", errU, errV);
        assertThat(errU).isLessThan(0.05);
        assertThat(errV).isLessThan(0.05);

        int center = (N / 2) * N + N / 2;
        double expectedPsi = AMPLITUDE;
        assertThat(Math.abs(partition.psi()[center] - expectedPsi) / expectedPsi).isLessThan(0.05);
        assertThat(norm(partition.udiv()) / norm(u)).isLessThan(0.05);
    }

    @Test
    @DisplayName("Un viento puramente divergente se recupera en la parte divergente")
    void partition_analyticVelocityPotential_shouldRecoverDivergentWind() {
        double[] u = new double[N * N];
        double[] v = new double[N * N];
        double ly = (N - 1) * dy;
        for (int j = 0; j < N; j++) {
            double lx = (N - 1) * dx[j];
            for (int i = 0; i < N; i++) {
                double ax = Math.PI * i / (N - 1);
                double ay = Math.PI * j / (N - 1);
                u[j * N + i] = AMPLITUDE * Math.PI / lx * Math.cos(ax) * Math.sin(ay);
                v[j * N + i] = AMPLITUDE * Math.PI / ly * Math.sin(ax) * Math.cos(ay);
            }
        }

        Partition partition = solver.partition(u, v, grid);

        assertThat(relativeRms(partition.udiv(), u)).isLessThan(0.05);
        assertThat(relativeRms(partition.vdiv(), v)).isLessThan(0.05);
    }

    @Test
    @DisplayName("Un viento uniforme es enteramente armónico")
    void partition_uniformWind_shouldBeHarmonic() {
        double[] u = new double[N * N];
        double[] v = new double[N * N];
        Arrays.fill(u, 5.0);
        Arrays.fill(v, -2.0);

        Partition partition = solver.partition(u, v, grid);

        assertThat(partition.vort()).containsOnly(0.0);
        assertThat(partition.divg()).containsOnly(0.0);
        assertThat(partition.uharm(u)).containsOnly(5.0);
        assertThat(partition.vharm(v)).containsOnly(-2.0);
    }

    @Test
    @DisplayName("Los valores ausentes del viento se tratan como cero")
    void partition_missingValues_shouldNotPropagateNaN() {
        double[] u = new double[N * N];
        double[] v = new double[N * N];
        Arrays.fill(u, 1.0);
        u[5 * N + 7] = Double.NaN;

        Partition partition = solver.partition(u, v, grid);

        assertThat(Arrays.stream(partition.psi()).anyMatch(Double::isNaN)).isFalse();
        assertThat(Arrays.stream(partition.urot()).anyMatch(Double::isNaN)).isFalse();
    }
}
