package tcdiags.physics.solver.impl;

import lombok.extern.slf4j.Slf4j;
import tcdiags.domain.grid.GeoGrid;
import tcdiags.physics.projection.GreatCircle;
import tcdiags.physics.solver.WindPartitionSolver;

/**
 * Partición de Helmholtz por diferencias finitas sobre la esfera.
 * <p>
 * dx = R cos(φ) Δλ por fila, dy = R Δφ. Vorticidad y divergencia con diferencias
 * centradas (laterales en los bordes). Las ecuaciones ∇²ψ = ζ y ∇²χ = δ se resuelven
 * con SOR sobre el operador de cinco puntos y condiciones de Dirichlet homogéneas.
 * Los valores ausentes del viento se tratan como cero.
 */
@Slf4j
public class FiniteDifferenceWindPartitionSolver implements WindPartitionSolver {

    private final double tolerance;
    private final int maxIterations;

    public FiniteDifferenceWindPartitionSolver() {
        this(1.0e-8, 20000);
    }

    /**
     * @param tolerance     Incremento máximo relativo para dar por convergido el SOR.
     * @param maxIterations Límite de barridos.
     */
    public FiniteDifferenceWindPartitionSolver(double tolerance, int maxIterations) {
        this.tolerance = tolerance;
        this.maxIterations = maxIterations;
    }

    @Override
    public String getName() {
        return "WindPartition_FD_SOR";
    }

    @Override
    public Partition partition(double[] u, double[] v, GeoGrid grid) {
        int ny = grid.ny();
        int nx = grid.nx();
        double[] dx = new double[ny];
        double dy = nx > 0 && ny > 1
                ? GreatCircle.EARTH_RADIUS * Math.toRadians(grid.rowLatitude(1) - grid.rowLatitude(0))
                : Double.NaN;
        double dlon = nx > 1 ? Math.toRadians(grid.columnLongitude(1) - grid.columnLongitude(0)) : Double.NaN;
        for (int j = 0; j < ny; j++) {
            double cos = Math.max(Math.cos(Math.toRadians(grid.rowLatitude(j))), 1.0e-6);
            dx[j] = GreatCircle.EARTH_RADIUS * cos * dlon;
        }

        double[] uu = zeroMissing(u);
        double[] vv = zeroMissing(v);

        double[] dvdx = ddx(vv, ny, nx, dx);
        double[] dudy = ddy(uu, ny, nx, dy);
        double[] dudx = ddx(uu, ny, nx, dx);
        double[] dvdy = ddy(vv, ny, nx, dy);

        double[] vort = new double[ny * nx];
        double[] divg = new double[ny * nx];
        for (int c = 0; c < vort.length; c++) {
            vort[c] = dvdx[c] - dudy[c];
            divg[c] = dudx[c] + dvdy[c];
        }

        double[] psi = solvePoisson(vort, ny, nx, dx, dy, "psi");
        double[] chi = solvePoisson(divg, ny, nx, dx, dy, "chi");

        double[] urot = negate(ddy(psi, ny, nx, dy));
        double[] vrot = ddx(psi, ny, nx, dx);
        double[] udiv = ddx(chi, ny, nx, dx);
        double[] vdiv = ddy(chi, ny, nx, dy);

        return new Partition(psi, chi, urot, vrot, udiv, vdiv, vort, divg);
    }

    /**
     * SOR sobre el operador de cinco puntos con frontera nula.
     */
    double[] solvePoisson(double[] rhs, int ny, int nx, double[] dx, double dy, String label) {
        double[] phi = new double[ny * nx];
        if (ny < 3 || nx < 3) {
            return phi;
        }
        double omega = 2.0 / (1.0 + Math.sin(Math.PI / Math.max(nx, ny)));
        double idy2 = 1.0 / (dy * dy);

        int iter = 0;
        double maxDelta;
        do {
            maxDelta = 0.0;
            double maxPhi = 0.0;
            for (int j = 1; j < ny - 1; j++) {
                double idx2 = 1.0 / (dx[j] * dx[j]);
                double diag = 2.0 * idx2 + 2.0 * idy2;
                for (int i = 1; i < nx - 1; i++) {
                    int c = j * nx + i;
                    double gs = ((phi[c + 1] + phi[c - 1]) * idx2
                            + (phi[c + nx] + phi[c - nx]) * idy2
                            - rhs[c]) / diag;
                    double delta = omega * (gs - phi[c]);
                    phi[c] += delta;
                    maxDelta = Math.max(maxDelta, Math.abs(delta));
                    maxPhi = Math.max(maxPhi, Math.abs(phi[c]));
                }
            }
            iter++;
            if (maxDelta <= tolerance * Math.max(maxPhi, Double.MIN_NORMAL)) {
                break;
            }
        } while (iter < maxIterations);

        if (iter >= maxIterations) {
            log.warn("SOR de {} sin converger tras {} iteraciones (último incremento {}).", label, iter, maxDelta);
        } else {
            log.debug("SOR de {} convergió en {} iteraciones.", label, iter);
        }
        return phi;
    }

    static double[] ddx(double[] f, int ny, int nx, double[] dx) {
        double[] out = new double[f.length];
        if (nx < 2) {
            return out;
        }
        for (int j = 0; j < ny; j++) {
            int row = j * nx;
            out[row] = (f[row + 1] - f[row]) / dx[j];
            out[row + nx - 1] = (f[row + nx - 1] - f[row + nx - 2]) / dx[j];
            for (int i = 1; i < nx - 1; i++) {
                out[row + i] = (f[row + i + 1] - f[row + i - 1]) / (2.0 * dx[j]);
            }
        }
        return out;
    }

    static double[] ddy(double[] f, int ny, int nx, double dy) {
        double[] out = new double[f.length];
        if (ny < 2) {
            return out;
        }
        for (int i = 0; i < nx; i++) {
            out[i] = (f[nx + i] - f[i]) / dy;
            out[(ny - 1) * nx + i] = (f[(ny - 1) * nx + i] - f[(ny - 2) * nx + i]) / dy;
            for (int j = 1; j < ny - 1; j++) {
                out[j * nx + i] = (f[(j + 1) * nx + i] - f[(j - 1) * nx + i]) / (2.0 * dy);
            }
        }
        return out;
    }

    private static double[] negate(double[] f) {
        double[] out = new double[f.length];
        for (int i = 0; i < f.length; i++) {
            out[i] = -f[i];
        }
        return out;
    }

    private static double[] zeroMissing(double[] f) {
        double[] out = f.clone();
        for (int i = 0; i < out.length; i++) {
            if (Double.isNaN(out[i])) {
                out[i] = 0.0;
            }
        }
        return out;
    }
}
