package tcdiags.physics.solver.impl;

import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.SingularOps_DDRM;
import org.ejml.dense.row.decomposition.svd.SafeSvd_DDRM;
import org.ejml.dense.row.factory.DecompositionFactory_DDRM;
import org.ejml.interfaces.decomposition.SingularValueDecomposition_F64;
import tcdiags.domain.exception.ConfigException;
import tcdiags.domain.grid.GeoGrid;
import tcdiags.domain.grid.TcFix;
import tcdiags.domain.warning.RankDeficiencyWarning;
import tcdiags.domain.warning.WarningLog;
import tcdiags.physics.projection.GreatCircle;
import tcdiags.physics.solver.SolverComponent;

/**
 * Filtro espacial por SVD truncada en la ventana de cada TC.
 * <p>
 * La ventana es el rectángulo de puntos a menos de {@code distance + ddist} del centro.
 * La reconstrucción con los {@code ncoeffs} tripletes principales se mezcla con el
 * campo original mediante una máscara de relajación: 0 hasta {@code distance},
 * rampa lineal hasta 1 en {@code distance + ddist}.
 */
@Slf4j
public class SvdSpatialFilter implements SolverComponent {

    /** Tolerancia relativa para considerar nulo un valor singular. */
    private static final double RANK_TOLERANCE = 1.0e-10;

    private final String source;

    public SvdSpatialFilter(String source) {
        this.source = source;
    }

    @Override
    public String getName() {
        return "SpatialFilter_TruncatedSVD";
    }

    /**
     * Reconstrucción truncada de una matriz.
     */
    public record Truncation(DMatrixRMaj reconstructed, int usedCoeffs, int availableRank) {
    }

    /**
     * Filtra un nivel lat × lon alrededor de cada TC.
     *
     * @param plane    Valores aplanados fila-mayor.
     * @param grid     Malla del nivel.
     * @param fixes    Centros de los TC.
     * @param distance Radio sin relajación [m].
     * @param ddist    Anchura de la rampa [m].
     * @param ncoeffs  Tripletes retenidos.
     * @param warnings Registro de advertencias de la ejecución.
     * @return Nuevo array filtrado.
     */
    public double[] filter(double[] plane, GeoGrid grid, Iterable<TcFix> fixes, double distance, double ddist,
                           int ncoeffs, WarningLog warnings) {
        if (ncoeffs < 1) {
            throw new ConfigException("ncoeffs debe ser al menos 1; recibido " + ncoeffs);
        }
        if (!(ddist > 0.0) || distance < 0.0) {
            throw new ConfigException(String.format("distance=%s y ddist=%s inválidos.", distance, ddist));
        }
        int nx = grid.nx();
        double[] out = plane.clone();
        double outer = distance + ddist;

        for (TcFix fix : fixes) {
            double[] dist = new double[plane.length];
            int jMin = Integer.MAX_VALUE;
            int jMax = -1;
            int iMin = Integer.MAX_VALUE;
            int iMax = -1;
            for (int j = 0; j < grid.ny(); j++) {
                for (int i = 0; i < nx; i++) {
                    double d = GreatCircle.distance(fix.lat(), fix.lon(), grid.latAt(j, i), grid.lonAt(j, i));
                    dist[j * nx + i] = d;
                    if (d <= outer) {
                        jMin = Math.min(jMin, j);
                        jMax = Math.max(jMax, j);
                        iMin = Math.min(iMin, i);
                        iMax = Math.max(iMax, i);
                    }
                }
            }
            if (jMax < 0) {
                log.warn("[{}] TC {} fuera de la malla: no se filtra.", source, fix.tcId());
                continue;
            }

            int rows = jMax - jMin + 1;
            int cols = iMax - iMin + 1;
            DMatrixRMaj window = new DMatrixRMaj(rows, cols);
            boolean hasMissing = false;
            for (int r = 0; r < rows; r++) {
                for (int c = 0; c < cols; c++) {
                    double value = out[(jMin + r) * nx + (iMin + c)];
                    hasMissing |= Double.isNaN(value);
                    window.set(r, c, value);
                }
            }
            if (hasMissing) {
                log.warn("[{}] La ventana del TC {} contiene valores ausentes: no se filtra.", source, fix.tcId());
                continue;
            }

            Truncation truncation = truncate(window, ncoeffs);
            if (truncation.usedCoeffs() < ncoeffs) {
                warnings.record(new RankDeficiencyWarning(source, fix.tcId(), ncoeffs, truncation.availableRank()));
            }
            DMatrixRMaj smooth = truncation.reconstructed();

            for (int r = 0; r < rows; r++) {
                for (int c = 0; c < cols; c++) {
                    int idx = (jMin + r) * nx + (iMin + c);
                    double mask = relaxation(dist[idx], distance, ddist);
                    out[idx] = (1.0 - mask) * smooth.get(r, c) + mask * out[idx];
                }
            }
            log.debug("[{}] TC {}: ventana {}x{}, {} tripletes de rango {}.", source, fix.tcId(),
                    rows, cols, truncation.usedCoeffs(), truncation.availableRank());
        }
        return out;
    }

    /**
     * SVD de {@code matrix} y reconstrucción con los {@code ncoeffs} valores singulares mayores,
     * limitados al rango numérico disponible.
     */
    public Truncation truncate(DMatrixRMaj matrix, int ncoeffs) {
        SingularValueDecomposition_F64<DMatrixRMaj> svd =
                new SafeSvd_DDRM(DecompositionFactory_DDRM.svd(true, true, true));
        if (!svd.decompose(matrix)) {
            throw new ConfigException("La descomposición SVD no convergió para una ventana de "
                    + matrix.numRows + "x" + matrix.numCols + ".");
        }
        DMatrixRMaj u = svd.getU(null, false);
        DMatrixRMaj w = svd.getW(null);
        DMatrixRMaj v = svd.getV(null, false);
        SingularOps_DDRM.descendingOrder(u, false, w, v, false);

        int k = Math.min(w.numRows, w.numCols);
        double largest = k > 0 ? w.get(0, 0) : 0.0;
        int rank = 0;
        for (int s = 0; s < k; s++) {
            if (w.get(s, s) > RANK_TOLERANCE * Math.max(largest, Double.MIN_NORMAL)) {
                rank++;
            }
        }
        int used = Math.min(ncoeffs, Math.max(rank, 0));

        DMatrixRMaj out = new DMatrixRMaj(matrix.numRows, matrix.numCols);
        for (int s = 0; s < used; s++) {
            double sigma = w.get(s, s);
            for (int r = 0; r < matrix.numRows; r++) {
                double us = u.get(r, s) * sigma;
                for (int c = 0; c < matrix.numCols; c++) {
                    out.add(r, c, us * v.get(c, s));
                }
            }
        }
        return new Truncation(out, used, rank);
    }

    static double relaxation(double d, double distance, double ddist) {
        if (d <= distance) {
            return 0.0;
        }
        if (d >= distance + ddist) {
            return 1.0;
        }
        return (d - distance) / ddist;
    }
}
