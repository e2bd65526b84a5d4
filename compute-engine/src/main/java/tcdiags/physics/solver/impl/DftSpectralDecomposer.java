package tcdiags.physics.solver.impl;

import lombok.extern.slf4j.Slf4j;
import tcdiags.domain.diagnostics.WavenumberSpectrum;
import tcdiags.domain.exception.ConfigException;
import tcdiags.domain.grid.PolarField;
import tcdiags.physics.solver.SpectralDecomposer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Descomposición azimutal por DFT directa anillo a anillo.
 * <p>
 * Para N azimuts y coeficientes C_k:
 * <pre>
 *   k = 0:        f_0(φ) = C_0 / N
 *   0 < k < N/2:  f_k(φ) = (2/N) Re(C_k e^{ikφ})
 * </pre>
 * Los anillos con algún valor ausente quedan ausentes en todas las componentes.
 */
@Slf4j
public class DftSpectralDecomposer implements SpectralDecomposer {

    @Override
    public String getName() {
        return "Spectral_Azimuthal_DFT";
    }

    @Override
    public WavenumberSpectrum decompose(PolarField field, int maxWn) {
        int nr = field.nRadii();
        int n = field.nAzimuths();
        if (maxWn < 0) {
            throw new ConfigException("max_wn no puede ser negativo: " + maxWn);
        }
        if (2 * maxWn >= n) {
            throw new ConfigException(String.format(
                    "max_wn=%d viola el límite de Nyquist para %d azimuts (max_wn < %d).", maxWn, n, (n + 1) / 2));
        }

        double[][][] components = new double[maxWn + 1][nr][n];
        double[][] truncated = new double[nr][n];
        double[][] residual = new double[nr][n];

        for (int r = 0; r < nr; r++) {
            double[] ring = field.ring(r);
            if (field.ringHasMissing(r)) {
                for (int k = 0; k <= maxWn; k++) {
                    Arrays.fill(components[k][r], PolarField.MISSING);
                }
                Arrays.fill(truncated[r], PolarField.MISSING);
                Arrays.fill(residual[r], PolarField.MISSING);
                continue;
            }
            for (int k = 0; k <= maxWn; k++) {
                double re = 0.0;
                double im = 0.0;
                for (int j = 0; j < n; j++) {
                    double angle = -2.0 * Math.PI * k * j / n;
                    re += ring[j] * Math.cos(angle);
                    im += ring[j] * Math.sin(angle);
                }
                for (int j = 0; j < n; j++) {
                    double value;
                    if (k == 0) {
                        value = re / n;
                    } else {
                        double angle = 2.0 * Math.PI * k * j / n;
                        value = (2.0 / n) * (re * Math.cos(angle) - im * Math.sin(angle));
                    }
                    components[k][r][j] = value;
                    truncated[r][j] += value;
                }
            }
            for (int j = 0; j < n; j++) {
                residual[r][j] = ring[j] - truncated[r][j];
            }
        }

        double maxMagnitude = Double.NaN;
        double radiusOfMax = Double.NaN;
        double azimuthOfMax = Double.NaN;
        for (int r = 0; r < nr; r++) {
            for (int a = 0; a < n; a++) {
                double value = field.get(r, a);
                if (!Double.isNaN(value) && (Double.isNaN(maxMagnitude) || Math.abs(value) > maxMagnitude)) {
                    maxMagnitude = Math.abs(value);
                    radiusOfMax = field.radiusAt(r);
                    azimuthOfMax = field.azimuthAt(a);
                }
            }
        }

        List<PolarField> componentFields = new ArrayList<>();
        List<Double> maxima = new ArrayList<>();
        for (int k = 0; k <= maxWn; k++) {
            componentFields.add(field.withValues(field.getName() + "_wn" + k, components[k]));
            maxima.add(maxAbs(components[k]));
        }
        log.debug("Espectro de '{}' ({}): máximos por número de onda {}", field.getName(),
                field.getTcFix() == null ? "-" : field.getTcFix().tcId(), maxima);

        return WavenumberSpectrum.builder()
                .original(field)
                .components(List.copyOf(componentFields))
                .truncated(field.withValues(field.getName() + "_truncated", truncated))
                .residual(field.withValues(field.getName() + "_residual", residual))
                .maxMagnitude(maxMagnitude)
                .radiusOfMax(radiusOfMax)
                .azimuthOfMax(azimuthOfMax)
                .componentMaxima(List.copyOf(maxima))
                .build();
    }

    private static double maxAbs(double[][] values) {
        double max = Double.NaN;
        for (double[] row : values) {
            for (double v : row) {
                if (!Double.isNaN(v) && (Double.isNaN(max) || Math.abs(v) > max)) {
                    max = Math.abs(v);
                }
            }
        }
        return max;
    }
}
