package tcdiags.physics.solver;

import tcdiags.domain.diagnostics.WavenumberSpectrum;
import tcdiags.domain.exception.ConfigException;
import tcdiags.domain.grid.PolarField;

public interface SpectralDecomposer extends SolverComponent {
    /**
     * Descompone cada anillo del campo polar en números de onda azimutales 0..maxWn.
     *
     * @param field Campo polar (radio × azimut).
     * @param maxWn Número de onda máximo retenido.
     * @return Componentes reales, suma truncada y residuo.
     * @throws ConfigException si {@code maxWn} alcanza la frecuencia de Nyquist.
     */
    WavenumberSpectrum decompose(PolarField field, int maxWn);
}
