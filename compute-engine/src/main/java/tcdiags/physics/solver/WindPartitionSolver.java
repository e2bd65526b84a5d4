package tcdiags.physics.solver;

import tcdiags.domain.grid.GeoGrid;

public interface WindPartitionSolver extends SolverComponent {

    /**
     * Componentes de la partición de Helmholtz de un nivel (arrays lat × lon aplanados).
     *
     * @param psi  Función de corriente [m^2/s].
     * @param chi  Potencial de velocidad [m^2/s].
     * @param vort Vorticidad relativa [1/s].
     * @param divg Divergencia [1/s].
     */
    record Partition(double[] psi, double[] chi, double[] urot, double[] vrot,
                     double[] udiv, double[] vdiv, double[] vort, double[] divg) {

        public double[] uharm(double[] u) {
            return harmonic(u, urot, udiv);
        }

        public double[] vharm(double[] v) {
            return harmonic(v, vrot, vdiv);
        }

        private static double[] harmonic(double[] total, double[] rot, double[] div) {
            double[] out = new double[total.length];
            for (int i = 0; i < out.length; i++) {
                out[i] = total[i] - rot[i] - div[i];
            }
            return out;
        }
    }

    /**
     * Separa el viento en componentes rotacional y divergente resolviendo
     * ∇²ψ = ζ y ∇²χ = δ sobre la malla.
     *
     * @param u    Viento zonal [m/s].
     * @param v    Viento meridional [m/s].
     * @param grid Malla lat/lon rectilínea.
     */
    Partition partition(double[] u, double[] v, GeoGrid grid);
}
