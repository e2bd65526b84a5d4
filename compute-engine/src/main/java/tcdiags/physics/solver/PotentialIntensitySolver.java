package tcdiags.physics.solver;

public interface PotentialIntensitySolver extends SolverComponent {

    /**
     * Resultado por columna. Todos los valores son NaN si la columna no tiene solución.
     *
     * @param vmax Viento máximo potencial [m/s].
     * @param pmin Presión mínima potencial [Pa].
     * @param tout Temperatura de salida [K].
     * @param pout Presión de salida [Pa].
     */
    record Result(double vmax, double pmin, double tout, double pout) {
        public static final Result UNDEFINED = new Result(Double.NaN, Double.NaN, Double.NaN, Double.NaN);

        public boolean isDefined() {
            return !Double.isNaN(vmax);
        }
    }

    /**
     * Intensidad potencial de una columna.
     *
     * @param sst         Temperatura de la superficie del mar [K].
     * @param pslp        Presión a nivel del mar [Pa].
     * @param pressure    Perfil de presión [Pa], nivel 0 el más bajo.
     * @param temperature Perfil de temperatura [K].
     * @param mixingRatio Perfil de razón de mezcla [kg/kg].
     */
    Result solve(double sst, double pslp, double[] pressure, double[] temperature, double[] mixingRatio);
}
