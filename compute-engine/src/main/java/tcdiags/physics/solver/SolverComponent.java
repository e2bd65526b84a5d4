package tcdiags.physics.solver;

/**
 * Componente numérico identificable en los logs.
 */
public interface SolverComponent {
    String getName();
}
