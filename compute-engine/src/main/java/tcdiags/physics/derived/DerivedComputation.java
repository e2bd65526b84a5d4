package tcdiags.physics.derived;

import tcdiags.domain.grid.GeoField;

import java.util.List;

/**
 * Cálculo puro de un campo derivado. Las entradas llegan ya convertidas a las
 * unidades del contrato del método y en el orden declarado.
 */
@FunctionalInterface
public interface DerivedComputation {

    /**
     * @param name   Nombre del campo resultante.
     * @param inputs Entradas en las unidades del contrato.
     * @return Campo en la unidad de salida del contrato.
     */
    GeoField compute(String name, List<GeoField> inputs);
}
