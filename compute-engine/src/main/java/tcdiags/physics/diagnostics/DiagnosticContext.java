package tcdiags.physics.diagnostics;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import tcdiags.domain.exception.ConfigException;
import tcdiags.domain.grid.GeoField;
import tcdiags.domain.grid.GeoGrid;
import tcdiags.domain.grid.TcFix;
import tcdiags.domain.warning.WarningLog;
import tcdiags.physics.projection.BilinearInterpolator;
import tcdiags.physics.resolver.ResolvedVariables;
import tcdiags.units.Unit;
import tcdiags.units.UnitSystem;

import java.util.List;

/**
 * Estado de sólo lectura compartido por las aplicaciones de una ejecución.
 * El único elemento mutable es el registro de advertencias; el interpolador de
 * centros se crea en el primer muestreo y se reutiliza.
 */
@Getter
public class DiagnosticContext {

    private final ResolvedVariables variables;

    private final List<TcFix> fixes;

    private final UnitSystem units;

    private final WarningLog warnings;

    @Getter(AccessLevel.NONE)
    private BilinearInterpolator centerSampler;

    @Builder
    private DiagnosticContext(ResolvedVariables variables, @Singular List<TcFix> fixes, UnitSystem units,
                              WarningLog warnings) {
        this.variables = variables;
        this.fixes = fixes;
        this.units = units;
        this.warnings = warnings;
    }

    /**
     * Variable resuelta convertida a {@code target}.
     *
     * @throws tcdiags.domain.exception.MissingVariableException si la variable no se resolvió.
     * @throws tcdiags.domain.exception.UnitException si las dimensiones no son compatibles.
     */
    public GeoField require(String name, Unit target) {
        GeoField field = variables.require(name);
        Unit declared = units.parse(field.getUnits());
        if (declared.equals(target)) {
            return field;
        }
        return field.withData(units.convert(field.toArray(), declared, target), target.symbol());
    }

    /**
     * Variable resuelta que además debe tener el rango indicado.
     */
    public GeoField require(String name, Unit target, int rank) {
        GeoField field = require(name, target);
        if (field.rank() != rank) {
            throw new ConfigException(String.format(
                    "La variable '%s' debe tener rango %d; tiene rango %d.", name, rank, field.rank()));
        }
        return field;
    }

    public GeoGrid grid() {
        return variables.requireGrid();
    }

    /**
     * Valor de un plano lat × lon en el centro de un TC (interpolación bilineal).
     */
    public double sampleAtCenter(double[] plane, TcFix fix) {
        return centerSampler().interpolate(plane, fix.lat(), fix.lon());
    }

    BilinearInterpolator centerSampler() {
        if (centerSampler == null) {
            centerSampler = new BilinearInterpolator(grid());
        }
        return centerSampler;
    }
}
