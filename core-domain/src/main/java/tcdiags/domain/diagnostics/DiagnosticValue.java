package tcdiags.domain.diagnostics;

import tcdiags.domain.grid.GeoField;
import tcdiags.domain.grid.PolarField;

/**
 * Valor con nombre de un diagnóstico: escalar, campo geográfico o campo polar.
 * Exactamente uno de los tres está presente.
 */
public record DiagnosticValue(
        String name,
        String units,
        String description,
        double scalar,
        GeoField field,
        PolarField polar) {

    public DiagnosticValue {
        int present = (field != null ? 1 : 0) + (polar != null ? 1 : 0);
        if (present > 1) {
            throw new IllegalArgumentException("El valor '" + name + "' no puede ser a la vez campo y campo polar.");
        }
    }

    public static DiagnosticValue scalar(String name, String units, String description, double value) {
        return new DiagnosticValue(name, units, description, value, null, null);
    }

    public static DiagnosticValue field(String name, String description, GeoField field) {
        return new DiagnosticValue(name, field.getUnits(), description, Double.NaN, field, null);
    }

    public static DiagnosticValue polar(String name, String description, PolarField polar) {
        return new DiagnosticValue(name, polar.getUnits(), description, Double.NaN, null, polar);
    }

    public boolean isScalar() {
        return field == null && polar == null;
    }
}
