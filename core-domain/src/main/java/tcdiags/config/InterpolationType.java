package tcdiags.config;

import tcdiags.domain.exception.ConfigException;

import java.util.Locale;

/**
 * Esquemas de inversión de un perfil vertical.
 */
public enum InterpolationType {
    LINEAR,
    NEAREST,
    PREVIOUS,
    NEXT;

    public static InterpolationType parse(String value) {
        try {
            return InterpolationType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new ConfigException("Tipo de interpolación no soportado: '" + value
                    + "'. Valores válidos: linear, nearest, previous, next.", e);
        }
    }
}
