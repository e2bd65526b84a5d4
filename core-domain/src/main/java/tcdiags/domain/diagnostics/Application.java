package tcdiags.domain.diagnostics;

import tcdiags.domain.exception.ConfigException;

/**
 * Aplicaciones de diagnóstico soportadas y su clave en la configuración.
 */
public enum Application {
    TCPI("tcpi", "Intensidad potencial (Bister & Emanuel 2002)"),
    TCMSI("tcmsi", "Intensidad multiescala (Vukicevic et al. 2014)"),
    TCSTEERING("tcsteering", "Flujo director"),
    TCOHC("tcohc", "Contenido calorífico oceánico");

    private final String key;
    private final String description;

    Application(String key, String description) {
        this.key = key;
        this.description = description;
    }

    public String key() {
        return key;
    }

    public String description() {
        return description;
    }

    public static Application fromKey(String key) {
        for (Application app : values()) {
            if (app.key.equalsIgnoreCase(key)) {
                return app;
            }
        }
        throw new ConfigException("Aplicación desconocida: '" + key + "'.");
    }
}
