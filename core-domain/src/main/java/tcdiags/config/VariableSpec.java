package tcdiags.config;

/**
 * Declaración de cómo obtener un campo con nombre: leído de archivo o derivado.
 */
public interface VariableSpec {

    String SOURCE_FILE = "file";
    String SOURCE_DERIVED = "derived";

    /**
     * Nombre lógico de la variable dentro de la ejecución (ej: "uwind").
     */
    String name();

    /**
     * Cadena de unidades declarada.
     */
    String units();
}
