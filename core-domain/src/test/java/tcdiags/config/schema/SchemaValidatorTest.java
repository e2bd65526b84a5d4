package tcdiags.config.schema;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tcdiags.domain.exception.ConfigException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Slf4j
class SchemaValidatorTest {

    private SchemaValidator validator;
    private SchemaRegistry registry;

    @BeforeEach
    void setUp() {
        validator = new SchemaValidator();
        registry = SchemaRegistry.standard();
    }

    @Test
    @DisplayName("La salida contiene exactamente las claves del esquema, con entrada o valor por defecto")
    void validate_shouldReturnExactlySchemaKeys() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("max_wn", 2);
        raw.put("dphi", "30");
        raw.put("clave_extra", "se descarta");

        ValidatedConfig config = validator.validate(registry.get(SchemaRegistry.TCMSI), raw);
        log.info("Tabla de validación:\n{}", config.getValidationTable());

        assertThat(config.keys())
                .containsExactly("drho", "dphi", "max_radius", "max_wn", "write_output", "output_file");
        assertEquals(2, config.getInt("max_wn"));
        assertEquals(30.0, config.getDouble("dphi"), 1e-12, "La cadena debe coercionarse a número.");
        assertEquals(100000.0, config.getDouble("drho"), 1e-12);
        assertTrue(config.isDefaulted("drho"));
        assertThat(config.isDefaulted("max_wn")).isFalse();
    }

    @Test
    @DisplayName("Omitir una clave obligatoria lanza ConfigException con el nombre de la clave")
    void validate_missingRequiredKey_shouldThrow() {
        Map<String, Object> raw = Map.of(
                "source", "file",
                "path", "analysis.json",
                "units", "m/s");

        ConfigException ex = assertThrows(ConfigException.class,
                () -> validator.validate(registry.get(SchemaRegistry.FILE_VARIABLE), raw));

        assertThat(ex.getMessage()).contains("variable_name");
    }

    @Test
    @DisplayName("Un valor no coercible al tipo declarado lanza ConfigException")
    void validate_typeMismatch_shouldThrow() {
        Map<String, Object> raw = Map.of("max_wn", "tres");

        assertThrows(ConfigException.class,
                () -> validator.validate(registry.get(SchemaRegistry.TCMSI), raw));
    }

    @Test
    @DisplayName("Un entero con parte decimal no es un INTEGER válido")
    void validate_fractionalInteger_shouldThrow() {
        Map<String, Object> raw = Map.of("ncoeffs", 2.5);

        assertThrows(ConfigException.class,
                () -> validator.validate(registry.get(SchemaRegistry.TCSTEERING), raw));
    }

    @Test
    @DisplayName("Coerciones: booleano desde cadena y escalar a lista de un elemento")
    void validate_shouldCoerceBooleansAndScalarsToLists() {
        Map<String, Object> raw = Map.of(
                "source", "derived",
                "method", "spfh_to_mxrt",
                "units", "kg/kg",
                "inputs", "specific_humidity");

        ValidatedConfig config = validator.validate(registry.get(SchemaRegistry.DERIVED_VARIABLE), raw);
        assertEquals(List.of("specific_humidity"), config.getStringList("inputs"));

        ValidatedConfig pi = validator.validate(registry.get(SchemaRegistry.TCPI), Map.of("write_output", "true"));
        assertTrue(pi.getBoolean("write_output"));
    }

    @Test
    @DisplayName("Un esquema no registrado es un error de configuración")
    void registry_unknownSchema_shouldThrow() {
        assertThrows(ConfigException.class, () -> registry.get("tcfoo"));
    }
}
