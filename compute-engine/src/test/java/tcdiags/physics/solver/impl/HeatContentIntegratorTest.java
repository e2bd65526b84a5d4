package tcdiags.physics.solver.impl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import tcdiags.domain.exception.ConfigException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

class HeatContentIntegratorTest {

    private static final double RHO_CP = HeatContentIntegrator.SEAWATER_DENSITY
            * HeatContentIntegrator.SEAWATER_HEAT_CAPACITY;

    // T(z) = 30 - 0.04 z: 26 °C a 100 m
    private static final double[] TEMPERATURE = {30.0, 29.0, 28.0, 27.0, 26.0, 22.0};
    private static final double[] DEPTH = {0.0, 25.0, 50.0, 75.0, 100.0, 200.0};

    @ParameterizedTest(name = "deltaz = {0} m")
    @ValueSource(doubles = {1.0, 5.0, 30.0, 250.0})
    @DisplayName("Un perfil lineal se integra exactamente para cualquier paso, con el último prorrateado")
    void integrate_linearProfile_shouldBeExact(double deltaz) {
        HeatContentIntegrator integrator = new HeatContentIntegrator(deltaz);

        double tchp = integrator.integrate(TEMPERATURE, DEPTH, 100.0, 26.0);

        assertEquals(200.0 * RHO_CP, tchp, 1e-6 * 200.0 * RHO_CP);
    }

    @Test
    @DisplayName("Con la isoterma en la superficie el TCHP es cero")
    void integrate_isothermAtSurface_shouldBeZero() {
        HeatContentIntegrator integrator = new HeatContentIntegrator(5.0);

        assertThat(integrator.integrate(TEMPERATURE, DEPTH, 0.0, 30.0)).isEqualTo(0.0);
    }

    @Test
    @DisplayName("El contenido por nivel es cero bajo la isoterma")
    void levelContent_shouldBeZeroBelowIsotherm() {
        double[] content = HeatContentIntegrator.levelContent(TEMPERATURE, DEPTH, 100.0, 26.0);

        assertEquals(4.0 * RHO_CP, content[0], 1e-6);
        assertEquals(1.0 * RHO_CP, content[3], 1e-6);
        assertThat(content[4]).isEqualTo(0.0);
        assertThat(content[5]).isEqualTo(0.0);
    }

    @Test
    @DisplayName("La conversión a kJ/cm^2 da valores típicos de un océano tropical")
    void tchp_conversion_shouldGiveTypicalMagnitude() {
        double tchp = new HeatContentIntegrator(5.0).integrate(TEMPERATURE, DEPTH, 100.0, 26.0)
                * HeatContentIntegrator.J_M2_TO_KJ_CM2;

        assertThat(tchp).isBetween(50.0, 100.0);
    }

    @Test
    @DisplayName("deltaz no positivo es un error de configuración")
    void constructor_nonPositiveStep_shouldThrow() {
        assertThatThrownBy(() -> new HeatContentIntegrator(0.0))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("deltaz");
    }
}
