package tcdiags.physics.resolver;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tcdiags.config.FileVariableSpec;
import tcdiags.domain.exception.ConfigException;
import tcdiags.domain.exception.MissingVariableException;
import tcdiags.domain.exception.UnitException;
import tcdiags.domain.grid.GeoField;
import tcdiags.domain.grid.GeoGrid;
import tcdiags.io.GridDataSource;
import tcdiags.io.GridFile;
import tcdiags.io.InMemoryGridDataSource;
import tcdiags.units.UnitSystem;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@Slf4j
@ExtendWith(MockitoExtension.class)
class VariableResolverTest {

    private static final String FILE = "gfs.json";

    @Mock
    private GridDataSource mockSource;

    @Mock
    private GridFile mockFile;

    private InMemoryGridDataSource memory;

    @BeforeEach
    void setUp() {
        // Latitudes norte → sur, dos niveles ordenados de arriba abajo, como en el análisis GFS.
        memory = new InMemoryGridDataSource()
                .put(FILE, "lat", new int[]{3}, new double[]{30.0, 20.0, 10.0})
                .put(FILE, "lon", new int[]{2}, new double[]{100.0, 110.0})
                .put(FILE, "ugrd", new int[]{1, 2, 3, 2}, new double[]{
                        // nivel alto
                        1, 2, 3, 4, 5, 6,
                        // nivel bajo
                        11, 12, 13, 14, 15, 16})
                .put(FILE, "vgrd", new int[]{1, 2, 3, 2}, new double[]{
                        -1, -2, -3, -4, -5, -6,
                        -11, -12, -13, -14, -15, -16})
                .put(FILE, "hgtsfc", new int[]{3, 2}, new double[]{0, 1, 2, 3, 4, 5});
    }

    private static FileVariableSpec.FileVariableSpecBuilder spec(String name, String variable, String units) {
        return FileVariableSpec.builder()
                .name(name)
                .path(FILE)
                .variableName(variable)
                .scaleMult(1.0)
                .units(units);
    }

    @Test
    @DisplayName("uwind y vwind con los mismos flags comparten orientación de latitud y niveles")
    void resolve_windsWithSameFlags_shouldShareOrientation() {
        VariableResolver resolver = new VariableResolver(memory, UnitSystem.standard());
        GeoField lat = resolver.resolveLatitudeAxis(spec("latitude", "lat", "degree").flipLat(true).build());
        GeoField u = resolver.resolve(spec("uwind", "ugrd", "mps").squeeze(true).flipLat(true).flipZ(true).build());
        GeoField v = resolver.resolve(spec("vwind", "vgrd", "mps").squeeze(true).flipLat(true).flipZ(true).build());

        assertThat(lat.toArray()).containsExactly(10.0, 20.0, 30.0);
        assertThat(u.shape()).containsExactly(2, 3, 2);
        // Nivel 0 = nivel bajo; fila 0 = latitud 10°.
        assertEquals(15.0, u.get(0, 0, 0), 0.0);
        assertEquals(1.0, u.get(1, 2, 0), 0.0);
        for (int k = 0; k < 2; k++) {
            for (int j = 0; j < 3; j++) {
                for (int i = 0; i < 2; i++) {
                    assertEquals(-u.get(k, j, i), v.get(k, j, i), 0.0, "u y v deben estar alineados");
                }
            }
        }
    }

    @Test
    @DisplayName("Un flip_lat contradictorio lanza ConfigException nombrando ambas variables")
    void resolve_conflictingFlipLat_shouldThrow() {
        VariableResolver resolver = new VariableResolver(memory, UnitSystem.standard());
        resolver.resolveLatitudeAxis(spec("latitude", "lat", "degree").flipLat(true).build());

        ConfigException ex = assertThrows(ConfigException.class,
                () -> resolver.resolve(spec("surface_height", "hgtsfc", "m").flipLat(false).build()));

        log.info("Mensaje: {}", ex.getMessage());
        assertThat(ex.getMessage()).contains("surface_height").contains("latitude");
    }

    @Test
    @DisplayName("Una longitud 1-D no participa en la convención de latitud y admite scale_add")
    void resolve_longitudeWithScaleAdd_shouldShift() {
        VariableResolver resolver = new VariableResolver(memory, UnitSystem.standard());
        resolver.resolveLatitudeAxis(spec("latitude", "lat", "degree").flipLat(true).build());

        GeoField lon = resolver.resolve(spec("longitude", "lon", "degree").scaleAdd(-360.0).build());

        assertThat(lon.toArray()).containsExactly(-260.0, -250.0);
    }

    @Test
    @DisplayName("flip_z sobre un campo 2-D es un error de configuración")
    void resolve_flipZOn2d_shouldThrow() {
        VariableResolver resolver = new VariableResolver(memory, UnitSystem.standard());

        assertThrows(ConfigException.class,
                () -> resolver.resolve(spec("surface_height", "hgtsfc", "m").flipZ(true).build()));
    }

    @Test
    @DisplayName("Una variable ausente en el archivo lanza MissingVariableException y cierra el archivo")
    void resolve_missingArray_shouldThrowAndClose() {
        when(mockSource.open(FILE)).thenReturn(mockFile);
        when(mockFile.hasVariable("tmp")).thenReturn(false);
        VariableResolver resolver = new VariableResolver(mockSource, UnitSystem.standard());

        MissingVariableException ex = assertThrows(MissingVariableException.class,
                () -> resolver.resolve(spec("temperature", "tmp", "K").build()));

        assertThat(ex.getVariableName()).isEqualTo("temperature");
        verify(mockFile).close();
    }

    @Test
    @DisplayName("Una unidad desconocida lanza UnitException sin abrir el archivo")
    void resolve_unknownUnit_shouldThrowBeforeReading() {
        VariableResolver resolver = new VariableResolver(mockSource, UnitSystem.standard());

        assertThrows(UnitException.class,
                () -> resolver.resolve(spec("temperature", "tmp", "grados_raros").build()));
        verifyNoInteractions(mockSource);
    }

    @Test
    @DisplayName("Las coordenadas 1-D se difunden a una malla 2-D")
    void broadcastCoordinates_shouldBuildGrid() {
        GeoField lat = GeoField.of("latitude", "degree", new int[]{3}, new double[]{10, 20, 30});
        GeoField lon = GeoField.of("longitude", "degree", new int[]{2}, new double[]{100, 110});

        GeoGrid grid = VariableResolver.broadcastCoordinates(lat, lon);

        assertThat(grid.ny()).isEqualTo(3);
        assertThat(grid.nx()).isEqualTo(2);
        assertEquals(30.0, grid.latAt(2, 1), 0.0);
        assertEquals(110.0, grid.lonAt(0, 1), 0.0);
        assertThat(grid.isLatitudeAscending()).isTrue();
    }
}
