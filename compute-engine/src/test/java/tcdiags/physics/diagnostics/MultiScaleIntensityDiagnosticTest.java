package tcdiags.physics.diagnostics;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tcdiags.config.MultiScaleIntensityConfig;
import tcdiags.domain.diagnostics.ApplicationResult;
import tcdiags.domain.diagnostics.TcAttributes;
import tcdiags.domain.diagnostics.WavenumberSpectrum;
import tcdiags.domain.grid.GeoField;
import tcdiags.domain.grid.GeoGrid;
import tcdiags.domain.grid.PolarField;
import tcdiags.domain.grid.TcFix;
import tcdiags.domain.warning.WarningLog;
import tcdiags.physics.projection.GreatCircle;
import tcdiags.physics.projection.TcRelativeProjector;
import tcdiags.physics.resolver.ResolvedVariables;
import tcdiags.physics.solver.impl.DftSpectralDecomposer;
import tcdiags.physics.solver.impl.VerticalInterpolator;
import tcdiags.units.UnitSystem;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class MultiScaleIntensityDiagnosticTest {

    private static final int N = 61;

    private GeoGrid grid;
    private MultiScaleIntensityDiagnostic diagnostic;
    private TcFix fix;

    @BeforeEach
    void setUp() {
        double[] lats = new double[N];
        double[] lons = new double[N];
        for (int k = 0; k < N; k++) {
            lats[k] = 0.5 * k;
            lons[k] = 120.0 + 0.5 * k;
        }
        grid = GeoGrid.fromAxes(lats, lons);
        fix = TcFix.of("14W", 15.0, 135.0);
        diagnostic = new MultiScaleIntensityDiagnostic(MultiScaleIntensityConfig.builder()
                .maxRadius(500000.0)
                .drho(100000.0)
                .dphi(45.0)
                .maxWn(3)
                .build(), new TcRelativeProjector(), new DftSpectralDecomposer(), new VerticalInterpolator());
    }

    private DiagnosticContext context(Map<String, GeoField> fields) {
        return DiagnosticContext.builder()
                .variables(ResolvedVariables.of(fields, grid))
                .fix(fix)
                .units(UnitSystem.standard())
                .warnings(new WarningLog())
                .build();
    }

    @Test
    @DisplayName("Un viento uniforme de 10 m/s es todo número de onda 0")
    void run_uniformWind_shouldBeAxisymmetric() {
        double[] speed = new double[N * N];
        Arrays.fill(speed, 10.0);
        Map<String, GeoField> fields = new LinkedHashMap<>();
        fields.put("wind_magnitude", GeoField.of("wind_magnitude", "m/s", new int[]{N, N}, speed, grid));

        ApplicationResult result = diagnostic.run(context(fields));

        TcAttributes attributes = result.getPerTc().get("14W");
        assertEquals(10.0, attributes.scalar("vmax"), 1e-9);
        assertEquals(10.0, attributes.scalar("wn0_msi"), 1e-9);
        assertEquals(0.0, attributes.scalar("wn1_msi"), 1e-9);
        assertEquals(10.0, attributes.scalar("wn0p1_msi"), 1e-9);
        assertEquals(0.0, attributes.scalar("epsi_msi"), 1e-9);
        assertThat(attributes.get("wnd10m").polar()).isNotNull();
        assertThat(result.getGridFields()).containsKey("wnd10m");
    }

    @Test
    @DisplayName("Con viento 3-D se interpola la magnitud a 10 m con la altura")
    void tenMeterWind_3dComponents_shouldInterpolateToTenMeters() {
        int plane = N * N;
        double[] u = new double[2 * plane];
        double[] v = new double[2 * plane];
        double[] height = new double[2 * plane];
        for (int c = 0; c < plane; c++) {
            u[c] = 3.0;
            v[c] = 4.0;
            height[c] = 5.0;
            u[plane + c] = 12.0;
            v[plane + c] = 16.0;
            height[plane + c] = 50.0;
        }
        Map<String, GeoField> fields = new LinkedHashMap<>();
        fields.put("uwind", GeoField.of("uwind", "m/s", new int[]{2, N, N}, u, grid));
        fields.put("vwind", GeoField.of("vwind", "m/s", new int[]{2, N, N}, v, grid));
        fields.put("height", GeoField.of("height", "m", new int[]{2, N, N}, height, grid));

        GeoField wind = diagnostic.tenMeterWind(context(fields));

        assertThat(wind.rank()).isEqualTo(2);
        assertEquals(5.0 + 15.0 * 5.0 / 45.0, wind.get2d(30, 30), 1e-9);
        assertThat(wind.grid()).contains(grid);
    }

    @Test
    @DisplayName("El radio de viento máximo se sitúa en el máximo de wn0 + wn1")
    void summarise_shouldLocateRadiusOfMaximumWind() {
        double[] radial = new double[6];
        double[] azimuth = new double[8];
        double[][] values = new double[6][8];
        for (int r = 0; r < 6; r++) {
            radial[r] = r * 100000.0;
        }
        for (int a = 0; a < 8; a++) {
            azimuth[a] = a * Math.PI / 4.0;
        }
        for (int r = 0; r < 6; r++) {
            double base = r == 2 ? 40.0 : 20.0;
            for (int a = 0; a < 8; a++) {
                values[r][a] = base * (1.0 + 0.2 * Math.cos(azimuth[a] - Math.PI / 2.0));
            }
        }
        PolarField polar = new PolarField("wnd10m", "m/s", fix, radial, azimuth, values);
        WavenumberSpectrum spectrum = new DftSpectralDecomposer().decompose(polar, 3);

        TcAttributes attributes = diagnostic.summarise(fix, spectrum);

        assertEquals(48.0, attributes.scalar("vmax"), 1e-9);
        assertEquals(200000.0, attributes.scalar("rmw"), 1e-9);
        assertEquals(90.0, attributes.scalar("head_rmw"), 1e-9);
        assertEquals(40.0, attributes.scalar("wn0_msi"), 1e-9);
        assertEquals(8.0, attributes.scalar("wn1_msi"), 1e-9);
        assertEquals(48.0, attributes.scalar("wn0p1_msi"), 1e-9);
        assertEquals(0.0, attributes.scalar("epsi_msi"), 1e-9);
        double[] expected = GreatCircle.destination(15.0, 135.0, Math.PI / 2.0, 200000.0);
        assertEquals(expected[0], attributes.scalar("lat_rmw"), 1e-9);
        assertEquals(expected[1], attributes.scalar("lon_rmw"), 1e-9);
    }
}
