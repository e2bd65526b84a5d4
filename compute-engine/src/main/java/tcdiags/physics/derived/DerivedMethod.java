package tcdiags.physics.derived;

import tcdiags.domain.exception.ConfigException;
import tcdiags.units.Unit;
import tcdiags.units.UnitSystem;

import java.util.List;
import java.util.Locale;

/**
 * Registro cerrado de métodos de derivación con su contrato de unidades.
 */
public enum DerivedMethod {

    PRESSURE_FROM_THICKNESS("pressure_from_thickness",
            List.of("pressure_thickness", "surface_pressure"),
            List.of(UnitSystem.PASCAL, UnitSystem.PASCAL),
            UnitSystem.PASCAL,
            AtmosphericPressures::fromThickness),

    HEIGHT_FROM_PRESSURE("height_from_pressure",
            List.of("pressure"),
            List.of(UnitSystem.PASCAL),
            UnitSystem.METER,
            AtmosphericHeights::fromPressure),

    PRESSURE_TO_SEALEVEL("pressure_to_sealevel",
            List.of("surface_pressure", "surface_height", "temperature", "specific_humidity"),
            List.of(UnitSystem.PASCAL, UnitSystem.METER, UnitSystem.KELVIN, UnitSystem.KG_PER_KG),
            UnitSystem.PASCAL,
            AtmosphericPressures::toSeaLevel),

    SPFH_TO_MXRT("spfh_to_mxrt",
            List.of("specific_humidity"),
            List.of(UnitSystem.KG_PER_KG),
            UnitSystem.KG_PER_KG,
            AtmosphericMoisture::mixingRatio),

    WIND_MAGNITUDE("wind_magnitude",
            List.of("uwind", "vwind"),
            List.of(UnitSystem.METER_PER_SECOND, UnitSystem.METER_PER_SECOND),
            UnitSystem.METER_PER_SECOND,
            WindKinematics::magnitude),

    DEPTH_FROM_PROFILE("depth_from_profile",
            List.of("depth_profile", "ocean_temperature"),
            List.of(UnitSystem.METER, UnitSystem.KELVIN),
            UnitSystem.METER,
            OceanDepths::fromProfile),

    SEAWATER_FROM_DEPTH("seawater_from_depth",
            List.of("depth", "latitude"),
            List.of(UnitSystem.METER, UnitSystem.DEGREE),
            UnitSystem.DECIBAR,
            Seawater::seawaterPressure);

    private final String key;
    private final List<String> defaultInputs;
    private final List<Unit> inputUnits;
    private final Unit outputUnit;
    private final DerivedComputation computation;

    DerivedMethod(String key, List<String> defaultInputs, List<Unit> inputUnits, Unit outputUnit,
                  DerivedComputation computation) {
        this.key = key;
        this.defaultInputs = defaultInputs;
        this.inputUnits = inputUnits;
        this.outputUnit = outputUnit;
        this.computation = computation;
    }

    public String key() {
        return key;
    }

    public List<String> defaultInputs() {
        return defaultInputs;
    }

    public List<Unit> inputUnits() {
        return inputUnits;
    }

    public Unit outputUnit() {
        return outputUnit;
    }

    public DerivedComputation computation() {
        return computation;
    }

    public int arity() {
        return defaultInputs.size();
    }

    public static DerivedMethod fromKey(String key) {
        if (key != null) {
            String normalized = key.trim().toLowerCase(Locale.ROOT);
            for (DerivedMethod method : values()) {
                if (method.key.equals(normalized)) {
                    return method;
                }
            }
        }
        throw new ConfigException("Método de derivación desconocido: '" + key + "'.");
    }
}
