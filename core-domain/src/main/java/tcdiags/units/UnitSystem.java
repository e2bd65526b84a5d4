package tcdiags.units;

import tcdiags.domain.exception.UnitException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Registro explícito de unidades de una ejecución.
 * <p>
 * Traduce las cadenas de unidades declaradas en la configuración ("mps", "pascals",
 * "kg/kg"...) a {@link Unit} y convierte valores entre unidades compatibles.
 * Se crea una vez por ejecución del orquestador y se pasa por referencia a cada
 * resolución de variables.
 */
public final class UnitSystem {

    public static final Unit KELVIN = new Unit("K", Dimension.TEMPERATURE, 1.0, 0.0);
    public static final Unit CELSIUS = new Unit("degC", Dimension.TEMPERATURE, 1.0, 273.15);
    public static final Unit PASCAL = new Unit("Pa", Dimension.PRESSURE, 1.0, 0.0);
    public static final Unit HECTOPASCAL = new Unit("hPa", Dimension.PRESSURE, 100.0, 0.0);
    public static final Unit DECIBAR = new Unit("dbar", Dimension.PRESSURE, 1.0e4, 0.0);
    public static final Unit METER = new Unit("m", Dimension.LENGTH, 1.0, 0.0);
    public static final Unit KILOMETER = new Unit("km", Dimension.LENGTH, 1000.0, 0.0);
    public static final Unit METER_PER_SECOND = new Unit("m/s", Dimension.SPEED, 1.0, 0.0);
    public static final Unit KNOT = new Unit("kt", Dimension.SPEED, 0.514444, 0.0);
    public static final Unit KG_PER_KG = new Unit("kg/kg", Dimension.MASS_RATIO, 1.0, 0.0);
    public static final Unit G_PER_KG = new Unit("g/kg", Dimension.MASS_RATIO, 1.0e-3, 0.0);
    public static final Unit DEGREE = new Unit("degree", Dimension.ANGLE, Math.PI / 180.0, 0.0);
    public static final Unit RADIAN = new Unit("rad", Dimension.ANGLE, 1.0, 0.0);
    public static final Unit PER_SECOND = new Unit("1/s", Dimension.INVERSE_TIME, 1.0, 0.0);
    public static final Unit M2_PER_SECOND = new Unit("m^2/s", Dimension.DIFFUSIVITY, 1.0, 0.0);
    public static final Unit J_PER_M2 = new Unit("J/m^2", Dimension.ENERGY_PER_AREA, 1.0, 0.0);
    public static final Unit KJ_PER_CM2 = new Unit("kJ/cm^2", Dimension.ENERGY_PER_AREA, 1.0e7, 0.0);
    public static final Unit J_PER_M3 = new Unit("J/m^3", Dimension.ENERGY_PER_VOLUME, 1.0, 0.0);
    public static final Unit DIMENSIONLESS = new Unit("1", Dimension.DIMENSIONLESS, 1.0, 0.0);

    private final Map<String, Unit> aliases;

    private UnitSystem(Map<String, Unit> aliases) {
        this.aliases = Collections.unmodifiableMap(aliases);
    }

    /**
     * Construye el registro con todas las unidades y alias conocidos.
     */
    public static UnitSystem standard() {
        Map<String, Unit> map = new LinkedHashMap<>();
        register(map, KELVIN, "k", "kelvin", "degk");
        register(map, CELSIUS, "degc", "celsius", "degree_celsius", "c");
        register(map, PASCAL, "pa", "pascal", "pascals");
        register(map, HECTOPASCAL, "hpa", "hectopascal", "hectopascals", "mb", "millibar");
        register(map, DECIBAR, "dbar", "decibar", "decibars");
        register(map, METER, "m", "meter", "meters", "metre", "gpm");
        register(map, KILOMETER, "km", "kilometer", "kilometers");
        register(map, METER_PER_SECOND, "m/s", "mps", "meter_per_second", "meters_per_second", "m s-1");
        register(map, KNOT, "kt", "knot", "knots");
        register(map, KG_PER_KG, "kg/kg", "kg kg-1", "gram/gram", "kilogram/kilogram", "kilogram / kilogram");
        register(map, G_PER_KG, "g/kg", "g kg-1", "gram/kilogram");
        register(map, DEGREE, "degree", "degrees", "deg", "degrees_north", "degrees_east");
        register(map, RADIAN, "rad", "radian", "radians");
        register(map, PER_SECOND, "1/s", "s-1", "1/second", "per_second");
        register(map, M2_PER_SECOND, "m^2/s", "m2/s", "meters^2/second", "m2 s-1");
        register(map, J_PER_M2, "j/m^2", "j/m2", "j m-2");
        register(map, KJ_PER_CM2, "kj/cm^2", "kj/cm2", "kj cm-2");
        register(map, J_PER_M3, "j/m^3", "j/m3", "j m-3");
        register(map, DIMENSIONLESS, "1", "dimensionless", "none", "");
        return new UnitSystem(map);
    }

    private static void register(Map<String, Unit> map, Unit unit, String... names) {
        for (String name : names) {
            map.put(name, unit);
        }
    }

    /**
     * Traduce una cadena de unidades declarada.
     *
     * @throws UnitException si la cadena no es reconocida.
     */
    public Unit parse(String unitString) {
        if (unitString == null) {
            throw new UnitException("La cadena de unidades es nula.");
        }
        Unit unit = aliases.get(unitString.trim().toLowerCase(Locale.ROOT));
        if (unit == null) {
            throw new UnitException("Unidad no reconocida por el sistema de unidades: '" + unitString + "'.");
        }
        return unit;
    }

    public boolean isKnown(String unitString) {
        return unitString != null && aliases.containsKey(unitString.trim().toLowerCase(Locale.ROOT));
    }

    public Set<String> knownNames() {
        return aliases.keySet();
    }

    /**
     * Convierte un valor escalar. Los NaN se propagan.
     *
     * @throws UnitException si las dimensiones no coinciden.
     */
    public double convert(double value, Unit from, Unit to) {
        requireCompatible(from, to);
        if (from.equals(to)) {
            return value;
        }
        return to.fromSi(from.toSi(value));
    }

    /**
     * Convierte un array completo devolviendo una copia nueva.
     */
    public double[] convert(double[] values, Unit from, Unit to) {
        requireCompatible(from, to);
        double[] out = new double[values.length];
        if (from.equals(to)) {
            System.arraycopy(values, 0, out, 0, values.length);
            return out;
        }
        for (int i = 0; i < values.length; i++) {
            out[i] = to.fromSi(from.toSi(values[i]));
        }
        return out;
    }

    private static void requireCompatible(Unit from, Unit to) {
        if (!from.isCompatibleWith(to)) {
            throw new UnitException(String.format("No se puede convertir de %s (%s) a %s (%s).",
                    from.symbol(), from.dimension(), to.symbol(), to.dimension()));
        }
    }
}
