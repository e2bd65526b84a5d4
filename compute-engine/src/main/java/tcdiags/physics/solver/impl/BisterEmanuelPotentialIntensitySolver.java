package tcdiags.physics.solver.impl;

import lombok.extern.slf4j.Slf4j;
import tcdiags.physics.solver.PotentialIntensitySolver;

import java.util.ArrayList;
import java.util.List;

/**
 * Intensidad potencial de Bister & Emanuel (2002) con ascenso reversible de la parcela.
 * <p>
 * Se calculan tres CAPE: la del entorno, la de la parcela en el radio de viento máximo
 * y la de la parcela saturada a la SST. La presión mínima se itera hasta que el cambio
 * es menor que 0.5 hPa. Internamente trabaja en hPa, K y kg/kg.
 */
@Slf4j
public class BisterEmanuelPotentialIntensitySolver implements PotentialIntensitySolver {

    static final double CPD = 1005.7;
    static final double CPV = 1870.0;
    static final double CL = 2500.0;
    static final double CPVMCL = CPV - CL;
    static final double RV = 461.5;
    static final double RD = 287.04;
    static final double EPS = RD / RV;
    static final double ALV0 = 2.501e6;
    /** Relación de coeficientes de arrastre en el perfil de viento (b). */
    static final double B = 2.0;

    private static final double CONVERGENCE_HPA = 0.5;
    private static final int MAX_ITERATIONS = 200;
    private static final double MIN_PRESSURE_HPA = 400.0;
    private static final double MIN_SST_CELSIUS = 5.0;

    private final double ckcd;
    private final double vReduc;
    private final double ptop;
    private final boolean dissipativeHeating;

    public BisterEmanuelPotentialIntensitySolver() {
        this(0.9, 0.8, 50.0, true);
    }

    /**
     * @param ckcd               Cociente de coeficientes de intercambio de entalpía y arrastre.
     * @param vReduc             Reducción del viento de gradiente a 10 m.
     * @param ptop               Presión [hPa] por encima de la cual se ignora el sondeo.
     * @param dissipativeHeating Incluye el calentamiento disipativo (SST/T_out).
     */
    public BisterEmanuelPotentialIntensitySolver(double ckcd, double vReduc, double ptop, boolean dissipativeHeating) {
        this.ckcd = ckcd;
        this.vReduc = vReduc;
        this.ptop = ptop;
        this.dissipativeHeating = dissipativeHeating;
    }

    @Override
    public String getName() {
        return "PotentialIntensity_BE2002";
    }

    /** Resultado de un ascenso: CAPE [J/kg], temperatura y presión [hPa] del nivel de flotabilidad nula. */
    record Cape(double cape, double outflowTemperature, double outflowPressure, int flag) {
        boolean valid() {
            return flag == 1;
        }
    }

    @Override
    public Result solve(double sst, double pslp, double[] pressure, double[] temperature, double[] mixingRatio) {
        double sstC = sst - 273.15;
        if (Double.isNaN(sst) || Double.isNaN(pslp) || sstC <= MIN_SST_CELSIUS) {
            return Result.UNDEFINED;
        }

        // Sondeo útil: niveles válidos por debajo de ptop, en hPa.
        List<double[]> levels = new ArrayList<>();
        for (int k = 0; k < pressure.length; k++) {
            double p = pressure[k] / 100.0;
            if (Double.isNaN(p) || Double.isNaN(temperature[k]) || Double.isNaN(mixingRatio[k]) || p < ptop) {
                continue;
            }
            if (temperature[k] <= 100.0) {
                return Result.UNDEFINED;
            }
            levels.add(new double[]{p, temperature[k], Math.max(mixingRatio[k], 0.0)});
        }
        if (levels.size() < 2) {
            return Result.UNDEFINED;
        }
        int n = levels.size();
        double[] p = new double[n];
        double[] t = new double[n];
        double[] r = new double[n];
        for (int k = 0; k < n; k++) {
            p[k] = levels.get(k)[0];
            t[k] = levels.get(k)[1];
            r[k] = levels.get(k)[2];
        }

        double msl = pslp / 100.0;
        double es0 = saturationVaporPressure(sstC);

        Cape environment = cape(t[0], r[0], p[0], t, r, p);
        if (!environment.valid()) {
            return Result.UNDEFINED;
        }

        int iterations = 0;
        double pm = 970.0;
        double pmOld = pm;
        double pNew = 0.0;
        double capem = 0.0;
        double capems = 0.0;
        double rat = 1.0;
        double tvav = 0.0;
        double to = Double.NaN;
        double otl = Double.NaN;

        while (Math.abs(pNew - pmOld) > CONVERGENCE_HPA) {
            // CAPE en el radio de viento máximo.
            double pp = Math.min(pm, 1000.0);
            double rp = EPS * r[0] * msl / (pp * (EPS + r[0]) - r[0] * msl);
            Cape atRmw = cape(t[0], rp, pp, t, r, p);
            if (!atRmw.valid()) {
                return Result.UNDEFINED;
            }
            capem = atRmw.cape();

            // CAPE saturada a la SST; fija la temperatura y el nivel de salida.
            double rs0 = EPS * es0 / (pp - es0);
            Cape saturated = cape(sst, rs0, pp, t, r, p);
            if (!saturated.valid()) {
                return Result.UNDEFINED;
            }
            capems = saturated.cape();
            to = saturated.outflowTemperature();
            otl = saturated.outflowPressure();
            rat = dissipativeHeating ? sst / to : 1.0;

            double tv0 = densityTemperature(t[0], r[0], r[0]);
            double tvsst = densityTemperature(sst, rs0, rs0);
            tvav = 0.5 * (tv0 + tvsst);
            double cat = Math.max((capem - environment.cape()) + 0.5 * ckcd * rat * (capems - capem), 0.0);
            pNew = msl * Math.exp(-cat / (RD * tvav));

            pmOld = pm;
            pm = pNew;
            iterations++;
            if (iterations > MAX_ITERATIONS || pm < MIN_PRESSURE_HPA) {
                log.debug("Intensidad potencial sin converger (iteraciones={}, pm={} hPa).", iterations, pm);
                return Result.UNDEFINED;
            }
        }

        double catFactor = 0.5 * (1.0 + 1.0 / B);
        double cat = Math.max((capem - environment.cape()) + ckcd * rat * catFactor * (capems - capem), 0.0);
        double pmin = msl * Math.exp(-cat / (RD * tvav));
        double vmax = vReduc * Math.sqrt(ckcd * rat * Math.max(capems - capem, 0.0));

        return new Result(vmax, pmin * 100.0, to, otl * 100.0);
    }

    /**
     * CAPE de ascenso reversible de una parcela (T [K], r [kg/kg], p [hPa]).
     */
    Cape cape(double tp, double rp, double pp, double[] t, double[] r, double[] p) {
        int n = p.length;
        if (rp < 1.0e-6 || tp < 200.0) {
            return new Cape(0.0, t[0], p[0], 0);
        }

        double tpc = tp - 273.15;
        double esp = saturationVaporPressure(tpc);
        double evp = rp * pp / (EPS + rp);
        double rh = Math.min(evp / esp, 1.0);
        double alv = ALV0 + CPVMCL * tpc;
        double s = (CPD + rp * CL) * Math.log(tp) - RD * Math.log(pp - evp) + alv * rp / tp - rp * RV * Math.log(rh);

        double chi = tp / (1669.0 - 122.0 * rh - tp);
        double plcl = pp * Math.pow(rh, chi);

        int jmin = -1;
        for (int j = 0; j < n; j++) {
            if (p[j] < pp) {
                jmin = j;
                break;
            }
        }
        if (jmin < 0) {
            return new Cape(0.0, t[0], p[0], 0);
        }

        double[] tvrdif = new double[n];
        for (int j = jmin; j < n; j++) {
            double tvenv = densityTemperature(t[j], r[j], r[j]);
            if (p[j] >= plcl) {
                double tg = tp * Math.pow(p[j] / pp, RD / CPD);
                tvrdif[j] = densityTemperature(tg, rp, rp) - tvenv;
            } else {
                double tgNew = t[j];
                double tg = 0.0;
                double rg = 0.0;
                int nc = 0;
                while (Math.abs(tgNew - tg) > 0.001) {
                    tg = tgNew;
                    double tc = tg - 273.15;
                    double enew = saturationVaporPressure(tc);
                    rg = EPS * enew / (p[j] - enew);
                    nc++;
                    double alvj = ALV0 + CPVMCL * tc;
                    double sl = (CPD + rp * CL + alvj * alvj * rg / (RV * tg * tg)) / tg;
                    double em = rg * p[j] / (EPS + rg);
                    double sg = (CPD + rp * CL) * Math.log(tg) - RD * Math.log(p[j] - em) + alvj * rg / tg;
                    double ap = nc < 3 ? 0.3 : 1.0;
                    tgNew = tg + ap * (s - sg) / sl;
                    if (nc > 500 || enew > p[j] - 1.0) {
                        return new Cape(0.0, t[0], p[0], 2);
                    }
                }
                // Ascenso reversible: el condensado se transporta con la parcela.
                tvrdif[j] = densityTemperature(tg, rp, rg) - tvenv;
            }
        }

        int inb = -1;
        for (int j = n - 1; j > jmin; j--) {
            if (tvrdif[j] > 0.0) {
                inb = j;
                break;
            }
        }
        if (inb < 0) {
            return new Cape(0.0, t[0], p[0], 1);
        }

        double pa = 0.0;
        double na = 0.0;
        for (int j = jmin + 1; j <= inb; j++) {
            double pfac = RD * (tvrdif[j] + tvrdif[j - 1]) * (p[j - 1] - p[j]) / (p[j] + p[j - 1]);
            pa += Math.max(pfac, 0.0);
            na -= Math.min(pfac, 0.0);
        }
        double pma = pp + p[jmin];
        double pfac = RD * (pp - p[jmin]) / pma;
        pa += pfac * Math.max(tvrdif[jmin], 0.0);
        na -= pfac * Math.min(tvrdif[jmin], 0.0);

        double pat = 0.0;
        double tob = t[inb];
        double lnb = p[inb];
        if (inb < n - 1) {
            double pinb = (p[inb + 1] * tvrdif[inb] - p[inb] * tvrdif[inb + 1]) / (tvrdif[inb] - tvrdif[inb + 1]);
            lnb = pinb;
            pat = RD * tvrdif[inb] * (p[inb] - pinb) / (p[inb] + pinb);
            tob = (t[inb] * (pinb - p[inb + 1]) + t[inb + 1] * (p[inb] - pinb)) / (p[inb] - p[inb + 1]);
        }
        return new Cape(Math.max(pa + pat - na, 0.0), tob, lnb, 1);
    }

    /**
     * Presión de vapor de saturación [hPa] (Bolton 1980), T en °C.
     */
    static double saturationVaporPressure(double tc) {
        return 6.112 * Math.exp(17.67 * tc / (243.5 + tc));
    }

    /**
     * Temperatura de densidad: T (1 + r/ε) / (1 + rt).
     */
    static double densityTemperature(double t, double rt, double r) {
        return t * (1.0 + r / EPS) / (1.0 + rt);
    }
}
