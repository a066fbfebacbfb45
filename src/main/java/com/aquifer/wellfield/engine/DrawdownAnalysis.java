package com.aquifer.wellfield.engine;

import com.aquifer.wellfield.domain.AquiferParameters;
import com.aquifer.wellfield.domain.DrawdownMethod;
import com.aquifer.wellfield.domain.PumpingWell;
import com.aquifer.wellfield.domain.SensitivityReport;
import com.aquifer.wellfield.exception.InvalidParameterException;
import com.aquifer.wellfield.exception.NumericalDomainException;

import java.util.List;

/**
 * Drawdown curves, well interference and parameter sensitivity built on the single-well kernels.
 */
public final class DrawdownAnalysis {

    private DrawdownAnalysis() {
    }

    /**
     * Radial profile s(r) around one well at time t. Radii below the well radius are floored.
     */
    public static double[] distanceDrawdown(PumpingWell well, double[] radii, double t,
                                            AquiferParameters aquifer, DrawdownMethod method) {
        double[] s = new double[radii.length];
        for (int k = 0; k < radii.length; k++) {
            double r = Math.max(well.getRadius(), radii[k]);
            s[k] = WellFunctions.drawdown(method, r, t, well.getRate(), aquifer);
        }
        return s;
    }

    /**
     * Drawdown history s(t) at distance r from one well.
     */
    public static double[] timeDrawdown(PumpingWell well, double r, double[] times,
                                        AquiferParameters aquifer, DrawdownMethod method) {
        double radius = Math.max(well.getRadius(), r);
        double[] s = new double[times.length];
        for (int k = 0; k < times.length; k++) {
            s[k] = WellFunctions.drawdown(method, radius, times[k], well.getRate(), aquifer);
        }
        return s;
    }

    /**
     * Interference coefficient s_all / s_reference at (x, y) for each time: how much the other wells
     * deepen the drawdown the reference well causes on its own.
     *
     * @throws NumericalDomainException if the reference well's own drawdown is not positive at some
     *                                  time (zero rate, or Cooper-Jacob evaluated at large u)
     */
    public static double[] interference(List<PumpingWell> wells, int referenceIndex, double x, double y,
                                        double[] times, AquiferParameters aquifer, DrawdownMethod method) {
        InvalidParameterException.require(referenceIndex >= 0 && referenceIndex < wells.size(),
                "Reference well index out of range: " + referenceIndex);
        PumpingWell reference = wells.get(referenceIndex);
        double[] all = SuperpositionEngine.drawdownHistory(wells, x, y, times, aquifer, method);
        double[] ratio = new double[times.length];
        for (int k = 0; k < times.length; k++) {
            double own = reference.drawdownAt(x, y, times[k], aquifer, method);
            if (!(own > 0.0)) {
                throw new NumericalDomainException("Interference undefined at t=" + times[k]
                        + ": reference well drawdown is " + own);
            }
            ratio[k] = all[k] / own;
        }
        return ratio;
    }

    public static SensitivityReport sensitivity(double r, double t, double rate, AquiferParameters aquifer,
                                                double[] factors) {
        double transmissivity = aquifer.getTransmissivity();
        double storativity = aquifer.getStorativity();
        double base = WellFunctions.theis(r, t, rate, transmissivity, storativity);
        double[] byRate = new double[factors.length];
        double[] byTransmissivity = new double[factors.length];
        double[] byStorativity = new double[factors.length];
        for (int k = 0; k < factors.length; k++) {
            double f = InvalidParameterException.requirePositive(factors[k], "Sensitivity factor");
            byRate[k] = percentChange(WellFunctions.theis(r, t, rate * f, transmissivity, storativity), base);
            byTransmissivity[k] = percentChange(WellFunctions.theis(r, t, rate, transmissivity * f, storativity), base);
            byStorativity[k] = percentChange(WellFunctions.theis(r, t, rate, transmissivity, storativity * f), base);
        }
        return SensitivityReport.builder()
                .baseDrawdown(base)
                .factors(factors.clone())
                .rateChangePercent(byRate)
                .transmissivityChangePercent(byTransmissivity)
                .storativityChangePercent(byStorativity)
                .build();
    }

    private static double percentChange(double value, double base) {
        return (value - base) / base * 100.0;
    }
}
