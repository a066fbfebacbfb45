package com.aquifer.wellfield.engine;

import com.aquifer.wellfield.domain.AquiferParameters;
import com.aquifer.wellfield.domain.ConstraintPoint;
import com.aquifer.wellfield.domain.DrawdownMethod;
import com.aquifer.wellfield.domain.PumpingWell;
import com.aquifer.wellfield.exception.InvalidParameterException;

import java.util.List;
import java.util.stream.IntStream;

/**
 * Linear superposition of single-well kernels: s_total(p, t) = sum_i s_i(p, t).
 * <p>
 * Exact for Theis and Cooper-Jacob since both are linear in Q. The Cooper-Jacob applicability
 * bound (u &lt; 0.01) is the caller's responsibility. Distances are floored at each well's radius.
 */
public final class SuperpositionEngine {

    private SuperpositionEngine() {
    }

    public static double drawdown(List<PumpingWell> wells, double x, double y, double t,
                                  AquiferParameters aquifer, DrawdownMethod method) {
        double total = 0.0;
        for (PumpingWell well : wells) {
            total += well.drawdownAt(x, y, t, aquifer, method);
        }
        return total;
    }

    public static double[] drawdown(List<PumpingWell> wells, double[] xs, double[] ys, double t,
                                    AquiferParameters aquifer, DrawdownMethod method) {
        return drawdown(wells, xs, ys, t, aquifer, method, false);
    }

    /**
     * Drawdown at every observation point. Points are independent, so {@code parallel} maps them
     * over the common fork-join pool.
     */
    public static double[] drawdown(List<PumpingWell> wells, double[] xs, double[] ys, double t,
                                    AquiferParameters aquifer, DrawdownMethod method, boolean parallel) {
        InvalidParameterException.require(xs.length == ys.length,
                "Observation x/y arrays differ in length: " + xs.length + " vs " + ys.length);
        double[] result = new double[xs.length];
        IntStream indices = IntStream.range(0, xs.length);
        if (parallel) {
            indices = indices.parallel();
        }
        indices.forEach(j -> result[j] = drawdown(wells, xs[j], ys[j], t, aquifer, method));
        return result;
    }

    /**
     * Drawdown history at one observation point.
     */
    public static double[] drawdownHistory(List<PumpingWell> wells, double x, double y, double[] times,
                                           AquiferParameters aquifer, DrawdownMethod method) {
        double[] result = new double[times.length];
        for (int k = 0; k < times.length; k++) {
            result[k] = drawdown(wells, x, y, times[k], aquifer, method);
        }
        return result;
    }

    /**
     * Per-unit-rate response matrix A[j][i]: drawdown at point j caused by well i pumping at Q = 1.
     * Rates carried by the wells are ignored.
     */
    public static double[][] unitResponse(List<PumpingWell> wells, List<ConstraintPoint> points, double t,
                                          AquiferParameters aquifer, DrawdownMethod method) {
        double[][] a = new double[points.size()][wells.size()];
        for (int j = 0; j < points.size(); j++) {
            ConstraintPoint p = points.get(j);
            for (int i = 0; i < wells.size(); i++) {
                double r = wells.get(i).effectiveDistance(p.getX(), p.getY());
                a[j][i] = WellFunctions.drawdown(method, r, t, 1.0, aquifer);
            }
        }
        return a;
    }

    /**
     * Drawdown at each constraint point for the given rate vector, with wells at fixed positions.
     */
    public static double[] drawdownAtPoints(List<PumpingWell> wells, double[] rates, List<ConstraintPoint> points,
                                            double t, AquiferParameters aquifer, DrawdownMethod method) {
        double[] s = new double[points.size()];
        for (int j = 0; j < points.size(); j++) {
            ConstraintPoint p = points.get(j);
            double total = 0.0;
            for (int i = 0; i < wells.size(); i++) {
                double r = wells.get(i).effectiveDistance(p.getX(), p.getY());
                total += WellFunctions.drawdown(method, r, t, rates[i], aquifer);
            }
            s[j] = total;
        }
        return s;
    }
}
