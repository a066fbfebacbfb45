package com.aquifer.wellfield.engine;

import com.aquifer.wellfield.domain.AllocationProblem;
import com.aquifer.wellfield.domain.DrawdownMethod;

import java.util.Arrays;

/**
 * Verification helpers shared by the allocation optimizers.
 */
final class AllocationSupport {

    private AllocationSupport() {
    }

    static double[] heads(AllocationProblem problem, double[] rates, DrawdownMethod method) {
        double[] s = SuperpositionEngine.drawdownAtPoints(problem.getWellField().getWells(), rates,
                problem.getConstraintPoints(), problem.getTime(), problem.getAquifer(), method);
        double[] h = new double[s.length];
        for (int j = 0; j < s.length; j++) {
            h[j] = problem.getInitialHead() - s[j];
        }
        return h;
    }

    /**
     * Largest shortfall max_j (h_min_j - h_j), floored at zero.
     */
    static double maxViolation(AllocationProblem problem, double[] heads) {
        double[] minHeads = problem.requiredMinHeads();
        double worst = 0.0;
        for (int j = 0; j < heads.length; j++) {
            worst = Math.max(worst, minHeads[j] - heads[j]);
        }
        return worst;
    }

    static double sum(double[] values) {
        return Arrays.stream(values).sum();
    }

    static double[] clampToBounds(double[] rates, double[] maxRates) {
        double[] clamped = new double[rates.length];
        for (int i = 0; i < rates.length; i++) {
            clamped[i] = Math.min(maxRates[i], Math.max(0.0, rates[i]));
        }
        return clamped;
    }
}
