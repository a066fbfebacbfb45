package com.aquifer.wellfield.engine;

import com.aquifer.wellfield.domain.AquiferParameters;
import com.aquifer.wellfield.domain.ConstraintPoint;
import com.aquifer.wellfield.domain.DrawdownMethod;
import com.aquifer.wellfield.domain.FeasibleRegion;
import com.aquifer.wellfield.domain.PumpingWell;
import com.aquifer.wellfield.domain.SitingProblem;
import com.aquifer.wellfield.domain.SitingResult;
import com.aquifer.wellfield.domain.SolverSettings;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.random.RandomGenerator;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Bounded random search over well coordinates. Every candidate is scored by the total head
 * violation sum_j max(0, h_min_j - h_j) using Cooper-Jacob superposition; only strict improvements
 * replace the incumbent. The whole iteration budget is always spent.
 */
@Slf4j
@Component
public class SitingOptimizer {

    static final int PARALLEL_CHUNK = 4096;

    public SitingResult search(SitingProblem problem, SolverSettings settings, RandomGenerator random) {
        long startTime = System.currentTimeMillis();
        problem.validate();
        settings.validate();

        int n = problem.getWellCount();
        int budget = problem.getMaxIterations();
        double[] rates = problem.wellRates();
        double[] minHeads = problem.getConstraintPoints().stream()
                .mapToDouble(p -> p.requiredMinHead(problem.getInitialHead()))
                .toArray();

        // Candidates are drawn in iteration order, one chunk at a time, so the outcome depends only
        // on the seed and memory stays bounded by the chunk size
        FeasibleRegion region = problem.getRegion();
        int chunk = settings.isParallel() ? Math.min(PARALLEL_CHUNK, budget) : 1;
        double[][] xs = new double[chunk][n];
        double[][] ys = new double[chunk][n];
        double[] scores = new double[chunk];
        double[] bestX = null;
        double[] bestY = null;
        double best = Double.POSITIVE_INFINITY;
        int bestIndex = -1;

        for (int first = 0; first < budget; first += chunk) {
            int size = Math.min(chunk, budget - first);
            for (int k = 0; k < size; k++) {
                for (int i = 0; i < n; i++) {
                    xs[k][i] = region.getMinX() + random.nextDouble() * (region.getMaxX() - region.getMinX());
                    ys[k][i] = region.getMinY() + random.nextDouble() * (region.getMaxY() - region.getMinY());
                }
            }
            if (size > 1) {
                IntStream.range(0, size).parallel()
                        .forEach(k -> scores[k] = violation(problem, xs[k], ys[k], rates, minHeads));
            } else {
                scores[0] = violation(problem, xs[0], ys[0], rates, minHeads);
            }
            // strict improvement only: ties keep the lowest iteration index
            for (int k = 0; k < size; k++) {
                if (scores[k] < best) {
                    best = scores[k];
                    bestIndex = first + k;
                    bestX = xs[k].clone();
                    bestY = ys[k].clone();
                    log.debug("Siting improvement at iteration {}: violation {}", bestIndex, best);
                }
            }
        }

        List<PumpingWell> wells = buildWells(bestX, bestY, rates);
        double[] heads = heads(problem, wells);
        double totalViolation = 0.0;
        for (int j = 0; j < heads.length; j++) {
            totalViolation += Math.max(0.0, minHeads[j] - heads[j]);
        }
        boolean feasible = totalViolation <= settings.getFeasibilityTolerance();

        log.info("Siting search evaluated {} candidates: best violation {} (feasible={})",
                budget, totalViolation, feasible);
        return SitingResult.builder()
                .wells(wells)
                .totalViolation(totalViolation)
                .constraintHeads(heads)
                .feasible(feasible)
                .iterations(budget)
                .message(feasible
                        ? "Feasible layout found after " + budget + " candidates (best at #" + (bestIndex + 1) + ")"
                        : "No fully feasible layout in " + budget + " candidates; best total head violation "
                        + totalViolation)
                .computationTimeMs(System.currentTimeMillis() - startTime)
                .build();
    }

    /**
     * Total head violation of one candidate layout. Allocation-free apart from the loop itself.
     */
    static double violation(SitingProblem problem, double[] xs, double[] ys, double[] rates, double[] minHeads) {
        AquiferParameters aquifer = problem.getAquifer();
        List<ConstraintPoint> points = problem.getConstraintPoints();
        double t = problem.getTime();
        double total = 0.0;
        for (int j = 0; j < points.size(); j++) {
            ConstraintPoint p = points.get(j);
            double s = 0.0;
            for (int i = 0; i < xs.length; i++) {
                double r = Math.max(PumpingWell.DEFAULT_RADIUS, Math.hypot(p.getX() - xs[i], p.getY() - ys[i]));
                s += WellFunctions.drawdown(DrawdownMethod.COOPER_JACOB, r, t, rates[i], aquifer);
            }
            total += Math.max(0.0, minHeads[j] - (problem.getInitialHead() - s));
        }
        return total;
    }

    private static List<PumpingWell> buildWells(double[] xs, double[] ys, double[] rates) {
        List<PumpingWell> wells = new ArrayList<>(xs.length);
        for (int i = 0; i < xs.length; i++) {
            wells.add(PumpingWell.builder()
                    .name("Well-" + (i + 1))
                    .x(xs[i])
                    .y(ys[i])
                    .rate(rates[i])
                    .build());
        }
        return wells;
    }

    private static double[] heads(SitingProblem problem, List<PumpingWell> wells) {
        List<ConstraintPoint> points = problem.getConstraintPoints();
        double[] heads = new double[points.size()];
        for (int j = 0; j < points.size(); j++) {
            ConstraintPoint p = points.get(j);
            heads[j] = problem.getInitialHead() - SuperpositionEngine.drawdown(wells, p.getX(), p.getY(),
                    problem.getTime(), problem.getAquifer(), DrawdownMethod.COOPER_JACOB);
        }
        return heads;
    }
}
