package com.aquifer.wellfield.service;

import com.aquifer.wellfield.config.SolverProperties;
import com.aquifer.wellfield.domain.AllocationEvaluation;
import com.aquifer.wellfield.domain.AllocationProblem;
import com.aquifer.wellfield.domain.AquiferParameters;
import com.aquifer.wellfield.domain.ConstraintPoint;
import com.aquifer.wellfield.domain.DrawdownMethod;
import com.aquifer.wellfield.domain.OptimizationMethod;
import com.aquifer.wellfield.domain.OptimizationResult;
import com.aquifer.wellfield.domain.SitingProblem;
import com.aquifer.wellfield.domain.SitingResult;
import com.aquifer.wellfield.domain.SolverSettings;
import com.aquifer.wellfield.domain.WellField;
import com.aquifer.wellfield.engine.AllocationOptimizer;
import com.aquifer.wellfield.engine.LinearAllocationOptimizer;
import com.aquifer.wellfield.engine.SequentialAllocationOptimizer;
import com.aquifer.wellfield.engine.SitingOptimizer;
import com.aquifer.wellfield.engine.SuperpositionEngine;
import com.aquifer.wellfield.exception.InvalidParameterException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.random.Well19937c;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class WellfieldService {

    private final LinearAllocationOptimizer linearOptimizer;
    private final SequentialAllocationOptimizer sequentialOptimizer;
    private final SitingOptimizer sitingOptimizer;
    private final SolverProperties properties;

    /**
     * Settings bound from {@code wellfield.solver.*}.
     */
    public SolverSettings defaultSettings() {
        return properties.toSettings();
    }

    public OptimizationResult optimizeAllocation(AllocationProblem problem, OptimizationMethod method,
                                                 SolverSettings settings) {
        if (problem == null) {
            throw new InvalidParameterException("Allocation problem cannot be null");
        }
        if (settings == null) {
            settings = properties.toSettings();
        }
        settings.validate();
        problem.validate();

        AllocationOptimizer optimizer = method == OptimizationMethod.NONLINEAR ? sequentialOptimizer : linearOptimizer;
        OptimizationResult result = optimizer.optimize(problem, settings);
        if (!result.isSuccess()) {
            log.info("Allocation ({}) unsuccessful: {} - {}", optimizer.method(), result.getStatus(), result.getMessage());
        }
        return result;
    }

    /**
     * Siting search with an explicit seed; {@code seed == null} falls back to the configured default.
     */
    public SitingResult searchSiting(SitingProblem problem, SolverSettings settings, Long seed) {
        if (problem == null) {
            throw new InvalidParameterException("Siting problem cannot be null");
        }
        if (settings == null) {
            settings = properties.toSettings();
        }
        settings.validate();
        if (problem.getMaxIterations() <= 0) {
            problem = problem.toBuilder().maxIterations(properties.getDefaultSitingIterations()).build();
        }
        long effectiveSeed = seed != null ? seed : properties.getDefaultSeed();
        return sitingOptimizer.search(problem, settings, new Well19937c(effectiveSeed));
    }

    /**
     * Heads at the constraint points for the rates currently carried by {@code field}.
     */
    public AllocationEvaluation evaluateAllocation(WellField field, AquiferParameters aquifer, double initialHead,
                                                   List<ConstraintPoint> points, double t, DrawdownMethod method) {
        InvalidParameterException.require(aquifer != null, "Aquifer parameters are required");
        InvalidParameterException.require(points != null && !points.isEmpty(), "At least one constraint point is required");
        double[] xs = points.stream().mapToDouble(ConstraintPoint::getX).toArray();
        double[] ys = points.stream().mapToDouble(ConstraintPoint::getY).toArray();
        double[] s = field.computeTotalDrawdown(xs, ys, t, aquifer, method);

        double[] heads = new double[s.length];
        boolean[] satisfied = new boolean[s.length];
        double worst = 0.0;
        for (int j = 0; j < s.length; j++) {
            heads[j] = initialHead - s[j];
            double shortfall = points.get(j).requiredMinHead(initialHead) - heads[j];
            satisfied[j] = shortfall <= 0.0;
            worst = Math.max(worst, shortfall);
        }
        return AllocationEvaluation.builder()
                .totalRate(field.getTotalPumping())
                .constraintHeads(heads)
                .satisfied(satisfied)
                .maxViolation(worst)
                .feasible(worst <= 0.0)
                .build();
    }

    public double[] drawdown(WellField field, double[] xs, double[] ys, double t, AquiferParameters aquifer,
                             DrawdownMethod method) {
        InvalidParameterException.require(aquifer != null, "Aquifer parameters are required");
        InvalidParameterException.require(field != null && !field.isEmpty(), "At least one well is required");
        return SuperpositionEngine.drawdown(field.getWells(), xs, ys, t, aquifer,
                method == null ? DrawdownMethod.THEIS : method, properties.isParallel());
    }
}
