package com.aquifer.wellfield.engine;

import com.aquifer.wellfield.domain.AllocationProblem;
import com.aquifer.wellfield.domain.ConstraintPoint;
import com.aquifer.wellfield.domain.DrawdownMethod;
import com.aquifer.wellfield.domain.OptimizationMethod;
import com.aquifer.wellfield.domain.OptimizationResult;
import com.aquifer.wellfield.domain.OptimizationStatus;
import com.aquifer.wellfield.domain.PumpingWell;
import com.aquifer.wellfield.domain.SolverSettings;
import com.google.ortools.Loader;
import com.google.ortools.linearsolver.MPConstraint;
import com.google.ortools.linearsolver.MPObjective;
import com.google.ortools.linearsolver.MPSolver;
import com.google.ortools.linearsolver.MPVariable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Cooper-Jacob linearization: drawdown is linear in Q, so the head constraints form the affine
 * system A&middot;Q &le; h0 - h_min with A[j][i] = ln(2.25Tt/(r_ji&sup2;S)) / (4&pi;T).
 * Solved once with GLOP.
 */
@Slf4j
@Component
public class LinearAllocationOptimizer implements AllocationOptimizer {

    static {
        Loader.loadNativeLibraries();
    }

    private static final String SOLVER_ID = "GLOP";

    @Override
    public OptimizationMethod method() {
        return OptimizationMethod.LINEAR;
    }

    @Override
    public OptimizationResult optimize(AllocationProblem problem, SolverSettings settings) {
        long startTime = System.currentTimeMillis();
        problem.validate();
        settings.validate();

        if (settings.isWarnOutsideCooperJacobRange()) {
            warnOutsideValidRange(problem);
        }

        MPSolver solver = MPSolver.createSolver(SOLVER_ID);
        if (solver == null) {
            log.error("Could not create solver {}", SOLVER_ID);
            return failure(OptimizationStatus.SOLVER_NOT_FOUND, "LP solver " + SOLVER_ID + " is not available",
                    problem, startTime);
        }
        solver.setTimeLimit(settings.getTimeLimitMs());

        int n = problem.wellCount();
        double[] maxRates = problem.getMaxRates();
        double[][] a = SuperpositionEngine.unitResponse(problem.getWellField().getWells(),
                problem.getConstraintPoints(), problem.getTime(), problem.getAquifer(), DrawdownMethod.COOPER_JACOB);
        double[] allowed = problem.allowedDrawdowns();

        // q[i]: pumping rate of well i, bounded by 0 <= q <= Q_max
        MPVariable[] q = new MPVariable[n];
        for (int i = 0; i < n; i++) {
            q[i] = solver.makeNumVar(0.0, maxRates[i], "q_" + i);
        }

        // sum_i A[j][i] q_i <= h0 - h_min_j
        for (int j = 0; j < a.length; j++) {
            MPConstraint head = solver.makeConstraint(-MPSolver.infinity(), allowed[j], "head_" + j);
            for (int i = 0; i < n; i++) {
                head.setCoefficient(q[i], a[j][i]);
            }
        }

        MPObjective objective = solver.objective();
        for (int i = 0; i < n; i++) {
            objective.setCoefficient(q[i], 1.0);
        }
        objective.setMaximization();

        final MPSolver.ResultStatus status = solver.solve();
        long iterations = solver.iterations();

        if (status != MPSolver.ResultStatus.OPTIMAL) {
            OptimizationStatus mapped = mapStatus(status);
            log.info("Linear allocation ended with solver status {} after {} iterations", status, iterations);
            if (status == MPSolver.ResultStatus.FEASIBLE) {
                double[] candidate = new double[n];
                for (int i = 0; i < n; i++) {
                    candidate[i] = q[i].solutionValue();
                }
                return candidateResult(problem, candidate, (int) iterations, startTime,
                        "LP stopped before proving optimality (" + status + "); candidate is not authoritative");
            }
            return failure(mapped, describe(status), problem, startTime);
        }

        double[] rates = new double[n];
        for (int i = 0; i < n; i++) {
            rates[i] = q[i].solutionValue();
        }
        rates = AllocationSupport.clampToBounds(rates, maxRates);
        double[] heads = AllocationSupport.heads(problem, rates, DrawdownMethod.COOPER_JACOB);
        double total = AllocationSupport.sum(rates);

        log.info("Linear allocation optimal: total Q = {} over {} wells ({} LP iterations)", total, n, iterations);
        return OptimizationResult.builder()
                .method(OptimizationMethod.LINEAR)
                .status(OptimizationStatus.OPTIMAL)
                .success(true)
                .authoritative(true)
                .rates(rates)
                .totalRate(total)
                .constraintHeads(heads)
                .maxViolation(AllocationSupport.maxViolation(problem, heads))
                .iterations((int) iterations)
                .message("Optimal allocation found by " + SOLVER_ID + " in " + iterations + " iterations")
                .computationTimeMs(System.currentTimeMillis() - startTime)
                .build();
    }

    private void warnOutsideValidRange(AllocationProblem problem) {
        List<PumpingWell> wells = problem.getWellField().getWells();
        double t = problem.getTime();
        double transmissivity = problem.getAquifer().getTransmissivity();
        double storativity = problem.getAquifer().getStorativity();
        int outside = 0;
        double worstU = 0.0;
        for (ConstraintPoint p : problem.getConstraintPoints()) {
            for (PumpingWell well : wells) {
                double r = well.effectiveDistance(p.getX(), p.getY());
                double u = WellFunctions.theisU(r, t, transmissivity, storativity);
                if (u >= WellFunctions.COOPER_JACOB_U_LIMIT) {
                    outside++;
                    worstU = Math.max(worstU, u);
                }
            }
        }
        if (outside > 0) {
            log.warn("Cooper-Jacob used outside u < {} for {} well/point pairs (max u = {}); "
                            + "linear allocation may be inaccurate, consider the nonlinear method",
                    WellFunctions.COOPER_JACOB_U_LIMIT, outside, worstU);
        }
    }

    private OptimizationStatus mapStatus(MPSolver.ResultStatus status) {
        return switch (status) {
            case OPTIMAL -> OptimizationStatus.OPTIMAL;
            case INFEASIBLE -> OptimizationStatus.INFEASIBLE;
            case FEASIBLE, NOT_SOLVED -> OptimizationStatus.NOT_CONVERGED;
            default -> OptimizationStatus.ABNORMAL;
        };
    }

    private String describe(MPSolver.ResultStatus status) {
        return switch (status) {
            case INFEASIBLE -> "Infeasible: no allocation within 0 <= Q <= Q_max satisfies every minimum-head constraint";
            case NOT_SOLVED -> "LP not solved within the time limit";
            case UNBOUNDED -> "LP reported unbounded; check rate bounds";
            default -> "LP solver returned " + status;
        };
    }

    private OptimizationResult candidateResult(AllocationProblem problem, double[] candidate, int iterations,
                                               long startTime, String message) {
        double[] heads = AllocationSupport.heads(problem, candidate, DrawdownMethod.COOPER_JACOB);
        return OptimizationResult.builder()
                .method(OptimizationMethod.LINEAR)
                .status(OptimizationStatus.NOT_CONVERGED)
                .success(false)
                .authoritative(false)
                .rates(candidate)
                .totalRate(AllocationSupport.sum(candidate))
                .constraintHeads(heads)
                .maxViolation(AllocationSupport.maxViolation(problem, heads))
                .iterations(iterations)
                .message(message)
                .computationTimeMs(System.currentTimeMillis() - startTime)
                .build();
    }

    private OptimizationResult failure(OptimizationStatus status, String message, AllocationProblem problem,
                                       long startTime) {
        return OptimizationResult.builder()
                .method(OptimizationMethod.LINEAR)
                .status(status)
                .success(false)
                .authoritative(false)
                .rates(new double[problem.wellCount()])
                .totalRate(0.0)
                .constraintHeads(new double[0])
                .maxViolation(Double.NaN)
                .message(message)
                .computationTimeMs(System.currentTimeMillis() - startTime)
                .build();
    }
}
