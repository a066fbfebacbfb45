package com.aquifer.wellfield.engine;

import com.aquifer.wellfield.domain.AllocationProblem;
import com.aquifer.wellfield.domain.DrawdownMethod;
import com.aquifer.wellfield.domain.OptimizationMethod;
import com.aquifer.wellfield.domain.OptimizationResult;
import com.aquifer.wellfield.domain.OptimizationStatus;
import com.aquifer.wellfield.domain.SolverSettings;
import com.google.ortools.Loader;
import com.google.ortools.linearsolver.MPConstraint;
import com.google.ortools.linearsolver.MPObjective;
import com.google.ortools.linearsolver.MPSolver;
import com.google.ortools.linearsolver.MPVariable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * Allocation with the exact Theis kernel inside the constraint function.
 * <p>
 * Sl1LP trust-region method: at every iterate the head constraints c_j(Q) = (h0 - h_min_j) - s_j(Q) &ge; 0
 * are linearized with a forward-difference Jacobian and an elastic LP
 * <pre>
 *   max  sum(d) - mu * sum(v)
 *   s.t. c + J d + v &ge; 0,  v &ge; 0,  0 &le; Q + d &le; Q_max,  |d| &le; delta
 * </pre>
 * is solved with GLOP. Steps are accepted on the l1 merit function -sum(Q) + mu * sum(max(0, -c)).
 */
@Slf4j
@Component
public class SequentialAllocationOptimizer implements AllocationOptimizer {

    static {
        Loader.loadNativeLibraries();
    }

    private static final String SOLVER_ID = "GLOP";
    private static final double ACCEPT_RATIO = 0.1;
    private static final double EXPAND_RATIO = 0.75;
    private static final int MAX_PENALTY_UPDATES = 8;

    @Override
    public OptimizationMethod method() {
        return OptimizationMethod.NONLINEAR;
    }

    @Override
    public OptimizationResult optimize(AllocationProblem problem, SolverSettings settings) {
        long startTime = System.currentTimeMillis();
        problem.validate();
        settings.validate();

        ConstraintModel model = new ConstraintModel(problem, settings.getFiniteDifferenceStep());
        double[] upper = problem.getMaxRates();
        int n = upper.length;
        double rateScale = Math.max(1.0, Arrays.stream(upper).max().orElse(0.0));
        double stepTolerance = settings.getOptimalityTolerance() * rateScale;
        double feasibilityTolerance = settings.getFeasibilityTolerance();

        // Q_max / 2 per well
        double[] q = new double[n];
        for (int i = 0; i < n; i++) {
            q[i] = 0.5 * upper[i];
        }
        double delta = Math.max(settings.getTrustRegionFraction() * rateScale, stepTolerance);
        double maxDelta = rateScale;
        double mu = settings.getInitialPenalty();

        double[] c = model.constraints(q);
        int iteration = 0;
        boolean converged = false;
        String stopReason = null;

        while (iteration < settings.getMaxIterations()) {
            iteration++;
            double[][] jac = model.jacobian(q, c);

            Step step = solveSubproblem(q, c, jac, upper, delta, mu, settings);
            if (step == null) {
                return failure(OptimizationStatus.SOLVER_NOT_FOUND, "LP solver " + SOLVER_ID + " is not available",
                        problem, q, iteration, startTime);
            }
            if (!step.solved) {
                return failure(OptimizationStatus.ABNORMAL, "Subproblem LP failed with status " + step.status
                        + " at iteration " + iteration, problem, q, iteration, startTime);
            }

            // Steering: raise mu while a better linearized feasibility is reachable inside the trust region
            int updates = 0;
            while (step.elasticSum > feasibilityTolerance && updates < MAX_PENALTY_UPDATES) {
                Step restoration = solveSubproblem(q, c, jac, upper, delta, Double.NaN, settings);
                if (restoration == null || !restoration.solved
                        || restoration.elasticSum >= step.elasticSum - feasibilityTolerance) {
                    break;
                }
                mu *= 10.0;
                updates++;
                step = solveSubproblem(q, c, jac, upper, delta, mu, settings);
                if (step == null || !step.solved) {
                    return failure(OptimizationStatus.ABNORMAL, "Subproblem LP failed while raising the penalty",
                            problem, q, iteration, startTime);
                }
            }
            if (step.elasticSum <= feasibilityTolerance && step.maxDual * 10.0 > mu) {
                mu = 10.0 * step.maxDual;
            }

            double stepNorm = maxAbs(step.d);
            double currentMerit = merit(q, c, mu);
            double predicted = step.objective + mu * (violationSum(c) - step.elasticSum);

            log.debug("SLP iter {}: total={} violation={} |d|={} delta={} mu={} pred={}",
                    iteration, AllocationSupport.sum(q), violationSum(c), stepNorm, delta, mu, predicted);

            if (stepNorm <= stepTolerance || predicted <= settings.getOptimalityTolerance() * Math.max(1.0, Math.abs(currentMerit))) {
                converged = true;
                stopReason = "step below tolerance";
                break;
            }

            double[] trial = new double[n];
            for (int i = 0; i < n; i++) {
                trial[i] = Math.min(upper[i], Math.max(0.0, q[i] + step.d[i]));
            }
            double[] trialC = model.constraints(trial);
            double actual = currentMerit - merit(trial, trialC, mu);
            double ratio = actual / predicted;

            if (ratio >= ACCEPT_RATIO) {
                q = trial;
                c = trialC;
                if (ratio >= EXPAND_RATIO && stepNorm >= 0.99 * delta) {
                    delta = Math.min(2.0 * delta, maxDelta);
                }
            } else {
                delta = 0.5 * stepNorm;
                if (delta <= stepTolerance) {
                    converged = true;
                    stopReason = "trust region collapsed";
                    break;
                }
            }
        }

        double[] rates = AllocationSupport.clampToBounds(q, upper);
        double[] heads = AllocationSupport.heads(problem, rates, DrawdownMethod.THEIS);
        double violation = AllocationSupport.maxViolation(problem, heads);
        double total = AllocationSupport.sum(rates);
        OptimizationResult.OptimizationResultBuilder result = OptimizationResult.builder()
                .method(OptimizationMethod.NONLINEAR)
                .rates(rates)
                .totalRate(total)
                .constraintHeads(heads)
                .maxViolation(violation)
                .iterations(iteration)
                .computationTimeMs(System.currentTimeMillis() - startTime);

        if (!converged) {
            log.warn("Nonlinear allocation did not converge in {} iterations (violation {})", iteration, violation);
            return result.status(OptimizationStatus.NOT_CONVERGED)
                    .success(false)
                    .authoritative(false)
                    .message("Iteration budget of " + settings.getMaxIterations()
                            + " exhausted; best candidate attached for diagnostics only (max head violation "
                            + violation + ")")
                    .build();
        }
        if (violation > feasibilityTolerance) {
            log.info("Nonlinear allocation stopped at an infeasible point (violation {})", violation);
            return result.status(OptimizationStatus.INFEASIBLE)
                    .success(false)
                    .authoritative(false)
                    .message("Infeasible: constraints cannot be met within 0 <= Q <= Q_max (max head violation "
                            + violation + ")")
                    .build();
        }
        log.info("Nonlinear allocation converged in {} iterations: total Q = {} ({})", iteration, total, stopReason);
        return result.status(OptimizationStatus.OPTIMAL)
                .success(true)
                .authoritative(true)
                .message("Converged in " + iteration + " iterations (" + stopReason + ", "
                        + model.evaluations + " drawdown evaluations)")
                .build();
    }

    /**
     * Elastic LP subproblem. With {@code mu} NaN the objective is pure feasibility: min sum(v).
     *
     * @return null when the LP solver cannot be created
     */
    private Step solveSubproblem(double[] q, double[] c, double[][] jac, double[] upper, double delta, double mu,
                                 SolverSettings settings) {
        MPSolver solver = MPSolver.createSolver(SOLVER_ID);
        if (solver == null) {
            log.error("Could not create solver {}", SOLVER_ID);
            return null;
        }
        solver.setTimeLimit(settings.getTimeLimitMs());
        boolean feasibilityOnly = Double.isNaN(mu);
        int n = q.length;
        int m = c.length;

        MPVariable[] d = new MPVariable[n];
        for (int i = 0; i < n; i++) {
            d[i] = solver.makeNumVar(Math.max(-delta, -q[i]), Math.min(delta, upper[i] - q[i]), "d_" + i);
        }
        MPVariable[] v = new MPVariable[m];
        MPConstraint[] rows = new MPConstraint[m];
        for (int j = 0; j < m; j++) {
            v[j] = solver.makeNumVar(0.0, MPSolver.infinity(), "v_" + j);
            // c_j + J_j d + v_j >= 0
            rows[j] = solver.makeConstraint(-c[j], MPSolver.infinity(), "head_" + j);
            for (int i = 0; i < n; i++) {
                rows[j].setCoefficient(d[i], jac[j][i]);
            }
            rows[j].setCoefficient(v[j], 1.0);
        }

        MPObjective objective = solver.objective();
        if (feasibilityOnly) {
            for (int j = 0; j < m; j++) {
                objective.setCoefficient(v[j], 1.0);
            }
            objective.setMinimization();
        } else {
            for (int i = 0; i < n; i++) {
                objective.setCoefficient(d[i], 1.0);
            }
            for (int j = 0; j < m; j++) {
                objective.setCoefficient(v[j], -mu);
            }
            objective.setMaximization();
        }

        MPSolver.ResultStatus status = solver.solve();
        Step step = new Step();
        step.status = status;
        step.solved = status == MPSolver.ResultStatus.OPTIMAL;
        if (!step.solved) {
            return step;
        }
        step.d = new double[n];
        for (int i = 0; i < n; i++) {
            step.d[i] = d[i].solutionValue();
            step.objective += step.d[i];
        }
        for (int j = 0; j < m; j++) {
            step.elasticSum += v[j].solutionValue();
            step.maxDual = Math.max(step.maxDual, Math.abs(rows[j].dualValue()));
        }
        return step;
    }

    private static double merit(double[] q, double[] c, double mu) {
        return -AllocationSupport.sum(q) + mu * violationSum(c);
    }

    private static double violationSum(double[] c) {
        double sum = 0.0;
        for (double cj : c) {
            sum += Math.max(0.0, -cj);
        }
        return sum;
    }

    private static double maxAbs(double[] values) {
        double max = 0.0;
        for (double value : values) {
            max = Math.max(max, Math.abs(value));
        }
        return max;
    }

    private OptimizationResult failure(OptimizationStatus status, String message, AllocationProblem problem,
                                       double[] candidate, int iterations, long startTime) {
        double[] rates = AllocationSupport.clampToBounds(candidate, problem.getMaxRates());
        double[] heads = AllocationSupport.heads(problem, rates, DrawdownMethod.THEIS);
        return OptimizationResult.builder()
                .method(OptimizationMethod.NONLINEAR)
                .status(status)
                .success(false)
                .authoritative(false)
                .rates(rates)
                .totalRate(AllocationSupport.sum(rates))
                .constraintHeads(heads)
                .maxViolation(AllocationSupport.maxViolation(problem, heads))
                .iterations(iterations)
                .message(message)
                .computationTimeMs(System.currentTimeMillis() - startTime)
                .build();
    }

    private static final class Step {
        MPSolver.ResultStatus status;
        boolean solved;
        double[] d;
        double objective;
        double elasticSum;
        double maxDual;
    }

    /**
     * Black-box Theis constraint function with a forward-difference Jacobian.
     */
    private static final class ConstraintModel {

        private final AllocationProblem problem;
        private final double[] allowed;
        private final double[] steps;
        private int evaluations;

        ConstraintModel(AllocationProblem problem, double relativeStep) {
            this.problem = problem;
            this.allowed = problem.allowedDrawdowns();
            double[] upper = problem.getMaxRates();
            this.steps = new double[upper.length];
            for (int i = 0; i < upper.length; i++) {
                steps[i] = relativeStep * Math.max(1.0, upper[i]);
            }
        }

        double[] constraints(double[] q) {
            evaluations++;
            double[] s = SuperpositionEngine.drawdownAtPoints(problem.getWellField().getWells(), q,
                    problem.getConstraintPoints(), problem.getTime(), problem.getAquifer(), DrawdownMethod.THEIS);
            double[] c = new double[s.length];
            for (int j = 0; j < s.length; j++) {
                c[j] = allowed[j] - s[j];
            }
            return c;
        }

        double[][] jacobian(double[] q, double[] c) {
            int n = q.length;
            double[][] jac = new double[c.length][n];
            for (int i = 0; i < n; i++) {
                double[] shifted = q.clone();
                shifted[i] += steps[i];
                double[] ci = constraints(shifted);
                for (int j = 0; j < c.length; j++) {
                    jac[j][i] = (ci[j] - c[j]) / steps[i];
                }
            }
            return jac;
        }
    }
}
