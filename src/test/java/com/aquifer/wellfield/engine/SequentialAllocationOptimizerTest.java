package com.aquifer.wellfield.engine;

import com.aquifer.wellfield.domain.AllocationProblem;
import com.aquifer.wellfield.domain.ConstraintPoint;
import com.aquifer.wellfield.domain.DrawdownMethod;
import com.aquifer.wellfield.domain.OptimizationMethod;
import com.aquifer.wellfield.domain.OptimizationResult;
import com.aquifer.wellfield.domain.OptimizationStatus;
import com.aquifer.wellfield.domain.SolverSettings;
import com.aquifer.wellfield.exception.InvalidParameterException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.aquifer.wellfield.engine.AllocationScenarios.*;
import static org.junit.jupiter.api.Assertions.*;

class SequentialAllocationOptimizerTest {

    private static final double EPS = 1e-4;

    private final SequentialAllocationOptimizer optimizer = new SequentialAllocationOptimizer();
    private final SolverSettings settings = SolverSettings.defaults();

    @Test
    @DisplayName("Single well: Q* = allowed drawdown / Theis unit response")
    void singleWellClosedForm() {
        OptimizationResult result = optimizer.optimize(singleWell(5000), settings);

        double unit = WellFunctions.theis(100.0, 1.0, 1.0, 500.0, 0.0002);
        assertTrue(result.isSuccess(), result.getMessage());
        assertEquals(OptimizationMethod.NONLINEAR, result.getMethod());
        assertEquals(1.0 / unit, result.getRates()[0], 1e-2);
        assertTrue(result.getMessage().startsWith("Converged in"));
    }

    @Test
    @DisplayName("Supply field: Theis heads at the optimum satisfy every constraint")
    void supplyFieldFeasibility() {
        AllocationProblem problem = supplyField();
        OptimizationResult result = optimizer.optimize(problem, settings);

        assertTrue(result.isSuccess(), result.getMessage());
        assertEquals(OptimizationStatus.OPTIMAL, result.getStatus());
        double[] rates = result.getRates();
        for (double q : rates) {
            assertTrue(q >= 0.0 && q <= 1500.0);
        }

        double[] s = SuperpositionEngine.drawdownAtPoints(problem.getWellField().getWells(), rates,
                problem.getConstraintPoints(), TIME, AQUIFER, DrawdownMethod.THEIS);
        double minSlack = Double.MAX_VALUE;
        for (int j = 0; j < s.length; j++) {
            double h = H0 - s[j];
            assertTrue(h >= H_MIN - EPS, "point " + j + " head " + h);
            minSlack = Math.min(minSlack, h - H_MIN);
        }
        assertEquals(0.0, minSlack, 1e-3, "at least one head constraint is active at the optimum");
    }

    @Test
    @DisplayName("Late time (u < 0.01): nonlinear and linear totals agree within 2%")
    void agreesWithLinearWhenCooperJacobValid() {
        AllocationProblem problem = supplyField();
        OptimizationResult nonlinear = optimizer.optimize(problem, settings);
        OptimizationResult linear = new LinearAllocationOptimizer().optimize(problem, settings);

        assertTrue(nonlinear.isSuccess() && linear.isSuccess());
        assertEquals(linear.getTotalRate(), nonlinear.getTotalRate(), 0.02 * linear.getTotalRate());
    }

    @Test
    @DisplayName("Conflicting h_min is reported as INFEASIBLE with a diagnostic message")
    void infeasible() {
        AllocationProblem problem = supplyField().toBuilder().initialHead(44.0).build();
        OptimizationResult result = optimizer.optimize(problem, settings);

        assertFalse(result.isSuccess());
        assertEquals(OptimizationStatus.INFEASIBLE, result.getStatus());
        assertFalse(result.isAuthoritative());
        assertTrue(result.getMaxViolation() > 0.0);
        assertNotNull(result.getMessage());
    }

    @Test
    @DisplayName("Exhausted iteration budget yields NOT_CONVERGED with a non-authoritative candidate")
    void iterationBudgetExhausted() {
        SolverSettings oneStep = settings.toBuilder().maxIterations(1).build();
        OptimizationResult result = optimizer.optimize(supplyField(), oneStep);

        assertFalse(result.isSuccess());
        assertEquals(OptimizationStatus.NOT_CONVERGED, result.getStatus());
        assertFalse(result.isAuthoritative());
        assertEquals(4, result.getRates().length);
        assertEquals(1, result.getIterations());
    }

    @Test
    @DisplayName("Constraint given as s_max behaves like the equivalent h_min")
    void maxDrawdownConstraint() {
        AllocationProblem byHead = supplyField();
        AllocationProblem byDrawdown = byHead.toBuilder()
                .constraintPoints(byHead.getConstraintPoints().stream()
                        .map(p -> ConstraintPoint.withMaxDrawdown(p.getName(), p.getX(), p.getY(), H0 - H_MIN))
                        .toList())
                .build();

        double a = optimizer.optimize(byHead, settings).getTotalRate();
        double b = optimizer.optimize(byDrawdown, settings).getTotalRate();
        assertEquals(a, b, 1e-6 * a);
    }

    @Test
    @DisplayName("Zero iteration budget or zero difference step is rejected, not run")
    void invalidSettingsRejected() {
        SolverSettings noBudget = settings.toBuilder().maxIterations(0).build();
        SolverSettings noStep = settings.toBuilder().finiteDifferenceStep(0.0).build();

        assertThrows(InvalidParameterException.class, () -> optimizer.optimize(supplyField(), noBudget));
        assertThrows(InvalidParameterException.class, () -> optimizer.optimize(supplyField(), noStep));
    }
}
