package com.aquifer.wellfield.engine;

import com.aquifer.wellfield.domain.AllocationProblem;
import com.aquifer.wellfield.domain.OptimizationMethod;
import com.aquifer.wellfield.domain.OptimizationResult;
import com.aquifer.wellfield.domain.SolverSettings;

public interface AllocationOptimizer {

    OptimizationMethod method();

    /**
     * Maximizes total extraction under the head constraints of {@code problem}.
     * Expected failures (infeasible, not converged) come back as a result with success=false.
     */
    OptimizationResult optimize(AllocationProblem problem, SolverSettings settings);
}
