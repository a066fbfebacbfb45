package com.aquifer.wellfield.domain;

import com.aquifer.wellfield.exception.InvalidParameterException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Budgets and tolerances shared by the allocation and siting optimizers.
 * <p>
 * Valid ranges, checked by {@link #validate()}: {@code timeLimitMs}, {@code maxIterations},
 * {@code optimalityTolerance}, {@code feasibilityTolerance}, {@code finiteDifferenceStep},
 * {@code initialPenalty} and {@code trustRegionFraction} must all be positive; the step and the
 * trust-region fraction must also be at most 1.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SolverSettings {

    // Wall-clock limit handed to each LP solve
    private long timeLimitMs;

    // Outer iteration budget of the sequential (nonlinear) solver
    private int maxIterations;

    // Step-size threshold for declaring convergence, relative to the largest rate bound
    private double optimalityTolerance;

    // Accepted head violation at a constraint point (length units)
    private double feasibilityTolerance;

    // Relative forward-difference step for the constraint Jacobian
    private double finiteDifferenceStep;

    // Starting l1 penalty on constraint violation; raised from LP duals as needed
    private double initialPenalty;

    // Initial trust-region half width as a fraction of the largest rate bound
    private double trustRegionFraction;

    // Map independent observation points / siting candidates over the fork-join pool
    private boolean parallel;

    // Log a warning when the linear method is used outside u < 0.01
    private boolean warnOutsideCooperJacobRange;

    /**
     * @return this, for chaining
     * @throws InvalidParameterException if any budget, tolerance or step is out of range
     */
    public SolverSettings validate() {
        InvalidParameterException.require(timeLimitMs > 0, "Solver time limit must be positive, got " + timeLimitMs);
        InvalidParameterException.require(maxIterations >= 1, "Iteration budget must be >= 1, got " + maxIterations);
        InvalidParameterException.requirePositive(optimalityTolerance, "Optimality tolerance");
        InvalidParameterException.requirePositive(feasibilityTolerance, "Feasibility tolerance");
        InvalidParameterException.requirePositive(finiteDifferenceStep, "Finite-difference step");
        InvalidParameterException.require(finiteDifferenceStep <= 1.0,
                "Finite-difference step is relative and must be <= 1, got " + finiteDifferenceStep);
        InvalidParameterException.requirePositive(initialPenalty, "Initial penalty");
        InvalidParameterException.requirePositive(trustRegionFraction, "Trust-region fraction");
        InvalidParameterException.require(trustRegionFraction <= 1.0,
                "Trust-region fraction must be <= 1, got " + trustRegionFraction);
        return this;
    }

    public static SolverSettings defaults() {
        return SolverSettings.builder()
                .timeLimitMs(10_000)
                .maxIterations(100)
                .optimalityTolerance(1e-7)
                .feasibilityTolerance(1e-6)
                .finiteDifferenceStep(1e-6)
                .initialPenalty(100.0)
                .trustRegionFraction(1.0)
                .parallel(false)
                .warnOutsideCooperJacobRange(true)
                .build();
    }

    /**
     * Short LP budget for callers that need fast answers (e.g. screening many scenarios).
     */
    public static SolverSettings fastScreening() {
        return defaults().toBuilder()
                .timeLimitMs(1_000)
                .maxIterations(30)
                .feasibilityTolerance(1e-4)
                .warnOutsideCooperJacobRange(false)
                .build();
    }
}
