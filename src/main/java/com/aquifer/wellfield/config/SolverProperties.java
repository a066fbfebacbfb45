package com.aquifer.wellfield.config;

import com.aquifer.wellfield.domain.SolverSettings;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Default solver budgets, bound from {@code wellfield.solver.*}.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "wellfield.solver")
public class SolverProperties {

    /**
     * Wall-clock limit for each LP solve, in milliseconds.
     */
    private long timeLimitMs = 10_000;

    /**
     * Outer iteration budget of the nonlinear allocation.
     */
    private int maxIterations = 100;

    private double optimalityTolerance = 1e-7;

    /**
     * Accepted head shortfall at a constraint point, in length units.
     */
    private double feasibilityTolerance = 1e-6;

    private double finiteDifferenceStep = 1e-6;

    private double initialPenalty = 100.0;

    private double trustRegionFraction = 1.0;

    private boolean parallel = false;

    private boolean warnOutsideCooperJacobRange = true;

    /**
     * Seed for siting searches that do not bring their own.
     */
    private long defaultSeed = 42L;

    /**
     * Iteration budget for siting searches that do not bring their own.
     */
    private int defaultSitingIterations = 1000;

    public SolverSettings toSettings() {
        return SolverSettings.builder()
                .timeLimitMs(timeLimitMs)
                .maxIterations(maxIterations)
                .optimalityTolerance(optimalityTolerance)
                .feasibilityTolerance(feasibilityTolerance)
                .finiteDifferenceStep(finiteDifferenceStep)
                .initialPenalty(initialPenalty)
                .trustRegionFraction(trustRegionFraction)
                .parallel(parallel)
                .warnOutsideCooperJacobRange(warnOutsideCooperJacobRange)
                .build();
    }
}
