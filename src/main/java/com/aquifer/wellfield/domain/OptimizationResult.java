package com.aquifer.wellfield.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one allocation run. Infeasibility and non-convergence are reported here rather than
 * thrown; {@code authoritative} is false when the attached rates are only a diagnostic candidate.
 */
@Value
public class OptimizationResult {

    OptimizationMethod method;
    OptimizationStatus status;
    boolean success;

    // Q*, one entry per well
    double[] rates;
    double totalRate;

    // h0 - s(p_j) recomputed with the method's own kernel
    double[] constraintHeads;
    double maxViolation;

    boolean authoritative;
    String message;
    int iterations;
    long computationTimeMs;

    @Builder
    private OptimizationResult(OptimizationMethod method, OptimizationStatus status, boolean success, double[] rates,
                               double totalRate, double[] constraintHeads, double maxViolation, boolean authoritative,
                               String message, int iterations, long computationTimeMs) {
        this.method = method;
        this.status = status;
        this.success = success;
        this.rates = rates == null ? null : rates.clone();
        this.totalRate = totalRate;
        this.constraintHeads = constraintHeads == null ? null : constraintHeads.clone();
        this.maxViolation = maxViolation;
        this.authoritative = authoritative;
        this.message = message;
        this.iterations = iterations;
        this.computationTimeMs = computationTimeMs;
    }

    public double[] getRates() {
        return rates == null ? null : rates.clone();
    }

    public double[] getConstraintHeads() {
        return constraintHeads == null ? null : constraintHeads.clone();
    }
}
