package com.aquifer.wellfield.web;

import com.aquifer.wellfield.domain.SolverSettings;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial solver settings sent by a client. Absent fields keep the configured value.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SolverSettingsDto {
    private Long timeLimitMs;
    private Integer maxIterations;
    private Double optimalityTolerance;
    private Double feasibilityTolerance;
    private Double finiteDifferenceStep;
    private Double initialPenalty;
    private Double trustRegionFraction;
    private Boolean parallel;
    private Boolean warnOutsideCooperJacobRange;

    public SolverSettings applyTo(SolverSettings base) {
        SolverSettings.SolverSettingsBuilder merged = base.toBuilder();
        if (timeLimitMs != null) merged.timeLimitMs(timeLimitMs);
        if (maxIterations != null) merged.maxIterations(maxIterations);
        if (optimalityTolerance != null) merged.optimalityTolerance(optimalityTolerance);
        if (feasibilityTolerance != null) merged.feasibilityTolerance(feasibilityTolerance);
        if (finiteDifferenceStep != null) merged.finiteDifferenceStep(finiteDifferenceStep);
        if (initialPenalty != null) merged.initialPenalty(initialPenalty);
        if (trustRegionFraction != null) merged.trustRegionFraction(trustRegionFraction);
        if (parallel != null) merged.parallel(parallel);
        if (warnOutsideCooperJacobRange != null) merged.warnOutsideCooperJacobRange(warnOutsideCooperJacobRange);
        return merged.build().validate();
    }
}
