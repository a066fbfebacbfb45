package com.aquifer.wellfield.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Heads produced by a fixed rate vector, without any optimization.
 */
@Value
@Builder
public class AllocationEvaluation {

    double totalRate;
    double[] constraintHeads;
    boolean[] satisfied;
    double maxViolation;
    boolean feasible;
}
