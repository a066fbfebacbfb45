package com.aquifer.wellfield.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class SitingResult {

    List<PumpingWell> wells;

    // sum_j max(0, h_min_j - h_j)
    double totalViolation;
    double[] constraintHeads;
    boolean feasible;
    int iterations;
    String message;
    long computationTimeMs;
}
