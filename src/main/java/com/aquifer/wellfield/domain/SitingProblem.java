package com.aquifer.wellfield.domain;

import com.aquifer.wellfield.exception.InvalidParameterException;
import lombok.Builder;
import lombok.Value;

import java.util.Arrays;
import java.util.List;

/**
 * Place {@code wellCount} wells inside {@code region} so that pumping {@code totalDemand}
 * minimizes the total head violation at the constraint points.
 */
@Value
public class SitingProblem {

    int wellCount;
    FeasibleRegion region;
    double totalDemand;

    // Optional split of the demand between wells; even split when null. Normalized before use.
    double[] rateShares;

    AquiferParameters aquifer;
    double initialHead;
    List<ConstraintPoint> constraintPoints;
    double time;
    int maxIterations;

    @Builder(toBuilder = true)
    private SitingProblem(int wellCount, FeasibleRegion region, double totalDemand, double[] rateShares,
                          AquiferParameters aquifer, double initialHead, List<ConstraintPoint> constraintPoints,
                          double time, int maxIterations) {
        this.wellCount = wellCount;
        this.region = region;
        this.totalDemand = totalDemand;
        this.rateShares = rateShares == null ? null : rateShares.clone();
        this.aquifer = aquifer;
        this.initialHead = initialHead;
        this.constraintPoints = constraintPoints == null ? null : List.copyOf(constraintPoints);
        this.time = time;
        this.maxIterations = maxIterations;
    }

    public double[] getRateShares() {
        return rateShares == null ? null : rateShares.clone();
    }

    public double[] wellRates() {
        double[] rates = new double[wellCount];
        if (rateShares == null) {
            Arrays.fill(rates, totalDemand / wellCount);
            return rates;
        }
        double sum = Arrays.stream(rateShares).sum();
        for (int i = 0; i < wellCount; i++) {
            rates[i] = totalDemand * rateShares[i] / sum;
        }
        return rates;
    }

    public void validate() {
        InvalidParameterException.require(wellCount >= 1, "Siting requires at least one well, got " + wellCount);
        InvalidParameterException.require(region != null, "Feasible region is required");
        InvalidParameterException.require(aquifer != null, "Aquifer parameters are required");
        InvalidParameterException.require(totalDemand >= 0.0 && Double.isFinite(totalDemand),
                "Total demand must be a finite non-negative number, got " + totalDemand);
        InvalidParameterException.require(constraintPoints != null && !constraintPoints.isEmpty(),
                "Siting requires at least one constraint point");
        InvalidParameterException.requireFinite(initialHead, "Initial head h0");
        InvalidParameterException.requirePositive(time, "Time t");
        InvalidParameterException.require(maxIterations >= 1, "Iteration budget must be >= 1, got " + maxIterations);
        if (rateShares != null) {
            InvalidParameterException.require(rateShares.length == wellCount,
                    "Rate shares must have one entry per well (" + wellCount + ")");
            InvalidParameterException.require(Arrays.stream(rateShares).allMatch(s -> s >= 0.0 && Double.isFinite(s))
                            && Arrays.stream(rateShares).sum() > 0.0,
                    "Rate shares must be non-negative with a positive sum");
        }
    }
}
