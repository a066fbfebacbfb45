package com.aquifer.wellfield.domain;

import com.aquifer.wellfield.exception.InvalidParameterException;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Maximize total extraction sum(Q_i) subject to 0 &le; Q_i &le; Q_max_i and
 * h0 - s_total(p_j, t) &ge; h_min_j at every constraint point.
 * <p>
 * Only the geometry (position, radius) of the wells is used; their current rates are ignored.
 */
@Value
public class AllocationProblem {

    WellField wellField;
    AquiferParameters aquifer;
    double initialHead;
    double[] maxRates;
    List<ConstraintPoint> constraintPoints;
    double time;

    @Builder(toBuilder = true)
    private AllocationProblem(WellField wellField, AquiferParameters aquifer, double initialHead, double[] maxRates,
                              List<ConstraintPoint> constraintPoints, double time) {
        this.wellField = wellField;
        this.aquifer = aquifer;
        this.initialHead = initialHead;
        this.maxRates = maxRates == null ? null : maxRates.clone();
        this.constraintPoints = constraintPoints == null ? null : List.copyOf(constraintPoints);
        this.time = time;
    }

    public double[] getMaxRates() {
        return maxRates == null ? null : maxRates.clone();
    }

    public int wellCount() {
        return wellField.size();
    }

    public double[] allowedDrawdowns() {
        return constraintPoints.stream().mapToDouble(p -> p.allowedDrawdown(initialHead)).toArray();
    }

    public double[] requiredMinHeads() {
        return constraintPoints.stream().mapToDouble(p -> p.requiredMinHead(initialHead)).toArray();
    }

    /**
     * @throws InvalidParameterException on empty well or constraint lists, mismatched or negative
     *                                   rate bounds, or non-positive time
     */
    public void validate() {
        InvalidParameterException.require(wellField != null && !wellField.isEmpty(),
                "Allocation requires at least one well");
        InvalidParameterException.require(aquifer != null, "Aquifer parameters are required");
        InvalidParameterException.require(constraintPoints != null && !constraintPoints.isEmpty(),
                "Allocation requires at least one constraint point");
        InvalidParameterException.requireFinite(initialHead, "Initial head h0");
        InvalidParameterException.requirePositive(time, "Time t");
        InvalidParameterException.require(maxRates != null && maxRates.length == wellField.size(),
                "Q_max must have one entry per well (" + wellField.size() + ")");
        for (int i = 0; i < maxRates.length; i++) {
            InvalidParameterException.require(maxRates[i] >= 0.0 && Double.isFinite(maxRates[i]),
                    "Q_max[" + i + "] must be a finite non-negative number, got " + maxRates[i]);
        }
    }
}
