package com.aquifer.wellfield.domain;

import com.aquifer.wellfield.exception.InvalidParameterException;
import lombok.Value;

/**
 * Observation location with either a minimum acceptable head or a maximum acceptable drawdown.
 * The two forms are equivalent once the undisturbed head h0 is known.
 */
@Value
public class ConstraintPoint {

    String name;
    double x;
    double y;
    Double minHead;
    Double maxDrawdown;

    private ConstraintPoint(String name, double x, double y, Double minHead, Double maxDrawdown) {
        this.name = name;
        this.x = InvalidParameterException.requireFinite(x, "Constraint point x");
        this.y = InvalidParameterException.requireFinite(y, "Constraint point y");
        InvalidParameterException.require((minHead == null) != (maxDrawdown == null),
                "Constraint point needs exactly one of minHead or maxDrawdown");
        if (minHead != null) {
            InvalidParameterException.requireFinite(minHead, "h_min");
        }
        if (maxDrawdown != null) {
            InvalidParameterException.require(maxDrawdown >= 0.0 && Double.isFinite(maxDrawdown),
                    "s_max must be a finite non-negative number, got " + maxDrawdown);
        }
        this.minHead = minHead;
        this.maxDrawdown = maxDrawdown;
    }

    /**
     * @throws com.aquifer.wellfield.exception.InvalidParameterException unless exactly one of
     *                                                                   {@code minHead} / {@code maxDrawdown} is given
     */
    public static ConstraintPoint of(String name, double x, double y, Double minHead, Double maxDrawdown) {
        return new ConstraintPoint(name, x, y, minHead, maxDrawdown);
    }

    public static ConstraintPoint withMinHead(String name, double x, double y, double minHead) {
        return new ConstraintPoint(name, x, y, minHead, null);
    }

    public static ConstraintPoint withMinHead(double x, double y, double minHead) {
        return withMinHead(null, x, y, minHead);
    }

    public static ConstraintPoint withMaxDrawdown(String name, double x, double y, double maxDrawdown) {
        return new ConstraintPoint(name, x, y, null, maxDrawdown);
    }

    public double requiredMinHead(double initialHead) {
        return minHead != null ? minHead : initialHead - maxDrawdown;
    }

    public double allowedDrawdown(double initialHead) {
        return maxDrawdown != null ? maxDrawdown : initialHead - minHead;
    }
}
