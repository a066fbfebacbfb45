package com.aquifer.wellfield.domain;

import com.aquifer.wellfield.engine.WellFunctions;
import com.aquifer.wellfield.exception.InvalidParameterException;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A single pumping well. Geometry is fixed at construction; the rate is changed only through
 * {@link #setRate(double)} or {@link #withRate(double)}. Positive rate means extraction.
 * Equality covers name and geometry only.
 */
@Getter
@ToString
@EqualsAndHashCode
public class PumpingWell {

    public static final double DEFAULT_RADIUS = 0.1;

    private final String name;
    private final double x;
    private final double y;
    private final double radius;
    // mutable, so kept out of equals/hashCode
    @EqualsAndHashCode.Exclude
    private double rate;

    @Builder(toBuilder = true)
    public PumpingWell(String name, double x, double y, double rate, Double radius) {
        this.name = name;
        this.x = InvalidParameterException.requireFinite(x, "Well x");
        this.y = InvalidParameterException.requireFinite(y, "Well y");
        this.rate = InvalidParameterException.requireFinite(rate, "Well rate Q");
        this.radius = radius == null
                ? DEFAULT_RADIUS
                : InvalidParameterException.requirePositive(radius, "Well radius");
    }

    public PumpingWell(double x, double y, double rate) {
        this(null, x, y, rate, null);
    }

    public void setRate(double rate) {
        this.rate = InvalidParameterException.requireFinite(rate, "Well rate Q");
    }

    public PumpingWell withRate(double newRate) {
        return toBuilder().rate(newRate).build();
    }

    public PumpingWell withName(String newName) {
        return toBuilder().name(newName).build();
    }

    public double distanceTo(double px, double py) {
        return Math.hypot(px - x, py - y);
    }

    /**
     * Distance to the point, floored at the well radius so the kernels never see r = 0.
     */
    public double effectiveDistance(double px, double py) {
        return Math.max(radius, distanceTo(px, py));
    }

    /**
     * Drawdown this well alone causes at (px, py) after pumping for time t.
     */
    public double drawdownAt(double px, double py, double t, AquiferParameters aquifer, DrawdownMethod method) {
        return WellFunctions.drawdown(method, effectiveDistance(px, py), t, rate, aquifer);
    }
}
