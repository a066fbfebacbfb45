package com.aquifer.wellfield.domain;

import com.aquifer.wellfield.exception.InvalidParameterException;
import lombok.Value;

/**
 * Axis-aligned rectangle in which wells may be sited.
 */
@Value
public class FeasibleRegion {

    double minX;
    double maxX;
    double minY;
    double maxY;

    public FeasibleRegion(double minX, double maxX, double minY, double maxY) {
        InvalidParameterException.require(Double.isFinite(minX) && Double.isFinite(maxX) && minX <= maxX,
                "Feasible region needs finite minX <= maxX, got [" + minX + ", " + maxX + "]");
        InvalidParameterException.require(Double.isFinite(minY) && Double.isFinite(maxY) && minY <= maxY,
                "Feasible region needs finite minY <= maxY, got [" + minY + ", " + maxY + "]");
        this.minX = minX;
        this.maxX = maxX;
        this.minY = minY;
        this.maxY = maxY;
    }

    public boolean contains(double x, double y) {
        return x >= minX && x <= maxX && y >= minY && y <= maxY;
    }
}
