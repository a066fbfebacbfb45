package com.aquifer.wellfield.exception;

/**
 * Non-physical input (T &le; 0, S outside (0,1), negative rate bound, empty well list...).
 * Raised immediately, never clamped.
 */
public class InvalidParameterException extends IllegalArgumentException {

    public InvalidParameterException(String message) {
        super(message);
    }

    public static void require(boolean condition, String message) {
        if (!condition) {
            throw new InvalidParameterException(message);
        }
    }

    public static double requirePositive(double value, String name) {
        if (!(value > 0.0) || Double.isInfinite(value)) {
            throw new InvalidParameterException(name + " must be a finite positive number, got " + value);
        }
        return value;
    }

    public static double requireFinite(double value, String name) {
        if (!Double.isFinite(value)) {
            throw new InvalidParameterException(name + " must be finite, got " + value);
        }
        return value;
    }
}
