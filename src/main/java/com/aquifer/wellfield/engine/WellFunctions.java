package com.aquifer.wellfield.engine;

import com.aquifer.wellfield.domain.AquiferParameters;
import com.aquifer.wellfield.domain.DrawdownMethod;
import com.aquifer.wellfield.exception.InvalidParameterException;
import com.aquifer.wellfield.exception.NumericalDomainException;

/**
 * Analytical drawdown kernels for a single well in a confined aquifer (Theis, Cooper-Jacob, Thiem).
 * All methods are pure and thread safe.
 */
public final class WellFunctions {

    public static final double EULER_GAMMA = 0.57721566490153286061;

    /** Upper bound of u for which Cooper-Jacob stays within ~1% of Theis. */
    public static final double COOPER_JACOB_U_LIMIT = 0.01;

    private static final double EPS = 1e-15;
    private static final double FPMIN = 1e-300;
    private static final int MAX_ITERATIONS = 200;
    private static final double FOUR_PI = 4.0 * Math.PI;

    private WellFunctions() {
    }

    /**
     * Theis well function W(u) = E1(u), the exponential integral.
     * Power series for u &le; 1, modified Lentz continued fraction above.
     *
     * @throws NumericalDomainException for u &le; 0 or NaN
     */
    public static double wellFunction(double u) {
        if (!(u > 0.0)) {
            throw new NumericalDomainException("Well function argument u must be > 0, got " + u);
        }
        if (Double.isInfinite(u)) {
            return 0.0;
        }
        if (u <= 1.0) {
            // E1(u) = -gamma - ln(u) - sum_{k>=1} (-u)^k / (k * k!)
            double sum = 0.0;
            double fact = 1.0;
            for (int k = 1; k <= MAX_ITERATIONS; k++) {
                fact *= -u / k;
                double term = fact / k;
                sum += term;
                if (Math.abs(term) < Math.abs(sum) * EPS) {
                    break;
                }
            }
            return -EULER_GAMMA - Math.log(u) - sum;
        }

        double b = u + 1.0;
        double c = 1.0 / FPMIN;
        double d = 1.0 / b;
        double h = d;
        for (int i = 1; i <= MAX_ITERATIONS; i++) {
            double an = -(double) i * i;
            b += 2.0;
            d = 1.0 / (an * d + b);
            c = b + an / c;
            double del = c * d;
            h *= del;
            if (Math.abs(del - 1.0) < EPS) {
                return h * Math.exp(-u);
            }
        }
        throw new NumericalDomainException("Continued fraction for E1 did not converge at u=" + u);
    }

    public static double theisU(double r, double t, double transmissivity, double storativity) {
        return r * r * storativity / (4.0 * transmissivity * t);
    }

    /**
     * Theis drawdown s = Q/(4&pi;T) W(u). The caller substitutes the well radius at r = 0.
     *
     * @throws NumericalDomainException for r &le; 0 or t &le; 0
     */
    public static double theis(double r, double t, double rate, double transmissivity, double storativity) {
        requireAquifer(transmissivity, storativity);
        requireRadialTime(r, t);
        double u = theisU(r, t, transmissivity, storativity);
        return rate / (FOUR_PI * transmissivity) * wellFunction(u);
    }

    /**
     * Cooper-Jacob drawdown s = Q/(4&pi;T) ln(2.25Tt/(r&sup2;S)). Only accurate for u &lt; 0.01;
     * that bound is not checked here.
     */
    public static double cooperJacob(double r, double t, double rate, double transmissivity, double storativity) {
        requireAquifer(transmissivity, storativity);
        requireRadialTime(r, t);
        return rate / (FOUR_PI * transmissivity) * Math.log(2.25 * transmissivity * t / (r * r * storativity));
    }

    /**
     * Thiem steady-state drawdown s = Q/(2&pi;T) ln(R/r). Zero at or beyond the influence radius R.
     */
    public static double thiem(double r, double rate, double transmissivity, double influenceRadius) {
        InvalidParameterException.requirePositive(transmissivity, "Transmissivity T");
        InvalidParameterException.requirePositive(r, "Radial distance r");
        InvalidParameterException.requirePositive(influenceRadius, "Influence radius R");
        if (r >= influenceRadius) {
            return 0.0;
        }
        return rate / (2.0 * Math.PI * transmissivity) * Math.log(influenceRadius / r);
    }

    /**
     * Thiem head h = h0 - s.
     */
    public static double thiemHead(double r, double rate, double transmissivity, double influenceRadius,
                                   double initialHead) {
        return initialHead - thiem(r, rate, transmissivity, influenceRadius);
    }

    public static double drawdown(DrawdownMethod method, double r, double t, double rate, AquiferParameters aquifer) {
        return switch (method) {
            case THEIS -> theis(r, t, rate, aquifer.getTransmissivity(), aquifer.getStorativity());
            case COOPER_JACOB -> cooperJacob(r, t, rate, aquifer.getTransmissivity(), aquifer.getStorativity());
        };
    }

    /**
     * Earliest elapsed time at which Cooper-Jacob is applicable at distance r: t = 25 r&sup2;S / T.
     */
    public static double cooperJacobValidFrom(double r, double transmissivity, double storativity) {
        requireAquifer(transmissivity, storativity);
        return r * r * storativity / (4.0 * transmissivity * COOPER_JACOB_U_LIMIT);
    }

    public static boolean isCooperJacobValid(double r, double t, double transmissivity, double storativity) {
        return theisU(r, t, transmissivity, storativity) < COOPER_JACOB_U_LIMIT;
    }

    private static void requireAquifer(double transmissivity, double storativity) {
        InvalidParameterException.requirePositive(transmissivity, "Transmissivity T");
        InvalidParameterException.require(storativity > 0.0 && storativity < 1.0,
                "Storativity S must satisfy 0 < S < 1, got " + storativity);
    }

    private static void requireRadialTime(double r, double t) {
        if (!(t > 0.0)) {
            throw new NumericalDomainException("Elapsed time t must be > 0, got " + t);
        }
        if (!(r > 0.0)) {
            throw new NumericalDomainException("Radial distance r must be > 0 (substitute the well radius), got " + r);
        }
    }
}
