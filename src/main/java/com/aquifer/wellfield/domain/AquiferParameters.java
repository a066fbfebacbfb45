package com.aquifer.wellfield.domain;

import com.aquifer.wellfield.exception.InvalidParameterException;
import lombok.Builder;
import lombok.Value;

/**
 * Homogeneous, isotropic confined aquifer of infinite areal extent.
 */
@Value
public class AquiferParameters {

    // length^2 / time
    double transmissivity;

    // dimensionless, 0 < S < 1
    double storativity;

    @Builder
    public AquiferParameters(double transmissivity, double storativity) {
        InvalidParameterException.requirePositive(transmissivity, "Transmissivity T");
        InvalidParameterException.require(storativity > 0.0 && storativity < 1.0,
                "Storativity S must satisfy 0 < S < 1, got " + storativity);
        this.transmissivity = transmissivity;
        this.storativity = storativity;
    }

    public static AquiferParameters of(double transmissivity, double storativity) {
        return new AquiferParameters(transmissivity, storativity);
    }
}
