package com.aquifer.wellfield.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Percent change of Theis drawdown when one parameter is scaled by each factor, the others held fixed.
 */
@Value
@Builder
public class SensitivityReport {

    double baseDrawdown;
    double[] factors;
    double[] rateChangePercent;
    double[] transmissivityChangePercent;
    double[] storativityChangePercent;
}
