package com.aquifer.wellfield.domain;

public enum OptimizationMethod {
    // Cooper-Jacob linearization, single LP solve
    LINEAR,
    // Exact Theis constraints, sequential linear programming
    NONLINEAR
}
