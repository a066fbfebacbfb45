package com.aquifer.wellfield.domain;

public enum OptimizationStatus {
    OPTIMAL,
    INFEASIBLE,
    NOT_CONVERGED,
    SOLVER_NOT_FOUND,
    ABNORMAL;

    public boolean isSuccess() {
        return this == OPTIMAL;
    }
}
