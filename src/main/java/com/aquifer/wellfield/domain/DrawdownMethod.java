package com.aquifer.wellfield.domain;

public enum DrawdownMethod {
    THEIS,
    // Late-time / near-well approximation, accurate only while u < 0.01
    COOPER_JACOB
}
