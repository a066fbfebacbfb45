package com.aquifer.wellfield.exception;

/**
 * Argument outside the valid domain of a well-function kernel (e.g. u &le; 0, t &le; 0).
 */
public class NumericalDomainException extends ArithmeticException {

    public NumericalDomainException(String message) {
        super(message);
    }
}
