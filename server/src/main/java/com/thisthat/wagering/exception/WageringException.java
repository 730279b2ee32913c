package com.thisthat.wagering.exception;

import lombok.Getter;

/**
 * Base of every error the wagering core reports to its callers. errorCode is stable and
 * suitable for mapping onto API responses.
 */
@Getter
public abstract class WageringException extends RuntimeException {

    private final String errorCode;

    protected WageringException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected WageringException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
