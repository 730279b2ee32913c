package com.thisthat.wagering.exception;

/**
 * The durable store rejected or could not complete the operation; safe to retry.
 */
public class TransientStoreException extends WageringException {

    public static final String CODE = "TRANSIENT_STORE_ERROR";

    public TransientStoreException(String operation, Throwable cause) {
        super(CODE, "Store operation failed: " + operation, cause);
    }
}
