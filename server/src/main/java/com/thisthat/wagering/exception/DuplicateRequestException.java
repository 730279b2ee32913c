package com.thisthat.wagering.exception;

import com.thisthat.wagering.entity.CreditTransaction;

import lombok.Getter;

/**
 * A ledger effect with this nonce was already recorded.
 *
 * A replay is not a failure of the request: callers on the API path answer with the prior
 * result, available from {@link #getRecorded()} when the entry was found before any write.
 * It is null when the collision was only detected by the unique index on insert, in which case
 * the enclosing transaction has aborted and the caller re-reads the prior result.
 */
@Getter
public class DuplicateRequestException extends WageringException {

    public static final String CODE = "DUPLICATE_REQUEST";

    private final String nonce;
    private final CreditTransaction recorded;

    public DuplicateRequestException(String nonce, CreditTransaction recorded, Throwable cause) {
        super(CODE, "Duplicate ledger request: nonce=" + nonce, cause);
        this.nonce = nonce;
        this.recorded = recorded;
    }

    public DuplicateRequestException(String nonce, Throwable cause) {
        this(nonce, null, cause);
    }
}
