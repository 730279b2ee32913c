package com.thisthat.wagering.service;

import com.mongodb.MongoException;
import com.thisthat.wagering.exception.TransientStoreException;
import io.github.resilience4j.retry.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Runs a unit of work (normally one MongoDB transaction) under the store retry policy.
 *
 * Concurrent transactions on the same user document abort with a write conflict; the losing
 * unit is replayed from the start. When attempts are exhausted the failure surfaces as a
 * {@link TransientStoreException}. Non-transient exceptions pass through untouched.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StoreRetries {

    private static final String TRANSIENT_TRANSACTION_ERROR = "TransientTransactionError";
    private static final String UNKNOWN_COMMIT_RESULT = "UnknownTransactionCommitResult";

    private final Retry storeRetry;

    public <T> T execute(String operation, Supplier<T> unitOfWork) {
        try {
            return storeRetry.executeSupplier(unitOfWork);
        } catch (RuntimeException e) {
            if (isTransient(e) && !(e instanceof TransientStoreException)) {
                log.error("Store operation failed after {} attempts: operation={}, error={}",
                        storeRetry.getRetryConfig().getMaxAttempts(), operation, e.getMessage());
                throw new TransientStoreException(operation, e);
            }
            throw e;
        }
    }

    /**
     * Whether a failure is worth retrying: write conflicts, transaction aborts and lost connections.
     */
    public static boolean isTransient(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof TransientStoreException
                    || t instanceof TransientDataAccessException
                    || t instanceof DataAccessResourceFailureException) {
                return true;
            }
            if (t instanceof MongoException mongoException
                    && (mongoException.hasErrorLabel(TRANSIENT_TRANSACTION_ERROR)
                        || mongoException.hasErrorLabel(UNKNOWN_COMMIT_RESULT))) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }
}
