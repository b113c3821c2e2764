package com.keer.seating.store;

import com.keer.seating.config.SeatingProperties;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.TransactionTimedOutException;

/**
 * Which store failures are worth another attempt, and how often.
 */
public final class StoreRetryPolicy {

    public static final String RETRY_NAME = "seatingStore";

    private StoreRetryPolicy() {}

    public static Retry create(SeatingProperties.Store store) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(store.getMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(store.getInitialBackoff(), 2.0))
                .retryOnException(StoreRetryPolicy::isTransient)
                .build();
        return Retry.of(RETRY_NAME, config);
    }

    public static boolean isTransient(Throwable e) {
        return e instanceof TransientDataAccessException
                || e instanceof DataAccessResourceFailureException
                || e instanceof CannotCreateTransactionException
                || e instanceof TransactionTimedOutException;
    }
}
