package com.flagship.revenue_ledger.config;

import com.flagship.revenue_ledger.exception.LedgerPersistenceException;
import com.flagship.revenue_ledger.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Runs a unit of work in its own transaction bounded by the caller's timeout.
 *
 * The timeout is handed to the transaction manager, which applies it to every
 * statement issued inside the transaction. Timeouts and storage outages surface as
 * {@link LedgerPersistenceException}; nothing is retried here.
 * {@link ConcurrencyFailureException}s pass through untouched so callers that own a
 * bounded retry can recognise them.
 */
@Component
@Slf4j
public class TransactionRunner {

    private final PlatformTransactionManager transactionManager;
    private final Duration defaultTimeout;
    private final Duration maxTimeout;

    public TransactionRunner(PlatformTransactionManager transactionManager,
                             @Value("${ledger.store.default-timeout:5s}") Duration defaultTimeout,
                             @Value("${ledger.store.max-timeout:30s}") Duration maxTimeout) {
        this.transactionManager = transactionManager;
        this.defaultTimeout = defaultTimeout;
        this.maxTimeout = maxTimeout;
    }

    /**
     * Clamps a caller-supplied timeout: null means the configured default, anything
     * above the configured maximum is capped.
     */
    public Duration effectiveTimeout(Duration requested) {
        if (requested == null) {
            return defaultTimeout;
        }
        if (requested.isNegative() || requested.isZero()) {
            throw new ValidationException("timeout", "Timeout must be positive");
        }
        return requested.compareTo(maxTimeout) > 0 ? maxTimeout : requested;
    }

    public <T> T inTransaction(Duration timeout, Supplier<T> work) {
        return execute(timeout, false, work);
    }

    public <T> T readOnly(Duration timeout, Supplier<T> work) {
        return execute(timeout, true, work);
    }

    private <T> T execute(Duration timeout, boolean readOnly, Supplier<T> work) {
        Duration effective = effectiveTimeout(timeout);
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setTimeout(toSeconds(effective));
        template.setReadOnly(readOnly);

        try {
            return template.execute(status -> work.get());
        } catch (ConcurrencyFailureException e) {
            throw e;
        } catch (TransactionTimedOutException | QueryTimeoutException e) {
            log.error("Store call exceeded timeout of {}ms: {}", effective.toMillis(), e.getMessage());
            throw new LedgerPersistenceException(
                    "Ledger store did not respond within " + effective.toMillis() + "ms", e);
        } catch (CannotCreateTransactionException | DataAccessResourceFailureException
                 | TransientDataAccessException e) {
            log.error("Ledger store unavailable: {}", e.getMessage());
            throw new LedgerPersistenceException("Ledger store unavailable", e);
        }
    }

    private static int toSeconds(Duration timeout) {
        long millis = timeout.toMillis();
        return (int) Math.max(1, (millis + 999) / 1000);
    }
}
