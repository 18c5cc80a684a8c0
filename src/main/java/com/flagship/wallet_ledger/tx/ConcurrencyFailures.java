package com.flagship.wallet_ledger.tx;

import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.transaction.TransactionTimedOutException;

import java.sql.SQLException;
import java.util.Set;

/**
 * Classifies exceptions that mean "the unit of work lost a race and was rolled back".
 */
public final class ConcurrencyFailures {

    // lock_not_available, deadlock_detected, serialization_failure, query_canceled
    private static final Set<String> TRANSIENT_SQL_STATES = Set.of("55P03", "40P01", "40001", "57014");

    private ConcurrencyFailures() {
    }

    public static boolean isTransient(Throwable failure) {
        Throwable current = failure;
        while (current != null) {
            if (current instanceof ConcurrencyFailureException
                    || current instanceof QueryTimeoutException
                    || current instanceof TransactionTimedOutException) {
                return true;
            }
            if (current instanceof SQLException sqlException
                    && sqlException.getSQLState() != null
                    && TRANSIENT_SQL_STATES.contains(sqlException.getSQLState())) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }
}
