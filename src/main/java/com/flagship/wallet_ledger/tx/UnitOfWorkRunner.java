package com.flagship.wallet_ledger.tx;

import com.flagship.wallet_ledger.config.LedgerProperties;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Function;

/**
 * Opens explicit units of work.
 *
 * Each call runs in a brand-new READ COMMITTED transaction (never joins a caller's one),
 * with PostgreSQL's {@code lock_timeout} bounding every row-lock wait. The transaction
 * commits when the work returns and rolls back on any exception, which is rethrown.
 */
@Component
public class UnitOfWorkRunner {

    private final TransactionTemplate transactionTemplate;
    private final JdbcTemplate jdbcTemplate;
    private final long lockTimeoutMillis;

    public UnitOfWorkRunner(PlatformTransactionManager transactionManager,
                            JdbcTemplate jdbcTemplate,
                            LedgerProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.lockTimeoutMillis = properties.getLockTimeout().toMillis();

        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.transactionTemplate.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        this.transactionTemplate.setTimeout((int) Math.max(1, properties.getUnitOfWorkTimeout().toSeconds()));
    }

    public <T> T execute(Function<UnitOfWork, T> work) {
        return transactionTemplate.execute(status -> {
            // SET LOCAL does not accept bind parameters; the value is a number we own
            jdbcTemplate.execute("SET LOCAL lock_timeout = '" + lockTimeoutMillis + "ms'");
            return work.apply(new UnitOfWork());
        });
    }
}
