package com.flagship.wallet_ledger.account;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Component
public class JdbcAccountVerificationLookup implements AccountVerificationLookup {

    private final JdbcTemplate jdbcTemplate;

    public JdbcAccountVerificationLookup(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<VerificationStatus> statusOf(UUID accountId) {
        List<String> statuses = jdbcTemplate.queryForList(
            "SELECT verification_status FROM accounts WHERE id = ? AND active",
            String.class,
            accountId
        );
        return statuses.stream().findFirst().map(VerificationStatus::valueOf);
    }
}
