package com.flagship.wallet_ledger.account;

import com.flagship.wallet_ledger.config.LedgerProperties;
import com.flagship.wallet_ledger.wallet.WalletStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Service for managing accounts.
 *
 * An account and its wallet are created in the same transaction, so there is never an
 * account without a wallet.
 */
@Service
@Slf4j
public class AccountService {

    private static final String SELECT_ACCOUNT =
        "SELECT id, email, display_name, verification_status, active, created_at FROM accounts ";

    private final JdbcTemplate jdbcTemplate;
    private final WalletStore walletStore;
    private final LedgerProperties properties;

    public AccountService(JdbcTemplate jdbcTemplate, WalletStore walletStore, LedgerProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.walletStore = walletStore;
        this.properties = properties;
    }

    /**
     * Creates an account with a zero-balance wallet in the configured currency.
     *
     * @throws org.springframework.dao.DuplicateKeyException if the email is already registered
     */
    @Transactional
    public Account provision(String email, String displayName) {
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("Email is required");
        }
        UUID accountId = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO accounts (id, email, display_name, verification_status, active, created_at, updated_at) " +
            "VALUES (?, ?, ?, ?, TRUE, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)",
            accountId,
            email.trim(),
            displayName,
            VerificationStatus.PENDING.name()
        );
        UUID walletId = walletStore.createFor(accountId, properties.getCurrency());
        log.info("Provisioned account {} with wallet {}", accountId, walletId);
        return findById(accountId).orElseThrow();
    }

    public Optional<Account> findById(UUID accountId) {
        List<Account> accounts = jdbcTemplate.query(SELECT_ACCOUNT + "WHERE id = ?", accountRowMapper(), accountId);
        return accounts.stream().findFirst();
    }

    public Optional<Account> findByEmail(String email) {
        List<Account> accounts = jdbcTemplate.query(
            SELECT_ACCOUNT + "WHERE LOWER(email) = LOWER(?)", accountRowMapper(), email.trim());
        return accounts.stream().findFirst();
    }

    /**
     * Resolves a recipient given either an account id or an email address (case-insensitive).
     */
    public Optional<Account> resolveRecipient(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            return Optional.empty();
        }
        String trimmed = identifier.trim();
        if (trimmed.contains("@")) {
            return findByEmail(trimmed);
        }
        try {
            return findById(UUID.fromString(trimmed));
        } catch (IllegalArgumentException e) {
            log.debug("Recipient identifier is neither an email nor an account id: {}", trimmed);
            return Optional.empty();
        }
    }

    @Transactional
    public void updateVerificationStatus(UUID accountId, VerificationStatus status) {
        int updated = jdbcTemplate.update(
            "UPDATE accounts SET verification_status = ?, updated_at = CURRENT_TIMESTAMP WHERE id = ?",
            status.name(),
            accountId
        );
        if (updated == 0) {
            throw new IllegalArgumentException("Account not found: " + accountId);
        }
        log.info("Account {} verification status is now {}", accountId, status);
    }

    @Transactional
    public void deactivate(UUID accountId) {
        int updated = jdbcTemplate.update(
            "UPDATE accounts SET active = FALSE, updated_at = CURRENT_TIMESTAMP WHERE id = ?",
            accountId
        );
        if (updated == 0) {
            throw new IllegalArgumentException("Account not found: " + accountId);
        }
    }

    private RowMapper<Account> accountRowMapper() {
        return (rs, rowNum) -> new Account(
            rs.getObject("id", UUID.class),
            rs.getString("email"),
            rs.getString("display_name"),
            VerificationStatus.valueOf(rs.getString("verification_status")),
            rs.getBoolean("active"),
            rs.getTimestamp("created_at").toInstant()
        );
    }
}
