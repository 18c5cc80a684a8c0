package com.flagship.wallet_ledger.wallet;

import com.flagship.wallet_ledger.config.CurrencyCode;
import com.flagship.wallet_ledger.tx.UnitOfWork;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Wallet balances, read and written only under an exclusive row lock.
 *
 * Locks are taken with {@code SELECT ... FOR UPDATE} inside a {@link UnitOfWork} and released
 * when it commits or rolls back. Writes to a wallet the unit of work has not locked are refused.
 */
@Repository
public class WalletStore {

    private static final String SELECT_WALLET =
        "SELECT id, account_id, balance, currency, version FROM wallets ";

    private final JdbcTemplate jdbcTemplate;

    public WalletStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public UUID createFor(UUID accountId, CurrencyCode currency) {
        UUID walletId = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO wallets (id, account_id, balance, currency, version, created_at, updated_at) " +
            "VALUES (?, ?, 0, ?, 0, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)",
            walletId,
            accountId,
            currency.name()
        );
        return walletId;
    }

    public Optional<UUID> findWalletIdByAccount(UUID accountId) {
        List<UUID> ids = jdbcTemplate.queryForList(
            "SELECT id FROM wallets WHERE account_id = ?", UUID.class, accountId);
        return ids.stream().findFirst();
    }

    /**
     * Latest committed state of the account's wallet, without locking.
     */
    public Optional<Wallet> findByAccount(UUID accountId) {
        List<Wallet> wallets = jdbcTemplate.query(
            SELECT_WALLET + "WHERE account_id = ?", walletRowMapper(), accountId);
        return wallets.stream().findFirst();
    }

    /**
     * Locks the wallet row until the unit of work ends, and returns its current state.
     *
     * @throws IllegalStateException if the wallet does not exist
     */
    public Wallet getForUpdate(UnitOfWork unitOfWork, UUID walletId) {
        List<Wallet> wallets = jdbcTemplate.query(
            SELECT_WALLET + "WHERE id = ? FOR UPDATE", walletRowMapper(), walletId);
        if (wallets.isEmpty()) {
            throw new IllegalStateException("Wallet not found: " + walletId);
        }
        unitOfWork.registerLock(walletId);
        return wallets.get(0);
    }

    /**
     * Locks several wallets in ascending id order, so two units of work touching the same
     * pair of wallets can never wait on each other in a cycle.
     *
     * @return the locked wallets keyed by id, in lock order
     */
    public Map<UUID, Wallet> lockAll(UnitOfWork unitOfWork, Collection<UUID> walletIds) {
        Map<UUID, Wallet> locked = new LinkedHashMap<>();
        walletIds.stream()
            .distinct()
            .sorted()
            .forEach(walletId -> locked.put(walletId, getForUpdate(unitOfWork, walletId)));
        return locked;
    }

    /**
     * Writes the new balance of a wallet locked by this unit of work.
     *
     * @return the wallet with its incremented version
     */
    public Wallet save(UnitOfWork unitOfWork, Wallet wallet) {
        if (!unitOfWork.holdsLock(wallet.getId())) {
            throw new IllegalStateException("Wallet " + wallet.getId() + " is not locked by this unit of work");
        }
        if (wallet.getBalance().signum() < 0) {
            throw new IllegalStateException("Wallet " + wallet.getId() + " balance cannot be negative");
        }
        int updated = jdbcTemplate.update(
            "UPDATE wallets SET balance = ?, version = version + 1, updated_at = CURRENT_TIMESTAMP " +
            "WHERE id = ? AND version = ?",
            wallet.getBalance(),
            wallet.getId(),
            wallet.getVersion()
        );
        if (updated != 1) {
            // Cannot happen while the row lock is held
            throw new IllegalStateException("Wallet " + wallet.getId() + " changed while locked");
        }
        return new Wallet(wallet.getId(), wallet.getAccountId(), wallet.getBalance(),
            wallet.getCurrency(), wallet.getVersion() + 1);
    }

    public Optional<BigDecimal> findBalance(UUID accountId) {
        return findByAccount(accountId).map(Wallet::getBalance);
    }

    private RowMapper<Wallet> walletRowMapper() {
        return (rs, rowNum) -> new Wallet(
            rs.getObject("id", UUID.class),
            rs.getObject("account_id", UUID.class),
            rs.getBigDecimal("balance"),
            CurrencyCode.valueOf(rs.getString("currency")),
            rs.getLong("version")
        );
    }
}
