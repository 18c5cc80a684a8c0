package com.flagship.wallet_ledger.ledger;

import com.flagship.wallet_ledger.tx.UnitOfWork;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Append-only double-entry ledger.
 *
 * This service enforces:
 * 1. Debits equal credits for every transfer (checked here, and again by a deferred database trigger)
 * 2. Entries are never updated or deleted (there is no API for it, and a trigger rejects it)
 * 3. Entries are only written inside a unit of work, together with the balance changes they describe
 */
@Service
public class LedgerService {

    private final JdbcTemplate jdbcTemplate;

    public LedgerService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Records the legs of one transfer.
     *
     * @throws IllegalArgumentException if the legs are empty, one-sided or unbalanced
     */
    public List<UUID> record(UnitOfWork unitOfWork, UUID transferId, List<LedgerLeg> legs) {
        if (legs == null || legs.isEmpty()) {
            throw new IllegalArgumentException("A ledger posting needs at least one debit and one credit");
        }
        BigDecimal debitTotal = total(legs, EntryType.DEBIT);
        BigDecimal creditTotal = total(legs, EntryType.CREDIT);
        if (debitTotal.signum() == 0 || creditTotal.signum() == 0) {
            throw new IllegalArgumentException("A ledger posting needs at least one debit and one credit");
        }
        if (debitTotal.compareTo(creditTotal) != 0) {
            throw new IllegalArgumentException(
                String.format("Transfer %s is not balanced: debits=%s, credits=%s",
                    transferId, debitTotal, creditTotal));
        }
        for (LedgerLeg leg : legs) {
            if (leg.isWalletLeg() && !unitOfWork.holdsLock(leg.getWalletId())) {
                throw new IllegalStateException("Wallet " + leg.getWalletId() + " is not locked by this unit of work");
            }
        }

        return legs.stream()
            .map(leg -> insertEntry(transferId, leg))
            .toList();
    }

    private UUID insertEntry(UUID transferId, LedgerLeg leg) {
        UUID entryId = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO ledger_entries (id, transfer_id, wallet_id, external_reference, entry_type, amount, balance_after, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP)",
            entryId,
            transferId,
            leg.getWalletId(),
            leg.getExternalReference(),
            leg.getEntryType().name(),
            leg.getAmount(),
            leg.getBalanceAfter()
        );
        return entryId;
    }

    public List<LedgerEntry> entriesFor(UUID transferId) {
        return jdbcTemplate.query(
            "SELECT id, transfer_id, wallet_id, external_reference, entry_type, amount, balance_after, created_at, sequence_number " +
            "FROM ledger_entries WHERE transfer_id = ? ORDER BY sequence_number",
            ledgerEntryRowMapper(),
            transferId
        );
    }

    /**
     * Balance of a wallet recomputed from its entries: credits minus debits.
     */
    public BigDecimal derivedBalance(UUID walletId) {
        BigDecimal balance = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(CASE WHEN entry_type = 'CREDIT' THEN amount ELSE -amount END), 0) " +
            "FROM ledger_entries WHERE wallet_id = ?",
            BigDecimal.class,
            walletId
        );
        return balance != null ? balance : BigDecimal.ZERO;
    }

    private static BigDecimal total(List<LedgerLeg> legs, EntryType entryType) {
        return legs.stream()
            .filter(leg -> leg.getEntryType() == entryType)
            .map(LedgerLeg::getAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private RowMapper<LedgerEntry> ledgerEntryRowMapper() {
        return (rs, rowNum) -> new LedgerEntry(
            rs.getObject("id", UUID.class),
            rs.getObject("transfer_id", UUID.class),
            rs.getObject("wallet_id", UUID.class),
            rs.getString("external_reference"),
            EntryType.valueOf(rs.getString("entry_type")),
            rs.getBigDecimal("amount"),
            rs.getBigDecimal("balance_after"),
            rs.getTimestamp("created_at").toInstant(),
            rs.getLong("sequence_number")
        );
    }
}
