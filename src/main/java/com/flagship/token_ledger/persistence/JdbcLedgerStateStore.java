package com.flagship.token_ledger.persistence;

import com.flagship.token_ledger.ledger.AccountId;
import com.flagship.token_ledger.ledger.AllowanceKey;
import com.flagship.token_ledger.ledger.LedgerChange;
import com.flagship.token_ledger.ledger.LedgerState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Stores the ledger in PostgreSQL using JDBC directly. Each save upserts only the rows the
 * call touched.
 *
 * Tables (see schema.sql):
 * - ledger_supply: single row holding the total supply; its presence means the ledger exists
 * - ledger_balances: one row per account
 * - ledger_allowances: one row per (owner, spender)
 *
 * Amounts are NUMERIC(39,0), wide enough for any unsigned 128-bit value.
 */
@Repository
@Slf4j
public class JdbcLedgerStateStore implements LedgerStateStore {

    private static final int SUPPLY_ROW_ID = 1;

    private final JdbcTemplate jdbcTemplate;

    public JdbcLedgerStateStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<LedgerState> load() {
        List<BigDecimal> supply = jdbcTemplate.queryForList(
            "SELECT total_supply FROM ledger_supply WHERE id = ?",
            BigDecimal.class,
            SUPPLY_ROW_ID
        );
        if (supply.isEmpty()) {
            return Optional.empty();
        }

        Map<AccountId, BigInteger> balances = new HashMap<>();
        jdbcTemplate.query(
            "SELECT account_id, balance FROM ledger_balances",
            rs -> {
                balances.put(AccountId.fromHex(rs.getString("account_id")),
                    rs.getBigDecimal("balance").toBigIntegerExact());
            }
        );

        Map<AllowanceKey, BigInteger> allowances = new HashMap<>();
        jdbcTemplate.query(
            "SELECT owner_id, spender_id, amount FROM ledger_allowances",
            rs -> {
                allowances.put(
                    AllowanceKey.of(AccountId.fromHex(rs.getString("owner_id")),
                        AccountId.fromHex(rs.getString("spender_id"))),
                    rs.getBigDecimal("amount").toBigIntegerExact());
            }
        );

        log.info("Loaded ledger state: accounts={}, allowances={}", balances.size(), allowances.size());
        return Optional.of(new LedgerState(supply.get(0).toBigIntegerExact(), balances, allowances));
    }

    @Override
    @Transactional
    public void save(LedgerChange change) {
        jdbcTemplate.update(
            "INSERT INTO ledger_supply (id, total_supply, updated_at) VALUES (?, ?, CURRENT_TIMESTAMP) " +
            "ON CONFLICT (id) DO UPDATE SET total_supply = EXCLUDED.total_supply, updated_at = CURRENT_TIMESTAMP",
            SUPPLY_ROW_ID,
            new BigDecimal(change.getTotalSupply())
        );

        List<Object[]> balanceRows = change.getBalances().entrySet().stream()
            .map(entry -> new Object[] {entry.getKey().toHex(), new BigDecimal(entry.getValue())})
            .toList();
        if (!balanceRows.isEmpty()) {
            jdbcTemplate.batchUpdate(
                "INSERT INTO ledger_balances (account_id, balance) VALUES (?, ?) " +
                "ON CONFLICT (account_id) DO UPDATE SET balance = EXCLUDED.balance",
                balanceRows
            );
        }

        List<Object[]> allowanceRows = new ArrayList<>();
        List<Object[]> removedAllowances = new ArrayList<>();
        change.getAllowances().forEach((key, amount) -> {
            if (amount.signum() == 0) {
                removedAllowances.add(new Object[] {key.getOwner().toHex(), key.getSpender().toHex()});
            } else {
                allowanceRows.add(new Object[] {
                    key.getOwner().toHex(), key.getSpender().toHex(), new BigDecimal(amount)});
            }
        });
        if (!allowanceRows.isEmpty()) {
            jdbcTemplate.batchUpdate(
                "INSERT INTO ledger_allowances (owner_id, spender_id, amount) VALUES (?, ?, ?) " +
                "ON CONFLICT (owner_id, spender_id) DO UPDATE SET amount = EXCLUDED.amount",
                allowanceRows
            );
        }
        if (!removedAllowances.isEmpty()) {
            jdbcTemplate.batchUpdate(
                "DELETE FROM ledger_allowances WHERE owner_id = ? AND spender_id = ?",
                removedAllowances
            );
        }

        log.debug("Saved ledger change: balances={}, allowances={}, removedAllowances={}",
            balanceRows.size(), allowanceRows.size(), removedAllowances.size());
    }
}
