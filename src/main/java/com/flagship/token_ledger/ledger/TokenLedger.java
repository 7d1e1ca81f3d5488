package com.flagship.token_ledger.ledger;

import com.flagship.token_ledger.ledger.event.TransferEvent;
import com.flagship.token_ledger.ledger.event.TransferNotifier;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Fungible-token ledger state machine.
 *
 * Owns the balance and allowance maps and every operation over them. Each operation is a
 * single read-modify-write: all validation happens before the first write, so a call that
 * throws leaves the ledger exactly as it was.
 *
 * Known behaviors preserved as-is:
 * <ul>
 *   <li>{@link #transferFrom} neither checks nor consumes an allowance. Any caller can move
 *       funds out of any account to itself.</li>
 *   <li>{@link #burn} and {@link #issue} do not adjust {@link #totalSupply()}, which therefore
 *       drifts from the sum of balances once either has been applied.</li>
 *   <li>Only {@link #transfer} emits a notification.</li>
 * </ul>
 *
 * Every write is also recorded as a touched key, so the host can store just the entries a
 * call changed (see {@link #drainChanges()}).
 *
 * Not thread-safe. The host serializes calls against one instance.
 */
public class TokenLedger {

    /**
     * Largest representable balance: the unsigned 128-bit maximum.
     */
    public static final BigInteger MAX_BALANCE = BigInteger.ONE.shiftLeft(128).subtract(BigInteger.ONE);

    private final BigInteger totalSupply;
    private final Map<AccountId, BigInteger> balances;
    private final Map<AllowanceKey, BigInteger> allowances;
    private final TransferNotifier notifier;

    private final Set<AccountId> touchedAccounts = new LinkedHashSet<>();
    private final Set<AllowanceKey> touchedAllowances = new LinkedHashSet<>();

    private TokenLedger(BigInteger totalSupply,
                        Map<AccountId, BigInteger> balances,
                        Map<AllowanceKey, BigInteger> allowances,
                        TransferNotifier notifier) {
        this.totalSupply = totalSupply;
        this.balances = balances;
        this.allowances = allowances;
        this.notifier = Objects.requireNonNull(notifier, "notifier");
    }

    /**
     * Creates a ledger whose whole initial supply is credited to {@code creator}.
     */
    public static TokenLedger create(AccountId creator, BigInteger initialSupply, TransferNotifier notifier) {
        Objects.requireNonNull(creator, "creator");
        requireAmount(initialSupply);

        TokenLedger ledger = new TokenLedger(initialSupply, new HashMap<>(), new HashMap<>(), notifier);
        ledger.putBalance(creator, initialSupply);
        return ledger;
    }

    /**
     * Empty ledger owned by {@code creator}; same as {@code create(creator, 0, notifier)}.
     */
    public static TokenLedger createDefault(AccountId creator, TransferNotifier notifier) {
        return create(creator, BigInteger.ZERO, notifier);
    }

    /**
     * Rebuilds a ledger from a snapshot previously taken with {@link #snapshot()}. The result
     * has no pending changes.
     */
    public static TokenLedger restore(LedgerState state, TransferNotifier notifier) {
        Objects.requireNonNull(state, "state");
        requireAmount(state.getTotalSupply());
        state.getBalances().values().forEach(TokenLedger::requireAmount);
        state.getAllowances().values().forEach(TokenLedger::requireAmount);
        return new TokenLedger(state.getTotalSupply(),
            new HashMap<>(state.getBalances()),
            new HashMap<>(state.getAllowances()),
            notifier);
    }

    // ==================== Queries ====================

    public BigInteger totalSupply() {
        return totalSupply;
    }

    public BigInteger balanceOf(AccountId account) {
        return balances.getOrDefault(Objects.requireNonNull(account, "account"), BigInteger.ZERO);
    }

    public BigInteger allowanceOf(AccountId owner, AccountId spender) {
        return allowances.getOrDefault(AllowanceKey.of(owner, spender), BigInteger.ZERO);
    }

    /**
     * Copies the whole state. Costs O(accounts); the host only uses it on creation.
     */
    public LedgerState snapshot() {
        return new LedgerState(totalSupply, balances, allowances);
    }

    /**
     * Returns the entries written since the previous call, and forgets them.
     */
    public LedgerChange drainChanges() {
        Map<AccountId, BigInteger> changedBalances = new HashMap<>();
        touchedAccounts.forEach(account -> changedBalances.put(account, balanceOf(account)));
        Map<AllowanceKey, BigInteger> changedAllowances = new HashMap<>();
        touchedAllowances.forEach(key -> changedAllowances.put(key, allowances.getOrDefault(key, BigInteger.ZERO)));

        touchedAccounts.clear();
        touchedAllowances.clear();
        return new LedgerChange(totalSupply, changedBalances, changedAllowances);
    }

    // ==================== Transfers ====================

    /**
     * Moves {@code value} from the caller's own balance to {@code to} and emits a
     * {@link TransferEvent}.
     *
     * @throws InsufficientBalanceException if the caller holds less than {@code value}
     * @throws BalanceOverflowException if the receiver's balance would exceed {@link #MAX_BALANCE}
     */
    public void transfer(AccountId caller, AccountId to, BigInteger value) {
        move(caller, to, value);
        notifier.publish(TransferEvent.of(caller, to, value));
    }

    /**
     * Moves {@code value} out of {@code from} and credits the caller.
     *
     * No allowance is consulted or decremented, and no notification is emitted. The call is
     * effectively unauthenticated.
     *
     * @throws InsufficientBalanceException if {@code from} holds less than {@code value}
     * @throws BalanceOverflowException if the caller's balance would exceed {@link #MAX_BALANCE}
     */
    public void transferFrom(AccountId caller, AccountId from, BigInteger value) {
        move(from, caller, value);
    }

    private void move(AccountId from, AccountId to, BigInteger value) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        requireAmount(value);

        BigInteger fromBalance = balanceOf(from);
        if (fromBalance.compareTo(value) < 0) {
            throw new InsufficientBalanceException(from, fromBalance, value);
        }
        if (from.equals(to)) {
            // debit then credit of the same account
            putBalance(from, fromBalance);
            return;
        }
        BigInteger toBalance = balanceOf(to);
        BigInteger credited = checkedCredit(to, toBalance, value);

        putBalance(from, fromBalance.subtract(value));
        putBalance(to, credited);
    }

    // ==================== Allowances ====================

    /**
     * Records that {@code spender} may move up to {@code value} out of the caller's balance,
     * replacing any earlier allowance. A zero value removes the entry.
     *
     * The allowance is informational only: {@link #transferFrom} does not enforce it.
     */
    public void approve(AccountId caller, AccountId spender, BigInteger value) {
        AllowanceKey key = AllowanceKey.of(caller, spender);
        requireAmount(value);
        if (value.signum() == 0) {
            allowances.remove(key);
        } else {
            allowances.put(key, value);
        }
        touchedAllowances.add(key);
    }

    // ==================== Supply ====================

    /**
     * Reduces the caller's balance by {@code value}, clamping at zero instead of failing.
     * Total supply is left unchanged.
     */
    public void burn(AccountId caller, BigInteger value) {
        Objects.requireNonNull(caller, "caller");
        requireAmount(value);

        BigInteger balance = balanceOf(caller);
        putBalance(caller, balance.compareTo(value) < 0 ? BigInteger.ZERO : balance.subtract(value));
    }

    /**
     * Credits {@code to} by {@code value}. Anyone may issue; total supply is left unchanged.
     *
     * @throws BalanceOverflowException if the balance would exceed {@link #MAX_BALANCE}
     */
    public void issue(AccountId to, BigInteger value) {
        Objects.requireNonNull(to, "to");
        requireAmount(value);

        putBalance(to, checkedCredit(to, balanceOf(to), value));
    }

    // ==================== Helpers ====================

    private void putBalance(AccountId account, BigInteger balance) {
        balances.put(account, balance);
        touchedAccounts.add(account);
    }

    private static BigInteger checkedCredit(AccountId account, BigInteger balance, BigInteger value) {
        BigInteger credited = balance.add(value);
        if (credited.compareTo(MAX_BALANCE) > 0) {
            throw new BalanceOverflowException(account, balance, value);
        }
        return credited;
    }

    private static void requireAmount(BigInteger value) {
        if (value == null) {
            throw new IllegalArgumentException("Amount is required");
        }
        if (value.signum() < 0) {
            throw new IllegalArgumentException("Amount must not be negative: " + value);
        }
        if (value.compareTo(MAX_BALANCE) > 0) {
            throw new IllegalArgumentException("Amount exceeds maximum balance: " + value);
        }
    }
}
