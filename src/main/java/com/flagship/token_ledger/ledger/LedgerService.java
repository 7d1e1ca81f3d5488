package com.flagship.token_ledger.ledger;

import com.flagship.token_ledger.ledger.event.TransferEvent;
import com.flagship.token_ledger.ledger.event.TransferNotifier;
import com.flagship.token_ledger.observability.CorrelationContext;
import com.flagship.token_ledger.observability.LedgerMetrics;
import com.flagship.token_ledger.persistence.LedgerStateStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Hosts the single {@link TokenLedger} of this deployment.
 *
 * For every call this service:
 * 1. Takes the ledger lock (one lock spans load, operation and save, so reads and writes never interleave)
 * 2. Restores the ledger from the store on first use
 * 3. Applies the operation, buffering any transfer notifications
 * 4. Saves the entries the operation touched
 * 5. Releases the lock, then forwards the buffered notifications
 *
 * Notifications go out after the lock is released, so a slow notification channel never
 * holds up other ledger calls. Events of concurrent calls may therefore reach the channel
 * in a different order than the calls committed.
 *
 * A failed operation stores nothing and notifies no one. If storing fails, the in-memory
 * ledger is dropped and reloaded from the store on the next call, so the store stays the
 * source of truth.
 */
@Service
@Slf4j
public class LedgerService {

    private final LedgerStateStore stateStore;
    private final TransferNotifier transferNotifier;
    private final LedgerMetrics ledgerMetrics;

    private final ReentrantLock lock = new ReentrantLock();
    private final List<TransferEvent> pendingEvents = new ArrayList<>();

    private TokenLedger ledger;
    private boolean loaded;

    public LedgerService(LedgerStateStore stateStore,
                         TransferNotifier transferNotifier,
                         LedgerMetrics ledgerMetrics) {
        this.stateStore = stateStore;
        this.transferNotifier = transferNotifier;
        this.ledgerMetrics = ledgerMetrics;
    }

    // ==================== Construction ====================

    /**
     * Creates the ledger with {@code initialSupply} credited to {@code creator}.
     *
     * @throws IllegalStateException if a ledger already exists
     */
    public LedgerState createLedger(AccountId creator, BigInteger initialSupply) {
        return create(creator, () -> TokenLedger.create(creator, initialSupply, pendingEvents::add));
    }

    /**
     * Creates an empty ledger owned by {@code creator}.
     *
     * @throws IllegalStateException if a ledger already exists
     */
    public LedgerState createDefaultLedger(AccountId creator) {
        return create(creator, () -> TokenLedger.createDefault(creator, pendingEvents::add));
    }

    private LedgerState create(AccountId creator, Supplier<TokenLedger> factory) {
        return execute("create", creator, () -> {
            if (ledger != null) {
                throw new IllegalStateException("Ledger has already been created");
            }
            TokenLedger created = factory.get();
            persist(created);
            ledger = created;
            log.info("Ledger created: creator={}, totalSupply={}", creator, created.totalSupply());
            return created.snapshot();
        });
    }

    public boolean isCreated() {
        lock.lock();
        try {
            ensureLoaded();
            return ledger != null;
        } finally {
            lock.unlock();
        }
    }

    // ==================== Queries ====================

    public BigInteger totalSupply() {
        return query(TokenLedger::totalSupply);
    }

    public BigInteger balanceOf(AccountId account) {
        return query(l -> l.balanceOf(account));
    }

    public BigInteger allowanceOf(AccountId owner, AccountId spender) {
        return query(l -> l.allowanceOf(owner, spender));
    }

    // ==================== Mutations ====================

    public void transfer(AccountId caller, AccountId to, BigInteger value) {
        mutate("transfer", caller, l -> l.transfer(caller, to, value));
        log.info("Transfer completed: to={}, value={}", to, value);
    }

    /**
     * Moves {@code value} out of {@code from} to the caller. No allowance is checked or consumed.
     */
    public void transferFrom(AccountId caller, AccountId from, BigInteger value) {
        mutate("transfer_from", caller, l -> l.transferFrom(caller, from, value));
        log.info("Transfer-from completed: from={}, value={}", from, value);
    }

    /**
     * @return the caller's balance after the burn
     */
    public BigInteger burn(AccountId caller, BigInteger value) {
        BigInteger balance = mutateAndGet("burn", caller, l -> {
            l.burn(caller, value);
            return l.balanceOf(caller);
        });
        log.info("Burn completed: value={}, balance={}", value, balance);
        return balance;
    }

    /**
     * Credits {@code to}. {@code caller} is only recorded and may be null.
     *
     * @return the receiver's balance after the issue
     */
    public BigInteger issue(AccountId caller, AccountId to, BigInteger value) {
        BigInteger balance = mutateAndGet("issue", caller, l -> {
            l.issue(to, value);
            return l.balanceOf(to);
        });
        log.info("Issue completed: to={}, value={}, balance={}", to, value, balance);
        return balance;
    }

    public void approve(AccountId caller, AccountId spender, BigInteger value) {
        mutate("approve", caller, l -> l.approve(caller, spender, value));
        log.info("Approval recorded: spender={}, value={}", spender, value);
    }

    // ==================== Execution ====================

    private <T> T query(Function<TokenLedger, T> read) {
        lock.lock();
        try {
            return read.apply(requireLedger());
        } finally {
            lock.unlock();
        }
    }

    private void mutate(String operation, AccountId caller, Consumer<TokenLedger> change) {
        mutateAndGet(operation, caller, l -> {
            change.accept(l);
            return null;
        });
    }

    private <T> T mutateAndGet(String operation, AccountId caller, Function<TokenLedger, T> change) {
        return execute(operation, caller, () -> {
            TokenLedger current = requireLedger();
            T result = change.apply(current);
            persist(current);
            return result;
        });
    }

    /**
     * Runs one ledger call with the caller in the MDC. Buffered notifications are forwarded
     * on success, after the lock is released, and discarded on failure.
     */
    private <T> T execute(String operation, AccountId caller, Supplier<T> call) {
        CorrelationContext.enterCall(caller != null ? caller.toHex() : null);
        try {
            List<TransferEvent> committed = new ArrayList<>();
            T result = executeLocked(operation, call, committed);
            committed.forEach(transferNotifier::publish);
            return result;
        } finally {
            CorrelationContext.exitCall();
        }
    }

    /**
     * Runs {@code call} under the lock and hands back, through {@code committed}, the
     * notifications it buffered once everything is saved.
     */
    private <T> T executeLocked(String operation, Supplier<T> call, List<TransferEvent> committed) {
        long startTime = System.nanoTime();
        lock.lock();
        try {
            ensureLoaded();
            T result = call.get();
            committed.addAll(pendingEvents);
            ledgerMetrics.recordOperation(operation, "success", elapsedSince(startTime));
            return result;

        } catch (InsufficientBalanceException e) {
            ledgerMetrics.recordOperation(operation, "insufficient_balance", elapsedSince(startTime));
            log.warn("Ledger {} rejected: {}", operation, e.getMessage());
            throw e;
        } catch (BalanceOverflowException e) {
            ledgerMetrics.recordOperation(operation, "overflow", elapsedSince(startTime));
            log.warn("Ledger {} rejected: {}", operation, e.getMessage());
            throw e;
        } catch (IllegalArgumentException | IllegalStateException | NullPointerException e) {
            ledgerMetrics.recordOperation(operation, "invalid", elapsedSince(startTime));
            log.warn("Ledger {} rejected: {}", operation, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            ledgerMetrics.recordOperation(operation, "error", elapsedSince(startTime));
            log.error("Ledger {} failed: error={}", operation, e.getMessage());
            throw e;
        } finally {
            pendingEvents.clear();
            lock.unlock();
        }
    }

    private void persist(TokenLedger candidate) {
        try {
            stateStore.save(candidate.drainChanges());
        } catch (RuntimeException e) {
            // The in-memory ledger may now be ahead of the store; reload it on the next call
            ledger = null;
            loaded = false;
            log.error("Failed to persist ledger state, discarding in-memory copy: error={}", e.getMessage());
            throw e;
        }
    }

    private void ensureLoaded() {
        if (loaded) {
            return;
        }
        Optional<LedgerState> state = stateStore.load();
        ledger = state.map(s -> TokenLedger.restore(s, pendingEvents::add)).orElse(null);
        loaded = true;
        log.info("Ledger state {}", ledger != null ? "restored from store" : "not found, awaiting creation");
    }

    private TokenLedger requireLedger() {
        ensureLoaded();
        if (ledger == null) {
            throw new IllegalStateException("Ledger has not been created");
        }
        return ledger;
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
