package com.flagship.token_ledger.ledger;

import com.flagship.token_ledger.ledger.event.TransferEvent;
import com.flagship.token_ledger.observability.LedgerMetrics;
import com.flagship.token_ledger.persistence.LedgerStateStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the ledger host: lifecycle, persistence ordering, notifications and serialization
 * of concurrent calls.
 */
class LedgerServiceTest {

    private static final AccountId ALICE = AccountId.filledWith(0x01);
    private static final AccountId BOB = AccountId.filledWith(0x02);

    private InMemoryStateStore stateStore;
    private List<TransferEvent> published;
    private SimpleMeterRegistry meterRegistry;
    private LedgerService ledgerService;

    @BeforeEach
    void setUp() {
        stateStore = new InMemoryStateStore();
        published = Collections.synchronizedList(new ArrayList<>());
        meterRegistry = new SimpleMeterRegistry();
        ledgerService = new LedgerService(stateStore, published::add, new LedgerMetrics(meterRegistry));
    }

    private static BigInteger amount(long value) {
        return BigInteger.valueOf(value);
    }

    @Test
    @DisplayName("Operations before creation are rejected")
    void testNotCreated() {
        assertFalse(ledgerService.isCreated());

        IllegalStateException exception = assertThrows(IllegalStateException.class,
            () -> ledgerService.transfer(ALICE, BOB, amount(1)));

        assertTrue(exception.getMessage().contains("not been created"));
        assertThrows(IllegalStateException.class, () -> ledgerService.balanceOf(ALICE));
        assertEquals(0, stateStore.saves);
    }

    @Test
    @DisplayName("Ledger can only be created once")
    void testCreateOnce() {
        LedgerState state = ledgerService.createLedger(ALICE, amount(1000));

        assertEquals(amount(1000), state.getTotalSupply());
        assertTrue(ledgerService.isCreated());
        assertEquals(1, stateStore.saves);

        assertThrows(IllegalStateException.class, () -> ledgerService.createDefaultLedger(BOB));
        assertEquals(amount(1000), ledgerService.balanceOf(ALICE));
        assertEquals(BigInteger.ZERO, ledgerService.balanceOf(BOB));
    }

    @Test
    @DisplayName("Default creation yields an empty ledger")
    void testCreateDefault() {
        ledgerService.createDefaultLedger(ALICE);

        assertEquals(BigInteger.ZERO, ledgerService.totalSupply());
        assertEquals(BigInteger.ZERO, ledgerService.balanceOf(ALICE));
    }

    @Test
    @DisplayName("Concrete scenario: transfer then transfer-from")
    void testTransferThenTransferFrom() {
        ledgerService.createLedger(ALICE, amount(1000));

        ledgerService.transfer(ALICE, BOB, amount(100));
        assertEquals(amount(100), ledgerService.balanceOf(BOB));
        assertEquals(amount(900), ledgerService.balanceOf(ALICE));

        ledgerService.transferFrom(ALICE, BOB, amount(50));
        assertEquals(amount(50), ledgerService.balanceOf(BOB));
        assertEquals(amount(950), ledgerService.balanceOf(ALICE));

        assertEquals(1, published.size(), "Only the plain transfer notifies");
        assertEquals(amount(50), stateStore.state.getBalances().get(BOB));
        assertEquals(3, stateStore.saves);
    }

    @Test
    @DisplayName("Rejected operations are neither persisted nor announced")
    void testFailedOperationNotPersisted() {
        ledgerService.createLedger(ALICE, amount(100));
        int savesBefore = stateStore.saves;

        assertThrows(InsufficientBalanceException.class,
            () -> ledgerService.transfer(ALICE, BOB, amount(200)));

        assertEquals(savesBefore, stateStore.saves);
        assertTrue(published.isEmpty());
        assertEquals(amount(100), ledgerService.balanceOf(ALICE));
        assertEquals(1.0, meterRegistry.counter("ledger.operations",
            "operation", "transfer", "outcome", "insufficient_balance").count());
    }

    @Test
    @DisplayName("Burn and issue report the resulting balance")
    void testBurnAndIssue() {
        ledgerService.createLedger(ALICE, amount(1000));

        assertEquals(BigInteger.ZERO, ledgerService.burn(ALICE, amount(1500)));
        assertEquals(amount(70), ledgerService.issue(null, BOB, amount(70)));
        assertEquals(amount(1000), ledgerService.totalSupply());
        assertTrue(published.isEmpty());
    }

    @Test
    @DisplayName("Approvals are stored and survive a restart")
    void testApproveSurvivesRestart() {
        ledgerService.createLedger(ALICE, amount(1000));
        ledgerService.approve(ALICE, BOB, amount(25));
        ledgerService.transfer(ALICE, BOB, amount(10));

        LedgerService restarted = new LedgerService(stateStore, published::add, new LedgerMetrics(meterRegistry));

        assertTrue(restarted.isCreated());
        assertEquals(amount(25), restarted.allowanceOf(ALICE, BOB));
        assertEquals(amount(990), restarted.balanceOf(ALICE));
        assertEquals(amount(10), restarted.balanceOf(BOB));
    }

    @Test
    @DisplayName("A failed save suppresses the notification and reloads the stored state")
    void testSaveFailure() {
        ledgerService.createLedger(ALICE, amount(1000));
        stateStore.failNextSave = true;

        assertThrows(DataAccessResourceFailureException.class,
            () -> ledgerService.transfer(ALICE, BOB, amount(100)));

        assertTrue(published.isEmpty(), "Nothing may be announced for an unsaved transfer");
        assertEquals(amount(1000), ledgerService.balanceOf(ALICE), "State reloaded from the store");
        assertEquals(BigInteger.ZERO, ledgerService.balanceOf(BOB));

        ledgerService.transfer(ALICE, BOB, amount(100));
        assertEquals(1, published.size());
        assertEquals(amount(900), ledgerService.balanceOf(ALICE));
        assertEquals(1.0, meterRegistry.counter("ledger.operations",
            "operation", "transfer", "outcome", "error").count());
    }

    @Test
    @DisplayName("A transfer saves only the two accounts it touched")
    void testSaveWritesTouchedEntriesOnly() {
        ledgerService.createLedger(ALICE, amount(1_000_000));
        for (int i = 0; i < 500; i++) {
            ledgerService.issue(null, AccountId.filledWith(0x10 + (i % 200)), amount(1));
        }
        ledgerService.approve(ALICE, BOB, amount(5));

        ledgerService.transfer(ALICE, BOB, amount(10));

        LedgerChange change = stateStore.lastChange;
        assertEquals(Map.of(ALICE, amount(999_990), BOB, amount(10)), change.getBalances());
        assertTrue(change.getAllowances().isEmpty());
        assertEquals(amount(1_000_000), change.getTotalSupply());
    }

    @Test
    @DisplayName("Queries and other calls proceed while a notification is still being delivered")
    void testSlowNotificationDoesNotHoldLedger() throws Exception {
        CountDownLatch deliveryStarted = new CountDownLatch(1);
        CountDownLatch releaseDelivery = new CountDownLatch(1);
        LedgerService service = new LedgerService(stateStore, event -> {
            deliveryStarted.countDown();
            try {
                releaseDelivery.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            published.add(event);
        }, new LedgerMetrics(meterRegistry));
        service.createLedger(ALICE, amount(1000));

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<?> transfer = executor.submit(() -> service.transfer(ALICE, BOB, amount(1)));
            assertTrue(deliveryStarted.await(5, TimeUnit.SECONDS));

            // the transfer is saved but its notification has not been delivered yet
            ExecutorService queries = Executors.newSingleThreadExecutor();
            try {
                Future<BigInteger> balance = queries.submit(() -> service.balanceOf(BOB));
                assertEquals(amount(1), balance.get(2, TimeUnit.SECONDS));
                Future<BigInteger> burned = queries.submit(() -> service.burn(ALICE, amount(9)));
                assertEquals(amount(990), burned.get(2, TimeUnit.SECONDS));
            } finally {
                queries.shutdownNow();
            }
            assertTrue(published.isEmpty());

            releaseDelivery.countDown();
            transfer.get(5, TimeUnit.SECONDS);
            assertEquals(1, published.size());
        } finally {
            releaseDelivery.countDown();
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Concurrent transfers are serialized and conserve the total")
    void testConcurrentTransfers() throws InterruptedException {
        ledgerService.createLedger(ALICE, amount(1000));

        int threadCount = 20;
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(threadCount);
        AtomicInteger successCount = new AtomicInteger(0);
        AtomicInteger rejectedCount = new AtomicInteger(0);

        // 20 threads each try to move 100 out of Alice's 1000: exactly 10 can succeed
        for (int i = 0; i < threadCount; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    ledgerService.transfer(ALICE, BOB, amount(100));
                    successCount.incrementAndGet();
                } catch (InsufficientBalanceException e) {
                    rejectedCount.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(10, TimeUnit.SECONDS));
        executor.shutdown();

        assertEquals(10, successCount.get());
        assertEquals(10, rejectedCount.get());
        assertEquals(BigInteger.ZERO, ledgerService.balanceOf(ALICE));
        assertEquals(amount(1000), ledgerService.balanceOf(BOB));
        assertEquals(10, published.size());
    }

    /**
     * Store that applies changes to in-memory tables and can be told to fail.
     */
    private static class InMemoryStateStore implements LedgerStateStore {
        private LedgerState state;
        private LedgerChange lastChange;
        private int saves;
        private boolean failNextSave;

        @Override
        public synchronized Optional<LedgerState> load() {
            return Optional.ofNullable(state);
        }

        @Override
        public synchronized void save(LedgerChange change) {
            if (failNextSave) {
                failNextSave = false;
                throw new DataAccessResourceFailureException("database unavailable");
            }
            Map<AccountId, BigInteger> balances = new HashMap<>();
            Map<AllowanceKey, BigInteger> allowances = new HashMap<>();
            if (state != null) {
                balances.putAll(state.getBalances());
                allowances.putAll(state.getAllowances());
            }
            balances.putAll(change.getBalances());
            change.getAllowances().forEach((key, amount) -> {
                if (amount.signum() == 0) {
                    allowances.remove(key);
                } else {
                    allowances.put(key, amount);
                }
            });
            state = new LedgerState(change.getTotalSupply(), balances, allowances);
            lastChange = change;
            saves++;
        }
    }
}
