package tl.java.engine;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tl.core.model.Decision;
import tl.core.model.TurnResult;
import tl.core.model.WaitTimeoutException;
import tl.core.scheduler.ManualScheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Core functional tests for TurnLimiter on virtual time.
 *
 * Focus:
 * - Immediate admission and queueing
 * - FIFO within a priority, precedence across priorities
 * - Wait timeouts
 * - Slot accounting and time until next admission
 * - Shutdown
 */
class TurnLimiterTest {

    private ManualScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new ManualScheduler();
    }

    private TurnLimiter limiter(int capacity, double windowSeconds) {
        return new TurnLimiter(scheduler, LimiterConfig.of(capacity, windowSeconds));
    }

    private static WaitTimeoutException timeoutOf(CompletableFuture<Void> future) {
        CompletionException thrown = assertThrows(CompletionException.class, future::join);
        assertInstanceOf(WaitTimeoutException.class, thrown.getCause());
        return (WaitTimeoutException) thrown.getCause();
    }

    @Test
    void testAwaitTurn_admitsImmediatelyWithinCapacity() {
        TurnLimiter limiter = limiter(2, 10);

        assertTrue(limiter.awaitTurn().isDone());
        assertTrue(limiter.awaitTurn(-4).isDone());

        assertEquals(2, limiter.usedSlots());
        assertTrue(limiter.isEmpty());
    }

    @Test
    void testAwaitTurn_sequentialWindows() {
        // capacity=1, window=10s, three calls at t=0
        TurnLimiter limiter = limiter(1, 10);
        assertEquals(0, limiter.usedSlots());

        CompletableFuture<Void> first = limiter.awaitTurn();
        CompletableFuture<Void> second = limiter.awaitTurn();
        CompletableFuture<Void> third = limiter.awaitTurn();

        assertTrue(first.isDone());
        assertFalse(second.isDone());
        assertFalse(third.isDone());
        assertEquals(1, limiter.usedSlots());
        assertEquals(2, limiter.length());

        scheduler.advanceSeconds(9.999);
        assertFalse(second.isDone(), "Second turn must wait for the full window");

        scheduler.advanceSeconds(0.001);
        assertTrue(second.isDone());
        assertFalse(third.isDone());
        assertEquals(1, limiter.usedSlots());

        scheduler.advanceSeconds(10);
        assertTrue(third.isDone());
        assertEquals(1, limiter.usedSlots());
        assertTrue(limiter.isEmpty());

        scheduler.advanceSeconds(10);
        assertEquals(0, limiter.usedSlots());
        assertEquals(Duration.ZERO, limiter.timeUntilNextAdmission());
    }

    @Test
    void testTimeout_failsBeforeSlotFrees() {
        // capacity=1, window=10s, slot busy until t=10; at t=1 a waiter with a 3s timeout
        TurnLimiter limiter = limiter(1, 10);
        limiter.awaitTurn();

        scheduler.advanceSeconds(1);
        CompletableFuture<Void> waiter = limiter.awaitTurn(5, Duration.ofSeconds(3));
        assertEquals(1, limiter.length());

        scheduler.advanceSeconds(2.999);
        assertFalse(waiter.isDone());
        assertEquals(1, limiter.length());

        scheduler.advanceSeconds(0.001);
        assertTrue(waiter.isCompletedExceptionally());
        assertEquals(0, limiter.length());
        assertTrue(limiter.isEmpty());

        WaitTimeoutException timeout = timeoutOf(waiter);
        assertEquals("Limiter timed out.", timeout.getMessage());
        assertEquals(5, timeout.priority());
    }

    @Test
    void testPriority_higherAdmittedFirstDespiteLaterEnqueue() {
        TurnLimiter limiter = limiter(1, 10);
        limiter.awaitTurn();

        scheduler.advanceSeconds(2);
        CompletableFuture<Void> low = limiter.awaitTurn(1);
        scheduler.advanceSeconds(1);
        CompletableFuture<Void> high = limiter.awaitTurn(5);

        scheduler.advanceSeconds(7);

        assertTrue(high.isDone());
        assertFalse(low.isDone());

        scheduler.advanceSeconds(10);
        assertTrue(low.isDone());
    }

    @Test
    void testFifo_withinPriority() {
        TurnLimiter limiter = limiter(1, 1);
        limiter.awaitTurn();

        List<Integer> order = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            int id = i;
            limiter.awaitTurn(3).thenRun(() -> order.add(id));
        }

        scheduler.advanceSeconds(10);

        assertEquals(List.of(0, 1, 2, 3, 4), order);
    }

    @Test
    void testTimeout_middleWaiterLeavesOrderIntact() {
        TurnLimiter limiter = limiter(1, 10);
        limiter.awaitTurn();

        List<String> order = new ArrayList<>();
        limiter.awaitTurn(0).thenRun(() -> order.add("a"));
        CompletableFuture<Void> b = limiter.awaitTurn(0, Duration.ofSeconds(5));
        limiter.awaitTurn(0).thenRun(() -> order.add("c"));
        limiter.awaitTurn(0, Duration.ofSeconds(35)).thenRun(() -> order.add("d"));

        scheduler.advanceSeconds(5);
        assertTrue(b.isCompletedExceptionally());
        assertEquals(3, limiter.length());

        scheduler.advanceSeconds(35);
        assertEquals(List.of("a", "c", "d"), order);
    }

    @Test
    void testTimeout_releaseAtSameInstantWins() {
        // release armed first, so it fires first when both fall due together
        TurnLimiter limiter = limiter(1, 10);
        limiter.awaitTurn();
        CompletableFuture<Void> waiter = limiter.awaitTurn(0, Duration.ofSeconds(10));

        scheduler.advanceSeconds(10);

        assertTrue(waiter.isDone());
        assertFalse(waiter.isCompletedExceptionally());
        assertEquals(1, scheduler.pendingTimers(), "Only the new release timer stays armed");
    }

    @Test
    void testAdmission_disarmsDeadline() {
        TurnLimiter limiter = limiter(1, 10);
        limiter.awaitTurn();
        CompletableFuture<Void> waiter = limiter.awaitTurn(0, Duration.ofSeconds(60));

        scheduler.advanceSeconds(10);
        assertTrue(waiter.isDone());

        scheduler.advanceSeconds(100);
        assertFalse(waiter.isCompletedExceptionally(), "Admitted waiter must never time out afterwards");
    }

    @Test
    void testTimeout_doesNotConsumeSlot() {
        TurnLimiter limiter = limiter(1, 10);
        limiter.awaitTurn();
        CompletableFuture<Void> impatient = limiter.awaitTurn(9, Duration.ofSeconds(1));
        CompletableFuture<Void> patient = limiter.awaitTurn(0);

        scheduler.advanceSeconds(10);

        assertTrue(impatient.isCompletedExceptionally());
        assertTrue(patient.isDone());
        assertFalse(patient.isCompletedExceptionally());
        assertEquals(1, limiter.usedSlots());
    }

    @Test
    void testRetryAfterTimeout_joinsBackOfLane() {
        TurnLimiter limiter = limiter(1, 10);
        limiter.awaitTurn();
        CompletableFuture<Void> impatient = limiter.awaitTurn(0, Duration.ofSeconds(1));
        CompletableFuture<Void> other = limiter.awaitTurn(0);

        scheduler.advanceSeconds(1);
        timeoutOf(impatient);
        CompletableFuture<Void> retried = limiter.awaitTurn(0);

        scheduler.advanceSeconds(9);
        assertTrue(other.isDone());
        assertFalse(retried.isDone());

        scheduler.advanceSeconds(10);
        assertTrue(retried.isDone());
    }

    @Test
    void testCapacity_neverExceededUnderMixedLoad() {
        int capacity = 3;
        double window = 2.0;
        TurnLimiter limiter = limiter(capacity, window);
        Random random = new Random(42);
        List<Long> admittedAt = new ArrayList<>();
        int[] resolutions = new int[1];
        List<CompletableFuture<Void>> futures = new ArrayList<>();

        for (int i = 0; i < 200; i++) {
            int priority = random.nextInt(4);
            Duration timeout = random.nextInt(3) == 0 ? Duration.ofMillis(500 + random.nextInt(5_000)) : Duration.ZERO;
            CompletableFuture<Void> future = limiter.awaitTurn(priority, timeout);
            future.whenComplete((ok, error) -> {
                resolutions[0]++;
                if (error == null) admittedAt.add(scheduler.clock().nowNanos());
            });
            futures.add(future);
            scheduler.advanceNanos(random.nextInt(300_000_000));
            assertTrue(limiter.usedSlots() <= capacity);
        }
        scheduler.advanceSeconds(1_000);

        assertEquals(futures.size(), resolutions[0], "Every call resolves exactly once");
        assertTrue(limiter.isEmpty());

        long windowNanos = limiter.config().windowNanos();
        for (int i = 0; i < admittedAt.size(); i++) {
            long start = admittedAt.get(i);
            long inWindow = admittedAt.stream().filter(t -> t >= start && t < start + windowNanos).count();
            assertTrue(inWindow <= capacity, "More than " + capacity + " admissions within one window");
        }
    }

    @Test
    void testTimeout_whenBeyondNanosecondRange_waitsLikeAnyOtherWaiter() {
        TurnLimiter limiter = limiter(1, 10);
        limiter.awaitTurn();

        CompletableFuture<Void> patient = limiter.awaitTurn(0, Duration.ofSeconds(Long.MAX_VALUE / 2));
        CompletableFuture<Void> next = limiter.awaitTurn();
        assertFalse(patient.isDone());
        assertEquals(2, limiter.length());

        scheduler.advanceSeconds(10);
        assertTrue(patient.isDone());
        assertFalse(patient.isCompletedExceptionally());
        assertFalse(next.isDone());
        assertEquals(1, limiter.length());

        scheduler.advanceSeconds(10);
        assertTrue(next.isDone(), "Caller behind the long wait keeps its place in line");
        assertTrue(limiter.isEmpty());
        assertEquals(1, limiter.usedSlots());
    }

    @Test
    void testTimeout_whenMaxDuration_neverFires() {
        TurnLimiter limiter = limiter(1, 10);
        limiter.awaitTurn();
        limiter.awaitTurn();

        CompletableFuture<Void> waiter = limiter.awaitTurn(1, Duration.ofSeconds(Long.MAX_VALUE, 999_999_999));
        assertEquals(2, limiter.length());

        scheduler.advanceSeconds(10);
        assertTrue(waiter.isDone(), "Higher priority waiter takes the first released slot");
        assertFalse(waiter.isCompletedExceptionally());
    }

    @Test
    void testContinuation_mayReenterLimiter() {
        TurnLimiter limiter = limiter(1, 1);
        limiter.awaitTurn();
        List<CompletableFuture<Void>> chained = new ArrayList<>();

        limiter.awaitTurn().thenRun(() -> chained.add(limiter.awaitTurn()));

        scheduler.advanceSeconds(1);
        assertEquals(1, chained.size());
        assertFalse(chained.get(0).isDone());
        assertEquals(1, limiter.length());

        scheduler.advanceSeconds(1);
        assertTrue(chained.get(0).isDone());
    }

    @Test
    void testTryTurn_allowThenRejectWithRetryAfter() {
        TurnLimiter limiter = limiter(1, 10);

        assertEquals(Decision.ALLOW, limiter.tryTurn().decision());

        scheduler.advanceSeconds(3);
        TurnResult rejected = limiter.tryTurn();
        assertEquals(Decision.REJECT, rejected.decision());
        assertEquals(7_000_000_000L, rejected.retryAfterNanos());
        assertEquals(0, limiter.length(), "tryTurn never queues");

        scheduler.advanceSeconds(7);
        assertTrue(limiter.tryTurn().allowed());
    }

    @Test
    void testTimeUntilNextAdmission() {
        TurnLimiter limiter = limiter(2, 10);
        assertEquals(Duration.ZERO, limiter.timeUntilNextAdmission());

        limiter.awaitTurn();
        scheduler.advanceSeconds(4);
        limiter.awaitTurn();

        assertEquals(Duration.ofSeconds(6), limiter.timeUntilNextAdmission());

        scheduler.advanceSeconds(6);
        assertEquals(Duration.ofSeconds(4), limiter.timeUntilNextAdmission());
    }

    @Test
    void testClose_cancelsWaitersAndRejectsNewCalls() {
        TurnLimiter limiter = limiter(1, 10);
        CompletableFuture<Void> admitted = limiter.awaitTurn();
        CompletableFuture<Void> waiting = limiter.awaitTurn(0, Duration.ofSeconds(5));

        limiter.close();
        limiter.close();

        assertTrue(admitted.isDone());
        assertThrows(CancellationException.class, waiting::join);
        assertEquals(0, limiter.length());
        assertEquals(0, scheduler.pendingTimers());
        assertThrows(IllegalStateException.class, limiter::awaitTurn);
        assertThrows(IllegalStateException.class, limiter::tryTurn);
    }

    @Test
    void testConfigAccessors() {
        TurnLimiter limiter = limiter(4, 0.25);

        assertEquals(4, limiter.capacity());
        assertEquals(Duration.ofMillis(250), limiter.window());
    }

    @Test
    void testInvalidArguments() {
        LimiterConfig config = LimiterConfig.of(1, 1.0);

        assertThrows(IllegalArgumentException.class, () -> new TurnLimiter(null, config));
        assertThrows(IllegalArgumentException.class, () -> new TurnLimiter(scheduler, null));

        TurnLimiter limiter = new TurnLimiter(scheduler, config);
        assertThrows(IllegalArgumentException.class, () -> limiter.awaitTurn(0, null));
        assertThrows(IllegalArgumentException.class, () -> limiter.awaitTurn(0, Duration.ofSeconds(-1)));
    }
}
