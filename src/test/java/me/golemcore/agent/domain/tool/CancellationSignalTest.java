package me.golemcore.agent.domain.tool;

import me.golemcore.agent.domain.exception.OperationCancelledException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CancellationSignalTest {

    @Test
    void shouldReportReasonOnceCancelled() {
        CancellationSignal signal = new CancellationSignal();
        assertFalse(signal.isCancelled());
        assertNull(signal.getReason());

        signal.cancel("user abort");
        signal.cancel("second");

        assertTrue(signal.isCancelled());
        assertEquals("user abort", signal.getReason());
    }

    @Test
    void shouldRunCallbacksOnCancel() {
        CancellationSignal signal = new CancellationSignal();
        AtomicInteger calls = new AtomicInteger();
        signal.onCancel(calls::incrementAndGet);

        signal.cancel(null);
        signal.onCancel(calls::incrementAndGet);

        assertEquals(2, calls.get());
        assertEquals("cancelled", signal.getReason());
    }

    @Test
    void shouldThrowIfCancelled() {
        CancellationSignal signal = new CancellationSignal();
        signal.throwIfCancelled();

        signal.cancel("stop");

        OperationCancelledException ex = assertThrows(OperationCancelledException.class, signal::throwIfCancelled);
        assertEquals("stop", ex.getMessage());
    }

    @Test
    void shouldReturnCompletedFutureValue() throws Exception {
        CancellationSignal signal = new CancellationSignal();

        assertEquals("done", signal.await(CompletableFuture.completedFuture("done"), 1, TimeUnit.SECONDS));
    }

    @Test
    void shouldCancelPendingFutureWhenSignalFires() {
        CancellationSignal signal = new CancellationSignal();
        CompletableFuture<String> pending = new CompletableFuture<>();
        signal.cancel("abort");

        assertThrows(OperationCancelledException.class, () -> signal.await(pending, 0, TimeUnit.SECONDS));
        assertTrue(pending.isCancelled());
    }

    @Test
    void shouldPropagateFutureFailure() {
        CancellationSignal signal = new CancellationSignal();
        CompletableFuture<String> failed = CompletableFuture.failedFuture(new IllegalStateException("broken"));

        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> signal.await(failed, 1, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, ex.getCause());
    }

    @Test
    void shouldTimeOut() {
        CancellationSignal signal = new CancellationSignal();

        assertThrows(TimeoutException.class,
                () -> signal.await(new CompletableFuture<String>(), 20, TimeUnit.MILLISECONDS));
    }

    @Test
    void shouldWakeSleepOnCancel() throws Exception {
        CancellationSignal signal = new CancellationSignal();
        assertFalse(signal.sleep(5));

        signal.cancel("stop");

        assertTrue(signal.sleep(10_000));
        assertTrue(signal.sleep(0));
    }

    @Test
    void shouldNotCancelSignalThroughDerivedFuture() {
        CancellationSignal signal = new CancellationSignal();

        signal.whenCancelled().complete("forged");

        assertFalse(signal.isCancelled());
    }
}
