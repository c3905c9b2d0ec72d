package dev.agentsdk.claude.hooks;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AbortSignalTest {

    @Test
    void listenersRunOnceOnFirstAbort() {
        AbortSignal signal = new AbortSignal();
        AtomicInteger calls = new AtomicInteger();
        signal.onAbort(calls::incrementAndGet);

        signal.abort("Cancelled");
        signal.abort("again");

        assertThat(calls.get()).isEqualTo(1);
        assertThat(signal.getReason()).isEqualTo("Cancelled");
        assertThat(signal.asCompletableFuture()).isDone();
    }

    @Test
    void lateListenerRunsImmediately() {
        AbortSignal signal = AbortSignal.aborted("gone");
        AtomicInteger calls = new AtomicInteger();

        signal.onAbort(calls::incrementAndGet);

        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void failingListenerDoesNotStopOthers() {
        AbortSignal signal = new AbortSignal();
        AtomicInteger calls = new AtomicInteger();
        signal.onAbort(() -> {
            throw new IllegalStateException("listener bug");
        });
        signal.onAbort(calls::incrementAndGet);

        signal.abort();

        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void throwIfAbortedCarriesReason() {
        AbortSignal signal = new AbortSignal();
        signal.throwIfAborted();
        signal.abort("Cancelled");

        assertThatThrownBy(signal::throwIfAborted)
                .isInstanceOf(CancellationException.class)
                .hasMessage("Cancelled");
    }
}
