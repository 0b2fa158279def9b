package com.smurthy.ai.search.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class CancellationTest {

    @Test
    @DisplayName("Listeners run once, however often cancel is called")
    void testListenersRunOnce() {
        // Given
        Cancellation cancellation = new Cancellation();
        AtomicInteger runs = new AtomicInteger();
        cancellation.onCancel(runs::incrementAndGet);

        // When
        cancellation.cancel();
        cancellation.cancel();

        // Then
        assertThat(cancellation.isCancelled()).isTrue();
        assertThat(runs).hasValue(1);
    }

    @Test
    @DisplayName("A listener registered after cancel runs immediately")
    void testLateRegistration() {
        Cancellation cancellation = new Cancellation();
        cancellation.cancel();
        AtomicInteger runs = new AtomicInteger();

        cancellation.onCancel(runs::incrementAndGet);

        assertThat(runs).hasValue(1);
    }

    @Test
    @DisplayName("Closing a registration removes its listener")
    void testClosedRegistration() {
        Cancellation cancellation = new Cancellation();
        AtomicInteger runs = new AtomicInteger();

        try (Cancellation.Registration ignored = cancellation.onCancel(runs::incrementAndGet)) {
            assertThat(cancellation.isCancelled()).isFalse();
        }
        cancellation.cancel();

        assertThat(runs).hasValue(0);
    }

    @Test
    @DisplayName("A failing listener does not stop the others")
    void testFailingListener() {
        Cancellation cancellation = new Cancellation();
        AtomicInteger runs = new AtomicInteger();
        cancellation.onCancel(() -> {
            throw new IllegalStateException("boom");
        });
        cancellation.onCancel(runs::incrementAndGet);

        cancellation.cancel();

        assertThat(runs).hasValue(1);
    }
}
