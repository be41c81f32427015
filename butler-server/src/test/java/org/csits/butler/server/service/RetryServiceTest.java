package org.csits.butler.server.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class RetryServiceTest {

    private final RetryService retryService = new RetryService();

    @Test
    void executeWithRetry_succeedsAfterFailures() {
        AtomicInteger calls = new AtomicInteger();

        String result = retryService.executeWithRetry(() -> {
            if (calls.incrementAndGet() < 3) {
                throw new IllegalStateException("not yet");
            }
            return "ok";
        }, 3, Duration.ZERO, "test");

        assertThat(result).isEqualTo("ok");
        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    void executeWithRetry_throwsLastExceptionWhenExhausted() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> retryService.executeWithRetry(() -> {
            throw new IllegalStateException("fail " + calls.incrementAndGet());
        }, 2, Duration.ZERO, "test"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("fail 3");
    }

    @Test
    void awaitCondition_boundedAttempts() {
        AtomicInteger checks = new AtomicInteger();

        assertThat(retryService.awaitCondition(() -> checks.incrementAndGet() >= 2, 5, Duration.ZERO, "ready"))
            .isTrue();
        assertThat(checks.get()).isEqualTo(2);

        checks.set(0);
        assertThat(retryService.awaitCondition(() -> {
            checks.incrementAndGet();
            return false;
        }, 4, Duration.ofMillis(1), "never")).isFalse();
        assertThat(checks.get()).isEqualTo(4);
    }
}
