package com.dpmfinder.common.retry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class BackoffPolicyTest {

    @Nested
    @DisplayName("delayFor()")
    class DelayFor {

        private final BackoffPolicy policy =
            new BackoffPolicy(10, Duration.ofSeconds(2), Duration.ofSeconds(30));

        @Test
        @DisplayName("doubles per retry")
        void doubles() {
            assertEquals(Duration.ofSeconds(2), policy.delayFor(1));
            assertEquals(Duration.ofSeconds(4), policy.delayFor(2));
            assertEquals(Duration.ofSeconds(8), policy.delayFor(3));
            assertEquals(Duration.ofSeconds(16), policy.delayFor(4));
        }

        @Test
        @DisplayName("is capped at maxDelay, even for huge retry numbers")
        void capped() {
            assertEquals(Duration.ofSeconds(30), policy.delayFor(5));
            assertEquals(Duration.ofSeconds(30), policy.delayFor(500));
        }

        @Test
        @DisplayName("retry numbers start at 1")
        void rejectsZero() {
            assertThrows(IllegalArgumentException.class, () -> policy.delayFor(0));
        }

        @Test
        @DisplayName("max below base is raised to base")
        void maxBelowBase() {
            BackoffPolicy p = new BackoffPolicy(3, Duration.ofSeconds(5), Duration.ofSeconds(1));
            assertEquals(Duration.ofSeconds(5), p.maxDelay());
        }
    }

    @Nested
    @DisplayName("retrySpec()")
    class RetrySpec {

        private final BackoffPolicy policy =
            new BackoffPolicy(3, Duration.ofMillis(1), Duration.ofMillis(4));

        @Test
        @DisplayName("gives up after maxAttempts and reports the attempt count")
        void exhausts() {
            AtomicInteger calls = new AtomicInteger();
            Mono<String> failing = Mono.defer(() -> {
                calls.incrementAndGet();
                return Mono.error(new IllegalStateException("boom"));
            });

            StepVerifier.create(failing.retryWhen(policy.retrySpec("test", e -> true,
                    (e, attempts) -> new RuntimeException("gave up after " + attempts, e))))
                .expectErrorMessage("gave up after 3")
                .verify(Duration.ofSeconds(5));
            assertEquals(3, calls.get());
        }

        @Test
        @DisplayName("non-retryable errors stop immediately")
        void nonRetryable() {
            AtomicInteger calls = new AtomicInteger();
            Mono<String> failing = Mono.defer(() -> {
                calls.incrementAndGet();
                return Mono.error(new IllegalArgumentException("bad request"));
            });

            StepVerifier.create(failing.retryWhen(policy.retrySpec("test",
                    e -> !(e instanceof IllegalArgumentException),
                    (e, attempts) -> new RuntimeException("attempts=" + attempts, e))))
                .expectErrorMessage("attempts=1")
                .verify(Duration.ofSeconds(5));
            assertEquals(1, calls.get());
        }

        @Test
        @DisplayName("recovers when a later attempt succeeds")
        void recovers() {
            AtomicInteger calls = new AtomicInteger();
            Mono<String> flaky = Mono.defer(() -> calls.incrementAndGet() < 3
                ? Mono.error(new IllegalStateException("flaky"))
                : Mono.just("ok"));

            StepVerifier.create(flaky.retryWhen(policy.retrySpec("test", e -> true, (e, n) -> e)))
                .expectNext("ok")
                .verifyComplete();
        }
    }
}
