package org.iceforge.strata.semantic.service;

import org.iceforge.strata.semantic.compiler.UnknownMetricException;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class AdaptiveRateLimiterTest {

    private static AdaptiveRateLimiter limiter(int maxAttempts) {
        return new AdaptiveRateLimiter(Duration.ofMillis(2), Duration.ofMillis(4), Duration.ofMillis(500),
                Duration.ZERO, maxAttempts);
    }

    @Test
    void retriesTransientFailuresUntilSuccess() {
        AdaptiveRateLimiter limiter = limiter(5);
        AtomicInteger attempts = new AtomicInteger();

        Mono<String> call = limiter.call("generate", () -> attempts.incrementAndGet() < 3
                ? Mono.<String>error(new QueryGenerationException("transport error"))
                : Mono.just("ok"));

        StepVerifier.create(call).expectNext("ok").verifyComplete();
        assertThat(attempts).hasValue(3);
    }

    @Test
    void surfacesTerminalErrorWhenAttemptsAreExhausted() {
        AdaptiveRateLimiter limiter = limiter(3);
        AtomicInteger attempts = new AtomicInteger();

        Mono<String> call = limiter.call("generate", () -> {
            attempts.incrementAndGet();
            return Mono.error(new QueryGenerationException("still down"));
        });

        StepVerifier.create(call)
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(RateLimitExhaustedException.class);
                    assertThat(((RateLimitExhaustedException) e).getAttempts()).isEqualTo(3);
                    assertThat(((RateLimitExhaustedException) e).getTarget()).isEqualTo("generate");
                    assertThat(e.getCause()).hasMessage("still down");
                })
                .verify(Duration.ofSeconds(5));
        assertThat(attempts).hasValue(3);
    }

    @Test
    void compileErrorsAreNotRetried() {
        AdaptiveRateLimiter limiter = limiter(5);
        AtomicInteger attempts = new AtomicInteger();

        Mono<String> call = limiter.call("generate", () -> {
            attempts.incrementAndGet();
            return Mono.error(new UnknownMetricException("total_revenue"));
        });

        StepVerifier.create(call).expectError(UnknownMetricException.class).verify(Duration.ofSeconds(5));
        assertThat(attempts).hasValue(1);
        assertThat(limiter.window("generate").minDelay()).isEqualTo(Duration.ofMillis(2));
    }

    @Test
    void timesOutSlowAttempts() {
        AdaptiveRateLimiter limiter = new AdaptiveRateLimiter(Duration.ZERO, Duration.ofMillis(1),
                Duration.ofMillis(50), Duration.ZERO, 2);

        StepVerifier.create(limiter.call("generate", Mono::<String>never))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(RateLimitExhaustedException.class);
                    assertThat(e.getCause()).isInstanceOf(TimeoutException.class);
                })
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void successNarrowsTheWindow() {
        AdaptiveRateLimiter limiter = limiter(1);

        StepVerifier.create(limiter.call("generate", () -> Mono.just(1))).expectNext(1).verifyComplete();

        AdaptiveRateLimiter.Window w = limiter.window("generate");
        assertThat(w.maxDelay()).isEqualTo(Duration.ofMillis(3));
        assertThat(w.minDelay().toNanos()).isCloseTo(1_998_000L, within(10L));
    }

    @Test
    void failureWidensTheWindow() {
        AdaptiveRateLimiter limiter = limiter(1);

        StepVerifier.create(limiter.call("generate", () -> Mono.error(new IllegalStateException("boom"))))
                .expectError(RateLimitExhaustedException.class)
                .verify(Duration.ofSeconds(5));

        AdaptiveRateLimiter.Window w = limiter.window("generate");
        assertThat(w.minDelay()).isEqualTo(Duration.ofMillis(3));
        assertThat(w.maxDelay().toNanos()).isCloseTo(4_040_000L, within(10L));
    }

    @Test
    void slowDownsAreRateLimited() {
        AtomicLong clock = new AtomicLong(1_000_000_000L);
        AdaptiveRateLimiter limiter = new AdaptiveRateLimiter(Duration.ofMillis(2), Duration.ofMillis(4),
                Duration.ofMillis(500), Duration.ofMillis(10), 3, clock::get);

        StepVerifier.create(limiter.call("generate", () -> Mono.error(new IllegalStateException("boom"))))
                .expectError(RateLimitExhaustedException.class)
                .verify(Duration.ofSeconds(5));

        // the clock never moved, so only the first of three failures widened the window
        assertThat(limiter.window("generate").minDelay()).isEqualTo(Duration.ofMillis(3));
    }

    @Test
    void targetsArePacedIndependently() {
        AdaptiveRateLimiter limiter = limiter(1);

        StepVerifier.create(limiter.call("a", () -> Mono.error(new IllegalStateException("boom"))))
                .expectError(RateLimitExhaustedException.class)
                .verify(Duration.ofSeconds(5));

        assertThat(limiter.window("a").minDelay()).isEqualTo(Duration.ofMillis(3));
        assertThat(limiter.window("b").minDelay()).isEqualTo(Duration.ofMillis(2));
    }

    @Test
    void spacesConsecutiveCallsToTheSameTarget() {
        AdaptiveRateLimiter limiter = new AdaptiveRateLimiter(Duration.ofMillis(100), Duration.ofMillis(100),
                Duration.ofSeconds(1), Duration.ZERO, 1);
        List<Long> starts = new CopyOnWriteArrayList<>();

        Mono<Integer> call = limiter.call("generate", () -> Mono.fromCallable(() -> {
            starts.add(System.nanoTime());
            return 1;
        }));

        StepVerifier.create(call.then(call)).expectNext(1).verifyComplete();

        assertThat(starts).hasSize(2);
        assertThat(Duration.ofNanos(starts.get(1) - starts.get(0))).isGreaterThanOrEqualTo(Duration.ofMillis(90));
    }
}
