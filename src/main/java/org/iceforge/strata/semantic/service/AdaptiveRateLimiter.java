package org.iceforge.strata.semantic.service;

import org.iceforge.strata.semantic.compiler.SemanticCompileException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * Paces, times out and retries asynchronous calls, adapting the pace per call target.
 *
 * <p>Each target owns a pacing window [min, max]. A call starts no sooner than (min + max) / 2 after the
 * previous call to the same target. A success narrows the window (speed up); a timeout or error widens it
 * (slow down, at most once per slow-down interval) and the call is retried, up to {@code maxAttempts}
 * attempts in total. Compile errors are deterministic and pass through without retry.
 */
public class AdaptiveRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(AdaptiveRateLimiter.class);

    private static final double SLOW_DOWN_FACTOR = 1.01;
    private static final double SPEED_UP_FACTOR = 0.999;

    private final double defaultMinNanos;
    private final double defaultMaxNanos;
    private final Duration timeout;
    private final long slowdownIntervalNanos;
    private final int maxAttempts;
    private final LongSupplier nanoClock;

    private final Object lock = new Object();
    private final Map<String, PacingWindow> windows = new HashMap<>();
    private long lastSlowdown;

    public AdaptiveRateLimiter(Duration minDelay, Duration maxDelay, Duration timeout,
                               Duration slowdownInterval, int maxAttempts) {
        this(minDelay, maxDelay, timeout, slowdownInterval, maxAttempts, System::nanoTime);
    }

    AdaptiveRateLimiter(Duration minDelay, Duration maxDelay, Duration timeout,
                        Duration slowdownInterval, int maxAttempts, LongSupplier nanoClock) {
        if (minDelay.isNegative() || maxDelay.compareTo(minDelay) < 0) {
            throw new IllegalArgumentException("require 0 <= minDelay <= maxDelay");
        }
        if (maxAttempts <= 0) throw new IllegalArgumentException("maxAttempts must be > 0");
        this.defaultMinNanos = minDelay.toNanos();
        this.defaultMaxNanos = maxDelay.toNanos();
        this.timeout = Objects.requireNonNull(timeout);
        this.slowdownIntervalNanos = slowdownInterval.toNanos();
        this.maxAttempts = maxAttempts;
        this.nanoClock = Objects.requireNonNull(nanoClock);
        this.lastSlowdown = nanoClock.getAsLong() - slowdownIntervalNanos - 1;
    }

    public <T> Mono<T> call(String target, Supplier<Mono<T>> call) {
        Objects.requireNonNull(target);
        Objects.requireNonNull(call);

        Mono<T> attempt = Mono.defer(() -> Mono.delay(reserveSlot(target))
                .then(Mono.defer(call).timeout(timeout))
                .doOnSuccess(v -> speedUp(target))
                .doOnError(AdaptiveRateLimiter::isRetryable, e -> slowDown(target)));

        return attempt.retryWhen(Retry.max(maxAttempts - 1L)
                .filter(AdaptiveRateLimiter::isRetryable)
                .doBeforeRetry(signal -> log.warn("Retrying '{}' (attempt {} of {}) after: {}",
                        target, signal.totalRetries() + 2, maxAttempts, signal.failure().toString()))
                .onRetryExhaustedThrow((spec, signal) ->
                        new RateLimitExhaustedException(target, signal.totalRetries() + 1, signal.failure())));
    }

    /**
     * Current pacing window of a target, or the default window if the target was never called.
     */
    public Window window(String target) {
        synchronized (lock) {
            PacingWindow w = windows.get(target);
            if (w == null) {
                return new Window(Duration.ofNanos((long) defaultMinNanos), Duration.ofNanos((long) defaultMaxNanos));
            }
            return new Window(Duration.ofNanos((long) w.minNanos), Duration.ofNanos((long) w.maxNanos));
        }
    }

    private Duration reserveSlot(String target) {
        synchronized (lock) {
            long now = nanoClock.getAsLong();
            PacingWindow w = windows.computeIfAbsent(target, t -> newWindow(now));
            long start = Math.max(now, w.lastRequest + (long) w.midNanos());
            w.lastRequest = start;
            return Duration.ofNanos(start - now);
        }
    }

    private PacingWindow newWindow(long now) {
        PacingWindow w = new PacingWindow(defaultMinNanos, defaultMaxNanos);
        // first call to a target goes out immediately
        w.lastRequest = now - (long) w.midNanos();
        return w;
    }

    private void slowDown(String target) {
        synchronized (lock) {
            long now = nanoClock.getAsLong();
            if (now - lastSlowdown <= slowdownIntervalNanos) {
                return;
            }
            lastSlowdown = now;
            PacingWindow w = windows.computeIfAbsent(target, t -> newWindow(now));
            w.minNanos = w.midNanos();
            w.maxNanos *= SLOW_DOWN_FACTOR;
            log.debug("slow down: {} min={}ns max={}ns", target, (long) w.minNanos, (long) w.maxNanos);
        }
    }

    private void speedUp(String target) {
        synchronized (lock) {
            PacingWindow w = windows.computeIfAbsent(target, t -> newWindow(nanoClock.getAsLong()));
            w.maxNanos = w.midNanos();
            w.minNanos *= SPEED_UP_FACTOR;
            log.trace("speed up: {} min={}ns max={}ns", target, (long) w.minNanos, (long) w.maxNanos);
        }
    }

    private static boolean isRetryable(Throwable t) {
        return !(t instanceof SemanticCompileException);
    }

    public record Window(Duration minDelay, Duration maxDelay) {
        public Duration midDelay() {
            return minDelay.plus(maxDelay).dividedBy(2);
        }
    }

    private static final class PacingWindow {
        double minNanos;
        double maxNanos;
        long lastRequest;

        PacingWindow(double minNanos, double maxNanos) {
            this.minNanos = minNanos;
            this.maxNanos = maxNanos;
        }

        double midNanos() {
            return (minNanos + maxNanos) / 2;
        }
    }
}
