package org.iceforge.strata.semantic.service;

public class RateLimitExhaustedException extends RuntimeException {

    private final String target;
    private final long attempts;

    public RateLimitExhaustedException(String target, long attempts, Throwable lastFailure) {
        super("Call to '" + target + "' failed after " + attempts + " attempt(s): "
                + (lastFailure == null ? "unknown error" : lastFailure.toString()), lastFailure);
        this.target = target;
        this.attempts = attempts;
    }

    public String getTarget() {
        return target;
    }

    public long getAttempts() {
        return attempts;
    }
}
