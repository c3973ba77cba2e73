package fr.lapetina.arena.round.exception;

import java.time.Duration;

/**
 * Thrown when fewer than two models are eligible for a round. The caller should
 * retry after {@link #getRetryAfter()}.
 */
public final class InsufficientModelsException extends RuntimeException {

    private final int eligible;
    private final Duration retryAfter;

    public InsufficientModelsException(int eligible, Duration retryAfter) {
        super("Not enough models available right now (" + eligible + " eligible), try again shortly");
        this.eligible = eligible;
        this.retryAfter = retryAfter;
    }

    public int getEligible() {
        return eligible;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }
}
