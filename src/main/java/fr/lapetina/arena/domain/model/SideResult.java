package fr.lapetina.arena.domain.model;

import java.time.Duration;

/**
 * Outcome of one side of a round: completion text on success, error kind on failure.
 * Carries no model identity so it can be shown before the vote.
 */
public record SideResult(
        String text,
        Duration latency,
        int tokenCount,
        int attempts,
        ErrorType errorType,
        String errorMessage
) {
    public SideResult {
        if (latency == null) {
            latency = Duration.ZERO;
        }
        if (errorType == null && (text == null || text.isBlank())) {
            throw new IllegalArgumentException("A successful side needs completion text");
        }
    }

    public boolean isSuccess() {
        return errorType == null;
    }

    public boolean isFailure() {
        return errorType != null;
    }

    public static SideResult success(String text, Duration latency, int tokenCount, int attempts) {
        return new SideResult(text, latency, tokenCount, attempts, null, null);
    }

    public static SideResult failure(ErrorType errorType, String errorMessage, Duration latency, int attempts) {
        return new SideResult(null, latency, 0, attempts, errorType, errorMessage);
    }
}
