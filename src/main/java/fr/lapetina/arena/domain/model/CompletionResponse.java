package fr.lapetina.arena.domain.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Result of a single chat-completion attempt against the upstream API.
 * Immutable and thread-safe.
 */
public record CompletionResponse(
        String model,
        String content,
        int tokenCount,
        int statusCode,
        Duration latency,
        ErrorType errorType,
        String errorMessage
) {
    public CompletionResponse {
        Objects.requireNonNull(model, "Model is required");
        if (latency == null) {
            latency = Duration.ZERO;
        }
    }

    public boolean isSuccess() {
        return errorType == null;
    }

    public boolean isError() {
        return errorType != null;
    }

    public boolean isThrottled() {
        return errorType == ErrorType.THROTTLED;
    }

    public boolean isRetryable() {
        return errorType != null && errorType.isRetryable();
    }

    /**
     * Creates a successful response.
     */
    public static CompletionResponse success(String model, String content, int tokenCount, Duration latency) {
        return new CompletionResponse(model, content, tokenCount, 200, latency, null, null);
    }

    /**
     * Creates an error response. {@code statusCode} is 0 when no HTTP response was received.
     */
    public static CompletionResponse error(
            String model,
            int statusCode,
            ErrorType errorType,
            String errorMessage,
            Duration latency
    ) {
        return new CompletionResponse(model, null, 0, statusCode, latency,
                Objects.requireNonNull(errorType, "Error type is required"), errorMessage);
    }
}
