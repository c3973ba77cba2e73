package fr.lapetina.arena.domain.model;

/**
 * Failure taxonomy for one side of a battle round.
 * A failed side degrades to an error placeholder; it never aborts the other side.
 */
public enum ErrorType {
    /** No response within the request timeout */
    TIMEOUT("No response in time"),

    /** Upstream signalled a rate limit (HTTP 429 or an embedded rate_limit error) */
    THROTTLED("Rate limited by the upstream"),

    /** 2xx response without usable completion text */
    INVALID_RESPONSE("Upstream returned no completion text"),

    /** Connection refused, reset, DNS failure and other transport errors */
    NETWORK_ERROR("Upstream unreachable"),

    /** Upstream 5xx */
    SERVER_ERROR("Upstream server error"),

    /** Upstream 4xx other than 429 (bad model name, bad key, etc.) */
    CLIENT_ERROR("Request rejected by the upstream"),

    /** Internal system error */
    INTERNAL_ERROR("Internal error");

    private final String description;

    ErrorType(String description) {
        this.description = description;
    }

    /**
     * Generic text for this kind of failure. Never names a model, so it is safe to
     * show on an anonymized side.
     */
    public String description() {
        return description;
    }

    /**
     * Transient failures worth another attempt.
     */
    public boolean isRetryable() {
        return this == NETWORK_ERROR || this == SERVER_ERROR || this == THROTTLED;
    }
}
