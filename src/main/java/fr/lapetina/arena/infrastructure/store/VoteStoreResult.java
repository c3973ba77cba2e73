package fr.lapetina.arena.infrastructure.store;

import java.util.Objects;

/**
 * Outcome of a vote store write.
 */
public record VoteStoreResult(FailureKind failureKind, String message) {

    private static final VoteStoreResult OK = new VoteStoreResult(null, null);

    public enum FailureKind {
        /** The backend could not be reached. */
        UNAVAILABLE,
        /** The backend was reached but rejected the write. */
        WRITE_ERROR
    }

    public static VoteStoreResult ok() {
        return OK;
    }

    public static VoteStoreResult failure(FailureKind kind, String message) {
        return new VoteStoreResult(Objects.requireNonNull(kind, "Failure kind is required"), message);
    }

    public boolean isOk() {
        return failureKind == null;
    }
}
