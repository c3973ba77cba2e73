package fr.lapetina.arena.disruptor;

import fr.lapetina.arena.domain.model.VoteRecord;
import fr.lapetina.arena.infrastructure.store.VoteStoreResult;

/**
 * A vote that could not be persisted. {@code cause} is null when the store reported
 * the failure itself.
 */
public record VoteFailure(
        VoteRecord vote,
        VoteStoreResult.FailureKind kind,
        String message,
        Throwable cause
) {
}
