package fr.lapetina.arena.infrastructure.store;

import fr.lapetina.arena.domain.model.VoteRecord;

/**
 * Durable sink for finalized votes.
 *
 * Implementations are called from the vote pipeline's consumer thread and may block.
 * They report failures through {@link VoteStoreResult} instead of throwing.
 */
public interface VoteStore extends AutoCloseable {

    /**
     * Persists one vote. Called at most once per round session.
     */
    VoteStoreResult insert(VoteRecord vote);

    /**
     * Total number of stored votes, or -1 when the store cannot be read.
     */
    long count();

    /**
     * Short backend name for logs and the health endpoint.
     */
    String name();

    @Override
    default void close() {
    }
}
