package fr.lapetina.arena.domain.event;

import fr.lapetina.arena.domain.model.VoteRecord;
import fr.lapetina.arena.infrastructure.store.VoteStoreResult;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Event object for the vote ring buffer.
 *
 * This is a mutable holder that gets reused across the ring buffer.
 * It should never be accessed outside the pipeline handlers.
 */
public final class VoteEvent {

    private VoteRecord vote;
    private CompletableFuture<VoteStoreResult> resultFuture;
    private Instant acceptedAt;

    /**
     * Clears the event for reuse.
     */
    public void clear() {
        this.vote = null;
        this.resultFuture = null;
        this.acceptedAt = null;
    }

    /**
     * Initializes the event with a new vote.
     */
    public void initialize(VoteRecord vote, CompletableFuture<VoteStoreResult> resultFuture) {
        clear();
        this.vote = vote;
        this.resultFuture = resultFuture;
        this.acceptedAt = Instant.now();
    }

    public VoteRecord getVote() {
        return vote;
    }

    public CompletableFuture<VoteStoreResult> getResultFuture() {
        return resultFuture;
    }

    public Instant getAcceptedAt() {
        return acceptedAt;
    }

    @Override
    public String toString() {
        return "VoteEvent{roundId=" + (vote != null ? vote.roundId() : null) + ", acceptedAt=" + acceptedAt + "}";
    }
}
