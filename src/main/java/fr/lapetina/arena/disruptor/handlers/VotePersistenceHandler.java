package fr.lapetina.arena.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.arena.disruptor.VoteFailure;
import fr.lapetina.arena.domain.event.VoteEvent;
import fr.lapetina.arena.domain.model.VoteRecord;
import fr.lapetina.arena.infrastructure.store.VoteStore;
import fr.lapetina.arena.infrastructure.store.VoteStoreResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Writes each vote to the {@link VoteStore}.
 *
 * Responsibilities:
 * - Calls the store exactly once per event
 * - Turns store exceptions into WRITE_ERROR results
 * - Hands failures to the pipeline's failure callback
 * - Completes the publisher's future and clears the event for reuse
 */
public final class VotePersistenceHandler implements EventHandler<VoteEvent> {

    private static final Logger log = LoggerFactory.getLogger(VotePersistenceHandler.class);

    private final VoteStore store;
    private final Consumer<VoteFailure> failureCallback;

    public VotePersistenceHandler(VoteStore store, Consumer<VoteFailure> failureCallback) {
        this.store = store;
        this.failureCallback = failureCallback;
    }

    @Override
    public void onEvent(VoteEvent event, long sequence, boolean endOfBatch) {
        VoteRecord vote = event.getVote();
        CompletableFuture<VoteStoreResult> future = event.getResultFuture();
        try {
            if (vote == null) {
                return;
            }
            VoteStoreResult result;
            Throwable cause = null;
            try {
                result = store.insert(vote);
            } catch (RuntimeException e) {
                log.error("Vote store threw: roundId={}, store={}", vote.roundId(), store.name(), e);
                cause = e;
                result = VoteStoreResult.failure(VoteStoreResult.FailureKind.WRITE_ERROR,
                        e.getClass().getSimpleName() + ": " + e.getMessage());
            }
            long queuedMs = event.getAcceptedAt() == null ? 0
                    : Duration.between(event.getAcceptedAt(), Instant.now()).toMillis();

            if (result.isOk()) {
                log.info("Vote persisted: roundId={}, sessionId={}, choice={}, store={}, latencyMs={}",
                        vote.roundId(), vote.sessionId(), vote.choice().label(), store.name(), queuedMs);
            } else {
                failureCallback.accept(new VoteFailure(vote, result.failureKind(), result.message(), cause));
            }
            if (future != null) {
                future.complete(result);
            }
        } finally {
            event.clear();
        }
    }
}
