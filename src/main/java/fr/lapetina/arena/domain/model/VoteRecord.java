package fr.lapetina.arena.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A finalized vote. Written once, never updated.
 */
public record VoteRecord(
        String roundId,
        String sessionId,
        VoteChoice choice,
        String modelA,
        String modelB,
        String promptHash,
        Instant votedAt
) {
    public VoteRecord {
        Objects.requireNonNull(roundId, "Round ID is required");
        Objects.requireNonNull(choice, "Vote choice is required");
        Objects.requireNonNull(modelA, "Model A is required");
        Objects.requireNonNull(modelB, "Model B is required");
        Objects.requireNonNull(promptHash, "Prompt hash is required");
        Objects.requireNonNull(votedAt, "Vote timestamp is required");
    }

    /**
     * Builds the record for a vote on the given round.
     */
    public static VoteRecord of(String sessionId, RoundRequest round, VoteChoice choice, Instant votedAt) {
        return new VoteRecord(
                round.roundId(),
                sessionId,
                choice,
                round.modelA(),
                round.modelB(),
                round.promptHash(),
                votedAt
        );
    }
}
