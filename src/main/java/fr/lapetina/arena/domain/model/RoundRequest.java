package fr.lapetina.arena.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One prompt submission with its two anonymized contestants.
 * Immutable and thread-safe.
 */
public record RoundRequest(
        String roundId,
        String prompt,
        String promptHash,
        String modelA,
        String modelB,
        Instant createdAt
) {
    public RoundRequest {
        Objects.requireNonNull(prompt, "Prompt is required");
        Objects.requireNonNull(modelA, "Model A is required");
        Objects.requireNonNull(modelB, "Model B is required");
        if (modelA.equals(modelB)) {
            throw new IllegalArgumentException("Model A and model B must differ: " + modelA);
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (promptHash == null) {
            promptHash = PromptDigest.hash(prompt);
        }
        if (roundId == null) {
            roundId = PromptDigest.roundId(promptHash, createdAt);
        }
    }

    /**
     * Creates a request for the given prompt and pair, deriving hash and round id.
     */
    public static RoundRequest of(String prompt, ModelPair pair, Instant createdAt) {
        return new RoundRequest(null, prompt, null, pair.modelA(), pair.modelB(), createdAt);
    }

    public ModelPair pair() {
        return new ModelPair(modelA, modelB);
    }
}
