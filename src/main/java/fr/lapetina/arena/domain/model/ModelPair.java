package fr.lapetina.arena.domain.model;

import java.util.Objects;

/**
 * The two models drawn for a round, already assigned to their slots.
 */
public record ModelPair(String modelA, String modelB) {

    public ModelPair {
        Objects.requireNonNull(modelA, "Model A is required");
        Objects.requireNonNull(modelB, "Model B is required");
        if (modelA.equals(modelB)) {
            throw new IllegalArgumentException("A round needs two distinct models, got " + modelA + " twice");
        }
    }
}
