package fr.lapetina.arena.domain.model;

import java.util.Objects;

/**
 * A language model in the arena pool.
 * Immutable; loaded once at process start.
 */
public record Model(
        String id,
        String displayName,
        String category,
        int contextLength
) {
    public static final String DEFAULT_CATEGORY = "general";

    public Model {
        Objects.requireNonNull(id, "Model ID is required");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Model ID must not be blank");
        }
        if (displayName == null || displayName.isBlank()) {
            displayName = id;
        }
        if (category == null || category.isBlank()) {
            category = DEFAULT_CATEGORY;
        }
        if (contextLength < 0) {
            throw new IllegalArgumentException("Context length must not be negative: " + contextLength);
        }
    }

    /**
     * Creates a model with default display name and category.
     */
    public static Model of(String id) {
        return new Model(id, null, null, 0);
    }
}
