package fr.lapetina.arena.round;

import fr.lapetina.arena.round.exception.PromptValidationException;

/**
 * Rejects empty and oversized prompts. Length is counted in code points.
 */
public final class PromptValidator {

    public static final int DEFAULT_MAX_LENGTH = 2000;

    private final int maxLength;

    public PromptValidator(int maxLength) {
        if (maxLength <= 0) {
            throw new IllegalArgumentException("Max prompt length must be positive: " + maxLength);
        }
        this.maxLength = maxLength;
    }

    public PromptValidator() {
        this(DEFAULT_MAX_LENGTH);
    }

    /**
     * @throws PromptValidationException if the prompt is blank or longer than the limit
     */
    public void validate(String prompt) {
        if (prompt == null || prompt.isBlank()) {
            throw new PromptValidationException("Prompt cannot be empty");
        }
        if (prompt.codePointCount(0, prompt.length()) > maxLength) {
            throw new PromptValidationException("Prompt too long (max " + maxLength + " characters)");
        }
    }

    public int getMaxLength() {
        return maxLength;
    }
}
