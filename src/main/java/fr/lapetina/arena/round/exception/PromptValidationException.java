package fr.lapetina.arena.round.exception;

/**
 * Thrown when a prompt is empty or too long. The message is meant for the user.
 */
public final class PromptValidationException extends RuntimeException {

    public PromptValidationException(String message) {
        super(message);
    }
}
