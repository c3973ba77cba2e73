package fr.lapetina.arena.disruptor.exception;

/**
 * Raised when the vote pipeline cannot accept a vote.
 *
 * This occurs when:
 * - Ring buffer is full
 * - Pipeline is not running
 */
public final class BackpressureException extends RuntimeException {

    private final BackpressureReason reason;

    public BackpressureException(BackpressureReason reason, String details) {
        super("Backpressure: " + reason.getMessage() + " - " + details);
        this.reason = reason;
    }

    public BackpressureReason getReason() {
        return reason;
    }

    public enum BackpressureReason {
        RING_BUFFER_FULL("Ring buffer is full"),
        PIPELINE_STOPPED("Vote pipeline is not running");

        private final String message;

        BackpressureReason(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }
    }
}
