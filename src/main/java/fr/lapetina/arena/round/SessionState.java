package fr.lapetina.arena.round;

/**
 * Lifecycle of a {@link RoundSession}.
 */
public enum SessionState {
    /** No round started yet. */
    IDLE,
    /** Both completions requested, waiting for the slower side. */
    DISPATCHING,
    /** Both sides resolved; identities hidden. */
    AWAITING_VOTE,
    /** Vote recorded; identities revealed. Terminal for the round. */
    VOTED
}
