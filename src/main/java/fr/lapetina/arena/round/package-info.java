/**
 * Battle rounds: session state machine, concurrent dispatch and vote recording.
 *
 * <h2>Session lifecycle</h2>
 * <pre>
 * IDLE → DISPATCHING → AWAITING_VOTE → VOTED
 * </pre>
 * <p>A prompt with new content always starts a new round with a higher sequence number;
 * results for older sequence numbers are dropped.
 *
 * @see fr.lapetina.arena.round.RoundSession
 * @see fr.lapetina.arena.round.RoundDispatcher
 */
package fr.lapetina.arena.round;
