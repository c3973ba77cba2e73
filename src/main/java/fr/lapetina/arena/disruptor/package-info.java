/**
 * LMAX Disruptor-based pipeline for persisting votes.
 *
 * <p>Voters publish into a pre-allocated ring buffer and return immediately; a single
 * consumer thread writes each vote to the configured store. A full buffer or a store
 * failure is reported to listeners and metrics, never to the voter.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.arena.disruptor.VotePipeline} - Ring buffer owner and {@code VoteSink}</li>
 *   <li>{@link fr.lapetina.arena.disruptor.handlers.VotePersistenceHandler} - Store writer</li>
 *   <li>{@link fr.lapetina.arena.disruptor.VoteFailure} - A vote that could not be stored</li>
 * </ul>
 *
 * @see com.lmax.disruptor.dsl.Disruptor
 */
package fr.lapetina.arena.disruptor;
