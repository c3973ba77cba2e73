/**
 * Domain model classes for battle rounds.
 *
 * <p>This package contains immutable value objects shared by the selection, dispatch,
 * session and persistence layers.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.arena.domain.model.Model} - A model in the pool</li>
 *   <li>{@link fr.lapetina.arena.domain.model.RoundRequest} - Prompt plus the two anonymized contestants</li>
 *   <li>{@link fr.lapetina.arena.domain.model.RoundResult} - Per-side success or failure</li>
 *   <li>{@link fr.lapetina.arena.domain.model.VoteRecord} - The finalized, write-once vote</li>
 *   <li>{@link fr.lapetina.arena.domain.model.ErrorType} - Per-side failure kinds</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>Every type here is a record or an enum and can be shared freely between threads.
 *
 * @see fr.lapetina.arena.domain.model.RoundRequest
 * @see fr.lapetina.arena.domain.model.SideResult
 */
package fr.lapetina.arena.domain.model;
