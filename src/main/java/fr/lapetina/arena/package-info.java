/**
 * LLM Arena - anonymized head-to-head rounds between two language models.
 *
 * <p>A user submits one prompt, two models drawn at random from the pool answer it
 * side by side without their names, and the user votes for the better answer. The
 * identities are revealed once the vote is in.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.arena.ArenaFactory} - Main entry point for creating a fully-wired
 *       arena from YAML configuration</li>
 *   <li>{@link fr.lapetina.arena.ArenaApplication} - Standalone HTTP server</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (ArenaFactory factory = ArenaFactory.create("config.yaml").start()) {
 *     RoundSession session = factory.getSessions().create();
 *     RoundView view = factory.getCoordinator().submitPrompt(session, "Hello").join();
 *     factory.getCoordinator().castVote(session, "Tie");
 * }
 * }</pre>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Uniform random pairing that skips rate-limited models</li>
 *   <li>Concurrent dispatch with per-side retries and timeout</li>
 *   <li>Exactly-once vote per round, persisted off the request path</li>
 *   <li>Micrometer metrics with Prometheus export</li>
 * </ul>
 *
 * @see fr.lapetina.arena.ArenaFactory
 * @see fr.lapetina.arena.round.RoundCoordinator
 */
package fr.lapetina.arena;
