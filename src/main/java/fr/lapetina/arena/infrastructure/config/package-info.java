/**
 * Configuration loading.
 *
 * <p>This package parses the YAML configuration into a JavaBean tree, resolves the upstream
 * API key from the environment when the file leaves it blank, and rejects unusable settings
 * before any component is wired.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.arena.infrastructure.config.ArenaConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.arena.infrastructure.config.ConfigLoader} - YAML loading and validation</li>
 * </ul>
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code server} - HTTP server settings (host, port, backlog)</li>
 *   <li>{@code api} - Upstream endpoint, credential and timeouts</li>
 *   <li>{@code retry} - Retry policy for transient failures</li>
 *   <li>{@code rateLimit} - Per-model cool-down window</li>
 *   <li>{@code validation} - Prompt limits</li>
 *   <li>{@code sessions} - Idle session eviction</li>
 *   <li>{@code voteStore} - Vote persistence backend and ring buffer</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 *   <li>{@code models} - The model pool</li>
 * </ul>
 */
package fr.lapetina.arena.infrastructure.config;
