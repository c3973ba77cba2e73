package fr.lapetina.arena.infrastructure.metrics;

import fr.lapetina.arena.domain.model.ErrorType;
import fr.lapetina.arena.domain.model.VoteChoice;
import fr.lapetina.arena.infrastructure.store.VoteStoreResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Round counters and per-side outcome counters per model
 * - Completion latency timers per model
 * - Throttle and vote counters
 * - Vote store failure counters
 * - JVM and system metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    static final String SUCCESS = "SUCCESS";

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Timer> latencyTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> outcomeCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> throttleCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> voteCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> storeFailureCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> roundCounters = new ConcurrentHashMap<>();

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("arena");
    }

    /**
     * Counts a round by how it ended: {@code started}, {@code completed}, {@code insufficient_models}.
     */
    public void incrementRoundCount(String outcome) {
        roundCounters.computeIfAbsent(outcome, k ->
                Counter.builder(prefix + "_rounds_total")
                        .description("Total number of rounds")
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
    }

    /**
     * Counts the final outcome of one side; {@code errorType} is null on success.
     */
    public void incrementSideOutcome(String model, ErrorType errorType) {
        String outcome = errorType == null ? SUCCESS : errorType.name();
        String key = model + ":" + outcome;
        outcomeCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_side_outcomes_total")
                        .description("Final outcome of each side of a round")
                        .tag("model", model)
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
    }

    /**
     * Records the wall time of one side, retries included.
     */
    public void recordLatency(String model, Duration latency) {
        latencyTimers.computeIfAbsent(model, k ->
                Timer.builder(prefix + "_completion_latency")
                        .description("Completion latency per side")
                        .tag("model", model)
                        .publishPercentileHistogram()
                        .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                        .register(registry)
        ).record(latency);
    }

    public void incrementThrottleCount(String model) {
        throttleCounters.computeIfAbsent(model, k ->
                Counter.builder(prefix + "_throttle_signals_total")
                        .description("Throttle signals received from the upstream")
                        .tag("model", model)
                        .register(registry)
        ).increment();
    }

    /**
     * Counts a vote attempt by outcome; {@code choice} is null when the label was not recognized.
     */
    public void incrementVoteCount(VoteChoice choice, String status) {
        String choiceTag = choice == null ? "NONE" : choice.label();
        String key = choiceTag + ":" + status;
        voteCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_votes_total")
                        .description("Vote attempts by choice and outcome")
                        .tag("choice", choiceTag)
                        .tag("status", status)
                        .register(registry)
        ).increment();
    }

    public void incrementVoteStoreFailure(VoteStoreResult.FailureKind kind) {
        storeFailureCounters.computeIfAbsent(kind.name(), k ->
                Counter.builder(prefix + "_vote_store_failures_total")
                        .description("Votes that could not be persisted")
                        .tag("kind", kind.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Registers a gauge for the number of throttled models.
     */
    public void registerThrottledModels(Supplier<Number> valueSupplier) {
        Gauge.builder(prefix + "_throttled_models", valueSupplier, s -> s.get().doubleValue())
                .description("Models currently inside their cool-down window")
                .register(registry);
    }

    /**
     * Registers a gauge for the number of live sessions.
     */
    public void registerActiveSessions(Supplier<Number> valueSupplier) {
        Gauge.builder(prefix + "_active_sessions", valueSupplier, s -> s.get().doubleValue())
                .description("Live round sessions")
                .register(registry);
    }

    /**
     * Registers a gauge for the remaining capacity of the vote ring buffer.
     */
    public void registerRingBufferRemaining(Supplier<Number> valueSupplier) {
        Gauge.builder(prefix + "_vote_ringbuffer_remaining", valueSupplier, s -> s.get().doubleValue())
                .description("Remaining capacity in the vote ring buffer")
                .register(registry);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    public String getPrefix() {
        return prefix;
    }

    @Override
    public void close() {
        registry.close();
    }
}
