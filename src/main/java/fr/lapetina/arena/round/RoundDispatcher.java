package fr.lapetina.arena.round;

import fr.lapetina.arena.domain.model.CompletionResponse;
import fr.lapetina.arena.domain.model.ErrorType;
import fr.lapetina.arena.domain.model.RoundRequest;
import fr.lapetina.arena.domain.model.RoundResult;
import fr.lapetina.arena.domain.model.SideResult;
import fr.lapetina.arena.infrastructure.config.ArenaConfig;
import fr.lapetina.arena.infrastructure.http.CompletionClient;
import fr.lapetina.arena.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.arena.infrastructure.ratelimit.RateLimitTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Fans a round out to its two models and joins the results.
 *
 * Each side runs on its own chain of futures, so a slow or failing side never holds
 * up the other. Retryable failures (network, 5xx, throttle) are retried with
 * exponential backoff; a throttle signal marks the model in the
 * {@link RateLimitTracker} before the retry is scheduled. The whole side, retries and
 * backoff included, is bounded by the request timeout. The combined future completes
 * only once both sides are resolved.
 */
public final class RoundDispatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RoundDispatcher.class);

    private final CompletionClient client;
    private final RateLimitTracker rateLimitTracker;
    private final MetricsRegistry metricsRegistry;
    private final Clock clock;
    private final ExecutorService executor;

    private final int maxRetries;
    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private final double backoffMultiplier;
    private final Duration requestTimeout;

    private RoundDispatcher(Builder builder) {
        this.client = builder.client;
        this.rateLimitTracker = builder.rateLimitTracker;
        this.metricsRegistry = builder.metricsRegistry;
        this.clock = builder.clock;
        this.maxRetries = builder.maxRetries;
        this.initialBackoff = builder.initialBackoff;
        this.maxBackoff = builder.maxBackoff;
        this.backoffMultiplier = builder.backoffMultiplier;
        this.requestTimeout = builder.requestTimeout;
        this.executor = Executors.newCachedThreadPool(new DispatchThreadFactory());

        log.info("RoundDispatcher created: maxRetries={}, initialBackoffMs={}, maxBackoffMs={}, timeoutMs={}",
                maxRetries, initialBackoff.toMillis(), maxBackoff.toMillis(), requestTimeout.toMillis());
    }

    /**
     * Requests completions from both models of the round.
     *
     * @return future completed with both sides; never completes exceptionally
     */
    public CompletableFuture<RoundResult> dispatch(RoundRequest request) {
        log.info("Dispatching round: roundId={}, modelA={}, modelB={}, timeoutMs={}",
                request.roundId(), request.modelA(), request.modelB(), requestTimeout.toMillis());

        CompletableFuture<SideResult> sideA = runSide(request, request.modelA(), "A");
        CompletableFuture<SideResult> sideB = runSide(request, request.modelB(), "B");
        return sideA.thenCombine(sideB, RoundResult::new);
    }

    private CompletableFuture<SideResult> runSide(RoundRequest request, String modelId, String slot) {
        long startNanos = System.nanoTime();
        AtomicInteger attempts = new AtomicInteger();
        AtomicBoolean abandoned = new AtomicBoolean(false);

        return attempt(request, modelId, slot, startNanos, attempts, abandoned)
                .orTimeout(requestTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .exceptionally(ex -> {
                    abandoned.set(true);
                    Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
                    Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
                    if (cause instanceof TimeoutException) {
                        return SideResult.failure(ErrorType.TIMEOUT,
                                "No response within " + requestTimeout.toMillis() + " ms", elapsed, attempts.get());
                    }
                    log.error("Side failed unexpectedly: roundId={}, side={}, model={}",
                            request.roundId(), slot, modelId, cause);
                    return SideResult.failure(ErrorType.INTERNAL_ERROR, ErrorType.INTERNAL_ERROR.description(),
                            elapsed, attempts.get());
                })
                .whenComplete((result, ignored) -> recordSide(request, modelId, slot, result));
    }

    private CompletableFuture<SideResult> attempt(
            RoundRequest request,
            String modelId,
            String slot,
            long startNanos,
            AtomicInteger attempts,
            AtomicBoolean abandoned
    ) {
        int attemptNo = attempts.incrementAndGet();
        return CompletableFuture.supplyAsync(() -> client.send(modelId, request.prompt()), executor)
                .thenCompose(Function.identity())
                .thenCompose(response -> {
                    Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
                    if (response.isSuccess()) {
                        return CompletableFuture.completedFuture(
                                SideResult.success(response.content(), elapsed, response.tokenCount(), attemptNo));
                    }
                    if (response.isThrottled()) {
                        rateLimitTracker.markThrottled(modelId, clock.instant());
                        if (metricsRegistry != null) {
                            metricsRegistry.incrementThrottleCount(modelId);
                        }
                    }
                    if (response.isRetryable() && attemptNo <= maxRetries && !abandoned.get()) {
                        return retryLater(request, modelId, slot, startNanos, attempts, abandoned, response);
                    }
                    log.warn("Upstream error: roundId={}, side={}, model={}, status={}, errorType={}, error={}",
                            request.roundId(), slot, modelId, response.statusCode(), response.errorType(),
                            response.errorMessage());
                    return CompletableFuture.completedFuture(SideResult.failure(
                            response.errorType(), sideMessage(response), elapsed, attemptNo));
                });
    }

    private CompletableFuture<SideResult> retryLater(
            RoundRequest request,
            String modelId,
            String slot,
            long startNanos,
            AtomicInteger attempts,
            AtomicBoolean abandoned,
            CompletionResponse failed
    ) {
        Duration delay = backoff(attempts.get() - 1);
        log.warn("Retrying side: roundId={}, side={}, model={}, attempt={}, errorType={}, backoffMs={}",
                request.roundId(), slot, modelId, attempts.get(), failed.errorType(), delay.toMillis());

        Executor delayed = CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS, executor);
        return CompletableFuture.supplyAsync(() -> abandoned.get(), delayed)
                .thenCompose(stop -> {
                    if (stop) {
                        return CompletableFuture.completedFuture(SideResult.failure(
                                failed.errorType(), sideMessage(failed),
                                Duration.ofNanos(System.nanoTime() - startNanos), attempts.get()));
                    }
                    return attempt(request, modelId, slot, startNanos, attempts, abandoned);
                });
    }

    /**
     * Message shown on a side before the vote. Upstream error bodies often quote the
     * model id, so only the error kind and HTTP status are kept; the raw text is logged.
     */
    static String sideMessage(CompletionResponse response) {
        String description = response.errorType().description();
        return response.statusCode() > 0 ? description + " (HTTP " + response.statusCode() + ")" : description;
    }

    /**
     * Backoff before retry number {@code retry + 1}: {@code initial * multiplier^retry}, capped.
     */
    Duration backoff(int retry) {
        double millis = initialBackoff.toMillis() * Math.pow(backoffMultiplier, retry);
        long capped = (long) Math.min(millis, (double) maxBackoff.toMillis());
        return Duration.ofMillis(Math.max(0L, capped));
    }

    private void recordSide(RoundRequest request, String modelId, String slot, SideResult result) {
        if (result == null) {
            return;
        }
        if (metricsRegistry != null) {
            metricsRegistry.incrementSideOutcome(modelId, result.errorType());
            metricsRegistry.recordLatency(modelId, result.latency());
        }
        if (result.isSuccess()) {
            log.info("Side completed: roundId={}, side={}, model={}, attempts={}, tokens={}, latencyMs={}",
                    request.roundId(), slot, modelId, result.attempts(), result.tokenCount(),
                    result.latency().toMillis());
        } else {
            log.warn("Side failed: roundId={}, side={}, model={}, attempts={}, errorType={}, error={}, latencyMs={}",
                    request.roundId(), slot, modelId, result.attempts(), result.errorType(),
                    result.errorMessage(), result.latency().toMillis());
        }
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    private static class DispatchThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger(0);

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "round-dispatch-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    /**
     * Builder for RoundDispatcher.
     */
    public static final class Builder {
        private CompletionClient client;
        private RateLimitTracker rateLimitTracker;
        private MetricsRegistry metricsRegistry;
        private Clock clock = Clock.systemUTC();
        private int maxRetries = 2;
        private Duration initialBackoff = Duration.ofSeconds(1);
        private Duration maxBackoff = Duration.ofSeconds(8);
        private double backoffMultiplier = 2.0;
        private Duration requestTimeout = Duration.ofSeconds(60);

        public Builder client(CompletionClient client) {
            this.client = client;
            return this;
        }

        public Builder rateLimitTracker(RateLimitTracker tracker) {
            this.rateLimitTracker = tracker;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry registry) {
            this.metricsRegistry = registry;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            if (maxRetries < 0) {
                throw new IllegalArgumentException("maxRetries must not be negative");
            }
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder initialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
            return this;
        }

        public Builder maxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
            return this;
        }

        public Builder backoffMultiplier(double multiplier) {
            this.backoffMultiplier = multiplier;
            return this;
        }

        public Builder requestTimeout(Duration timeout) {
            this.requestTimeout = timeout;
            return this;
        }

        public Builder fromConfig(ArenaConfig config) {
            maxRetries(config.getRetry().getMaxRetries());
            this.initialBackoff = Duration.ofMillis(config.getRetry().getInitialBackoffMs());
            this.maxBackoff = Duration.ofMillis(config.getRetry().getMaxBackoffMs());
            this.backoffMultiplier = config.getRetry().getBackoffMultiplier();
            this.requestTimeout = Duration.ofMillis(config.getApi().getRequestTimeoutMs());
            return this;
        }

        public RoundDispatcher build() {
            if (client == null) {
                throw new IllegalStateException("CompletionClient is required");
            }
            if (rateLimitTracker == null) {
                throw new IllegalStateException("RateLimitTracker is required");
            }
            if (requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()) {
                throw new IllegalStateException("Request timeout must be positive");
            }
            return new RoundDispatcher(this);
        }
    }
}
