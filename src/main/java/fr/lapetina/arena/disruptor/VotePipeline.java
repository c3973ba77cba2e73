package fr.lapetina.arena.disruptor;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.arena.disruptor.exception.BackpressureException;
import fr.lapetina.arena.disruptor.exception.BackpressureException.BackpressureReason;
import fr.lapetina.arena.disruptor.handlers.VotePersistenceHandler;
import fr.lapetina.arena.domain.event.VoteEvent;
import fr.lapetina.arena.domain.event.VoteEventFactory;
import fr.lapetina.arena.domain.model.VoteRecord;
import fr.lapetina.arena.infrastructure.config.ArenaConfig;
import fr.lapetina.arena.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.arena.infrastructure.store.VoteStore;
import fr.lapetina.arena.infrastructure.store.VoteStoreResult;
import fr.lapetina.arena.round.VoteSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;

/**
 * Fire-and-forget persistence of finalized votes on an LMAX Disruptor ring buffer.
 *
 * Publishers are the threads that cast votes, so the producer type is MULTI. A single
 * {@link VotePersistenceHandler} consumes the buffer and is the only thread that ever
 * touches the {@link VoteStore}. Publishing never waits: when the buffer is full the
 * vote is reported as a failure instead of blocking the voter.
 *
 * Failures are logged, counted and handed to the registered listeners. They never flow
 * back into the session that produced the vote.
 */
public final class VotePipeline implements VoteSink, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(VotePipeline.class);

    private final Disruptor<VoteEvent> disruptor;
    private final RingBuffer<VoteEvent> ringBuffer;
    private final AtomicBoolean running = new AtomicBoolean(false);
    // Publishers share the read lock; close() takes the write lock to stop accepting votes
    private final ReadWriteLock publishLock = new ReentrantReadWriteLock();
    private final List<Consumer<VoteFailure>> failureListeners = new CopyOnWriteArrayList<>();
    private final MetricsRegistry metricsRegistry;
    private final VoteStore store;
    private final VotePersistenceHandler persistenceHandler;
    private final Duration shutdownTimeout;

    private VotePipeline(Builder builder) {
        this.metricsRegistry = builder.metricsRegistry;
        this.store = builder.store;
        this.shutdownTimeout = builder.shutdownTimeout;
        this.persistenceHandler = new VotePersistenceHandler(store, this::reportFailure);

        this.disruptor = new Disruptor<>(
                new VoteEventFactory(),
                builder.ringBufferSize,
                new PipelineThreadFactory("vote-persistence"),
                ProducerType.MULTI,
                createWaitStrategy(builder.waitStrategy)
        );

        disruptor.handleEventsWith(persistenceHandler);
        disruptor.setDefaultExceptionHandler(new VoteExceptionHandler());

        this.ringBuffer = disruptor.getRingBuffer();
        if (metricsRegistry != null) {
            metricsRegistry.registerRingBufferRemaining(ringBuffer::remainingCapacity);
        }

        log.info("VotePipeline created: ringBufferSize={}, waitStrategy={}, store={}",
                builder.ringBufferSize, builder.waitStrategy, store.name());
    }

    /**
     * Starts the consumer thread.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            disruptor.start();
            log.info("VotePipeline started");
        }
    }

    @Override
    public void submit(VoteRecord vote) {
        publish(vote);
    }

    /**
     * Hands a vote to the persistence thread.
     *
     * @param vote The finalized vote
     * @return future completed with the store outcome; never completes exceptionally
     */
    public CompletableFuture<VoteStoreResult> publish(VoteRecord vote) {
        publishLock.readLock().lock();
        try {
            if (!running.get()) {
                return rejected(vote, new BackpressureException(BackpressureReason.PIPELINE_STOPPED,
                        "roundId=" + vote.roundId()));
            }

            long sequence;
            try {
                sequence = ringBuffer.tryNext();
            } catch (InsufficientCapacityException e) {
                return rejected(vote, new BackpressureException(BackpressureReason.RING_BUFFER_FULL,
                        "remaining capacity: " + ringBuffer.remainingCapacity()));
            }

            CompletableFuture<VoteStoreResult> resultFuture = new CompletableFuture<>();
            try {
                VoteEvent event = ringBuffer.get(sequence);
                event.initialize(vote, resultFuture);
            } finally {
                ringBuffer.publish(sequence);
            }

            log.debug("Vote published: roundId={}, sequence={}", vote.roundId(), sequence);
            return resultFuture;
        } finally {
            publishLock.readLock().unlock();
        }
    }

    private CompletableFuture<VoteStoreResult> rejected(VoteRecord vote, BackpressureException e) {
        VoteStoreResult result = VoteStoreResult.failure(VoteStoreResult.FailureKind.UNAVAILABLE, e.getMessage());
        reportFailure(new VoteFailure(vote, result.failureKind(), e.getMessage(), e));
        return CompletableFuture.completedFuture(result);
    }

    private void reportFailure(VoteFailure failure) {
        log.error("Vote not persisted: roundId={}, sessionId={}, kind={}, error={}",
                failure.vote().roundId(), failure.vote().sessionId(), failure.kind(), failure.message());
        if (metricsRegistry != null) {
            metricsRegistry.incrementVoteStoreFailure(failure.kind());
        }
        for (Consumer<VoteFailure> listener : failureListeners) {
            try {
                listener.accept(failure);
            } catch (RuntimeException e) {
                log.error("Error notifying vote failure listener", e);
            }
        }
    }

    /**
     * Adds a listener for votes that could not be persisted.
     */
    public void addFailureListener(Consumer<VoteFailure> listener) {
        failureListeners.add(listener);
    }

    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    public boolean isRunning() {
        return running.get();
    }

    public VoteStore getStore() {
        return store;
    }

    /**
     * Drains pending votes and stops the consumer thread.
     *
     * Every publish that returned a pending future before this call is drained. Later
     * publishes are rejected as {@code PIPELINE_STOPPED}.
     */
    @Override
    public void close() {
        boolean stopped;
        publishLock.writeLock().lock();
        try {
            stopped = running.compareAndSet(true, false);
        } finally {
            publishLock.writeLock().unlock();
        }
        if (stopped) {
            log.info("Shutting down VotePipeline...");
            try {
                disruptor.shutdown(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS);
                log.info("VotePipeline shut down gracefully");
            } catch (TimeoutException e) {
                log.warn("VotePipeline shutdown timed out after {} ms, halting...", shutdownTimeout.toMillis());
                disruptor.halt();
                failUnconsumed();
            }
        }
    }

    // After halt() nothing consumes the ring, so pending futures are settled here
    private void failUnconsumed() {
        long consumed = disruptor.getSequenceValueFor(persistenceHandler);
        long cursor = ringBuffer.getCursor();
        for (long sequence = consumed + 1; sequence <= cursor; sequence++) {
            VoteEvent event = ringBuffer.get(sequence);
            CompletableFuture<VoteStoreResult> future = event.getResultFuture();
            VoteRecord vote = event.getVote();
            if (future == null || vote == null) {
                continue;
            }
            VoteStoreResult result = VoteStoreResult.failure(VoteStoreResult.FailureKind.UNAVAILABLE,
                    "pipeline halted before the vote was stored");
            if (future.complete(result)) {
                reportFailure(new VoteFailure(vote, result.failureKind(), result.message(), null));
            }
        }
    }

    private static WaitStrategy createWaitStrategy(String name) {
        return switch (name == null ? "blocking" : name.toLowerCase(Locale.ROOT)) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "busy-spin" -> new BusySpinWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                yield new BlockingWaitStrategy();
            }
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    private static class PipelineThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        PipelineThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    private static class VoteExceptionHandler implements ExceptionHandler<VoteEvent> {

        private static final Logger log = LoggerFactory.getLogger(VoteExceptionHandler.class);

        @Override
        public void handleEventException(Throwable ex, long sequence, VoteEvent event) {
            log.error("Exception in vote handler: sequence={}, event={}", sequence, event, ex);
            CompletableFuture<VoteStoreResult> future = event.getResultFuture();
            if (future != null && !future.isDone()) {
                future.complete(VoteStoreResult.failure(VoteStoreResult.FailureKind.WRITE_ERROR,
                        String.valueOf(ex.getMessage())));
            }
            event.clear();
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during vote pipeline start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during vote pipeline shutdown", ex);
        }
    }

    /**
     * Builder for VotePipeline.
     */
    public static final class Builder {
        private int ringBufferSize = 256;
        private String waitStrategy = "blocking";
        private VoteStore store;
        private MetricsRegistry metricsRegistry;
        private Duration shutdownTimeout = Duration.ofSeconds(10);

        public Builder ringBufferSize(int size) {
            if (Integer.bitCount(size) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2");
            }
            this.ringBufferSize = size;
            return this;
        }

        public Builder waitStrategy(String strategy) {
            this.waitStrategy = strategy;
            return this;
        }

        public Builder store(VoteStore store) {
            this.store = store;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry registry) {
            this.metricsRegistry = registry;
            return this;
        }

        /**
         * How long {@link #close()} waits for the backlog before halting the consumer.
         */
        public Builder shutdownTimeout(Duration timeout) {
            this.shutdownTimeout = timeout;
            return this;
        }

        public Builder fromConfig(ArenaConfig.VoteStoreConfig config) {
            ringBufferSize(config.getRingBufferSize());
            this.waitStrategy = config.getWaitStrategy();
            return this;
        }

        public VotePipeline build() {
            if (store == null) {
                throw new IllegalStateException("VoteStore is required");
            }
            return new VotePipeline(this);
        }
    }
}
