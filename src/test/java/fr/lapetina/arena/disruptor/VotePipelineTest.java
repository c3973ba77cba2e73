package fr.lapetina.arena.disruptor;

import fr.lapetina.arena.domain.model.ModelPair;
import fr.lapetina.arena.domain.model.RoundRequest;
import fr.lapetina.arena.domain.model.VoteChoice;
import fr.lapetina.arena.domain.model.VoteRecord;
import fr.lapetina.arena.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.arena.infrastructure.store.InMemoryVoteStore;
import fr.lapetina.arena.infrastructure.store.VoteStoreResult;
import fr.lapetina.arena.infrastructure.store.VoteStoreResult.FailureKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VotePipelineTest {

    private static final Instant T0 = Instant.parse("2025-03-01T12:00:00Z");

    private MetricsRegistry metrics;
    private VotePipeline pipeline;
    private final List<VoteFailure> failures = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        metrics = new MetricsRegistry("pipeline_test");
    }

    @AfterEach
    void tearDown() {
        if (pipeline != null) {
            pipeline.close();
        }
        metrics.close();
    }

    private VotePipeline start(InMemoryVoteStore store) {
        pipeline = VotePipeline.builder()
                .ringBufferSize(16)
                .store(store)
                .metricsRegistry(metrics)
                .build();
        pipeline.addFailureListener(failures::add);
        pipeline.start();
        return pipeline;
    }

    private static VoteRecord vote(String prompt, VoteChoice choice) {
        RoundRequest round = RoundRequest.of(prompt, new ModelPair("M1", "M2"), T0);
        return VoteRecord.of("session-1", round, choice, T0.plusSeconds(1));
    }

    @Test
    @DisplayName("should persist published votes in order")
    void shouldPersistVotes() throws Exception {
        InMemoryVoteStore store = new InMemoryVoteStore();
        start(store);

        VoteRecord first = vote("first", VoteChoice.A);
        VoteRecord second = vote("second", VoteChoice.TIE);
        CompletableFuture<VoteStoreResult> r1 = pipeline.publish(first);
        CompletableFuture<VoteStoreResult> r2 = pipeline.publish(second);

        assertThat(r1.get(5, TimeUnit.SECONDS).isOk()).isTrue();
        assertThat(r2.get(5, TimeUnit.SECONDS).isOk()).isTrue();
        assertThat(store.votes()).containsExactly(first, second);
        assertThat(failures).isEmpty();
    }

    @Test
    @DisplayName("should report a store failure to listeners")
    void shouldReportStoreFailure() throws Exception {
        start(new InMemoryVoteStore() {
            @Override
            public VoteStoreResult insert(VoteRecord vote) {
                return VoteStoreResult.failure(FailureKind.WRITE_ERROR, "disk full");
            }
        });

        VoteRecord record = vote("p", VoteChoice.B);
        VoteStoreResult result = pipeline.publish(record).get(5, TimeUnit.SECONDS);

        assertThat(result.failureKind()).isEqualTo(FailureKind.WRITE_ERROR);
        assertThat(failures).hasSize(1);
        assertThat(failures.get(0).vote()).isEqualTo(record);
        assertThat(failures.get(0).message()).isEqualTo("disk full");
        assertThat(metrics.scrape()).contains("pipeline_test_vote_store_failures_total");
    }

    @Test
    @DisplayName("should turn a store exception into a write error")
    void shouldHandleStoreException() throws Exception {
        start(new InMemoryVoteStore() {
            @Override
            public VoteStoreResult insert(VoteRecord vote) {
                throw new IllegalStateException("driver crashed");
            }
        });

        VoteStoreResult result = pipeline.publish(vote("p", VoteChoice.A)).get(5, TimeUnit.SECONDS);

        assertThat(result.failureKind()).isEqualTo(FailureKind.WRITE_ERROR);
        assertThat(failures).hasSize(1);
        assertThat(failures.get(0).cause()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("should keep running after a failed vote")
    void shouldContinueAfterFailure() throws Exception {
        List<VoteRecord> stored = new CopyOnWriteArrayList<>();
        start(new InMemoryVoteStore() {
            @Override
            public VoteStoreResult insert(VoteRecord vote) {
                if (vote.choice() == VoteChoice.BOTH_BAD) {
                    throw new IllegalStateException("boom");
                }
                stored.add(vote);
                return VoteStoreResult.ok();
            }
        });

        pipeline.publish(vote("bad", VoteChoice.BOTH_BAD)).get(5, TimeUnit.SECONDS);
        VoteStoreResult next = pipeline.publish(vote("good", VoteChoice.A)).get(5, TimeUnit.SECONDS);

        assertThat(next.isOk()).isTrue();
        assertThat(stored).hasSize(1);
    }

    @Test
    @DisplayName("should refuse votes when not running")
    void shouldRefuseWhenStopped() throws Exception {
        InMemoryVoteStore store = new InMemoryVoteStore();
        pipeline = VotePipeline.builder().ringBufferSize(16).store(store).build();
        pipeline.addFailureListener(failures::add);

        VoteStoreResult result = pipeline.publish(vote("p", VoteChoice.A)).get(1, TimeUnit.SECONDS);

        assertThat(result.failureKind()).isEqualTo(FailureKind.UNAVAILABLE);
        assertThat(failures).hasSize(1);
        assertThat(store.count()).isZero();
    }

    @Test
    @DisplayName("should drain pending votes on close")
    void shouldDrainOnClose() {
        InMemoryVoteStore store = new InMemoryVoteStore();
        start(store);

        for (int i = 0; i < 10; i++) {
            pipeline.submit(vote("prompt " + i, VoteChoice.A));
        }
        pipeline.close();

        assertThat(store.count()).isEqualTo(10);
        assertThat(pipeline.isRunning()).isFalse();
    }

    @Test
    @DisplayName("should settle every vote published while closing")
    void shouldSettleVotesPublishedDuringClose() throws Exception {
        InMemoryVoteStore store = new InMemoryVoteStore();
        start(store);

        int voters = 4;
        ExecutorService executor = Executors.newFixedThreadPool(voters);
        CountDownLatch go = new CountDownLatch(1);
        List<CompletableFuture<VoteStoreResult>> results = new CopyOnWriteArrayList<>();
        try {
            for (int v = 0; v < voters; v++) {
                int voter = v;
                executor.execute(() -> {
                    try {
                        go.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return;
                    }
                    for (int i = 0; i < 200; i++) {
                        results.add(pipeline.publish(vote("voter " + voter + " prompt " + i, VoteChoice.A)));
                    }
                });
            }
            go.countDown();
            Thread.sleep(2);
            pipeline.close();
            executor.shutdown();
            assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        } finally {
            executor.shutdownNow();
        }

        CompletableFuture.allOf(results.toArray(new CompletableFuture[0])).get(5, TimeUnit.SECONDS);
        long persisted = results.stream().filter(r -> r.join().isOk()).count();
        assertThat(results).hasSize(voters * 200);
        assertThat(persisted).isEqualTo(store.count());
        assertThat(failures).hasSize(results.size() - (int) persisted);
    }

    @Test
    @DisplayName("should fail pending votes when the store outlives the shutdown timeout")
    void shouldFailPendingVotesOnHalt() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch entered = new CountDownLatch(1);
        pipeline = VotePipeline.builder()
                .ringBufferSize(16)
                .shutdownTimeout(Duration.ofMillis(200))
                .store(new InMemoryVoteStore() {
                    @Override
                    public VoteStoreResult insert(VoteRecord vote) {
                        entered.countDown();
                        try {
                            release.await();
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                        return VoteStoreResult.ok();
                    }
                })
                .build();
        pipeline.addFailureListener(failures::add);
        pipeline.start();
        try {
            CompletableFuture<VoteStoreResult> stuck = pipeline.publish(vote("stuck", VoteChoice.A));
            assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
            CompletableFuture<VoteStoreResult> queued = pipeline.publish(vote("queued", VoteChoice.B));

            pipeline.close();

            assertThat(stuck.get(1, TimeUnit.SECONDS).failureKind()).isEqualTo(FailureKind.UNAVAILABLE);
            assertThat(queued.get(1, TimeUnit.SECONDS).failureKind()).isEqualTo(FailureKind.UNAVAILABLE);
            assertThat(failures).hasSize(2);
        } finally {
            release.countDown();
        }
    }

    @Test
    @DisplayName("should require a power-of-two ring size and a store")
    void shouldValidateBuilder() {
        assertThatThrownBy(() -> VotePipeline.builder().ringBufferSize(100))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> VotePipeline.builder().build())
                .isInstanceOf(IllegalStateException.class);
    }
}
