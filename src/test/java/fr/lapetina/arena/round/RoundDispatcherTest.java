package fr.lapetina.arena.round;

import fr.lapetina.arena.domain.model.CompletionResponse;
import fr.lapetina.arena.domain.model.ErrorType;
import fr.lapetina.arena.domain.model.ModelPair;
import fr.lapetina.arena.domain.model.RoundRequest;
import fr.lapetina.arena.domain.model.RoundResult;
import fr.lapetina.arena.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.arena.infrastructure.ratelimit.RateLimitTracker;
import fr.lapetina.arena.support.MutableClock;
import fr.lapetina.arena.support.StubCompletionClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class RoundDispatcherTest {

    private static final Instant T0 = Instant.parse("2025-03-01T12:00:00Z");

    private StubCompletionClient client;
    private RateLimitTracker tracker;
    private MetricsRegistry metrics;
    private MutableClock clock;
    private RoundDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        client = new StubCompletionClient();
        tracker = new RateLimitTracker(Duration.ofSeconds(60));
        metrics = new MetricsRegistry("dispatch_test");
        clock = new MutableClock(T0);
        dispatcher = RoundDispatcher.builder()
                .client(client)
                .rateLimitTracker(tracker)
                .metricsRegistry(metrics)
                .clock(clock)
                .maxRetries(2)
                .initialBackoff(Duration.ofMillis(10))
                .maxBackoff(Duration.ofMillis(40))
                .backoffMultiplier(2.0)
                .requestTimeout(Duration.ofMillis(500))
                .build();
    }

    @AfterEach
    void tearDown() {
        dispatcher.close();
        metrics.close();
    }

    private RoundResult dispatch(String modelA, String modelB) throws Exception {
        RoundRequest request = RoundRequest.of("Say hi", new ModelPair(modelA, modelB), T0);
        return dispatcher.dispatch(request).get(5, TimeUnit.SECONDS);
    }

    private static CompletionResponse error(String model, ErrorType type, int status) {
        return CompletionResponse.error(model, status, type, type.name(), Duration.ofMillis(1));
    }

    @Test
    @DisplayName("should return both sides in their slots")
    void shouldReturnBothSides() throws Exception {
        client.succeed("M1", "Hello!").succeed("M2", "Hi there");

        RoundResult result = dispatch("M1", "M2");

        assertThat(result.sideA().text()).isEqualTo("Hello!");
        assertThat(result.sideB().text()).isEqualTo("Hi there");
        assertThat(result.sideA().attempts()).isEqualTo(1);
        assertThat(client.calls("M1")).isEqualTo(1);
        assertThat(client.calls("M2")).isEqualTo(1);
    }

    @Test
    @DisplayName("should wait for the slower side before completing")
    void shouldWaitForSlowerSide() throws Exception {
        client.succeedAfter("M1", "Slow answer", Duration.ofMillis(200)).succeed("M2", "Fast answer");

        RoundResult result = dispatch("M1", "M2");

        assertThat(result.sideA().text()).isEqualTo("Slow answer");
        assertThat(result.sideA().latency()).isGreaterThanOrEqualTo(Duration.ofMillis(200));
        assertThat(result.sideB().text()).isEqualTo("Fast answer");
    }

    @Nested
    @DisplayName("retries")
    class Retries {

        @Test
        @DisplayName("should retry server errors until success")
        void shouldRetryServerErrors() throws Exception {
            client.sequence("M1",
                    error("M1", ErrorType.SERVER_ERROR, 503),
                    error("M1", ErrorType.NETWORK_ERROR, 0),
                    CompletionResponse.success("M1", "Finally", 1, Duration.ofMillis(1)));
            client.succeed("M2", "Hi");

            RoundResult result = dispatch("M1", "M2");

            assertThat(result.sideA().text()).isEqualTo("Finally");
            assertThat(result.sideA().attempts()).isEqualTo(3);
            assertThat(client.calls("M1")).isEqualTo(3);
        }

        @Test
        @DisplayName("should give up after the configured number of retries")
        void shouldGiveUpAfterMaxRetries() throws Exception {
            client.fail("M1", ErrorType.SERVER_ERROR, 500).succeed("M2", "Hi");

            RoundResult result = dispatch("M1", "M2");

            assertThat(result.sideA().errorType()).isEqualTo(ErrorType.SERVER_ERROR);
            assertThat(result.sideA().attempts()).isEqualTo(3);
            assertThat(client.calls("M1")).isEqualTo(3);
            assertThat(result.sideB().isSuccess()).isTrue();
        }

        @Test
        @DisplayName("should not retry client errors")
        void shouldNotRetryClientErrors() throws Exception {
            client.fail("M1", ErrorType.CLIENT_ERROR, 400).succeed("M2", "Hi");

            RoundResult result = dispatch("M1", "M2");

            assertThat(result.sideA().errorType()).isEqualTo(ErrorType.CLIENT_ERROR);
            assertThat(result.sideA().attempts()).isEqualTo(1);
            assertThat(client.calls("M1")).isEqualTo(1);
        }

        @Test
        @DisplayName("should not retry invalid responses")
        void shouldNotRetryInvalidResponses() throws Exception {
            client.fail("M2", ErrorType.INVALID_RESPONSE, 200).succeed("M1", "Hi");

            RoundResult result = dispatch("M1", "M2");

            assertThat(result.sideB().errorType()).isEqualTo(ErrorType.INVALID_RESPONSE);
            assertThat(client.calls("M2")).isEqualTo(1);
        }

        @Test
        @DisplayName("should mark a throttled model before retrying")
        void shouldMarkThrottledModel() throws Exception {
            client.sequence("M1",
                    error("M1", ErrorType.THROTTLED, 429),
                    CompletionResponse.success("M1", "After cooldown", 1, Duration.ofMillis(1)));
            client.succeed("M2", "Hi");

            RoundResult result = dispatch("M1", "M2");

            assertThat(result.sideA().text()).isEqualTo("After cooldown");
            assertThat(result.sideA().attempts()).isEqualTo(2);
            assertThat(tracker.isThrottled("M1", T0.plusSeconds(30))).isTrue();
            assertThat(tracker.isThrottled("M1", T0.plusSeconds(60))).isFalse();
            assertThat(tracker.isThrottled("M2", T0)).isFalse();
            assertThat(metrics.scrape()).contains("dispatch_test_throttle_signals_total");
        }
    }

    @Test
    @DisplayName("should time out a hung side without holding the other")
    void shouldTimeOutHungSide() throws Exception {
        client.hang("M1").succeed("M2", "Hi there");

        RoundResult result = dispatch("M1", "M2");

        assertThat(result.sideA().errorType()).isEqualTo(ErrorType.TIMEOUT);
        assertThat(result.sideA().errorMessage()).contains("500 ms");
        assertThat(result.sideB().text()).isEqualTo("Hi there");
    }

    @Test
    @DisplayName("should bound retries by the request timeout")
    void shouldBoundRetriesByTimeout() throws Exception {
        RoundDispatcher slowBackoff = RoundDispatcher.builder()
                .client(client)
                .rateLimitTracker(tracker)
                .maxRetries(5)
                .initialBackoff(Duration.ofSeconds(2))
                .maxBackoff(Duration.ofSeconds(8))
                .requestTimeout(Duration.ofMillis(300))
                .build();
        try {
            client.fail("M1", ErrorType.SERVER_ERROR, 502).succeed("M2", "Hi");
            RoundRequest request = RoundRequest.of("Say hi", new ModelPair("M1", "M2"), T0);

            RoundResult result = slowBackoff.dispatch(request).get(5, TimeUnit.SECONDS);

            assertThat(result.sideA().errorType()).isEqualTo(ErrorType.TIMEOUT);
            assertThat(client.calls("M1")).isEqualTo(1);
        } finally {
            slowBackoff.close();
        }
    }

    @Test
    @DisplayName("should count side outcomes")
    void shouldCountSideOutcomes() throws Exception {
        client.succeed("M1", "Hello!").fail("M2", ErrorType.CLIENT_ERROR, 400);

        dispatch("M1", "M2");

        String scrape = metrics.scrape();
        assertThat(scrape).contains("dispatch_test_side_outcomes_total");
        assertThat(scrape).contains("outcome=\"SUCCESS\"");
        assertThat(scrape).contains("outcome=\"CLIENT_ERROR\"");
    }

    @Test
    @DisplayName("should compute exponential backoff with a cap")
    void shouldComputeBackoff() {
        RoundDispatcher defaults = RoundDispatcher.builder()
                .client(client)
                .rateLimitTracker(tracker)
                .build();
        try {
            assertThat(defaults.backoff(0)).isEqualTo(Duration.ofSeconds(1));
            assertThat(defaults.backoff(1)).isEqualTo(Duration.ofSeconds(2));
            assertThat(defaults.backoff(2)).isEqualTo(Duration.ofSeconds(4));
            assertThat(defaults.backoff(3)).isEqualTo(Duration.ofSeconds(8));
            assertThat(defaults.backoff(6)).isEqualTo(Duration.ofSeconds(8));
        } finally {
            defaults.close();
        }
    }
}
