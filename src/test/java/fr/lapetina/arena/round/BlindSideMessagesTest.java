package fr.lapetina.arena.round;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import fr.lapetina.arena.api.dto.RoundResponse;
import fr.lapetina.arena.domain.model.CompletionResponse;
import fr.lapetina.arena.domain.model.ErrorType;
import fr.lapetina.arena.domain.model.ModelPair;
import fr.lapetina.arena.domain.model.RoundResult;
import fr.lapetina.arena.domain.model.VoteChoice;
import fr.lapetina.arena.infrastructure.http.CompletionClient;
import fr.lapetina.arena.infrastructure.ratelimit.RateLimitTracker;
import fr.lapetina.arena.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Upstream error bodies that quote the model id must not reach an anonymized side.
 */
class BlindSideMessagesTest {

    private static final Instant T0 = Instant.parse("2025-03-01T12:00:00Z");

    private final ObjectMapper mapper = new ObjectMapper();

    private HttpServer upstream;
    private CompletionClient client;
    private RoundDispatcher dispatcher;

    @BeforeEach
    void setUp() throws IOException {
        upstream = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        upstream.setExecutor(Executors.newCachedThreadPool());
        upstream.createContext("/chat", this::unknownModel);
        upstream.start();

        client = new CompletionClient(
                URI.create("http://127.0.0.1:" + upstream.getAddress().getPort() + "/chat"),
                "key", Duration.ofSeconds(2), Duration.ofSeconds(2));
        dispatcher = RoundDispatcher.builder()
                .client(client)
                .rateLimitTracker(new RateLimitTracker(Duration.ofSeconds(60)))
                .requestTimeout(Duration.ofSeconds(5))
                .build();
    }

    @AfterEach
    void tearDown() {
        dispatcher.close();
        upstream.stop(0);
    }

    private void unknownModel(HttpExchange exchange) throws IOException {
        JsonNode request = mapper.readTree(exchange.getRequestBody());
        String model = request.path("model").asText();
        byte[] bytes = ("{\"error\":{\"message\":\"The model `" + model + "` does not exist\"}}")
                .getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(404, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    @Test
    @DisplayName("should keep model ids out of side errors until the vote")
    void shouldHideModelIdsInSideErrors() throws Exception {
        RoundSession session = new RoundSession("s-1", new PromptValidator(), new MutableClock(T0), vote -> { });
        RoundTicket ticket = session.startRound("Say hi",
                new ModelPair("secret-model-a", "secret-model-b"), T0);

        RoundResult result = dispatcher.dispatch(ticket.request()).get(10, TimeUnit.SECONDS);
        session.resultsReady(ticket.sequence(), result);

        assertThat(result.sideA().errorType()).isEqualTo(ErrorType.CLIENT_ERROR);
        assertThat(result.sideA().errorMessage()).isEqualTo("Request rejected by the upstream (HTTP 404)");
        String json = mapper.writeValueAsString(RoundResponse.from(session.snapshot()));
        assertThat(json).contains("\"state\":\"AWAITING_VOTE\"");
        assertThat(json).doesNotContain("secret-model-a").doesNotContain("secret-model-b");

        session.castVote(VoteChoice.BOTH_BAD);
        String revealed = mapper.writeValueAsString(RoundResponse.from(session.snapshot()));
        assertThat(revealed).contains("secret-model-a").contains("secret-model-b");
    }

    @Test
    @DisplayName("should describe failures by kind and status only")
    void shouldDescribeByKindAndStatus() {
        assertThat(RoundDispatcher.sideMessage(CompletionResponse.error(
                "gemma3:12b", 429, ErrorType.THROTTLED, "Rate limit reached for gemma3:12b", Duration.ZERO)))
                .isEqualTo("Rate limited by the upstream (HTTP 429)");
        assertThat(RoundDispatcher.sideMessage(CompletionResponse.error(
                "gemma3:12b", 0, ErrorType.NETWORK_ERROR, "Connection refused", Duration.ZERO)))
                .isEqualTo("Upstream unreachable");
    }
}
