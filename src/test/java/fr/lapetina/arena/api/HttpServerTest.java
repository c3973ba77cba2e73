package fr.lapetina.arena.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.arena.domain.model.ErrorType;
import fr.lapetina.arena.integration.TestArenaFactory;
import fr.lapetina.arena.support.Await;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class HttpServerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient http = HttpClient.newHttpClient();

    private TestArenaFactory factory;
    private HttpServer server;
    private String baseUrl;

    @BeforeEach
    void setUp() throws Exception {
        factory = TestArenaFactory.create();
        server = new HttpServer("127.0.0.1", 0, 10,
                factory.getCoordinator(),
                factory.getSessions(),
                factory.getVotePipeline(),
                factory.getMetricsRegistry(),
                Duration.ofMillis(factory.getConfig().getApi().getRequestTimeoutMs()));
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getPort();
    }

    @AfterEach
    void tearDown() {
        server.close();
        factory.close();
    }

    private HttpResponse<String> get(String path) throws Exception {
        return http.send(HttpRequest.newBuilder(URI.create(baseUrl + path)).GET().build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        return http.send(HttpRequest.newBuilder(URI.create(baseUrl + path))
                        .header("Content-Type", "application/json")
                        .POST(HttpRequest.BodyPublishers.ofString(body))
                        .build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> delete(String path) throws Exception {
        return http.send(HttpRequest.newBuilder(URI.create(baseUrl + path)).DELETE().build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private JsonNode json(HttpResponse<String> response) throws Exception {
        return mapper.readTree(response.body());
    }

    private String newSession() throws Exception {
        HttpResponse<String> response = post("/v1/sessions", "");
        assertThat(response.statusCode()).isEqualTo(201);
        return json(response).path("session_id").asText();
    }

    @Test
    @DisplayName("should play a round over HTTP")
    void shouldPlayRound() throws Exception {
        factory.getStub().succeed("M1", "one").succeed("M2", "two").succeed("M3", "three");
        String session = newSession();

        HttpResponse<String> prompt = post("/v1/sessions/" + session + "/prompt", "{\"prompt\":\"Say hi\"}");

        assertThat(prompt.statusCode()).isEqualTo(200);
        JsonNode round = json(prompt);
        assertThat(round.path("state").asText()).isEqualTo("AWAITING_VOTE");
        assertThat(round.path("side_a").path("success").asBoolean()).isTrue();
        assertThat(round.path("side_b").path("text").asText()).isIn("one", "two", "three");
        assertThat(round.has("model_a")).isFalse();

        HttpResponse<String> vote = post("/v1/sessions/" + session + "/vote", "{\"choice\":\"Tie\"}");

        assertThat(vote.statusCode()).isEqualTo(200);
        JsonNode voted = json(vote);
        assertThat(voted.path("status").asText()).isEqualTo("RECORDED");
        assertThat(voted.path("choice").asText()).isEqualTo("Tie");
        assertThat(voted.path("model_a").asText()).isIn("M1", "M2", "M3");
        assertThat(voted.path("round_id").asText()).isEqualTo(round.path("round_id").asText());

        JsonNode view = json(get("/v1/sessions/" + session));
        assertThat(view.path("state").asText()).isEqualTo("VOTED");
        assertThat(view.path("vote").asText()).isEqualTo("Tie");
        Await.until(Duration.ofSeconds(5), () -> factory.getVoteStore().count() == 1);
    }

    @Test
    @DisplayName("should not leak model ids through side errors before the vote")
    void shouldNotLeakModelIdsBeforeVote() throws Exception {
        for (String model : new String[]{"M1", "M2", "M3"}) {
            factory.getStub().failWith(model, ErrorType.CLIENT_ERROR, 404,
                    "The model `" + model + "` does not exist");
        }
        String session = newSession();

        HttpResponse<String> prompt = post("/v1/sessions/" + session + "/prompt", "{\"prompt\":\"Say hi\"}");

        assertThat(prompt.statusCode()).isEqualTo(200);
        JsonNode round = json(prompt);
        assertThat(round.path("side_a").path("error_type").asText()).isEqualTo("CLIENT_ERROR");
        assertThat(round.path("side_a").path("error").asText())
                .isEqualTo("Request rejected by the upstream (HTTP 404)");
        assertThat(prompt.body()).doesNotContain("`M1`", "`M2`", "`M3`");
    }

    @Nested
    @DisplayName("prompt errors")
    class PromptErrors {

        @Test
        @DisplayName("should answer 400 for an empty prompt")
        void shouldRejectEmptyPrompt() throws Exception {
            String session = newSession();

            HttpResponse<String> response = post("/v1/sessions/" + session + "/prompt", "{\"prompt\":\"  \"}");

            assertThat(response.statusCode()).isEqualTo(400);
            assertThat(json(response).path("error").asText()).isEqualTo("Prompt cannot be empty");
        }

        @Test
        @DisplayName("should answer 400 for malformed JSON")
        void shouldRejectMalformedJson() throws Exception {
            String session = newSession();

            HttpResponse<String> response = post("/v1/sessions/" + session + "/prompt", "{not json");

            assertThat(response.statusCode()).isEqualTo(400);
        }

        @Test
        @DisplayName("should answer 503 with Retry-After when models are throttled")
        void shouldAnswer503WhenThrottled() throws Exception {
            factory.getRateLimitTracker().markThrottled("M1", factory.getClock().instant());
            factory.getRateLimitTracker().markThrottled("M2", factory.getClock().instant());
            String session = newSession();

            HttpResponse<String> response = post("/v1/sessions/" + session + "/prompt", "{\"prompt\":\"Say hi\"}");

            assertThat(response.statusCode()).isEqualTo(503);
            assertThat(response.headers().firstValue("Retry-After")).contains("60");
        }

        @Test
        @DisplayName("should answer 404 for an unknown session")
        void shouldAnswer404ForUnknownSession() throws Exception {
            HttpResponse<String> response = post("/v1/sessions/nope/prompt", "{\"prompt\":\"Say hi\"}");

            assertThat(response.statusCode()).isEqualTo(404);
        }
    }

    @Test
    @DisplayName("should answer 409 for a vote before any round")
    void shouldRejectEarlyVote() throws Exception {
        String session = newSession();

        HttpResponse<String> response = post("/v1/sessions/" + session + "/vote", "{\"choice\":\"A\"}");

        assertThat(response.statusCode()).isEqualTo(409);
        assertThat(json(response).path("status").asText()).isEqualTo("REJECTED");
    }

    @Test
    @DisplayName("should end a session")
    void shouldEndSession() throws Exception {
        String session = newSession();

        assertThat(delete("/v1/sessions/" + session).statusCode()).isEqualTo(204);
        assertThat(delete("/v1/sessions/" + session).statusCode()).isEqualTo(404);
        assertThat(get("/v1/sessions/" + session).statusCode()).isEqualTo(404);
    }

    @Test
    @DisplayName("should list models with their throttle state")
    void shouldListModels() throws Exception {
        factory.getRateLimitTracker().markThrottled("M2", factory.getClock().instant());

        JsonNode models = json(get("/v1/models"));

        assertThat(models.size()).isEqualTo(3);
        assertThat(models.path(0).path("id").asText()).isEqualTo("M1");
        assertThat(models.path(0).path("throttled").asBoolean()).isFalse();
        assertThat(models.path(1).path("throttled").asBoolean()).isTrue();
        assertThat(models.path(2).path("category").asText()).isEqualTo("general");
    }

    @Test
    @DisplayName("should report health")
    void shouldReportHealth() throws Exception {
        HttpResponse<String> up = get("/health");
        assertThat(up.statusCode()).isEqualTo(200);
        JsonNode body = json(up);
        assertThat(body.path("status").asText()).isEqualTo("UP");
        assertThat(body.path("votes").path("store").asText()).isEqualTo("memory");
        assertThat(body.path("votes").path("pipelineRunning").asBoolean()).isTrue();

        factory.getRateLimitTracker().markThrottled("M1", factory.getClock().instant());
        factory.getRateLimitTracker().markThrottled("M3", factory.getClock().instant());
        HttpResponse<String> degraded = get("/health");
        assertThat(degraded.statusCode()).isEqualTo(503);
        assertThat(json(degraded).path("throttledModels").asInt()).isEqualTo(2);
    }

    @Test
    @DisplayName("should expose Prometheus metrics")
    void shouldExposeMetrics() throws Exception {
        newSession();

        HttpResponse<String> response = get("/metrics");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).contains("arena_test_active_sessions");
    }
}
