package fr.lapetina.arena.infrastructure.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.arena.domain.model.CompletionResponse;
import fr.lapetina.arena.domain.model.ErrorType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * HTTP client for the upstream chat-completions API.
 *
 * Uses java.net.http.HttpClient for non-blocking I/O. Every call is a single attempt;
 * retries belong to the caller. The returned future never completes exceptionally:
 * transport failures are mapped to an {@link ErrorType}.
 */
public class CompletionClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CompletionClient.class);

    static final String USER_AGENT = "llm-arena/1.0";
    private static final String RATE_LIMIT_MARKER = "rate_limit";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final URI endpoint;
    private final String apiKey;
    private final Duration requestTimeout;

    public CompletionClient(URI endpoint, String apiKey, Duration connectTimeout, Duration requestTimeout) {
        this.endpoint = endpoint;
        this.apiKey = apiKey;
        this.requestTimeout = requestTimeout;

        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Sends one chat-completion request for {@code prompt} to {@code modelId}.
     *
     * @param modelId Model identifier understood by the upstream
     * @param prompt  User prompt, sent as a single user message
     * @return CompletableFuture with the classified response
     */
    public CompletableFuture<CompletionResponse> send(String modelId, String prompt) {
        HttpRequest httpRequest;
        try {
            httpRequest = buildHttpRequest(modelId, prompt);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("Failed to build request: model={}", modelId, e);
            return CompletableFuture.completedFuture(
                    CompletionResponse.error(modelId, 0, ErrorType.CLIENT_ERROR,
                            "Failed to build request: " + e.getMessage(), Duration.ZERO));
        }

        Instant startTime = Instant.now();
        log.debug("Sending completion request: model={}, endpoint={}", modelId, httpRequest.uri());

        return httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString())
                .thenApply(response -> handleResponse(modelId, response, startTime))
                .exceptionally(ex -> handleException(modelId, ex, startTime));
    }

    private HttpRequest buildHttpRequest(String modelId, String prompt) throws JsonProcessingException {
        return HttpRequest.newBuilder()
                .uri(endpoint)
                .timeout(requestTimeout)
                .header("Authorization", "Bearer " + apiKey)
                .header("Content-Type", "application/json")
                .header("User-Agent", USER_AGENT)
                .POST(HttpRequest.BodyPublishers.ofString(buildRequestBody(modelId, prompt)))
                .build();
    }

    private String buildRequestBody(String modelId, String prompt) throws JsonProcessingException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", modelId);
        body.put("messages", List.of(Map.of("role", "user", "content", prompt)));
        body.put("stream", false);
        return objectMapper.writeValueAsString(body);
    }

    private CompletionResponse handleResponse(String modelId, HttpResponse<String> response, Instant startTime) {
        Duration latency = Duration.between(startTime, Instant.now());
        int statusCode = response.statusCode();
        JsonNode json = readTree(response.body());

        if (statusCode == 429 || hasRateLimitError(json)) {
            log.warn("Completion throttled: model={}, status={}, latencyMs={}", modelId, statusCode, latency.toMillis());
            return CompletionResponse.error(modelId, statusCode, ErrorType.THROTTLED,
                    errorMessage(json, "Rate limited (HTTP " + statusCode + ")"), latency);
        }

        if (statusCode >= 200 && statusCode < 300) {
            String content = extractContent(json);
            if (content == null || content.isBlank()) {
                log.warn("Completion response had no content: model={}, status={}", modelId, statusCode);
                return CompletionResponse.error(modelId, statusCode, ErrorType.INVALID_RESPONSE,
                        json == null ? "Response body is not valid JSON" : "Response contains no completion text",
                        latency);
            }
            int tokens = json.path("usage").path("completion_tokens").asInt(0);
            log.info("Completion successful: model={}, status={}, tokens={}, latencyMs={}",
                    modelId, statusCode, tokens, latency.toMillis());
            return CompletionResponse.success(modelId, content, tokens, latency);
        }

        ErrorType errorType = statusCode >= 500 ? ErrorType.SERVER_ERROR : ErrorType.CLIENT_ERROR;
        log.warn("Completion failed with HTTP error: model={}, status={}, errorType={}, latencyMs={}",
                modelId, statusCode, errorType, latency.toMillis());
        return CompletionResponse.error(modelId, statusCode, errorType,
                errorMessage(json, "HTTP " + statusCode), latency);
    }

    private JsonNode readTree(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            return node != null && node.isObject() ? node : null;
        } catch (JsonProcessingException e) {
            log.debug("Response body is not JSON: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static String extractContent(JsonNode json) {
        if (json == null) {
            return null;
        }
        JsonNode choice = json.path("choices").path(0).path("message").path("content");
        if (choice.isTextual()) {
            return choice.asText();
        }
        // Ollama-style shapes
        JsonNode message = json.path("message").path("content");
        if (message.isTextual()) {
            return message.asText();
        }
        JsonNode response = json.path("response");
        return response.isTextual() ? response.asText() : null;
    }

    private static boolean hasRateLimitError(JsonNode json) {
        if (json == null || !json.has("error")) {
            return false;
        }
        JsonNode error = json.get("error");
        if (error.isTextual()) {
            return containsMarker(error.asText());
        }
        return containsMarker(error.path("type").asText(""))
                || containsMarker(error.path("code").asText(""))
                || containsMarker(error.path("message").asText(""));
    }

    private static boolean containsMarker(String value) {
        return value.toLowerCase(Locale.ROOT).contains(RATE_LIMIT_MARKER);
    }

    private static String errorMessage(JsonNode json, String fallback) {
        if (json == null || !json.has("error")) {
            return fallback;
        }
        JsonNode error = json.get("error");
        if (error.isTextual()) {
            return error.asText();
        }
        String message = error.path("message").asText("");
        return message.isBlank() ? fallback : message;
    }

    private CompletionResponse handleException(String modelId, Throwable ex, Instant startTime) {
        Duration latency = Duration.between(startTime, Instant.now());
        Throwable cause = unwrap(ex);
        ErrorType errorType = classifyException(cause);
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();

        if (errorType == ErrorType.TIMEOUT) {
            log.error("Completion timeout: model={}, latencyMs={}, error={}", modelId, latency.toMillis(), message);
        } else if (errorType == ErrorType.NETWORK_ERROR) {
            log.error("Upstream connection error: model={}, errorType={}, error={}",
                    modelId, cause.getClass().getSimpleName(), message);
        } else {
            log.error("Completion failed unexpectedly: model={}, errorType={}, error={}",
                    modelId, cause.getClass().getSimpleName(), message, ex);
        }

        return CompletionResponse.error(modelId, 0, errorType, message, latency);
    }

    private static Throwable unwrap(Throwable ex) {
        Throwable current = ex;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    static ErrorType classifyException(Throwable cause) {
        // HttpConnectTimeoutException extends HttpTimeoutException
        if (cause instanceof HttpConnectTimeoutException) {
            return ErrorType.NETWORK_ERROR;
        }
        if (cause instanceof HttpTimeoutException || cause instanceof TimeoutException) {
            return ErrorType.TIMEOUT;
        }
        if (cause instanceof ConnectException || cause instanceof IOException) {
            return ErrorType.NETWORK_ERROR;
        }
        return ErrorType.INTERNAL_ERROR;
    }

    public Duration requestTimeout() {
        return requestTimeout;
    }

    @Override
    public void close() {
        // HttpClient doesn't need explicit closing in Java 17
    }
}
