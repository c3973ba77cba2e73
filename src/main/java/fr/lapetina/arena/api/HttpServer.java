package fr.lapetina.arena.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import fr.lapetina.arena.api.dto.PromptRequest;
import fr.lapetina.arena.api.dto.RoundResponse;
import fr.lapetina.arena.api.dto.VoteRequest;
import fr.lapetina.arena.api.dto.VoteResponse;
import fr.lapetina.arena.disruptor.VotePipeline;
import fr.lapetina.arena.domain.model.Model;
import fr.lapetina.arena.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.arena.round.RoundCoordinator;
import fr.lapetina.arena.round.RoundSession;
import fr.lapetina.arena.round.RoundView;
import fr.lapetina.arena.round.VoteOutcome;
import fr.lapetina.arena.round.exception.InsufficientModelsException;
import fr.lapetina.arena.round.exception.PromptValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Lightweight HTTP server using JDK's built-in HttpServer.
 *
 * Endpoints:
 * - POST /v1/sessions - Open a session
 * - GET /v1/sessions/{id} - Current round of a session
 * - DELETE /v1/sessions/{id} - End a session
 * - POST /v1/sessions/{id}/prompt - Submit a prompt, answers when both sides resolved
 * - POST /v1/sessions/{id}/vote - Vote on the current round
 * - GET /v1/models - Model catalog
 * - GET /health - Health check endpoint
 * - GET /metrics - Prometheus metrics endpoint, absent when metrics are disabled
 */
public final class HttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private static final String SESSIONS_PATH = "/v1/sessions";
    private static final Duration RESPONSE_GRACE = Duration.ofSeconds(10);

    private final com.sun.net.httpserver.HttpServer server;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final RoundCoordinator coordinator;
    private final SessionRegistry sessions;
    private final VotePipeline votePipeline;
    private final MetricsRegistry metricsRegistry;
    private final Duration roundWait;

    public HttpServer(
            String host,
            int port,
            int backlog,
            RoundCoordinator coordinator,
            SessionRegistry sessions,
            VotePipeline votePipeline,
            MetricsRegistry metricsRegistry,
            Duration requestTimeout
    ) throws IOException {
        this.coordinator = coordinator;
        this.sessions = sessions;
        this.votePipeline = votePipeline;
        this.metricsRegistry = metricsRegistry;
        this.roundWait = requestTimeout.plus(RESPONSE_GRACE);

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        this.server = com.sun.net.httpserver.HttpServer.create(new InetSocketAddress(host, port), backlog);
        this.executor = Executors.newCachedThreadPool();
        server.setExecutor(executor);

        server.createContext(SESSIONS_PATH, new SessionHandler());
        server.createContext("/v1/models", new ModelsHandler());
        server.createContext("/health", new HealthHandler());
        if (metricsRegistry != null) {
            server.createContext("/metrics", new MetricsHandler());
        }

        log.info("HTTP server configured on {}:{}", host, port);
    }

    public void start() {
        server.start();
        log.info("HTTP server started on port {}", getPort());
    }

    /**
     * The bound port; differs from the configured one when that was 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(1);
        executor.shutdown();
        log.info("HTTP server stopped");
    }

    // ==================== SESSION HANDLER ====================

    private class SessionHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            MDC.put("requestId", UUID.randomUUID().toString());
            try {
                route(exchange);
            } catch (Exception e) {
                log.error("Error handling session request: path={}", exchange.getRequestURI().getPath(), e);
                sendError(exchange, 500, "Internal server error");
            } finally {
                MDC.clear();
            }
        }

        private void route(HttpExchange exchange) throws Exception {
            String method = exchange.getRequestMethod();
            String rest = exchange.getRequestURI().getPath().substring(SESSIONS_PATH.length());
            String[] parts = rest.isEmpty() || "/".equals(rest)
                    ? new String[0]
                    : rest.substring(1).split("/");

            if (parts.length == 0) {
                if ("POST".equalsIgnoreCase(method)) {
                    RoundSession session = sessions.create();
                    sendJson(exchange, 201, Map.of("session_id", session.id()));
                } else {
                    sendError(exchange, 405, "Method Not Allowed");
                }
                return;
            }

            String sessionId = parts[0];
            MDC.put("sessionId", sessionId);

            if (parts.length == 1 && "DELETE".equalsIgnoreCase(method)) {
                if (sessions.remove(sessionId)) {
                    exchange.sendResponseHeaders(204, -1);
                    exchange.close();
                } else {
                    sendError(exchange, 404, "Session not found: " + sessionId);
                }
                return;
            }

            Optional<RoundSession> session = sessions.get(sessionId);
            if (session.isEmpty()) {
                sendError(exchange, 404, "Session not found: " + sessionId);
                return;
            }

            if (parts.length == 1 && "GET".equalsIgnoreCase(method)) {
                sendJson(exchange, 200, RoundResponse.from(session.get().snapshot()));
            } else if (parts.length == 2 && "prompt".equals(parts[1]) && "POST".equalsIgnoreCase(method)) {
                handlePrompt(exchange, session.get());
            } else if (parts.length == 2 && "vote".equals(parts[1]) && "POST".equalsIgnoreCase(method)) {
                handleVote(exchange, session.get());
            } else {
                sendError(exchange, 404, "Not Found");
            }
        }

        private void handlePrompt(HttpExchange exchange, RoundSession session) throws Exception {
            PromptRequest request = readBody(exchange, PromptRequest.class);
            if (request == null) {
                sendError(exchange, 400, "Malformed JSON body");
                return;
            }

            RoundView view;
            try {
                view = coordinator.submitPrompt(session, request.getPrompt())
                        .get(roundWait.toMillis(), TimeUnit.MILLISECONDS);
            } catch (PromptValidationException e) {
                log.info("Prompt rejected: sessionId={}, reason={}", session.id(), e.getMessage());
                sendError(exchange, 400, e.getMessage());
                return;
            } catch (InsufficientModelsException e) {
                long retryAfter = Math.max(1, e.getRetryAfter().toSeconds());
                log.warn("Round refused: sessionId={}, eligible={}", session.id(), e.getEligible());
                exchange.getResponseHeaders().set("Retry-After", String.valueOf(retryAfter));
                sendError(exchange, 503, e.getMessage());
                return;
            } catch (TimeoutException e) {
                log.error("Round did not settle in time: sessionId={}, waitMs={}", session.id(), roundWait.toMillis());
                sendError(exchange, 504, "Round did not complete in time");
                return;
            } catch (ExecutionException e) {
                log.error("Round failed: sessionId={}", session.id(), e.getCause());
                sendError(exchange, 500, "Round failed");
                return;
            }
            sendJson(exchange, 200, RoundResponse.from(view));
        }

        private void handleVote(HttpExchange exchange, RoundSession session) throws IOException {
            VoteRequest request = readBody(exchange, VoteRequest.class);
            if (request == null) {
                sendError(exchange, 400, "Malformed JSON body");
                return;
            }

            VoteOutcome outcome = coordinator.castVote(session, request.getChoice());
            int status = outcome.status() == VoteOutcome.Status.REJECTED ? 409 : 200;
            sendJson(exchange, status, VoteResponse.from(outcome, session.snapshot()));
        }
    }

    // ==================== MODELS HANDLER ====================

    private class ModelsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            List<String> throttled = coordinator.throttledModels();
            List<Map<String, Object>> models = new ArrayList<>();
            for (Model model : coordinator.models()) {
                Map<String, Object> info = new LinkedHashMap<>();
                info.put("id", model.id());
                info.put("display_name", model.displayName());
                info.put("category", model.category());
                info.put("context_length", model.contextLength());
                info.put("throttled", throttled.contains(model.id()));
                models.add(info);
            }
            sendJson(exchange, 200, models);
        }
    }

    // ==================== HEALTH HANDLER ====================

    private class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            int registered = coordinator.models().size();
            int throttled = coordinator.throttledModels().size();
            boolean pipelineUp = votePipeline.isRunning();
            String status;
            if (!pipelineUp || registered - throttled < 2) {
                status = "DEGRADED";
            } else {
                status = "UP";
            }

            Map<String, Object> health = new LinkedHashMap<>();
            health.put("status", status);
            health.put("timestamp", System.currentTimeMillis());
            health.put("models", registered);
            health.put("throttledModels", throttled);
            health.put("activeSessions", sessions.size());

            Map<String, Object> votes = new LinkedHashMap<>();
            votes.put("store", votePipeline.getStore().name());
            votes.put("total", votePipeline.getStore().count());
            votes.put("pipelineRunning", pipelineUp);
            votes.put("ringBufferRemaining", votePipeline.getRemainingCapacity());
            health.put("votes", votes);

            sendJson(exchange, "UP".equals(status) ? 200 : 503, health);
        }
    }

    // ==================== METRICS HANDLER ====================

    private class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            String metrics = metricsRegistry.scrape();
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            byte[] bytes = metrics.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }
    }

    // ==================== HELPER METHODS ====================

    private <T> T readBody(HttpExchange exchange, Class<T> type) throws IOException {
        try (InputStream is = exchange.getRequestBody()) {
            return objectMapper.readValue(is, type);
        } catch (JsonProcessingException e) {
            log.info("Malformed request body: type={}, error={}", type.getSimpleName(), e.getOriginalMessage());
            return null;
        }
    }

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        sendJson(exchange, statusCode, Map.of("error", message));
    }
}
