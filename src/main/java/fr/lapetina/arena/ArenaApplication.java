package fr.lapetina.arena;

import fr.lapetina.arena.api.HttpServer;
import fr.lapetina.arena.infrastructure.config.ArenaConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Standalone arena: the component graph behind the HTTP API.
 *
 * Usage: {@code java fr.lapetina.arena.ArenaApplication [config.yaml]}
 */
public final class ArenaApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ArenaApplication.class);

    private final ArenaFactory factory;
    private final HttpServer httpServer;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public ArenaApplication(String configPath) throws IOException {
        this(ArenaFactory.create(configPath));
    }

    ArenaApplication(ArenaFactory factory) throws IOException {
        this.factory = factory.start();
        ArenaConfig config = factory.getConfig();
        this.httpServer = new HttpServer(
                config.getServer().getHost(),
                config.getServer().getPort(),
                config.getServer().getBacklog(),
                factory.getCoordinator(),
                factory.getSessions(),
                factory.getVotePipeline(),
                config.getMetrics().isEnabled() ? factory.getMetricsRegistry() : null,
                Duration.ofMillis(config.getApi().getRequestTimeoutMs())
        );
    }

    public void start() {
        httpServer.start();
        log.info("Arena serving {} models from {} on port {}, votes to {}",
                factory.getModelRegistry().size(), factory.getConfig().getApi().getBaseUrl(),
                httpServer.getPort(), factory.getVoteStore().name());
    }

    /**
     * The bound port; differs from the configured one when that was 0.
     */
    public int getPort() {
        return httpServer.getPort();
    }

    /**
     * Stops the HTTP server first so no round starts while votes drain. Idempotent.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        int openSessions = factory.getSessions().size();
        try {
            httpServer.close();
        } finally {
            factory.close();
        }
        log.info("Arena closed with {} open sessions", openSessions);
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : "config.yaml";
        CountDownLatch stopped = new CountDownLatch(1);

        try {
            ArenaApplication app = new ArenaApplication(configPath);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                app.close();
                stopped.countDown();
            }, "arena-shutdown"));
            app.start();
            stopped.await();
        } catch (Exception e) {
            log.error("Arena failed to start from {}", configPath, e);
            System.exit(1);
        }
    }
}
