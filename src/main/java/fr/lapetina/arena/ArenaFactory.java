package fr.lapetina.arena;

import fr.lapetina.arena.api.SessionRegistry;
import fr.lapetina.arena.disruptor.VotePipeline;
import fr.lapetina.arena.domain.selection.ModelSelector;
import fr.lapetina.arena.infrastructure.config.ArenaConfig;
import fr.lapetina.arena.infrastructure.config.ConfigLoader;
import fr.lapetina.arena.infrastructure.http.CompletionClient;
import fr.lapetina.arena.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.arena.infrastructure.ratelimit.RateLimitTracker;
import fr.lapetina.arena.infrastructure.registry.ModelRegistry;
import fr.lapetina.arena.infrastructure.store.VoteStore;
import fr.lapetina.arena.infrastructure.store.VoteStores;
import fr.lapetina.arena.round.PromptValidator;
import fr.lapetina.arena.round.RoundCoordinator;
import fr.lapetina.arena.round.RoundDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.function.Function;

/**
 * Factory for creating a fully-wired arena from configuration.
 * This is the primary entry point for obtaining a configured {@link RoundCoordinator}.
 *
 * <p>Usage:
 * <pre>{@code
 * try (ArenaFactory factory = ArenaFactory.create("config.yaml").start()) {
 *     RoundSession session = factory.getSessions().create();
 *     RoundView view = factory.getCoordinator().submitPrompt(session, "Hello").join();
 * }
 * }</pre>
 */
public class ArenaFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ArenaFactory.class);

    private final ArenaConfig config;
    private final Clock clock;
    private final MetricsRegistry metricsRegistry;
    private final ModelRegistry modelRegistry;
    private final RateLimitTracker rateLimitTracker;
    private final CompletionClient completionClient;
    private final RoundDispatcher dispatcher;
    private final VoteStore voteStore;
    private final VotePipeline votePipeline;
    private final SessionRegistry sessions;
    private final RoundCoordinator coordinator;

    protected ArenaFactory(
            String configPath,
            CompletionClient clientOverride,
            Function<String, String> environment,
            Clock clock
    ) {
        log.info("Initializing ArenaFactory from config: {}", configPath);

        this.config = new ConfigLoader(configPath, environment).load();
        this.clock = clock;

        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());
        this.modelRegistry = ModelRegistry.fromConfig(config.getModels());
        this.rateLimitTracker = new RateLimitTracker(Duration.ofMillis(config.getRateLimit().getCooldownMs()));
        metricsRegistry.registerThrottledModels(() -> rateLimitTracker.throttledModels(clock.instant()).size());

        // Allow override for testing
        this.completionClient = clientOverride != null ? clientOverride : createCompletionClient();

        this.dispatcher = RoundDispatcher.builder()
                .fromConfig(config)
                .client(completionClient)
                .rateLimitTracker(rateLimitTracker)
                .metricsRegistry(metricsRegistry)
                .clock(clock)
                .build();

        this.voteStore = VoteStores.create(config.getVoteStore());
        this.votePipeline = VotePipeline.builder()
                .fromConfig(config.getVoteStore())
                .store(voteStore)
                .metricsRegistry(metricsRegistry)
                .build();

        PromptValidator validator = new PromptValidator(config.getValidation().getMaxPromptLength());
        this.sessions = new SessionRegistry(validator, votePipeline, clock,
                Duration.ofMillis(config.getSessions().getIdleTimeoutMs()));
        metricsRegistry.registerActiveSessions(sessions::size);

        this.coordinator = new RoundCoordinator(
                modelRegistry,
                new ModelSelector(modelRegistry, rateLimitTracker),
                rateLimitTracker,
                dispatcher,
                validator,
                metricsRegistry,
                clock
        );

        log.info("ArenaFactory initialized: models={}, voteStore={}", modelRegistry.size(), voteStore.name());
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static ArenaFactory create(String configPath) {
        return new ArenaFactory(configPath, null, System::getenv, Clock.systemUTC());
    }

    /**
     * Creates a factory from the default configuration (config.yaml).
     */
    public static ArenaFactory create() {
        return create("config.yaml");
    }

    /**
     * Starts the vote pipeline.
     */
    public ArenaFactory start() {
        votePipeline.start();
        log.info("Arena started");
        return this;
    }

    public ArenaConfig getConfig() {
        return config;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public ModelRegistry getModelRegistry() {
        return modelRegistry;
    }

    public RateLimitTracker getRateLimitTracker() {
        return rateLimitTracker;
    }

    public CompletionClient getCompletionClient() {
        return completionClient;
    }

    public VoteStore getVoteStore() {
        return voteStore;
    }

    public VotePipeline getVotePipeline() {
        return votePipeline;
    }

    public SessionRegistry getSessions() {
        return sessions;
    }

    public RoundCoordinator getCoordinator() {
        return coordinator;
    }

    public Clock getClock() {
        return clock;
    }

    private CompletionClient createCompletionClient() {
        ArenaConfig.ApiConfig api = config.getApi();
        return new CompletionClient(
                URI.create(api.getBaseUrl()),
                api.getApiKey(),
                Duration.ofMillis(api.getConnectTimeoutMs()),
                Duration.ofMillis(api.getRequestTimeoutMs())
        );
    }

    @Override
    public void close() {
        log.info("Shutting down ArenaFactory...");

        try {
            dispatcher.close();
        } catch (Exception e) {
            log.warn("Error closing dispatcher", e);
        }

        try {
            votePipeline.close();
        } catch (Exception e) {
            log.warn("Error closing vote pipeline", e);
        }

        try {
            voteStore.close();
        } catch (Exception e) {
            log.warn("Error closing vote store", e);
        }

        try {
            completionClient.close();
        } catch (Exception e) {
            log.warn("Error closing completion client", e);
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        log.info("ArenaFactory shut down");
    }
}
