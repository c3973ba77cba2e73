package fr.lapetina.arena.round;

import fr.lapetina.arena.domain.model.Model;
import fr.lapetina.arena.domain.model.ModelPair;
import fr.lapetina.arena.domain.selection.ModelSelector;
import fr.lapetina.arena.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.arena.infrastructure.ratelimit.RateLimitTracker;
import fr.lapetina.arena.infrastructure.registry.ModelRegistry;
import fr.lapetina.arena.round.exception.InsufficientModelsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Drives rounds for sessions: validate, select, dispatch, deliver, vote.
 */
public final class RoundCoordinator {

    private static final Logger log = LoggerFactory.getLogger(RoundCoordinator.class);

    private final ModelRegistry registry;
    private final ModelSelector selector;
    private final RateLimitTracker rateLimitTracker;
    private final RoundDispatcher dispatcher;
    private final PromptValidator validator;
    private final MetricsRegistry metricsRegistry;
    private final Clock clock;

    public RoundCoordinator(
            ModelRegistry registry,
            ModelSelector selector,
            RateLimitTracker rateLimitTracker,
            RoundDispatcher dispatcher,
            PromptValidator validator,
            MetricsRegistry metricsRegistry,
            Clock clock
    ) {
        this.registry = registry;
        this.selector = selector;
        this.rateLimitTracker = rateLimitTracker;
        this.dispatcher = dispatcher;
        this.validator = validator;
        this.metricsRegistry = metricsRegistry;
        this.clock = clock;
    }

    /**
     * Submits a prompt on behalf of {@code session}.
     *
     * A prompt with the same content as the current round returns that round again
     * without reselecting or redispatching. Any other prompt starts a fresh round.
     *
     * @return future completed with the session snapshot once both sides resolved
     * @throws fr.lapetina.arena.round.exception.PromptValidationException if the prompt is invalid
     * @throws InsufficientModelsException if fewer than two models are eligible
     */
    public CompletableFuture<RoundView> submitPrompt(RoundSession session, String prompt) {
        validator.validate(prompt);

        Instant now = clock.instant();
        RoundStart start = session.startRoundIfNew(prompt, () -> selectPair(now), now);
        if (!start.isNew()) {
            return start.settled().thenApply(v -> session.snapshot());
        }

        RoundTicket ticket = start.ticket();
        countRound("started");

        return dispatcher.dispatch(ticket.request())
                .thenApply(result -> {
                    if (session.resultsReady(ticket.sequence(), result)) {
                        countRound("completed");
                    } else {
                        countRound("abandoned");
                    }
                    return session.snapshot();
                });
    }

    private ModelPair selectPair(Instant now) {
        Optional<ModelPair> pair = selector.select(now);
        if (pair.isEmpty()) {
            int eligible = selector.eligibleModels(now).size();
            countRound("insufficient_models");
            log.warn("Cannot start round: eligible={}, throttled={}", eligible, rateLimitTracker.throttledModels(now));
            throw new InsufficientModelsException(eligible, rateLimitTracker.cooldownWindow());
        }
        return pair.get();
    }

    /**
     * Casts a vote on the session's current round.
     */
    public VoteOutcome castVote(RoundSession session, String label) {
        VoteOutcome outcome = session.castVote(label);
        if (metricsRegistry != null) {
            metricsRegistry.incrementVoteCount(outcome.choice(), outcome.status().name());
        }
        return outcome;
    }

    /**
     * The model catalog, in configuration order.
     */
    public List<Model> models() {
        return registry.list();
    }

    /**
     * Ids of the models currently in their cool-down window.
     */
    public List<String> throttledModels() {
        return rateLimitTracker.throttledModels(clock.instant());
    }

    private void countRound(String outcome) {
        if (metricsRegistry != null) {
            metricsRegistry.incrementRoundCount(outcome);
        }
    }
}
