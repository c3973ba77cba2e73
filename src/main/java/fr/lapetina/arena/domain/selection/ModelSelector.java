package fr.lapetina.arena.domain.selection;

import fr.lapetina.arena.domain.model.Model;
import fr.lapetina.arena.domain.model.ModelPair;
import fr.lapetina.arena.infrastructure.ratelimit.RateLimitTracker;
import fr.lapetina.arena.infrastructure.registry.ModelRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Draws two distinct, non-throttled models for a round.
 *
 * Every ordered pair of eligible models is equally likely: the first index is drawn
 * uniformly, the second uniformly among the remaining ones.
 */
public final class ModelSelector {

    private static final Logger log = LoggerFactory.getLogger(ModelSelector.class);

    private final ModelRegistry registry;
    private final RateLimitTracker rateLimitTracker;
    private final Random random;

    public ModelSelector(ModelRegistry registry, RateLimitTracker rateLimitTracker) {
        this(registry, rateLimitTracker, null);
    }

    /**
     * @param random source of randomness; {@code null} uses {@link ThreadLocalRandom}
     */
    public ModelSelector(ModelRegistry registry, RateLimitTracker rateLimitTracker, Random random) {
        this.registry = registry;
        this.rateLimitTracker = rateLimitTracker;
        this.random = random;
    }

    /**
     * Models in registry order that are not throttled at {@code now}.
     */
    public List<Model> eligibleModels(Instant now) {
        return registry.list().stream()
                .filter(m -> !rateLimitTracker.isThrottled(m.id(), now))
                .toList();
    }

    /**
     * Selects a pair, or empty when fewer than two models are eligible.
     */
    public Optional<ModelPair> select(Instant now) {
        List<Model> eligible = eligibleModels(now);
        int n = eligible.size();
        if (n < 2) {
            log.warn("Not enough eligible models: eligible={}, registered={}", n, registry.size());
            return Optional.empty();
        }

        Random rnd = random != null ? random : ThreadLocalRandom.current();
        int i = rnd.nextInt(n);
        int j = rnd.nextInt(n - 1);
        if (j >= i) {
            j++;
        }

        ModelPair pair = new ModelPair(eligible.get(i).id(), eligible.get(j).id());
        log.debug("Pair selected: modelA={}, modelB={}, eligible={}", pair.modelA(), pair.modelB(), n);
        return Optional.of(pair);
    }
}
