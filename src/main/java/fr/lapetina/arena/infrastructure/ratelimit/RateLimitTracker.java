package fr.lapetina.arena.infrastructure.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Remembers when each model last signalled "too many requests".
 *
 * A model is throttled while {@code now < lastSignal + cooldown}. Entries are never
 * removed: an expired entry simply stops matching. Timestamps only move forward,
 * so a late-arriving older signal cannot shorten a cool-down.
 */
public final class RateLimitTracker {

    private static final Logger log = LoggerFactory.getLogger(RateLimitTracker.class);

    private final Map<String, Instant> lastThrottled = new ConcurrentHashMap<>();
    private final Duration cooldown;

    public RateLimitTracker(Duration cooldown) {
        Objects.requireNonNull(cooldown, "Cooldown is required");
        if (cooldown.isZero() || cooldown.isNegative()) {
            throw new IllegalArgumentException("Cooldown must be positive: " + cooldown);
        }
        this.cooldown = cooldown;
    }

    /**
     * Records a throttle signal for the model at {@code now}.
     */
    public void markThrottled(String modelId, Instant now) {
        Instant effective = lastThrottled.merge(modelId, now, (old, fresh) -> fresh.isAfter(old) ? fresh : old);
        log.warn("Model throttled: model={}, until={}", modelId, effective.plus(cooldown));
    }

    /**
     * Returns true if the model is still inside its cool-down window at {@code now}.
     * Models that never signalled are not throttled.
     */
    public boolean isThrottled(String modelId, Instant now) {
        Instant last = lastThrottled.get(modelId);
        return last != null && now.isBefore(last.plus(cooldown));
    }

    /**
     * Returns the ids of all models currently inside their cool-down window.
     */
    public List<String> throttledModels(Instant now) {
        return lastThrottled.entrySet().stream()
                .filter(e -> now.isBefore(e.getValue().plus(cooldown)))
                .map(Map.Entry::getKey)
                .sorted()
                .toList();
    }

    public Duration cooldownWindow() {
        return cooldown;
    }
}
