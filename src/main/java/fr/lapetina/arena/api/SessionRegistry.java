package fr.lapetina.arena.api;

import fr.lapetina.arena.round.PromptValidator;
import fr.lapetina.arena.round.RoundSession;
import fr.lapetina.arena.round.VoteSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live round sessions keyed by an opaque token.
 *
 * Sessions idle for longer than the configured timeout are evicted lazily whenever
 * the registry is accessed.
 */
public final class SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final Map<String, RoundSession> sessions = new ConcurrentHashMap<>();
    private final PromptValidator validator;
    private final VoteSink voteSink;
    private final Clock clock;
    private final Duration idleTimeout;

    public SessionRegistry(PromptValidator validator, VoteSink voteSink, Clock clock, Duration idleTimeout) {
        this.validator = validator;
        this.voteSink = voteSink;
        this.clock = clock;
        this.idleTimeout = idleTimeout;
    }

    public RoundSession create() {
        evictIdle();
        String id = UUID.randomUUID().toString();
        RoundSession session = new RoundSession(id, validator, clock, voteSink);
        sessions.put(id, session);
        log.info("Session created: sessionId={}, active={}", id, sessions.size());
        return session;
    }

    public Optional<RoundSession> get(String id) {
        evictIdle();
        RoundSession session = sessions.get(id);
        if (session != null) {
            session.touch();
        }
        return Optional.ofNullable(session);
    }

    public boolean remove(String id) {
        RoundSession removed = sessions.remove(id);
        if (removed != null) {
            log.info("Session ended: sessionId={}, state={}", id, removed.state());
        }
        return removed != null;
    }

    public int size() {
        evictIdle();
        return sessions.size();
    }

    private void evictIdle() {
        Instant cutoff = clock.instant().minus(idleTimeout);
        sessions.entrySet().removeIf(entry -> {
            boolean idle = entry.getValue().lastAccess().isBefore(cutoff);
            if (idle) {
                log.info("Session evicted after idle timeout: sessionId={}", entry.getKey());
            }
            return idle;
        });
    }
}
