package fr.lapetina.arena.round;

import fr.lapetina.arena.domain.model.ModelPair;
import fr.lapetina.arena.domain.model.PromptDigest;
import fr.lapetina.arena.domain.model.RoundRequest;
import fr.lapetina.arena.domain.model.RoundResult;
import fr.lapetina.arena.domain.model.VoteChoice;
import fr.lapetina.arena.domain.model.VoteRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * State of one user interaction with the arena.
 *
 * <pre>
 * IDLE -> DISPATCHING -> AWAITING_VOTE -> VOTED
 *            ^______________|_______________|   (new prompt)
 * </pre>
 *
 * Every transition runs under one lock. Each round gets a new sequence number and
 * results carrying an older number are dropped, so a slow response to an abandoned
 * prompt can never overwrite the current round. A round accepts exactly one vote;
 * the vote is handed to the {@link VoteSink} after the lock is released.
 */
public final class RoundSession {

    private static final Logger log = LoggerFactory.getLogger(RoundSession.class);

    private final String id;
    private final PromptValidator validator;
    private final Clock clock;
    private final VoteSink voteSink;
    private final ReentrantLock lock = new ReentrantLock();

    private SessionState state = SessionState.IDLE;
    private long sequence;
    private RoundRequest currentRound;
    private RoundResult currentResult;
    private VoteRecord voteRecord;
    private CompletableFuture<Void> settled = CompletableFuture.completedFuture(null);

    private volatile Instant lastAccess;

    public RoundSession(String id, PromptValidator validator, Clock clock, VoteSink voteSink) {
        this.id = Objects.requireNonNull(id, "Session ID is required");
        this.validator = Objects.requireNonNull(validator, "Validator is required");
        this.clock = Objects.requireNonNull(clock, "Clock is required");
        this.voteSink = Objects.requireNonNull(voteSink, "Vote sink is required");
        this.lastAccess = clock.instant();
    }

    /**
     * Starts a fresh round for {@code prompt} with the already-selected pair.
     * Any round in progress is abandoned.
     *
     * @throws fr.lapetina.arena.round.exception.PromptValidationException if the prompt is invalid;
     *         the session is left unchanged
     */
    public RoundTicket startRound(String prompt, ModelPair pair, Instant now) {
        validator.validate(prompt);

        CompletableFuture<Void> previous;
        RoundTicket ticket;
        lock.lock();
        try {
            previous = settled;
            ticket = begin(prompt, pair, now);
        } finally {
            lock.unlock();
        }
        previous.complete(null);

        log.info("Round started: sessionId={}, roundId={}, sequence={}", id, ticket.request().roundId(),
                ticket.sequence());
        return ticket;
    }

    /**
     * Starts a round unless {@code prompt} has the same content hash as the current one.
     * The hash check, the pair selection and the transition run under the session lock,
     * so concurrent submissions of one prompt start at most one round.
     *
     * @param pairSelector called under the lock only when a new round is needed; an
     *                     exception it throws leaves the session unchanged
     * @return the started ticket, or the current round's settle future when reused
     */
    public RoundStart startRoundIfNew(String prompt, Supplier<ModelPair> pairSelector, Instant now) {
        validator.validate(prompt);
        String hash = PromptDigest.hash(prompt);

        CompletableFuture<Void> previous;
        RoundTicket ticket;
        lock.lock();
        try {
            if (currentRound != null && currentRound.promptHash().equals(hash)) {
                touch();
                log.debug("Same prompt resubmitted, reusing current round: sessionId={}, roundId={}",
                        id, currentRound.roundId());
                return RoundStart.reused(settled);
            }
            ModelPair pair = pairSelector.get();
            previous = settled;
            ticket = begin(prompt, pair, now);
        } finally {
            lock.unlock();
        }
        previous.complete(null);

        log.info("Round started: sessionId={}, roundId={}, sequence={}", id, ticket.request().roundId(),
                ticket.sequence());
        return RoundStart.started(ticket);
    }

    // Caller holds the lock
    private RoundTicket begin(String prompt, ModelPair pair, Instant now) {
        RoundRequest request = RoundRequest.of(prompt, pair, now);
        touch();
        long seq = ++sequence;
        currentRound = request;
        currentResult = null;
        voteRecord = null;
        settled = new CompletableFuture<>();
        state = SessionState.DISPATCHING;
        return new RoundTicket(seq, request);
    }

    /**
     * Delivers the combined result of the round identified by {@code seq}.
     *
     * @return true if the result was accepted; false if it belongs to an older round
     *         or the session is no longer dispatching
     */
    public boolean resultsReady(long seq, RoundResult result) {
        CompletableFuture<Void> toComplete;
        String roundId;
        lock.lock();
        try {
            if (seq != sequence || state != SessionState.DISPATCHING) {
                log.debug("Stale round result dropped: sessionId={}, sequence={}, current={}, state={}",
                        id, seq, sequence, state);
                return false;
            }
            currentResult = Objects.requireNonNull(result, "Round result is required");
            state = SessionState.AWAITING_VOTE;
            toComplete = settled;
            roundId = currentRound.roundId();
        } finally {
            lock.unlock();
        }
        toComplete.complete(null);

        log.info("Round ready for vote: sessionId={}, roundId={}, sideA={}, sideB={}",
                id, roundId,
                result.sideA().isSuccess() ? "ok" : result.sideA().errorType(),
                result.sideB().isSuccess() ? "ok" : result.sideB().errorType());
        return true;
    }

    /**
     * Records a vote given as a wire label ("A", "B", "Tie", "BothBad").
     */
    public VoteOutcome castVote(String label) {
        Optional<VoteChoice> choice = VoteChoice.fromLabel(label);
        if (choice.isPresent()) {
            return castVote(choice.get());
        }
        lock.lock();
        try {
            touch();
            if (state == SessionState.VOTED) {
                return VoteOutcome.alreadyVoted(voteRecord.choice());
            }
        } finally {
            lock.unlock();
        }
        log.warn("Vote rejected: sessionId={}, reason=unknown choice, label={}", id, label);
        return VoteOutcome.rejected(null, "Unknown vote choice: " + label);
    }

    /**
     * Records a vote on the current round.
     */
    public VoteOutcome castVote(VoteChoice choice) {
        Objects.requireNonNull(choice, "Vote choice is required");
        VoteRecord record;
        lock.lock();
        try {
            touch();
            if (state == SessionState.VOTED) {
                log.debug("Duplicate vote ignored: sessionId={}, roundId={}", id, currentRound.roundId());
                return VoteOutcome.alreadyVoted(voteRecord.choice());
            }
            if (state != SessionState.AWAITING_VOTE) {
                log.warn("Vote rejected: sessionId={}, state={}, choice={}", id, state, choice.label());
                return VoteOutcome.rejected(choice, "No round is awaiting a vote (state " + state + ")");
            }
            record = VoteRecord.of(id, currentRound, choice, clock.instant());
            voteRecord = record;
            state = SessionState.VOTED;
        } finally {
            lock.unlock();
        }

        log.info("Vote recorded: sessionId={}, roundId={}, choice={}, modelA={}, modelB={}",
                id, record.roundId(), choice.label(), record.modelA(), record.modelB());
        try {
            voteSink.submit(record);
        } catch (RuntimeException e) {
            log.error("Vote sink rejected vote: sessionId={}, roundId={}", id, record.roundId(), e);
        }
        return VoteOutcome.recorded(record);
    }

    /**
     * True if {@code prompt} has the same content hash as the current round's prompt.
     */
    public boolean isCurrentPrompt(String prompt) {
        if (prompt == null) {
            return false;
        }
        String hash = PromptDigest.hash(prompt);
        lock.lock();
        try {
            return currentRound != null && currentRound.promptHash().equals(hash);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Completes when the current round has both results, or when it is abandoned.
     */
    public CompletableFuture<Void> currentRoundSettled() {
        lock.lock();
        try {
            return settled;
        } finally {
            lock.unlock();
        }
    }

    public RoundView snapshot() {
        lock.lock();
        try {
            boolean revealed = state == SessionState.VOTED;
            return new RoundView(
                    id,
                    sequence,
                    state,
                    currentRound != null ? currentRound.roundId() : null,
                    currentRound != null ? currentRound.prompt() : null,
                    currentResult != null ? currentResult.sideA() : null,
                    currentResult != null ? currentResult.sideB() : null,
                    voteRecord != null ? voteRecord.choice() : null,
                    revealed ? currentRound.modelA() : null,
                    revealed ? currentRound.modelB() : null
            );
        } finally {
            lock.unlock();
        }
    }

    public SessionState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks the session as used now.
     */
    public void touch() {
        lastAccess = clock.instant();
    }

    public Instant lastAccess() {
        return lastAccess;
    }

    public String id() {
        return id;
    }
}
