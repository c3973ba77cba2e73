package fr.lapetina.arena.round;

import java.util.concurrent.CompletableFuture;

/**
 * Outcome of {@link RoundSession#startRoundIfNew}.
 *
 * @param ticket  the new round; null when the current round was reused
 * @param settled settle future of the reused round; null when a new round started
 */
public record RoundStart(RoundTicket ticket, CompletableFuture<Void> settled) {

    static RoundStart started(RoundTicket ticket) {
        return new RoundStart(ticket, null);
    }

    static RoundStart reused(CompletableFuture<Void> settled) {
        return new RoundStart(null, settled);
    }

    public boolean isNew() {
        return ticket != null;
    }
}
