package fr.lapetina.arena.round;

import fr.lapetina.arena.domain.model.VoteChoice;
import fr.lapetina.arena.domain.model.VoteRecord;

/**
 * Result of a vote attempt.
 *
 * @param record the vote written by this call; null unless the status is RECORDED
 * @param reason why the vote was rejected; null otherwise
 */
public record VoteOutcome(Status status, VoteChoice choice, VoteRecord record, String reason) {

    public enum Status {
        RECORDED,
        ALREADY_VOTED,
        REJECTED
    }

    static VoteOutcome recorded(VoteRecord record) {
        return new VoteOutcome(Status.RECORDED, record.choice(), record, null);
    }

    static VoteOutcome alreadyVoted(VoteChoice existing) {
        return new VoteOutcome(Status.ALREADY_VOTED, existing, null, null);
    }

    static VoteOutcome rejected(VoteChoice choice, String reason) {
        return new VoteOutcome(Status.REJECTED, choice, null, reason);
    }
}
