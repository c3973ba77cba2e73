package fr.lapetina.arena.round;

import fr.lapetina.arena.domain.model.VoteRecord;

/**
 * Receives finalized votes. Implementations must not block the caller on I/O.
 */
@FunctionalInterface
public interface VoteSink {

    void submit(VoteRecord vote);
}
