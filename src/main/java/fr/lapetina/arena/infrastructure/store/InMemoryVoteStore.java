package fr.lapetina.arena.infrastructure.store;

import fr.lapetina.arena.domain.model.VoteRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Process-local vote store. Votes are lost on restart.
 */
public class InMemoryVoteStore implements VoteStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryVoteStore.class);

    private final List<VoteRecord> votes = new CopyOnWriteArrayList<>();

    @Override
    public VoteStoreResult insert(VoteRecord vote) {
        votes.add(vote);
        log.debug("Vote stored in memory: roundId={}, choice={}", vote.roundId(), vote.choice().label());
        return VoteStoreResult.ok();
    }

    @Override
    public long count() {
        return votes.size();
    }

    @Override
    public String name() {
        return "memory";
    }

    /**
     * Snapshot of all stored votes in insertion order.
     */
    public List<VoteRecord> votes() {
        return List.copyOf(votes);
    }
}
