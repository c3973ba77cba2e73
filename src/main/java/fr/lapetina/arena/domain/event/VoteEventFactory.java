package fr.lapetina.arena.domain.event;

import com.lmax.disruptor.EventFactory;

/**
 * Pre-allocates {@link VoteEvent} slots in the ring buffer.
 */
public final class VoteEventFactory implements EventFactory<VoteEvent> {

    @Override
    public VoteEvent newInstance() {
        return new VoteEvent();
    }
}
