package fr.lapetina.arena.round;

import fr.lapetina.arena.domain.model.SideResult;
import fr.lapetina.arena.domain.model.VoteChoice;

/**
 * Read-only snapshot of a session for the presentation layer.
 * {@code revealedModelA} and {@code revealedModelB} are null unless the state is {@link SessionState#VOTED}.
 */
public record RoundView(
        String sessionId,
        long sequence,
        SessionState state,
        String roundId,
        String prompt,
        SideResult sideA,
        SideResult sideB,
        VoteChoice vote,
        String revealedModelA,
        String revealedModelB
) {
    public boolean isRevealed() {
        return state == SessionState.VOTED;
    }
}
