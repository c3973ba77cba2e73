package fr.lapetina.arena.domain.model;

import java.util.Objects;

/**
 * Combined outcome of both sides of a round.
 */
public record RoundResult(SideResult sideA, SideResult sideB) {

    public RoundResult {
        Objects.requireNonNull(sideA, "Side A result is required");
        Objects.requireNonNull(sideB, "Side B result is required");
    }

    public boolean bothSucceeded() {
        return sideA.isSuccess() && sideB.isSuccess();
    }

    public boolean bothFailed() {
        return sideA.isFailure() && sideB.isFailure();
    }
}
