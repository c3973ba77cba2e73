package fr.lapetina.arena.round;

import fr.lapetina.arena.domain.model.RoundRequest;

/**
 * Handle on a started round. Results must be delivered with the same {@code sequence}.
 */
public record RoundTicket(long sequence, RoundRequest request) {
}
