package fr.lapetina.arena.domain.model;

import java.util.Locale;
import java.util.Optional;

/**
 * The user's preference for a round.
 */
public enum VoteChoice {
    A("A"),
    B("B"),
    TIE("Tie"),
    BOTH_BAD("BothBad");

    private final String label;

    VoteChoice(String label) {
        this.label = label;
    }

    /**
     * Wire label stored with the vote.
     */
    public String label() {
        return label;
    }

    /**
     * Parses a wire label. Case-insensitive; also accepts "Both Bad" and the enum names.
     */
    public static Optional<VoteChoice> fromLabel(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().replace(" ", "").replace("_", "").toLowerCase(Locale.ROOT);
        for (VoteChoice choice : values()) {
            if (choice.label.toLowerCase(Locale.ROOT).equals(normalized)) {
                return Optional.of(choice);
            }
        }
        return Optional.empty();
    }
}
