package fr.lapetina.arena.domain.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;

/**
 * Content hashes used to detect new prompts and to derive round identifiers.
 */
public final class PromptDigest {

    private static final int ROUND_ID_LENGTH = 16;

    private PromptDigest() {
        // Utility class
    }

    /**
     * Lowercase hex SHA-256 of the exact prompt text.
     */
    public static String hash(String prompt) {
        return sha256Hex(prompt);
    }

    /**
     * Round identifier derived from the prompt hash and the round creation time.
     */
    public static String roundId(String promptHash, Instant createdAt) {
        return sha256Hex(promptHash + ":" + createdAt.toEpochMilli()).substring(0, ROUND_ID_LENGTH);
    }

    private static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // Every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
