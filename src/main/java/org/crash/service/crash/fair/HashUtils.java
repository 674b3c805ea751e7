package org.crash.service.crash.fair;

import org.crash.exception.EntropySourceError;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * SHA-256 et aléa cryptographique pour le provably fair.
 */
public final class HashUtils {

    public static final int SEED_BYTES = 32;

    private static final HexFormat HEX = HexFormat.of();
    private static final SecureRandom RANDOM = new SecureRandom();

    private HashUtils() {
    }

    public static byte[] sha256(byte[] input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input);
        } catch (NoSuchAlgorithmException e) {
            // toute JVM doit fournir SHA-256
            throw new IllegalStateException("SHA-256 indisponible", e);
        }
    }

    public static String sha256Hex(String input) {
        return HEX.formatHex(sha256(input.getBytes(StandardCharsets.UTF_8)));
    }

    public static byte[] randomSeed() {
        return randomSeed(RANDOM);
    }

    static byte[] randomSeed(SecureRandom source) {
        byte[] seed = new byte[SEED_BYTES];
        try {
            source.nextBytes(seed);
        } catch (RuntimeException e) {
            throw new EntropySourceError("Source d'aléa indisponible", e);
        }
        return seed;
    }

    /** Graine serveur au format texte (64 caractères hex), celle qui est hachée puis révélée. */
    public static String randomSeedHex() {
        return HEX.formatHex(randomSeed());
    }

    public static String toHex(byte[] bytes) {
        return HEX.formatHex(bytes);
    }
}
