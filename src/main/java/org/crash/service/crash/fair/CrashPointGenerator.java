package org.crash.service.crash.fair;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Dérivation déterministe du crash point à partir de (serverSeed, clientSeed, nonce).
 * N'importe qui possédant la graine révélée peut recalculer la même valeur.
 */
public final class CrashPointGenerator {

    public static final BigDecimal MIN_CRASH_POINT = new BigDecimal("1.01");

    private static final int HASH_PREFIX_CHARS = 13;
    private static final long E = 1L << 52;
    private static final int INSTANT_CRASH_MODULO = 33;

    private CrashPointGenerator() {
    }

    public static String roundHash(String serverSeed, String clientSeed, long nonce) {
        return HashUtils.sha256Hex(serverSeed + ":" + clientSeed + ":" + nonce);
    }

    public static BigDecimal crashPoint(String serverSeed, String clientSeed, long nonce) {
        return crashPointFromHash(roundHash(serverSeed, clientSeed, nonce));
    }

    public static BigDecimal crashPointFromHash(String roundHash) {
        if (roundHash == null || roundHash.length() < HASH_PREFIX_CHARS)
            throw new IllegalArgumentException("Hash de round invalide");
        long h = Long.parseLong(roundHash.substring(0, HASH_PREFIX_CHARS), 16);
        return crashPointFromValue(h);
    }

    /** h : entier non signé sur 52 bits. */
    public static BigDecimal crashPointFromValue(long h) {
        if (h < 0 || h >= E) throw new IllegalArgumentException("h hors de l'intervalle 52 bits: " + h);
        if (h % INSTANT_CRASH_MODULO == 0) return MIN_CRASH_POINT;

        // même ordre d'opérations en double que le vérificateur publié
        double result = (100.0 * (double) (E - h)) / (double) (E - 1);
        BigDecimal multiplier = BigDecimal.valueOf(Math.floor(result))
                .movePointLeft(2)
                .setScale(2, RoundingMode.FLOOR);
        return multiplier.max(MIN_CRASH_POINT);
    }
}
