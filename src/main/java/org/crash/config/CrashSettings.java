package org.crash.config;

import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Constantes de jeu lues depuis application.properties.
 * Les valeurs par défaut sont celles attendues par les clients (10 x 1s, 50ms, 5s, 100 rounds).
 */
@Component
@Getter
public class CrashSettings {

    private final int countdownTicks;
    private final long countdownTickMs;
    private final long tickMs;
    private final long cooldownMs;
    private final int revealCadence;
    private final String clientSeed;
    private final Map<String, BigDecimal> defaultBalances;

    public CrashSettings(@Value("${crash.countdown.ticks:10}") int countdownTicks,
                         @Value("${crash.countdown.tick-ms:1000}") long countdownTickMs,
                         @Value("${crash.tick-ms:50}") long tickMs,
                         @Value("${crash.cooldown-ms:5000}") long cooldownMs,
                         @Value("${crash.reveal.cadence:100}") int revealCadence,
                         @Value("${crash.fair.client-seed:global_client_seed}") String clientSeed,
                         @Value("${crash.player.default-balances:USD:1000}") String defaultBalances) {
        if (countdownTicks < 1) throw new IllegalArgumentException("crash.countdown.ticks doit être >= 1");
        if (tickMs <= 0) throw new IllegalArgumentException("crash.tick-ms doit être > 0");
        if (revealCadence < 1) throw new IllegalArgumentException("crash.reveal.cadence doit être >= 1");
        this.countdownTicks = countdownTicks;
        this.countdownTickMs = countdownTickMs;
        this.tickMs = tickMs;
        this.cooldownMs = cooldownMs;
        this.revealCadence = revealCadence;
        this.clientSeed = clientSeed;
        this.defaultBalances = parseBalances(defaultBalances);
    }

    /** Valeurs du contrat client, utiles pour les tests. */
    public static CrashSettings defaults() {
        return new CrashSettings(10, 1000, 50, 5000, 100, "global_client_seed", "USD:1000");
    }

    // format "USD:1000,EUR:500"
    private static Map<String, BigDecimal> parseBalances(String raw) {
        Map<String, BigDecimal> out = new LinkedHashMap<>();
        if (raw == null || raw.isBlank()) return Collections.unmodifiableMap(out);
        for (String part : raw.split("\\s*,\\s*")) {
            int sep = part.indexOf(':');
            if (sep <= 0) throw new IllegalArgumentException("Solde par défaut invalide: " + part);
            out.put(part.substring(0, sep).trim(), new BigDecimal(part.substring(sep + 1).trim()));
        }
        return Collections.unmodifiableMap(out);
    }
}
