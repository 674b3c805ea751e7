package org.crash.service.crash.broadcast;

import lombok.RequiredArgsConstructor;
import org.crash.dto.CrashEvent;
import org.crash.model.RoundBet;
import org.crash.model.SeedCommitment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Diffusion des événements du jeu à tous les observateurs (topic STOMP global).
 * Un échec d'envoi ne doit jamais interrompre le moteur : il est journalisé.
 */
@Service
@RequiredArgsConstructor
public class GameBroadcaster {
    public static final String TOPIC = "/topic/crash";

    private static final Logger log = LoggerFactory.getLogger(GameBroadcaster.class);

    private final SimpMessagingTemplate broker;

    public void gameWaiting(String message) {
        publish(CrashEvent.of("GAME_WAITING").with("message", message));
    }

    public void countdown(int secondsLeft) {
        publish(CrashEvent.of("COUNTDOWN").with("time", secondsLeft));
    }

    public void roundStarted(Long roundId, String seedHash) {
        publish(CrashEvent.of("ROUND_STARTED").with("roundId", roundId).with("seedHash", seedHash));
    }

    public void multiplier(double multiplier, double elapsedSeconds) {
        publish(CrashEvent.of("CNT_MULTIPLY")
                .with("multiplier", formatMultiplier(multiplier))
                .with("time", elapsedSeconds));
    }

    public void roundCrashed(double finalMultiplier) {
        publish(CrashEvent.of("ROUND_CRASHED").with("multiplier", formatMultiplier(finalMultiplier)));
    }

    public void seedRevealed(SeedCommitment seed) {
        if (!seed.isRevealed()) throw new IllegalStateException("Graine non révélée: " + seed.getId());
        publish(CrashEvent.of("SEED_REVEALED")
                .with("serverSeed", seed.getServerSeed())
                .with("serverSeedHash", seed.getServerSeedHash()));
    }

    public void playerBet(RoundBet bet) {
        publish(CrashEvent.of("PLAYER_BET")
                .with("walletAddress", bet.getWalletAddress())
                .with("amount", bet.getAmount())
                .with("currency", bet.getCurrency()));
    }

    public void playerCashedOut(String walletAddress, BigDecimal winnings, double multiplier) {
        publish(CrashEvent.of("PLAYER_CASHED_OUT")
                .with("walletAddress", walletAddress)
                .with("winnings", winnings)
                .with("multiplier", formatMultiplier(multiplier)));
    }

    private void publish(CrashEvent evt) {
        try {
            broker.convertAndSend(TOPIC, evt);
        } catch (MessagingException e) {
            log.warn("Diffusion {} impossible: {}", evt.getAction(), e.getMessage());
        }
    }

    public static String formatMultiplier(double multiplier) {
        return String.format(Locale.ROOT, "%.2f", multiplier);
    }
}
