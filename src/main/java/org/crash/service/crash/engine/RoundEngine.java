package org.crash.service.crash.engine;

import org.crash.config.CrashSettings;
import org.crash.exception.EntropySourceError;
import org.crash.model.CrashRound;
import org.crash.model.RoundBet;
import org.crash.model.RoundPhase;
import org.crash.model.SeedCommitment;
import org.crash.repo.CrashRoundRepository;
import org.crash.service.crash.broadcast.GameBroadcaster;
import org.crash.service.crash.fair.CrashPointGenerator;
import org.crash.service.crash.fair.SeedManager;
import org.crash.service.crash.util.ProcessTerminator;
import org.crash.service.crash.util.Timeouts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import jakarta.annotation.PreDestroy;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Objects;

/**
 * Machine à états d'un round : WAITING -> COUNTING_DOWN -> RUNNING -> CRASHED, puis round suivant.
 * Les transitions sont pilotées uniquement par les timers du round (jamais par un message client).
 */
@Service
public class RoundEngine {
    private static final Logger log = LoggerFactory.getLogger(RoundEngine.class);

    static final String ENGINE_GROUP = "engine";
    static final String NEXT_ROUND = "nextRound";
    static final String COUNTDOWN = "countdown";
    static final String TICK = "tick";
    static final String WAITING_MESSAGE = "Place your bets!";

    private final EngineClock clock;
    private final SeedManager seedManager;
    private final CrashRoundRepository rounds;
    private final GameBroadcaster broadcaster;
    private final Timeouts timeouts;
    private final CrashSettings settings;
    private final ProcessTerminator terminator;
    private final boolean autostart;

    private volatile Long currentRoundId;
    private volatile SeedCommitment currentSeed;

    public RoundEngine(EngineClock clock, SeedManager seedManager, CrashRoundRepository rounds,
                       GameBroadcaster broadcaster, Timeouts timeouts, CrashSettings settings,
                       ProcessTerminator terminator,
                       @Value("${crash.engine.autostart:true}") boolean autostart) {
        this.clock = clock;
        this.seedManager = seedManager;
        this.rounds = rounds;
        this.broadcaster = broadcaster;
        this.timeouts = timeouts;
        this.settings = settings;
        this.terminator = terminator;
        this.autostart = autostart;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (autostart) startRound();
    }

    /** WAITING : nouveau round persisté avec le hash de la graine, paris ouverts, compte à rebours. */
    public synchronized void startRound() {
        Long previous = currentRoundId;
        if (previous != null) timeouts.cancelAllOf(group(previous));

        SeedCommitment seed;
        CrashRound round;
        try {
            seed = seedManager.ensureActiveSeed();
            round = rounds.save(CrashRound.waiting(seed, Instant.now()));
        } catch (EntropySourceError e) {
            terminator.terminate(e);
            return;
        } catch (DataAccessException | TransactionException e) {
            log.error("Création du round impossible, nouvel essai dans {} ms", settings.getCooldownMs(), e);
            scheduleNextRound();
            return;
        }

        currentSeed = seed;
        currentRoundId = round.getId();
        clock.beginRound(round.getId(), seed.getServerSeedHash());
        log.info("Round {} en attente des paris (graine {})", round.getId(), seed.getServerSeedHash());

        broadcaster.gameWaiting(WAITING_MESSAGE);
        countdown(round.getId(), settings.getCountdownTicks());
    }

    synchronized void countdown(Long roundId, int remaining) {
        if (!isCurrent(roundId)) return;
        if (remaining <= 0) {
            closeBetsAndLaunch(roundId);
            return;
        }
        broadcaster.countdown(remaining);
        timeouts.schedule(group(roundId), COUNTDOWN, settings.getCountdownTickMs(),
                () -> countdown(roundId, remaining - 1));
    }

    /**
     * COUNTING_DOWN puis RUNNING : le crash point est calculé et persisté avant d'être utilisé
     * et avant l'annonce du départ. Aucun nouvel essai en cas d'échec : le nonce a pu être observé.
     */
    synchronized void closeBetsAndLaunch(Long roundId) {
        if (!isCurrent(roundId)) return;
        clock.closeBetting();

        long nonce;
        BigDecimal crashPoint;
        try {
            CrashRound round = rounds.findById(roundId)
                    .orElseThrow(() -> new IllegalStateException("Round introuvable: " + roundId));
            nonce = rounds.count();
            String roundHash = CrashPointGenerator.roundHash(currentSeed.getServerSeed(), settings.getClientSeed(), nonce);
            crashPoint = CrashPointGenerator.crashPointFromHash(roundHash);
            round.advanceTo(RoundPhase.COUNTING_DOWN);
            round.assignCrashPoint(nonce, roundHash, crashPoint);
            round.advanceTo(RoundPhase.RUNNING);
            rounds.save(round);
        } catch (RuntimeException e) {
            abandon(roundId, e);
            return;
        }

        clock.launch(crashPoint);
        broadcaster.roundStarted(roundId, currentSeed.getServerSeedHash());
        log.info("Round {} lancé (nonce {})", roundId, nonce);
        log.debug("Round {} crash point {}", roundId, crashPoint);
        timeouts.scheduleAtFixedRate(group(roundId), TICK, settings.getTickMs(), () -> tick(roundId));
    }

    void tick(Long roundId) {
        if (!isCurrent(roundId) || clock.getPhase() != RoundPhase.RUNNING) return;
        EngineClock.Tick t = clock.advance(settings.getTickMs());
        // diffusé aussi au tick du crash ; l'encaissement reste au multiplier précédent
        broadcaster.multiplier(t.multiplier, t.elapsedSeconds);
        if (!t.crashed) return;
        // arrêté une seule fois, au crash
        timeouts.cancel(group(roundId), TICK);
        endRound(roundId, t.multiplier);
    }

    /** CRASHED : les paris non encaissés sont perdus, aucun mouvement de solde pour eux. */
    synchronized void endRound(Long roundId, double finalMultiplier) {
        BigDecimal crashPoint = clock.getCrashPoint();
        int lost = clock.activeBets().size();
        try {
            CrashRound round = rounds.findById(roundId)
                    .orElseThrow(() -> new IllegalStateException("Round introuvable: " + roundId));
            round.setFinalMultiplier(finalMultiplierColumn(finalMultiplier));
            round.setEndedAt(Instant.now());
            round.advanceTo(RoundPhase.CRASHED);
            rounds.save(round);
        } catch (RuntimeException e) {
            log.error("Clôture du round {} non persistée, à réconcilier manuellement", roundId, e);
        }

        // multiplier atteint par le tick du crash, >= crash point
        broadcaster.roundCrashed(finalMultiplier);
        log.info("Round {} crashé à {}x (crash point {}), {} pari(s) perdu(s)",
                roundId, GameBroadcaster.formatMultiplier(finalMultiplier), crashPoint, lost);

        revealIfDue();
        scheduleNextRound();
    }

    // une fois par round terminé, jamais par tick
    private void revealIfDue() {
        try {
            long completed = rounds.countByPhase(RoundPhase.CRASHED);
            seedManager.maybeReveal(completed).ifPresent(broadcaster::seedRevealed);
        } catch (DataAccessException | TransactionException e) {
            log.error("Révélation de graine non effectuée", e);
        }
    }

    private void abandon(Long roundId, Throwable cause) {
        timeouts.cancelAllOf(group(roundId));
        clock.abandon();
        log.error("Round {} abandonné : transition non persistée", roundId, cause);
        for (RoundBet b : clock.activeBets()) {
            log.error("A réconcilier : round={} wallet={} mise={} {}",
                    roundId, b.getWalletAddress(), b.getAmount(), b.getCurrency());
        }
        try {
            rounds.findById(roundId).ifPresent(r -> {
                r.advanceTo(RoundPhase.ABANDONED);
                r.setEndedAt(Instant.now());
                rounds.save(r);
            });
        } catch (RuntimeException e) {
            log.warn("Statut ABANDONED non persisté pour le round {}: {}", roundId, e.getMessage());
        }
        scheduleNextRound();
    }

    private void scheduleNextRound() {
        timeouts.schedule(ENGINE_GROUP, NEXT_ROUND, settings.getCooldownMs(), this::startRound);
    }

    @PreDestroy
    public void stop() {
        timeouts.cancelAllOf(ENGINE_GROUP);
        Long id = currentRoundId;
        if (id != null) timeouts.cancelAllOf(group(id));
    }

    public Long getCurrentRoundId() {
        return currentRoundId;
    }

    private boolean isCurrent(Long roundId) {
        return Objects.equals(currentRoundId, roundId);
    }

    static BigDecimal finalMultiplierColumn(double multiplier) {
        return BigDecimal.valueOf(multiplier).setScale(4, RoundingMode.FLOOR);
    }

    static String group(Long roundId) {
        return "round-" + roundId;
    }
}
