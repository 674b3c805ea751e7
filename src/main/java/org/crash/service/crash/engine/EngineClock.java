package org.crash.service.crash.engine;

import org.crash.model.RoundBet;
import org.crash.model.RoundPhase;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * État horloge du round en cours, instance unique du process.
 * <p>
 * Seul le moteur écrit (verrou exclusif) ; les paris et encaissements lisent sous le verrou partagé
 * pendant toute leur section critique, donc une transition de phase ou un tick ne peut pas
 * s'intercaler au milieu d'une opération joueur.
 */
@Component
public class EngineClock {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);

    // null tant qu'aucun round n'a démarré
    private RoundPhase phase;
    private Long activeRoundId;
    private String seedHash;
    private BigDecimal crashPoint;
    private double currentMultiplier = 1.0;
    private double elapsedSeconds;
    private long ticks;

    // paris du round actif, indexés par wallet
    private final Map<String, RoundBet> bets = new ConcurrentHashMap<>();

    public void beginRound(Long roundId, String seedHash) {
        lock.writeLock().lock();
        try {
            if (phase != null && !phase.isTerminal())
                throw new IllegalStateException("Round " + activeRoundId + " encore en cours (" + phase + ")");
            this.activeRoundId = roundId;
            this.seedHash = seedHash;
            this.crashPoint = null;
            this.currentMultiplier = 1.0;
            this.elapsedSeconds = 0;
            this.ticks = 0;
            this.bets.clear();
            this.phase = RoundPhase.WAITING;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Ferme les paris. Attend la fin des paris en cours (verrou exclusif). */
    public void closeBetting() {
        advanceTo(RoundPhase.COUNTING_DOWN);
    }

    public void launch(BigDecimal crashPoint) {
        lock.writeLock().lock();
        try {
            if (phase != RoundPhase.COUNTING_DOWN)
                throw new IllegalStateException("Lancement impossible depuis " + phase);
            this.crashPoint = crashPoint;
            this.currentMultiplier = 1.0;
            this.elapsedSeconds = 0;
            this.ticks = 0;
            this.phase = RoundPhase.RUNNING;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Un tick de la boucle : multiplier = 2^(elapsed / 10).
     * Si la valeur atteint le crash point, la phase passe à CRASHED dans la même section critique
     * et {@code currentMultiplier} garde la dernière valeur encaissable.
     */
    public Tick advance(long tickMs) {
        lock.writeLock().lock();
        try {
            if (phase != RoundPhase.RUNNING)
                throw new IllegalStateException("Tick hors phase RUNNING (" + phase + ")");
            ticks++;
            double elapsed = ticks * tickMs / 1000.0;
            double multiplier = Math.pow(2, elapsed / 10);
            elapsedSeconds = elapsed;
            if (multiplier >= crashPoint.doubleValue()) {
                phase = RoundPhase.CRASHED;
                return new Tick(activeRoundId, multiplier, elapsed, true);
            }
            currentMultiplier = multiplier;
            return new Tick(activeRoundId, multiplier, elapsed, false);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void abandon() {
        advanceTo(RoundPhase.ABANDONED);
    }

    private void advanceTo(RoundPhase next) {
        lock.writeLock().lock();
        try {
            if (phase == null || !phase.canAdvanceTo(next))
                throw new IllegalStateException("Transition interdite " + phase + " -> " + next);
            phase = next;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Exécute {@code action} sous le verrou partagé : la phase et le multiplier ne bougent pas pendant ce temps. */
    public <T> T read(Supplier<T> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    public RoundPhase getPhase() {
        return read(() -> phase);
    }

    public Long getActiveRoundId() {
        return read(() -> activeRoundId);
    }

    public double getCurrentMultiplier() {
        return read(() -> currentMultiplier);
    }

    public BigDecimal getCrashPoint() {
        return read(() -> crashPoint);
    }

    public String getSeedHash() {
        return read(() -> seedHash);
    }

    public RoundBet betOf(String walletAddress) {
        return bets.get(walletAddress);
    }

    public void recordBet(RoundBet bet) {
        bets.put(bet.getWalletAddress(), bet);
    }

    public List<RoundBet> activeBets() {
        List<RoundBet> out = new ArrayList<>();
        for (RoundBet b : bets.values()) if (!b.isCashedOut()) out.add(b);
        return out;
    }

    public Snapshot snapshot() {
        return read(() -> new Snapshot(activeRoundId, phase, currentMultiplier, elapsedSeconds, seedHash));
    }

    public static final class Tick {
        public final Long roundId;
        public final double multiplier;
        public final double elapsedSeconds;
        public final boolean crashed;

        public Tick(Long roundId, double multiplier, double elapsedSeconds, boolean crashed) {
            this.roundId = roundId;
            this.multiplier = multiplier;
            this.elapsedSeconds = elapsedSeconds;
            this.crashed = crashed;
        }
    }

    public static final class Snapshot {
        public final Long roundId;
        public final RoundPhase phase;
        public final double multiplier;
        public final double elapsedSeconds;
        public final String seedHash;

        public Snapshot(Long roundId, RoundPhase phase, double multiplier, double elapsedSeconds, String seedHash) {
            this.roundId = roundId;
            this.phase = phase;
            this.multiplier = multiplier;
            this.elapsedSeconds = elapsedSeconds;
            this.seedHash = seedHash;
        }
    }
}
