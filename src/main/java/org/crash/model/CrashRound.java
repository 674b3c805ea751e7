package org.crash.model;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "crash_round")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CrashRound {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // séquence du round, fixée au passage en RUNNING
    private Long nonce;

    @Column(nullable = false)
    private Instant startTime;

    @Column(name = "seed_id", nullable = false)
    private Long seedId;

    @Column(name = "seed_hash", nullable = false, length = 64)
    private String seedHash;

    @Column(name = "round_hash", length = 64)
    private String roundHash;

    @Setter(AccessLevel.NONE)
    @Column(name = "crash_point", precision = 12, scale = 2)
    private BigDecimal crashPoint;

    @Column(name = "final_multiplier", precision = 12, scale = 4)
    private BigDecimal finalMultiplier;

    @Setter(AccessLevel.NONE)
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private RoundPhase phase;

    private Instant endedAt;

    public static CrashRound waiting(SeedCommitment seed, Instant now) {
        return CrashRound.builder()
                .startTime(now)
                .seedId(seed.getId())
                .seedHash(seed.getServerSeedHash())
                .phase(RoundPhase.WAITING)
                .build();
    }

    /** Fige le crash point : il ne peut plus changer ensuite. */
    public void assignCrashPoint(long nonce, String roundHash, BigDecimal crashPoint) {
        if (this.crashPoint != null) throw new IllegalStateException("Crash point déjà fixé pour le round " + id);
        this.nonce = nonce;
        this.roundHash = roundHash;
        this.crashPoint = crashPoint;
    }

    public void advanceTo(RoundPhase next) {
        if (!phase.canAdvanceTo(next))
            throw new IllegalStateException("Transition interdite " + phase + " -> " + next + " (round " + id + ")");
        this.phase = next;
    }
}
