package org.crash.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "provably_fair_seed")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SeedCommitment {
    public static final int ACTIVE = 1;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // jamais sérialisé tant que revealed = false
    @JsonIgnore
    @Column(name = "server_seed", nullable = false, length = 64, updatable = false)
    private String serverSeed;

    @Column(name = "server_seed_hash", nullable = false, length = 64, unique = true, updatable = false)
    private String serverSeedHash;

    @Column(nullable = false)
    private boolean revealed;

    private Instant revealedAt;

    // nombre de rounds terminés au moment de la révélation
    private Long revealedAtRound;

    // 1 tant que la graine n'est pas révélée, NULL ensuite : une seule graine active possible en base
    @JsonIgnore
    @Column(name = "active_slot", unique = true)
    private Integer activeSlot;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    public static SeedCommitment commit(String serverSeed, String serverSeedHash) {
        return SeedCommitment.builder()
                .serverSeed(serverSeed)
                .serverSeedHash(serverSeedHash)
                .revealed(false)
                .activeSlot(ACTIVE)
                .createdAt(Instant.now())
                .build();
    }

    public void reveal(long roundsSettled, Instant at) {
        if (revealed) throw new IllegalStateException("Graine déjà révélée: " + id);
        this.revealed = true;
        this.revealedAt = at;
        this.revealedAtRound = roundsSettled;
        this.activeSlot = null;
    }
}
