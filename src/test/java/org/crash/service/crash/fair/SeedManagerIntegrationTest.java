package org.crash.service.crash.fair;

import org.crash.model.SeedCommitment;
import org.crash.repo.SeedCommitmentRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

@SpringBootTest
class SeedManagerIntegrationTest {

    @Autowired
    private SeedManager seedManager;

    @Autowired
    private SeedCommitmentRepository seeds;

    @Test
    void uneSeuleGraineActiveEnBase() {
        SeedCommitment active = seedManager.ensureActiveSeed();
        assertThat(seedManager.ensureActiveSeed().getId()).isEqualTo(active.getId());

        String other = HashUtils.randomSeedHex();
        assertThatThrownBy(() -> seeds.saveAndFlush(SeedCommitment.commit(other, HashUtils.sha256Hex(other))))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    void revelation_uneFoisParPalier_puisNouvelleGraine() {
        SeedCommitment active = seedManager.ensureActiveSeed();
        long palier = 700L * seedManager.getRevealCadence();

        Optional<SeedCommitment> revealed = seedManager.maybeReveal(palier);

        assertThat(revealed).isPresent();
        assertThat(revealed.get().getId()).isEqualTo(active.getId());
        SeedCommitment stored = seeds.findById(active.getId()).orElseThrow();
        assertThat(stored.isRevealed()).isTrue();
        assertThat(stored.getRevealedAtRound()).isEqualTo(palier);
        assertThat(HashUtils.sha256Hex(stored.getServerSeed())).isEqualTo(stored.getServerSeedHash());

        // même palier observé deux fois : pas de seconde révélation
        seedManager.ensureActiveSeed();
        assertThat(seedManager.maybeReveal(palier)).isEmpty();

        SeedCommitment next = seedManager.ensureActiveSeed();
        assertThat(next.getId()).isNotEqualTo(active.getId());
        assertThat(next.isRevealed()).isFalse();
    }
}
