package org.crash.service.crash.fair;

import org.crash.config.CrashSettings;
import org.crash.model.SeedCommitment;
import org.crash.repo.SeedCommitmentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;

/**
 * Engagement / révélation des graines serveur.
 * Le hash est persisté avant tout round qui utilise la graine ; la graine n'est publiée
 * qu'une fois, tous les {@code crash.reveal.cadence} rounds terminés.
 */
@Service
public class SeedManager {

    private static final Logger log = LoggerFactory.getLogger(SeedManager.class);

    private final SeedCommitmentRepository seeds;
    private final int revealCadence;

    public SeedManager(SeedCommitmentRepository seeds, CrashSettings settings) {
        this.seeds = seeds;
        this.revealCadence = settings.getRevealCadence();
    }

    public synchronized SeedCommitment ensureActiveSeed() {
        return seeds.findFirstByRevealedFalseOrderByIdAsc().orElseGet(this::commitNewSeed);
    }

    private SeedCommitment commitNewSeed() {
        String serverSeed = HashUtils.randomSeedHex();
        SeedCommitment commitment = SeedCommitment.commit(serverSeed, HashUtils.sha256Hex(serverSeed));
        try {
            SeedCommitment saved = seeds.saveAndFlush(commitment);
            log.info("Nouvelle graine engagée id={} hash={}", saved.getId(), saved.getServerSeedHash());
            return saved;
        } catch (DataIntegrityViolationException race) {
            // un autre écrivain a engagé sa graine avant nous (active_slot unique) : on garde la sienne
            log.warn("Graine déjà engagée par un autre écrivain, relecture");
            return seeds.findFirstByRevealedFalseOrderByIdAsc().orElseThrow(() -> race);
        }
    }

    public synchronized Optional<SeedCommitment> maybeReveal(long roundsSettledSoFar) {
        if (roundsSettledSoFar <= 0 || roundsSettledSoFar % revealCadence != 0) return Optional.empty();
        if (seeds.existsByRevealedAtRound(roundsSettledSoFar)) return Optional.empty();

        return seeds.findFirstByRevealedFalseOrderByIdAsc().map(commitment -> {
            commitment.reveal(roundsSettledSoFar, Instant.now());
            SeedCommitment saved = seeds.save(commitment);
            log.info("Graine révélée id={} après {} rounds", saved.getId(), roundsSettledSoFar);
            return saved;
        });
    }

    public int getRevealCadence() {
        return revealCadence;
    }
}
