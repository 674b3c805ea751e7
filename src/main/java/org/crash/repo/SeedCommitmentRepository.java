package org.crash.repo;

import org.crash.model.SeedCommitment;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface SeedCommitmentRepository extends JpaRepository<SeedCommitment, Long> {
    // graine engagée mais pas encore révélée (au plus une, cf. active_slot)
    Optional<SeedCommitment> findFirstByRevealedFalseOrderByIdAsc();

    boolean existsByRevealedAtRound(Long revealedAtRound);
}
