package org.crash.repo;

import org.crash.model.CrashRound;
import org.crash.model.RoundPhase;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface CrashRoundRepository extends JpaRepository<CrashRound, Long> {
    Optional<CrashRound> findTopByOrderByIdDesc();

    long countByPhase(RoundPhase phase);
}
