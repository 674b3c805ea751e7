package org.crash.repo;

import org.crash.model.RoundBet;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

public interface RoundBetRepository extends JpaRepository<RoundBet, Long> {
    Optional<RoundBet> findByRoundIdAndWalletAddress(Long roundId, String walletAddress);

    List<RoundBet> findByRoundId(Long roundId);

    // 0 ligne modifiée = pari déjà encaissé (ou inexistant)
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update RoundBet b set b.cashedOut = true, b.cashoutMultiplier = :multiplier, b.winnings = :winnings " +
            "where b.id = :id and b.cashedOut = false")
    int markCashedOutIfActive(@Param("id") Long id,
                              @Param("multiplier") BigDecimal multiplier,
                              @Param("winnings") BigDecimal winnings);
}
