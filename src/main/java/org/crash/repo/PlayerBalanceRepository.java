package org.crash.repo;

import org.crash.model.PlayerBalance;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

public interface PlayerBalanceRepository extends JpaRepository<PlayerBalance, Long> {
    List<PlayerBalance> findByWalletAddress(String walletAddress);

    Optional<PlayerBalance> findByWalletAddressAndCurrency(String walletAddress, String currency);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update PlayerBalance b set b.amount = b.amount + :amount " +
            "where b.walletAddress = :wallet and b.currency = :currency")
    int incrementAmount(@Param("wallet") String walletAddress,
                        @Param("currency") String currency,
                        @Param("amount") BigDecimal amount);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update PlayerBalance b set b.amount = b.amount - :amount " +
            "where b.walletAddress = :wallet and b.currency = :currency and b.amount >= :amount")
    int decrementAmountIfEnough(@Param("wallet") String walletAddress,
                                @Param("currency") String currency,
                                @Param("amount") BigDecimal amount);
}
