package org.crash.service.crash.ledger;

import lombok.RequiredArgsConstructor;
import org.crash.exception.GameRuleException;
import org.crash.model.RoundBet;
import org.crash.repo.RoundBetRepository;
import org.crash.service.WalletService;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;

/**
 * Mouvements de solde liés à un round. Chaque méthode est une seule transaction :
 * débit + enregistrement du pari, ou marquage encaissé + crédit des gains.
 */
@Service
@RequiredArgsConstructor
public class SettlementService {
    private final RoundBetRepository bets;
    private final WalletService walletService;

    @Transactional
    public RoundBet recordBet(Long roundId, String walletAddress, BigDecimal amount, String currency) {
        walletService.debiter(walletAddress, currency, amount);
        return bets.save(RoundBet.builder()
                .roundId(roundId)
                .walletAddress(walletAddress)
                .amount(amount)
                .currency(currency)
                .cashedOut(false)
                .placedAt(Instant.now())
                .build());
    }

    /**
     * Le drapeau cashedOut est posé par un UPDATE conditionnel : si une autre requête l'a déjà
     * posé, rien n'est crédité.
     */
    @Transactional
    public BigDecimal settleCashout(RoundBet bet, double multiplier) {
        BigDecimal winnings = winnings(bet.getAmount(), multiplier);
        int updated = bets.markCashedOutIfActive(bet.getId(), multiplierColumn(multiplier), winnings);
        if (updated == 0) throw new GameRuleException("Already cashed out.");
        walletService.crediter(bet.getWalletAddress(), bet.getCurrency(), winnings);
        return winnings;
    }

    /** floor(amount * multiplier * 100) / 100 */
    public static BigDecimal winnings(BigDecimal amount, double multiplier) {
        return amount.multiply(BigDecimal.valueOf(multiplier)).setScale(2, RoundingMode.FLOOR);
    }

    static BigDecimal multiplierColumn(double multiplier) {
        return BigDecimal.valueOf(multiplier).setScale(4, RoundingMode.FLOOR);
    }
}
