package org.crash.service.crash.ledger;

import lombok.RequiredArgsConstructor;
import org.crash.exception.GameRuleException;
import org.crash.exception.LedgerPersistenceException;
import org.crash.exception.NotFoundException;
import org.crash.model.RoundBet;
import org.crash.model.RoundPhase;
import org.crash.repo.PlayerRepository;
import org.crash.service.crash.broadcast.GameBroadcaster;
import org.crash.service.crash.engine.EngineClock;
import org.crash.service.crash.util.Locks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Paris et encaissements sur le round actif.
 * <p>
 * Ordre des verrous, toujours le même : moniteur du wallet puis verrou partagé de l'horloge.
 * Le moteur ne prend que le verrou exclusif de l'horloge.
 */
@Service
@RequiredArgsConstructor
public class BetLedger {
    private static final Logger log = LoggerFactory.getLogger(BetLedger.class);
    private static final int MAX_CURRENCY_LENGTH = 16;

    private final EngineClock clock;
    private final Locks locks;
    private final PlayerRepository players;
    private final SettlementService settlement;
    private final GameBroadcaster broadcaster;

    public RoundBet placeBet(String walletAddress, BigDecimal amount, String currency) {
        String wallet = requireWallet(walletAddress);
        BigDecimal stake = normalizeAmount(amount);
        String cur = normalizeCurrency(currency);

        RoundBet bet;
        synchronized (locks.of(wallet)) {
            bet = clock.read(() -> {
                Long roundId = clock.getActiveRoundId();
                if (roundId == null) throw new NotFoundException("No active round.");
                if (clock.getPhase() != RoundPhase.WAITING) throw new GameRuleException("Betting closed.");
                if (clock.betOf(wallet) != null) throw new GameRuleException("Already has an active bet.");
                if (players.findByWalletAddress(wallet).isEmpty()) throw new NotFoundException("User not found.");

                RoundBet saved = persistBet(roundId, wallet, stake, cur);
                clock.recordBet(saved);
                return saved;
            });
        }
        log.info("Pari accepté round={} wallet={} {} {}", bet.getRoundId(), wallet, stake, cur);
        broadcaster.playerBet(bet);
        return bet;
    }

    public CashoutResult cashout(String walletAddress) {
        String wallet = requireWallet(walletAddress);

        CashoutResult result;
        synchronized (locks.of(wallet)) {
            result = clock.read(() -> {
                if (clock.getActiveRoundId() == null) throw new NotFoundException("No active round.");
                if (clock.getPhase() != RoundPhase.RUNNING) throw new GameRuleException("Cannot cash out now.");
                RoundBet bet = clock.betOf(wallet);
                if (bet == null) throw new GameRuleException("No active bet.");
                if (bet.isCashedOut()) throw new GameRuleException("Already cashed out.");

                // multiplier figé : le tick ne peut pas avancer tant qu'on tient le verrou partagé
                double multiplier = clock.getCurrentMultiplier();
                BigDecimal winnings = persistCashout(bet, multiplier);
                bet.setCashedOut(true);
                bet.setCashoutMultiplier(SettlementService.multiplierColumn(multiplier));
                bet.setWinnings(winnings);
                return new CashoutResult(wallet, bet.getCurrency(), winnings, multiplier);
            });
        }
        log.info("Cashout accepté wallet={} x{} gains={}", wallet,
                GameBroadcaster.formatMultiplier(result.multiplier), result.winnings);
        broadcaster.playerCashedOut(wallet, result.winnings, result.multiplier);
        return result;
    }

    private RoundBet persistBet(Long roundId, String wallet, BigDecimal stake, String currency) {
        try {
            return settlement.recordBet(roundId, wallet, stake, currency);
        } catch (DataIntegrityViolationException e) {
            // clé unique (round_id, wallet_address)
            throw new GameRuleException("Already has an active bet.");
        } catch (DataAccessException | TransactionException e) {
            log.error("Pari non enregistré round={} wallet={}", roundId, wallet, e);
            throw new LedgerPersistenceException("Bet could not be recorded.", e);
        }
    }

    private BigDecimal persistCashout(RoundBet bet, double multiplier) {
        try {
            return settlement.settleCashout(bet, multiplier);
        } catch (DataAccessException | TransactionException e) {
            log.error("Cashout non enregistré bet={} wallet={}", bet.getId(), bet.getWalletAddress(), e);
            throw new LedgerPersistenceException("Cashout could not be recorded.", e);
        }
    }

    private static String requireWallet(String walletAddress) {
        if (walletAddress == null || walletAddress.isBlank()) throw new GameRuleException("Invalid wallet address.");
        return walletAddress.trim();
    }

    static BigDecimal normalizeAmount(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) throw new GameRuleException("Invalid amount.");
        try {
            return amount.setScale(2, RoundingMode.UNNECESSARY);
        } catch (ArithmeticException e) {
            throw new GameRuleException("Invalid amount.");
        }
    }

    private static String normalizeCurrency(String currency) {
        if (currency == null || currency.isBlank() || currency.trim().length() > MAX_CURRENCY_LENGTH)
            throw new GameRuleException("Invalid currency.");
        return currency.trim();
    }

    public static final class CashoutResult {
        public final String walletAddress;
        public final String currency;
        public final BigDecimal winnings;
        public final double multiplier;

        public CashoutResult(String walletAddress, String currency, BigDecimal winnings, double multiplier) {
            this.walletAddress = walletAddress;
            this.currency = currency;
            this.winnings = winnings;
            this.multiplier = multiplier;
        }
    }
}
