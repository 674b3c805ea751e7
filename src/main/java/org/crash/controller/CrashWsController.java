package org.crash.controller;

import lombok.RequiredArgsConstructor;
import org.crash.dto.CashoutMsg;
import org.crash.dto.CrashEvent;
import org.crash.dto.PlaceBetMsg;
import org.crash.exception.GameRuleException;
import org.crash.exception.LedgerPersistenceException;
import org.crash.exception.NotFoundException;
import org.crash.model.RoundBet;
import org.crash.service.crash.broadcast.GameBroadcaster;
import org.crash.service.crash.ledger.BetLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.simp.annotation.SendToUser;
import org.springframework.stereotype.Controller;

/**
 * Requêtes joueur sur la socket. Chaque requête reçoit une réponse directe sur
 * /user/queue/crash (session courante), succès ou ERROR.
 */
@Controller
@RequiredArgsConstructor
public class CrashWsController {
    public static final String REPLY_QUEUE = "/queue/crash";

    private static final Logger log = LoggerFactory.getLogger(CrashWsController.class);

    private final BetLedger ledger;

    @MessageMapping("/crash/bet")
    @SendToUser(destinations = REPLY_QUEUE, broadcast = false)
    public CrashEvent bet(PlaceBetMsg msg) {
        try {
            RoundBet bet = ledger.placeBet(msg.getWalletAddress(), msg.getAmount(), msg.getCurrency());
            return CrashEvent.of("BET_PLACED")
                    .with("walletAddress", bet.getWalletAddress())
                    .with("amount", bet.getAmount())
                    .with("currency", bet.getCurrency());
        } catch (GameRuleException | NotFoundException | LedgerPersistenceException ex) {
            return CrashEvent.error(ex.getMessage());
        } catch (RuntimeException ex) {
            log.error("Pari en échec wallet={}", msg.getWalletAddress(), ex);
            return CrashEvent.error("Internal error.");
        }
    }

    @MessageMapping("/crash/cashout")
    @SendToUser(destinations = REPLY_QUEUE, broadcast = false)
    public CrashEvent cashout(CashoutMsg msg) {
        try {
            BetLedger.CashoutResult res = ledger.cashout(msg.getWalletAddress());
            return CrashEvent.of("CASHOUT_SUCCESS")
                    .with("walletAddress", res.walletAddress)
                    .with("winnings", res.winnings)
                    .with("multiplier", GameBroadcaster.formatMultiplier(res.multiplier));
        } catch (GameRuleException | NotFoundException | LedgerPersistenceException ex) {
            return CrashEvent.error(ex.getMessage());
        } catch (RuntimeException ex) {
            log.error("Cashout en échec wallet={}", msg.getWalletAddress(), ex);
            return CrashEvent.error("Internal error.");
        }
    }
}
