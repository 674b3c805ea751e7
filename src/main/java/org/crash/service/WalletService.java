package org.crash.service;

import org.crash.exception.GameRuleException;
import org.crash.model.PlayerBalance;
import org.crash.repo.PlayerBalanceRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Soldes multi-devises d'un wallet. Chaque mouvement est un UPDATE conditionnel unique :
 * un débit qui rendrait le solde négatif n'est jamais appliqué.
 */
@Service
public class WalletService {
    @Autowired
    private PlayerBalanceRepository balanceRepo;

    public Map<String, BigDecimal> soldes(String walletAddress) {
        Map<String, BigDecimal> out = new LinkedHashMap<>();
        for (PlayerBalance b : balanceRepo.findByWalletAddress(walletAddress)) {
            out.put(b.getCurrency(), b.getAmount());
        }
        return out;
    }

    public BigDecimal solde(String walletAddress, String currency) {
        return balanceRepo.findByWalletAddressAndCurrency(walletAddress, currency)
                .map(PlayerBalance::getAmount)
                .orElse(BigDecimal.ZERO);
    }

    @Transactional
    public void crediter(String walletAddress, String currency, BigDecimal montant) {
        if (montant.signum() < 0) throw new IllegalArgumentException("Montant négatif");
        int updated = balanceRepo.incrementAmount(walletAddress, currency, montant);
        if (updated == 0) {
            // première entrée dans cette devise
            balanceRepo.save(PlayerBalance.builder()
                    .walletAddress(walletAddress)
                    .currency(currency)
                    .amount(montant)
                    .build());
        }
    }

    @Transactional
    public void debiter(String walletAddress, String currency, BigDecimal montant) {
        if (montant.signum() <= 0) throw new IllegalArgumentException("Montant invalide");
        int updated = balanceRepo.decrementAmountIfEnough(walletAddress, currency, montant);
        if (updated == 0) throw new GameRuleException("Insufficient balance.");
    }
}
