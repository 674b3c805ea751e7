package org.crash.service;

import lombok.RequiredArgsConstructor;
import org.crash.config.CrashSettings;
import org.crash.exception.GameRuleException;
import org.crash.exception.NotFoundException;
import org.crash.model.Player;
import org.crash.repo.PlayerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

@Service
@RequiredArgsConstructor
public class PlayerService {
    private static final Logger log = LoggerFactory.getLogger(PlayerService.class);
    private static final int MAX_WALLET_LENGTH = 128;

    private final PlayerRepository players;
    private final WalletService walletService;
    private final CrashSettings settings;

    /** Crée le joueur avec les soldes de départ (USD 1000 par défaut). */
    @Transactional
    public Player register(String walletAddress) {
        String wallet = normalizeWallet(walletAddress);
        if (players.existsByWalletAddress(wallet))
            throw new GameRuleException("Wallet already registered.");

        Player p = players.save(Player.builder()
                .walletAddress(wallet)
                .createdAt(Instant.now())
                .build());
        for (Map.Entry<String, BigDecimal> e : settings.getDefaultBalances().entrySet()) {
            walletService.crediter(wallet, e.getKey(), e.getValue());
        }
        log.info("Joueur enregistré wallet={}", wallet);
        return p;
    }

    public Player require(String walletAddress) {
        return players.findByWalletAddress(walletAddress)
                .orElseThrow(() -> new NotFoundException("User not found."));
    }

    public Map<String, BigDecimal> balances(String walletAddress) {
        require(walletAddress);
        return walletService.soldes(walletAddress);
    }

    static String normalizeWallet(String walletAddress) {
        if (walletAddress == null || walletAddress.isBlank())
            throw new GameRuleException("Invalid wallet address.");
        String w = walletAddress.trim();
        if (w.length() > MAX_WALLET_LENGTH) throw new GameRuleException("Invalid wallet address.");
        return w;
    }
}
