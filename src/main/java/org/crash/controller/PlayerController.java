package org.crash.controller;

import lombok.RequiredArgsConstructor;
import org.crash.exception.GameRuleException;
import org.crash.exception.NotFoundException;
import org.crash.model.Player;
import org.crash.service.PlayerService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/players")
@RequiredArgsConstructor
public class PlayerController {

    private final PlayerService playerService;

    // POST /api/players {"walletAddress": "..."}
    @PostMapping
    public ResponseEntity<?> register(@RequestBody Map<String, String> body) {
        try {
            Player p = playerService.register(body.get("walletAddress"));
            return ResponseEntity.status(HttpStatus.CREATED).body(Map.of(
                    "walletAddress", p.getWalletAddress(),
                    "balances", playerService.balances(p.getWalletAddress())
            ));
        } catch (GameRuleException ex) {
            return ResponseEntity.badRequest().body(Map.of("error", ex.getMessage()));
        }
    }

    @GetMapping("/{walletAddress}")
    public ResponseEntity<?> get(@PathVariable String walletAddress) {
        try {
            return ResponseEntity.ok(Map.of(
                    "walletAddress", walletAddress,
                    "balances", playerService.balances(walletAddress)
            ));
        } catch (NotFoundException ex) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", ex.getMessage()));
        }
    }
}
