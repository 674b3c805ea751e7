package org.crash.controller;

import org.crash.exception.GameRuleException;
import org.crash.exception.NotFoundException;
import org.crash.model.Player;
import org.crash.service.PlayerService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.ResponseEntity;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PlayerControllerTest {

    @Mock
    private PlayerService playerService;

    @InjectMocks
    private PlayerController controller;

    @SuppressWarnings("unchecked")
    private static Map<String, Object> body(ResponseEntity<?> res) {
        return (Map<String, Object>) res.getBody();
    }

    @Test
    void register_201AvecLesSoldes() {
        when(playerService.register("0xabc"))
                .thenReturn(Player.builder().id(1L).walletAddress("0xabc").createdAt(Instant.now()).build());
        when(playerService.balances("0xabc")).thenReturn(Map.of("USD", new BigDecimal("1000.00")));

        ResponseEntity<?> res = controller.register(Map.of("walletAddress", "0xabc"));

        assertThat(res.getStatusCode().value()).isEqualTo(201);
        assertThat(body(res)).containsEntry("walletAddress", "0xabc");
    }

    @Test
    void register_doublon_400() {
        when(playerService.register("0xabc")).thenThrow(new GameRuleException("Wallet already registered."));

        ResponseEntity<?> res = controller.register(Map.of("walletAddress", "0xabc"));

        assertThat(res.getStatusCode().value()).isEqualTo(400);
        assertThat(body(res)).containsEntry("error", "Wallet already registered.");
    }

    @Test
    void get_joueurInconnu_404() {
        when(playerService.balances("ghost")).thenThrow(new NotFoundException("User not found."));

        ResponseEntity<?> res = controller.get("ghost");

        assertThat(res.getStatusCode().value()).isEqualTo(404);
        assertThat(body(res)).containsEntry("error", "User not found.");
    }
}
