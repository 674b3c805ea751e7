package org.crash.service.crash.broadcast;

import org.crash.dto.CrashEvent;
import org.crash.model.RoundBet;
import org.crash.model.SeedCommitment;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.messaging.MessageDeliveryException;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class GameBroadcasterTest {

    @Mock
    private SimpMessagingTemplate broker;

    @InjectMocks
    private GameBroadcaster broadcaster;

    private CrashEvent sent() {
        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(broker).convertAndSend(eq(GameBroadcaster.TOPIC), captor.capture());
        return (CrashEvent) captor.getValue();
    }

    @Test
    void countdown_secondesRestantes() {
        broadcaster.countdown(10);

        CrashEvent e = sent();
        assertThat(e.getAction()).isEqualTo("COUNTDOWN");
        assertThat(e.get("time")).isEqualTo(10);
    }

    @Test
    void multiplier_deuxDecimales() {
        broadcaster.multiplier(Math.pow(2, 0.005), 0.05);

        CrashEvent e = sent();
        assertThat(e.getAction()).isEqualTo("CNT_MULTIPLY");
        assertThat(e.get("multiplier")).isEqualTo("1.00");
        assertThat(e.get("time")).isEqualTo(0.05);
    }

    @Test
    void roundCrashed_multiplierDuTickDeCrashFormate() {
        broadcaster.roundCrashed(Math.pow(2, 0.015));

        CrashEvent e = sent();
        assertThat(e.getAction()).isEqualTo("ROUND_CRASHED");
        assertThat(e.get("multiplier")).isEqualTo("1.01");
    }

    @Test
    void seedRevealed_publieLaGraineEtSonHash() {
        SeedCommitment s = SeedCommitment.commit("ab".repeat(32), "cd".repeat(32));
        s.reveal(100, java.time.Instant.now());

        broadcaster.seedRevealed(s);

        CrashEvent e = sent();
        assertThat(e.getAction()).isEqualTo("SEED_REVEALED");
        assertThat(e.get("serverSeed")).isEqualTo("ab".repeat(32));
        assertThat(e.get("serverSeedHash")).isEqualTo("cd".repeat(32));
    }

    @Test
    void seedRevealed_graineNonRevelee_jamaisPubliee() {
        SeedCommitment s = SeedCommitment.commit("ab".repeat(32), "cd".repeat(32));

        assertThatThrownBy(() -> broadcaster.seedRevealed(s)).isInstanceOf(IllegalStateException.class);
        verifyNoInteractions(broker);
    }

    @Test
    void playerBet_diffuseLeWalletEtLaMise() {
        broadcaster.playerBet(RoundBet.builder()
                .walletAddress("w1").amount(new BigDecimal("100.00")).currency("USD").build());

        CrashEvent e = sent();
        assertThat(e.getAction()).isEqualTo("PLAYER_BET");
        assertThat(e.get("walletAddress")).isEqualTo("w1");
        assertThat(e.get("amount")).isEqualTo(new BigDecimal("100.00"));
    }

    @Test
    void publish_echecBroker_nePropagePas() {
        doThrow(new MessageDeliveryException("broker down"))
                .when(broker).convertAndSend(anyString(), any(Object.class));

        assertThatCode(() -> broadcaster.gameWaiting("Place your bets!")).doesNotThrowAnyException();
    }
}
