package org.crash.service;

import org.crash.exception.GameRuleException;
import org.crash.model.PlayerBalance;
import org.crash.repo.PlayerBalanceRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class WalletServiceTest {

    @Mock
    private PlayerBalanceRepository balanceRepo;

    @InjectMocks
    private WalletService walletService;

    private PlayerBalance balance(String currency, String amount) {
        return PlayerBalance.builder()
                .walletAddress("w1")
                .currency(currency)
                .amount(new BigDecimal(amount))
                .build();
    }

    // --- soldes() / solde() ---

    @Test
    void soldes_toutesLesDevises() {
        when(balanceRepo.findByWalletAddress("w1"))
                .thenReturn(List.of(balance("USD", "1000.00"), balance("EUR", "12.50")));

        Map<String, BigDecimal> res = walletService.soldes("w1");

        assertThat(res).containsOnlyKeys("USD", "EUR");
        assertThat(res.get("EUR")).isEqualByComparingTo("12.50");
    }

    @Test
    void solde_deviseAbsente_zero() {
        when(balanceRepo.findByWalletAddressAndCurrency("w1", "BTC")).thenReturn(Optional.empty());

        assertThat(walletService.solde("w1", "BTC")).isEqualByComparingTo("0");
    }

    // --- crediter() ---

    @Test
    void crediter_incrementeLeSoldeExistant() {
        when(balanceRepo.incrementAmount("w1", "USD", new BigDecimal("250.00"))).thenReturn(1);

        walletService.crediter("w1", "USD", new BigDecimal("250.00"));

        verify(balanceRepo, never()).save(any());
    }

    @Test
    void crediter_premiereEntreeDansLaDevise_creeLaLigne() {
        when(balanceRepo.incrementAmount("w1", "EUR", new BigDecimal("5.00"))).thenReturn(0);

        walletService.crediter("w1", "EUR", new BigDecimal("5.00"));

        ArgumentCaptor<PlayerBalance> captor = ArgumentCaptor.forClass(PlayerBalance.class);
        verify(balanceRepo).save(captor.capture());
        assertThat(captor.getValue().getCurrency()).isEqualTo("EUR");
        assertThat(captor.getValue().getAmount()).isEqualByComparingTo("5.00");
    }

    @Test
    void crediter_montantNegatif_refuse() {
        assertThrows(IllegalArgumentException.class,
                () -> walletService.crediter("w1", "USD", new BigDecimal("-1")));
        verifyNoInteractions(balanceRepo);
    }

    // --- debiter() ---

    @Test
    void debiter_soldeSuffisant() {
        when(balanceRepo.decrementAmountIfEnough("w1", "USD", new BigDecimal("100.00"))).thenReturn(1);

        walletService.debiter("w1", "USD", new BigDecimal("100.00"));

        verify(balanceRepo).decrementAmountIfEnough("w1", "USD", new BigDecimal("100.00"));
    }

    @Test
    void debiter_soldeInsuffisant_refuse() {
        when(balanceRepo.decrementAmountIfEnough("w1", "USD", new BigDecimal("5000.00"))).thenReturn(0);

        GameRuleException ex = assertThrows(GameRuleException.class,
                () -> walletService.debiter("w1", "USD", new BigDecimal("5000.00")));
        assertThat(ex.getMessage()).isEqualTo("Insufficient balance.");
    }

    @Test
    void debiter_montantNul_refuse() {
        assertThrows(IllegalArgumentException.class,
                () -> walletService.debiter("w1", "USD", BigDecimal.ZERO));
        verifyNoInteractions(balanceRepo);
    }
}
