package org.crash.model;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class PlayerBalanceTest {

    @Test
    void builder_sansMontant_soldeAZero() {
        PlayerBalance b = PlayerBalance.builder().walletAddress("w1").currency("EUR").build();

        assertThat(b.getAmount()).isEqualByComparingTo(BigDecimal.ZERO);
    }
}
