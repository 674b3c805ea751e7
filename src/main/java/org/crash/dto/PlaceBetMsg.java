package org.crash.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PlaceBetMsg {
    @NotBlank
    private String walletAddress;
    @Positive(message = "La mise doit être > 0")
    private BigDecimal amount;
    @NotBlank
    private String currency;
}
