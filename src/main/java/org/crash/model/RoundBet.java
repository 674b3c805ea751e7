package org.crash.model;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "round_bet",
        uniqueConstraints = @UniqueConstraint(name = "uk_round_bet_wallet", columnNames = {"round_id", "wallet_address"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RoundBet {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "round_id", nullable = false, updatable = false)
    private Long roundId;

    @Column(name = "wallet_address", nullable = false, updatable = false)
    private String walletAddress;

    @Column(nullable = false, precision = 19, scale = 2, updatable = false)
    private BigDecimal amount;

    @Column(nullable = false, length = 16, updatable = false)
    private String currency;

    @Column(nullable = false)
    private boolean cashedOut;

    @Column(precision = 12, scale = 4)
    private BigDecimal cashoutMultiplier;

    @Column(precision = 19, scale = 2)
    private BigDecimal winnings;

    @Column(nullable = false, updatable = false)
    private Instant placedAt;
}
