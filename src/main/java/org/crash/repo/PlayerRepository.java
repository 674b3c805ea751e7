package org.crash.repo;

import org.crash.model.Player;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface PlayerRepository extends JpaRepository<Player, Long> {
    Optional<Player> findByWalletAddress(String walletAddress);

    boolean existsByWalletAddress(String walletAddress);
}
