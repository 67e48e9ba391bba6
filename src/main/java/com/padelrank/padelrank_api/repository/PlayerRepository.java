package com.padelrank.padelrank_api.repository;

import com.padelrank.padelrank_api.model.Player;
import org.springframework.data.jpa.repository.JpaRepository;

public interface PlayerRepository extends JpaRepository<Player, Long> {
}
