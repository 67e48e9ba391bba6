package com.padelrank.padelrank_api.config;

import com.padelrank.padelrank_api.model.Pair;
import com.padelrank.padelrank_api.model.Player;
import com.padelrank.padelrank_api.repository.PairRepository;
import com.padelrank.padelrank_api.repository.PlayerRepository;
import com.padelrank.padelrank_api.security.JwtUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Local development data: two small ladders ("Masculino A" and "Masculino B") so
 * challenges, promotions and forfeits can be tried by hand. Only runs with the
 * "dev" profile, and only on an empty database.
 */
@Component
@Profile("dev")
public class DataSeeder implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(DataSeeder.class);

    private final PlayerRepository playerRepository;
    private final PairRepository pairRepository;
    private final JwtUtil jwtUtil;

    public DataSeeder(PlayerRepository playerRepository,
                      PairRepository pairRepository,
                      JwtUtil jwtUtil) {
        this.playerRepository = playerRepository;
        this.pairRepository = pairRepository;
        this.jwtUtil = jwtUtil;
    }

    @Override
    public void run(String... args) throws Exception {
        // Check if data already exists to prevent duplicates on restart
        if (playerRepository.count() == 0) {
            seedLadder("Masculino A", 4, 1);
            seedLadder("Masculino B", 4, 100);
            log.info("Database seeded with 16 players in 8 pairs.");
        }
    }

    private void seedLadder(String groupLabel, int size, int firstPlayerNumber) {
        for (int slot = 1; slot <= size; slot++) {
            int n = firstPlayerNumber + (slot - 1) * 2;
            Player first = playerRepository.save(new Player("Jugador", String.valueOf(n), "jugador" + n + "@padelrank.dev"));
            Player second = playerRepository.save(new Player("Jugador", String.valueOf(n + 1), "jugador" + (n + 1) + "@padelrank.dev"));

            Pair pair = new Pair(first.getId(), second.getId(), first.getId(), groupLabel, slot);
            pairRepository.save(pair);

            log.info("Seeded pair {} ({} #{}); captain token: {}",
                    pair.getId(), groupLabel, slot, jwtUtil.generateAccessToken(first.getId()));
        }
    }
}
