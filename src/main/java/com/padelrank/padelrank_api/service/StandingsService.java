package com.padelrank.padelrank_api.service;

import com.padelrank.padelrank_api.model.Pair;
import com.padelrank.padelrank_api.model.Player;
import com.padelrank.padelrank_api.service.LadderException.Reason;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Ladder tables and "who can I challenge" lookups. Both run the forfeit sweep
 * first so the slots shown already include expired challenges.
 */
@Service
public class StandingsService {

    private final RankingStore store;
    private final EligibilityRules eligibilityRules;
    private final ForfeitSweeper forfeitSweeper;
    private final Clock clock;

    public StandingsService(RankingStore store,
                            EligibilityRules eligibilityRules,
                            ForfeitSweeper forfeitSweeper,
                            Clock clock) {
        this.store = store;
        this.eligibilityRules = eligibilityRules;
        this.forfeitSweeper = forfeitSweeper;
        this.clock = clock;
    }

    /**
     * Ranked pairs in ladder order with played/won/lost counts.
     *
     * @param groupFilter exact group ("Masculino B"), bare category ("Femenino"), or null for all
     */
    @Transactional(readOnly = true)
    public List<Standing> standings(String groupFilter) {
        forfeitSweeper.sweepExpired(LocalDateTime.now(clock));

        List<Pair> pairs = store.findRankedPairs().stream()
                .filter(p -> CategoryResolver.matchesGroupFilter(p, groupFilter))
                .toList();
        Map<Long, Player> players = playersOf(pairs);

        List<Standing> rows = new ArrayList<>();
        for (Pair p : pairs) {
            long played = store.countPlayed(p.getId());
            long won = store.countWon(p.getId());
            rows.add(new Standing(
                    p.getId(),
                    pairName(p, players),
                    p.getGroupLabel(),
                    p.getPosition(),
                    played,
                    won,
                    played - won
            ));
        }
        return rows;
    }

    /**
     * Active ranked pairs the player's pair could challenge right now,
     * ignoring the weekly cap (which depends on the date picked).
     */
    @Transactional(readOnly = true)
    public List<ChallengeablePair> challengeable(Long playerId) {
        forfeitSweeper.sweepExpired(LocalDateTime.now(clock));

        Pair own = store.findActivePairForPlayer(playerId)
                .orElseThrow(() -> new LadderException(Reason.NO_ACTIVE_PAIR,
                        "Player " + playerId + " has no active pair."));

        List<Pair> targets = store.findRankedPairs().stream()
                .filter(p -> eligibilityRules.isChallengeable(own, p))
                .toList();
        Map<Long, Player> players = playersOf(targets);

        return targets.stream()
                .map(p -> new ChallengeablePair(p.getId(), pairName(p, players), p.getGroupLabel(), p.getPosition()))
                .toList();
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private Map<Long, Player> playersOf(List<Pair> pairs) {
        return store.findPlayers(pairs.stream()
                .flatMap(p -> Stream.of(p.getPlayer1Id(), p.getPlayer2Id()))
                .distinct()
                .toList());
    }

    private static String pairName(Pair pair, Map<Long, Player> players) {
        return nameOf(players.get(pair.getPlayer1Id())) + " / " + nameOf(players.get(pair.getPlayer2Id()));
    }

    private static String nameOf(Player player) {
        return player != null ? player.getDisplayName() : "Unknown";
    }

    // =========================================================================
    // DTOs
    // =========================================================================

    public record Standing(
            Long pairId, String pairName, String group, Integer position,
            long played, long won, long lost
    ) {}

    public record ChallengeablePair(Long pairId, String pairName, String group, Integer position) {}
}
