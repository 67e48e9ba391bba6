package com.padelrank.padelrank_api.service;

import com.padelrank.padelrank_api.model.Challenge;
import com.padelrank.padelrank_api.model.ChallengeStatus;
import com.padelrank.padelrank_api.model.Pair;
import com.padelrank.padelrank_api.model.Player;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read/write access to pairs and challenges used by the ladder rules.
 *
 * Implementations must make each mutating call atomic, and {@link #lockPairs}
 * must hold the returned rows until the surrounding transaction ends so a
 * two-pair swap is applied all-or-nothing.
 */
public interface RankingStore {

    // =========================================================================
    // Pairs
    // =========================================================================

    /** Any pair, active or not. */
    Optional<Pair> findPair(Long pairId);

    Optional<Pair> findActivePair(Long pairId);

    /** The acting player's active pair. First by id if the player is in several. */
    Optional<Pair> findActivePairForPlayer(Long playerId);

    /** Every pair the player has ever belonged to. */
    List<Pair> findPairsForPlayer(Long playerId);

    /** Active pairs holding a slot, ordered by group then position. */
    List<Pair> findRankedPairs();

    /** Group labels match ignoring case and surrounding whitespace. */
    Optional<Integer> findMaxActivePosition(String groupLabel);

    /** Loads and write-locks the pairs, ascending id order. */
    List<Pair> lockPairs(Collection<Long> pairIds);

    Pair savePair(Pair pair);

    Map<Long, Player> findPlayers(Collection<Long> playerIds);

    // =========================================================================
    // Challenges
    // =========================================================================

    Optional<Challenge> findChallenge(Long challengeId);

    /**
     * Loads and write-locks the challenge, returning its committed state. Take this
     * lock before {@link #lockPairs} on every path that changes a challenge.
     */
    Optional<Challenge> lockChallenge(Long challengeId);

    /**
     * Challenges of a pair in the given statuses scheduled in [from, toExclusive).
     *
     * @param excludeChallengeId challenge left out of the count, or null
     */
    long countChallenges(Long pairId, Collection<ChallengeStatus> statuses,
                         LocalDate from, LocalDate toExclusive, Long excludeChallengeId);

    List<Challenge> findPendingCreatedBefore(LocalDateTime cutoff);

    /** Ordered by scheduled date and time, soonest first. */
    List<Challenge> findChallengesByStatus(Collection<ChallengeStatus> statuses);

    /** Ordered by scheduled date and time, newest first. */
    List<Challenge> findChallengesByPairs(Collection<Long> pairIds);

    /** Ordered by scheduled date and time, soonest first. */
    List<Challenge> findChallengesByPairsScheduledFrom(Collection<Long> pairIds,
                                                       Collection<ChallengeStatus> statuses,
                                                       LocalDate from);

    long countPlayed(Long pairId);

    long countWon(Long pairId);

    Challenge saveChallenge(Challenge challenge);
}
