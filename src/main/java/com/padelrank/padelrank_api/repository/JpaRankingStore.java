package com.padelrank.padelrank_api.repository;

import com.padelrank.padelrank_api.model.Challenge;
import com.padelrank.padelrank_api.model.ChallengeStatus;
import com.padelrank.padelrank_api.model.Pair;
import com.padelrank.padelrank_api.model.Player;
import com.padelrank.padelrank_api.service.RankingStore;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * {@link RankingStore} over Spring Data JPA. Callers own the transaction;
 * locked rows stay locked until it commits.
 */
@Component
public class JpaRankingStore implements RankingStore {

    // Identity columns start at 1, so this never matches a real challenge.
    private static final long NO_CHALLENGE = 0L;

    private final PairRepository pairRepository;
    private final ChallengeRepository challengeRepository;
    private final PlayerRepository playerRepository;

    public JpaRankingStore(PairRepository pairRepository,
                           ChallengeRepository challengeRepository,
                           PlayerRepository playerRepository) {
        this.pairRepository = pairRepository;
        this.challengeRepository = challengeRepository;
        this.playerRepository = playerRepository;
    }

    // =========================================================================
    // Pairs
    // =========================================================================

    @Override
    public Optional<Pair> findPair(Long pairId) {
        return pairRepository.findById(pairId);
    }

    @Override
    public Optional<Pair> findActivePair(Long pairId) {
        return pairRepository.findByIdAndActiveTrue(pairId);
    }

    @Override
    public Optional<Pair> findActivePairForPlayer(Long playerId) {
        return pairRepository.findActiveByMember(playerId).stream().findFirst();
    }

    @Override
    public List<Pair> findPairsForPlayer(Long playerId) {
        return pairRepository.findAllByMember(playerId);
    }

    @Override
    public List<Pair> findRankedPairs() {
        return pairRepository.findRanked();
    }

    @Override
    public Optional<Integer> findMaxActivePosition(String groupLabel) {
        if (groupLabel == null) return Optional.empty();
        return pairRepository.findMaxActivePosition(groupLabel.trim().toUpperCase(Locale.ROOT));
    }

    @Override
    public List<Pair> lockPairs(Collection<Long> pairIds) {
        List<Long> orderedIds = pairIds.stream().distinct().sorted().toList();
        return pairRepository.findAllByIdWithLock(orderedIds);
    }

    @Override
    public Pair savePair(Pair pair) {
        return pairRepository.save(pair);
    }

    @Override
    public Map<Long, Player> findPlayers(Collection<Long> playerIds) {
        return playerRepository.findAllById(playerIds).stream()
                .collect(Collectors.toMap(Player::getId, Function.identity()));
    }

    // =========================================================================
    // Challenges
    // =========================================================================

    @Override
    public Optional<Challenge> findChallenge(Long challengeId) {
        return challengeRepository.findById(challengeId);
    }

    @Override
    public Optional<Challenge> lockChallenge(Long challengeId) {
        return challengeRepository.findByIdWithLock(challengeId);
    }

    @Override
    public long countChallenges(Long pairId, Collection<ChallengeStatus> statuses,
                                LocalDate from, LocalDate toExclusive, Long excludeChallengeId) {
        return challengeRepository.countInWindow(pairId, statuses, from, toExclusive,
                excludeChallengeId != null ? excludeChallengeId : NO_CHALLENGE);
    }

    @Override
    public List<Challenge> findPendingCreatedBefore(LocalDateTime cutoff) {
        return challengeRepository.findByStatusCreatedBefore(ChallengeStatus.PENDING, cutoff);
    }

    @Override
    public List<Challenge> findChallengesByStatus(Collection<ChallengeStatus> statuses) {
        return challengeRepository.findByStatusInOrderByScheduledDateAscScheduledTimeAsc(statuses);
    }

    @Override
    public List<Challenge> findChallengesByPairs(Collection<Long> pairIds) {
        if (pairIds.isEmpty()) return List.of();
        return challengeRepository.findByPairs(pairIds);
    }

    @Override
    public List<Challenge> findChallengesByPairsScheduledFrom(Collection<Long> pairIds,
                                                              Collection<ChallengeStatus> statuses,
                                                              LocalDate from) {
        if (pairIds.isEmpty()) return List.of();
        return challengeRepository.findByPairsScheduledFrom(pairIds, statuses, from);
    }

    @Override
    public long countPlayed(Long pairId) {
        return challengeRepository.countPlayedByPair(pairId);
    }

    @Override
    public long countWon(Long pairId) {
        return challengeRepository.countWonByPair(pairId);
    }

    @Override
    public Challenge saveChallenge(Challenge challenge) {
        return challengeRepository.save(challenge);
    }
}
