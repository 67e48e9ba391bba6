package com.padelrank.padelrank_api.service;

import com.padelrank.padelrank_api.model.Challenge;
import com.padelrank.padelrank_api.model.ChallengeStatus;
import com.padelrank.padelrank_api.model.Pair;
import com.padelrank.padelrank_api.model.SetScores;
import com.padelrank.padelrank_api.service.LadderException.Reason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Challenge lifecycle: create, accept, reject, reschedule, submit result, and the
 * read paths. Every entry point first runs the forfeit sweep so expired pending
 * challenges are resolved before anything is read or changed.
 *
 * States: PENDING → ACCEPTED | REJECTED | PLAYED (forfeit); ACCEPTED → PLAYED.
 * Ranking changes only happen on the transition to PLAYED.
 */
@Service
public class ChallengeService {
    private static final Logger log = LoggerFactory.getLogger(ChallengeService.class);

    // "My upcoming" also shows what was played in the last week
    private static final int RECENT_DAYS = 7;

    private final RankingStore store;
    private final EligibilityRules eligibilityRules;
    private final RankingMutator rankingMutator;
    private final ForfeitSweeper forfeitSweeper;
    private final ChallengeNotifier notifier;
    private final Clock clock;

    public ChallengeService(RankingStore store,
                            EligibilityRules eligibilityRules,
                            RankingMutator rankingMutator,
                            ForfeitSweeper forfeitSweeper,
                            ChallengeNotifier notifier,
                            Clock clock) {
        this.store = store;
        this.eligibilityRules = eligibilityRules;
        this.rankingMutator = rankingMutator;
        this.forfeitSweeper = forfeitSweeper;
        this.notifier = notifier;
        this.clock = clock;
    }

    // =========================================================================
    // Create
    // =========================================================================

    @Transactional
    public Challenge create(Long actingPlayerId, Long challengedPairId,
                            LocalDate date, LocalTime time, String observation) {
        sweep();
        log.info("Challenge request from player {} against pair {} for {} {}",
                actingPlayerId, challengedPairId, date, time);

        Pair challenger = store.findActivePairForPlayer(actingPlayerId)
                .orElseThrow(() -> new LadderException(Reason.NO_ACTIVE_PAIR,
                        "Player " + actingPlayerId + " has no active pair."));
        Pair challenged = store.findActivePair(challengedPairId)
                .orElseThrow(() -> new LadderException(Reason.PAIR_NOT_FOUND,
                        "Pair " + challengedPairId + " not found or inactive."));

        if (challenger.getId().equals(challenged.getId())) {
            throw new LadderException(Reason.SELF_CHALLENGE, "A pair cannot challenge itself.");
        }
        requireSlot(date, time);
        eligibilityRules.validate(challenger, challenged, date, null);

        Challenge challenge = new Challenge(challenger.getId(), challenged.getId(), date, time);
        challenge.setObservation(observation);
        challenge.setTitle(titleFor(challenger, challenged));
        challenge.setWeeklyLimitOk(true);
        challenge = store.saveChallenge(challenge);

        log.info("Challenge {} created: pair {} vs pair {} ({})",
                challenge.getId(), challenger.getId(), challenged.getId(), challenge.getTitle());
        notifier.created(challenge, challenger, challenged);
        return challenge;
    }

    // =========================================================================
    // Accept / Reject
    // =========================================================================

    @Transactional
    public Challenge accept(Long actingPlayerId, Long challengeId) {
        sweep();
        Challenge challenge = lockChallenge(challengeId);
        requirePending(challenge);
        requireChallengedSide(challenge, actingPlayerId);

        challenge.setStatus(ChallengeStatus.ACCEPTED);
        log.info("Challenge {} accepted by player {}", challengeId, actingPlayerId);
        return store.saveChallenge(challenge);
    }

    @Transactional
    public Challenge reject(Long actingPlayerId, Long challengeId) {
        sweep();
        Challenge challenge = lockChallenge(challengeId);
        requirePending(challenge);
        requireChallengedSide(challenge, actingPlayerId);

        challenge.setStatus(ChallengeStatus.REJECTED);
        log.info("Challenge {} rejected by player {}", challengeId, actingPlayerId);
        return store.saveChallenge(challenge);
    }

    // =========================================================================
    // Reschedule
    // =========================================================================

    @Transactional
    public Challenge reschedule(Long actingPlayerId, Long challengeId, LocalDate date, LocalTime time) {
        sweep();
        Challenge challenge = lockChallenge(challengeId);
        requirePending(challenge);

        Pair challenger = loadPair(challenge.getChallengerPairId());
        Pair challenged = loadPair(challenge.getChallengedPairId());
        requireParticipant(challenge, challenger, challenged, actingPlayerId);
        requireSlot(date, time);
        eligibilityRules.validate(challenger, challenged, date, challenge.getId());

        LocalDate previousDate = challenge.getScheduledDate();
        LocalTime previousTime = challenge.getScheduledTime();
        challenge.setScheduledDate(date);
        challenge.setScheduledTime(time);
        challenge = store.saveChallenge(challenge);

        log.info("Challenge {} rescheduled by player {}: {} {} → {} {}",
                challengeId, actingPlayerId, previousDate, previousTime, date, time);
        notifier.rescheduled(challenge, challenger, challenged);
        return challenge;
    }

    // =========================================================================
    // Submit result
    // =========================================================================

    @Transactional
    public Challenge submitResult(Long actingPlayerId, Long challengeId, SetScores scores) {
        sweep();
        Challenge challenge = lockChallenge(challengeId);
        if (challenge.getStatus() == ChallengeStatus.PLAYED) {
            throw new LadderException(Reason.ALREADY_RESOLVED, "Challenge " + challengeId + " was already played.");
        }
        if (challenge.getStatus() == ChallengeStatus.REJECTED) {
            throw new LadderException(Reason.ALREADY_REJECTED, "Challenge " + challengeId + " was rejected.");
        }

        Map<Long, Pair> locked = store.lockPairs(
                        List.of(challenge.getChallengerPairId(), challenge.getChallengedPairId()))
                .stream().collect(Collectors.toMap(Pair::getId, Function.identity()));
        Pair challenger = locked.get(challenge.getChallengerPairId());
        Pair challenged = locked.get(challenge.getChallengedPairId());
        if (challenger == null || challenged == null) {
            throw new LadderException(Reason.PAIR_NOT_FOUND, "Pairs of challenge " + challengeId + " not found.");
        }
        requireParticipant(challenge, challenger, challenged, actingPlayerId);

        eligibilityRules.checkCategory(challenger, challenged);
        if (!CategoryResolver.sameGroup(challenger, challenged)) {
            // Ranks may have moved since the challenge was made
            eligibilityRules.checkPromotion(challenger, challenged);
        }

        boolean challengerWon = MatchAdjudicator.challengerWins(scores);

        challenge.recordScores(scores);
        rankingMutator.applyResult(challenge, challenger, challenged, challengerWon);
        challenge.setPlayedDate(LocalDate.now(clock));
        challenge.setStatus(ChallengeStatus.PLAYED);
        challenge = store.saveChallenge(challenge);

        log.info("Result for challenge {} submitted by player {}: winner pair {}, swap applied {}",
                challengeId, actingPlayerId, challenge.getWinnerPairId(), challenge.isSwapApplied());
        notifier.resultRecorded(challenge, challenger, challenged);
        return challenge;
    }

    // =========================================================================
    // Queries
    // =========================================================================

    /** Pending and accepted challenges across the league, soonest first. */
    @Transactional(readOnly = true)
    public List<Challenge> listUpcoming() {
        sweep();
        return store.findChallengesByStatus(ChallengeStatus.OPEN);
    }

    /** History of one pair, newest first. */
    @Transactional(readOnly = true)
    public List<Challenge> listByPair(Long pairId) {
        sweep();
        loadPair(pairId);
        return store.findChallengesByPairs(List.of(pairId));
    }

    /** Every challenge of any pair the player belongs or belonged to, newest first. */
    @Transactional(readOnly = true)
    public List<Challenge> listMine(Long playerId) {
        sweep();
        return store.findChallengesByPairs(pairIdsOf(playerId));
    }

    /** The player's pending, accepted and recently played challenges, soonest first. */
    @Transactional(readOnly = true)
    public List<Challenge> listMyUpcoming(Long playerId) {
        sweep();
        LocalDate from = LocalDate.now(clock).minusDays(RECENT_DAYS);
        return store.findChallengesByPairsScheduledFrom(pairIdsOf(playerId),
                EnumSet.of(ChallengeStatus.PENDING, ChallengeStatus.ACCEPTED, ChallengeStatus.PLAYED), from);
    }

    /** Only members of either pair can see the challenge through this path. */
    @Transactional(readOnly = true)
    public Challenge getForParticipant(Long playerId, Long challengeId) {
        sweep();
        Challenge challenge = loadChallenge(challengeId);
        requireParticipant(challenge, loadPair(challenge.getChallengerPairId()),
                loadPair(challenge.getChallengedPairId()), playerId);
        return challenge;
    }

    @Transactional(readOnly = true)
    public Challenge getPublic(Long challengeId) {
        sweep();
        return loadChallenge(challengeId);
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private void sweep() {
        forfeitSweeper.sweepExpired(LocalDateTime.now(clock));
    }

    private Challenge loadChallenge(Long challengeId) {
        return store.findChallenge(challengeId)
                .orElseThrow(() -> new LadderException(Reason.CHALLENGE_NOT_FOUND,
                        "Challenge " + challengeId + " not found."));
    }

    private Challenge lockChallenge(Long challengeId) {
        return store.lockChallenge(challengeId)
                .orElseThrow(() -> new LadderException(Reason.CHALLENGE_NOT_FOUND,
                        "Challenge " + challengeId + " not found."));
    }

    private Pair loadPair(Long pairId) {
        return store.findPair(pairId)
                .orElseThrow(() -> new LadderException(Reason.PAIR_NOT_FOUND, "Pair " + pairId + " not found."));
    }

    private List<Long> pairIdsOf(Long playerId) {
        return store.findPairsForPlayer(playerId).stream().map(Pair::getId).toList();
    }

    private void requirePending(Challenge challenge) {
        switch (challenge.getStatus()) {
            case PENDING -> { }
            case PLAYED -> throw new LadderException(Reason.ALREADY_RESOLVED,
                    "Challenge " + challenge.getId() + " was already played.");
            case REJECTED -> throw new LadderException(Reason.ALREADY_REJECTED,
                    "Challenge " + challenge.getId() + " was already rejected.");
            default -> throw new LadderException(Reason.INVALID_TRANSITION,
                    "Challenge " + challenge.getId() + " is " + challenge.getStatus().getLabel()
                            + "; only pending challenges can change.");
        }
    }

    private void requireChallengedSide(Challenge challenge, Long playerId) {
        Pair challenged = loadPair(challenge.getChallengedPairId());
        if (!challenged.hasMember(playerId)) {
            log.warn("Player {} is not in challenged pair {} of challenge {}",
                    playerId, challenged.getId(), challenge.getId());
            throw new LadderException(Reason.NOT_A_PARTICIPANT,
                    "Only the challenged pair can answer this challenge.");
        }
    }

    private void requireParticipant(Challenge challenge, Pair challenger, Pair challenged, Long playerId) {
        if (!challenger.hasMember(playerId) && !challenged.hasMember(playerId)) {
            log.warn("Player {} is not part of challenge {}", playerId, challenge.getId());
            throw new LadderException(Reason.NOT_A_PARTICIPANT, "You are not part of this challenge.");
        }
    }

    private static void requireSlot(LocalDate date, LocalTime time) {
        if (date == null) {
            throw new LadderException(Reason.INVALID_TIME_SLOT, "A match date is required.");
        }
        if (time == null || time.getMinute() != 0 || time.getSecond() != 0 || time.getNano() != 0) {
            throw new LadderException(Reason.INVALID_TIME_SLOT,
                    "Matches start on the hour (e.g. 18:00), got " + time + ".");
        }
    }

    static String titleFor(Pair challenger, Pair challenged) {
        if (challenger.getPosition() != null && challenged.getPosition() != null) {
            return challenger.getPosition() + " vs " + challenged.getPosition();
        }
        return challenger.getId() + " vs " + challenged.getId();
    }
}
