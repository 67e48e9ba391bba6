package com.padelrank.padelrank_api.service;

import com.padelrank.padelrank_api.config.LadderRulesProperties;
import com.padelrank.padelrank_api.model.Challenge;
import com.padelrank.padelrank_api.model.ChallengeStatus;
import com.padelrank.padelrank_api.model.Pair;
import com.padelrank.util.InMemoryRankingStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.support.TransactionOperations;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static com.padelrank.util.TestFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ForfeitSweeperTest {

    @Mock private ChallengeNotifier notifier;

    private InMemoryRankingStore store;
    private ForfeitSweeper sweeper;

    private Pair b3;
    private Pair b1;

    @BeforeEach
    void setUp() {
        store = new InMemoryRankingStore();
        b1 = buildPair(11, "Masculino B", 1);
        b3 = buildPair(13, "Masculino B", 3);
        store.withPairs(b1, b3);

        LadderRulesProperties rules = LadderRulesProperties.defaults();
        sweeper = new ForfeitSweeper(store, new EligibilityRules(store, rules), new RankingMutator(store),
                notifier, rules, TransactionOperations.withoutTransaction());
    }

    private Challenge pendingCreated(long id, Pair challenger, Pair challenged, LocalDateTime createdAt) {
        Challenge challenge = buildChallenge(id, challenger, challenged, MATCH_DAY, createdAt);
        store.withChallenges(challenge);
        return challenge;
    }

    @Test
    @DisplayName("pendingPastGracePeriod_challengerWinsByForfeit")
    void pendingPastGracePeriod_challengerWinsByForfeit() {
        Challenge challenge = pendingCreated(100, b3, b1, NOW.minusDays(3).minusMinutes(1));

        int resolved = sweeper.sweepExpired(NOW);

        assertEquals(1, resolved);
        assertEquals(ChallengeStatus.PLAYED, challenge.getStatus());
        assertEquals(13L, challenge.getWinnerPairId());
        assertEquals(NOW.toLocalDate(), challenge.getPlayedDate());
        assertTrue(challenge.isSwapApplied());
        assertEquals(1, b3.getPosition());
        assertEquals(3, b1.getPosition());
        verify(notifier).resultRecorded(same(challenge), same(b3), same(b1));
    }

    @Test
    @DisplayName("pendingWithinGracePeriod_untouched")
    void pendingWithinGracePeriod_untouched() {
        Challenge challenge = pendingCreated(100, b3, b1, NOW.minusDays(2));

        assertEquals(0, sweeper.sweepExpired(NOW));

        assertEquals(ChallengeStatus.PENDING, challenge.getStatus());
        assertEquals(3, b3.getPosition());
        verifyNoInteractions(notifier);
    }

    @Test
    @DisplayName("acceptedChallenge_neverForfeited")
    void acceptedChallenge_neverForfeited() {
        Challenge challenge = pendingCreated(100, b3, b1, NOW.minusDays(10));
        challenge.setStatus(ChallengeStatus.ACCEPTED);

        assertEquals(0, sweeper.sweepExpired(NOW));
        assertEquals(ChallengeStatus.ACCEPTED, challenge.getStatus());
    }

    @Test
    @DisplayName("sweepTwice_secondRunIsNoOp")
    void sweepTwice_secondRunIsNoOp() {
        pendingCreated(100, b3, b1, NOW.minusDays(4));

        assertEquals(1, sweeper.sweepExpired(NOW));
        assertEquals(0, sweeper.sweepExpired(NOW.plusHours(1)));

        assertEquals(1, b3.getPosition());
        assertEquals(3, b1.getPosition());
        verify(notifier, times(1)).resultRecorded(any(), any(), any());
    }

    @Test
    @DisplayName("overlappingSweeps_forfeitSwapAppliedOnce")
    void overlappingSweeps_forfeitSwapAppliedOnce() {
        Challenge committed = pendingCreated(100, b3, b1, NOW.minusDays(4));
        // A second request listed and read the challenge before the first sweep committed
        Challenge staleRead = buildChallenge(100, b3, b1, MATCH_DAY, NOW.minusDays(4));
        InMemoryRankingStore lagging = new InMemoryRankingStore() {
            @Override
            public List<Challenge> findPendingCreatedBefore(LocalDateTime cutoff) {
                return List.of(staleRead);
            }

            @Override
            public Optional<Challenge> findChallenge(Long challengeId) {
                return Optional.of(staleRead);
            }
        }.withPairs(b1, b3).withChallenges(committed);
        LadderRulesProperties rules = LadderRulesProperties.defaults();
        ForfeitSweeper concurrent = new ForfeitSweeper(lagging, new EligibilityRules(lagging, rules),
                new RankingMutator(lagging), notifier, rules, TransactionOperations.withoutTransaction());

        assertEquals(1, sweeper.sweepExpired(NOW));
        assertEquals(0, concurrent.sweepExpired(NOW));

        assertEquals(List.of(100L), lagging.challengeLockCalls());
        assertTrue(lagging.lockCalls().isEmpty());
        assertEquals(1, b3.getPosition());
        assertEquals(3, b1.getPosition());
        verify(notifier, times(1)).resultRecorded(any(), any(), any());
    }

    @Test
    @DisplayName("categoryMismatch_leftPending")
    void categoryMismatch_leftPending() {
        Pair femenino = buildPair(21, "Femenino B", 2);
        store.withPairs(femenino);
        Challenge challenge = pendingCreated(100, femenino, b1, NOW.minusDays(4));

        assertEquals(0, sweeper.sweepExpired(NOW));

        assertEquals(ChallengeStatus.PENDING, challenge.getStatus());
        assertNull(challenge.getWinnerPairId());
        verifyNoInteractions(notifier);
    }

    @Test
    @DisplayName("crossDivisionNoLongerEligible_winsWithoutSwap")
    void crossDivisionNoLongerEligible_winsWithoutSwap() {
        // B#3 may no longer reach A#1 (only the bottom window of A is in range)
        Pair a1 = buildPair(1, "Masculino A", 1);
        Pair a2 = buildPair(2, "Masculino A", 2);
        Pair a3 = buildPair(3, "Masculino A", 3);
        Pair a4 = buildPair(4, "Masculino A", 4);
        store.withPairs(a1, a2, a3, a4);
        Challenge challenge = pendingCreated(100, b3, a1, NOW.minusDays(4));

        assertEquals(1, sweeper.sweepExpired(NOW));

        assertEquals(ChallengeStatus.PLAYED, challenge.getStatus());
        assertEquals(13L, challenge.getWinnerPairId());
        assertFalse(challenge.isSwapApplied());
        assertTrue(challenge.isRankingApplied());
        assertEquals("Masculino B", b3.getGroupLabel());
        assertEquals(1, a1.getPosition());
    }

    @Test
    @DisplayName("crossDivisionStillEligible_promotes")
    void crossDivisionStillEligible_promotes() {
        Pair a1 = buildPair(1, "Masculino A", 1);
        Pair a2 = buildPair(2, "Masculino A", 2);
        store.withPairs(a1, a2);
        Challenge challenge = pendingCreated(100, b1, a2, NOW.minusDays(4));

        assertEquals(1, sweeper.sweepExpired(NOW));

        assertTrue(challenge.isSwapApplied());
        assertEquals("Masculino A", b1.getGroupLabel());
        assertEquals(2, b1.getPosition());
        assertEquals("Masculino B", a2.getGroupLabel());
        assertEquals(1, a2.getPosition());
    }

    @Test
    @DisplayName("oneRecordFails_othersStillResolved")
    void oneRecordFails_othersStillResolved() {
        Pair orphanTarget = buildPair(99, "Masculino B", 2);
        Challenge broken = pendingCreated(100, b3, orphanTarget, NOW.minusDays(5));
        Challenge healthy = pendingCreated(101, b3, b1, NOW.minusDays(4));

        assertEquals(1, sweeper.sweepExpired(NOW));

        assertEquals(ChallengeStatus.PENDING, broken.getStatus());
        assertEquals(ChallengeStatus.PLAYED, healthy.getStatus());
    }

    @Test
    @DisplayName("pairsLockedInAscendingIdOrder")
    void pairsLockedInAscendingIdOrder() {
        pendingCreated(100, b3, b1, NOW.minusDays(4));

        sweeper.sweepExpired(NOW);

        assertEquals(List.of(List.of(11L, 13L)), store.lockCalls());
    }
}
