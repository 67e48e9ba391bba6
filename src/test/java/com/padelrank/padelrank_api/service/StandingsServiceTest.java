package com.padelrank.padelrank_api.service;

import com.padelrank.padelrank_api.config.LadderRulesProperties;
import com.padelrank.padelrank_api.model.Challenge;
import com.padelrank.padelrank_api.model.ChallengeStatus;
import com.padelrank.padelrank_api.service.LadderException.Reason;
import com.padelrank.padelrank_api.service.StandingsService.ChallengeablePair;
import com.padelrank.padelrank_api.service.StandingsService.Standing;
import com.padelrank.util.InMemoryRankingStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.time.ZoneId;
import java.util.List;

import static com.padelrank.util.TestFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(MockitoExtension.class)
class StandingsServiceTest {

    @Mock private ChallengeNotifier notifier;

    private InMemoryRankingStore store;
    private StandingsService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryRankingStore()
                .withPairs(
                        buildPair(1, "Masculino A", 1),
                        buildPair(2, "Masculino A", 2),
                        buildPair(11, "Masculino B", 1),
                        buildPair(12, "Masculino B", 2),
                        buildPair(13, "Masculino B", 3),
                        buildPair(14, "Masculino B", 4),
                        buildPair(15, "Masculino B", 5),
                        buildPair(21, "Femenino A", 1),
                        buildInactivePair(30, "Masculino B"))
                .withPlayers(
                        buildPlayer(firstMember(13), "Ana", "Ruiz"),
                        buildPlayer(secondMember(13), "Lucia", "Gomez"));

        LadderRulesProperties rules = LadderRulesProperties.defaults();
        EligibilityRules eligibility = new EligibilityRules(store, rules);
        ForfeitSweeper sweeper = new ForfeitSweeper(store, eligibility, new RankingMutator(store), notifier, rules,
                TransactionOperations.withoutTransaction());
        Clock clock = Clock.fixed(NOW.atZone(ZoneId.systemDefault()).toInstant(), ZoneId.systemDefault());
        service = new StandingsService(store, eligibility, sweeper, clock);
    }

    @Test
    @DisplayName("standings_ladderOrder_withRecord")
    void standings_ladderOrder_withRecord() {
        Challenge won = buildChallenge(100, store.findPair(13L).orElseThrow(), store.findPair(12L).orElseThrow(),
                ChallengeStatus.PLAYED);
        won.setWinnerPairId(13L);
        Challenge lost = buildChallenge(101, store.findPair(14L).orElseThrow(), store.findPair(13L).orElseThrow(),
                ChallengeStatus.PLAYED);
        lost.setWinnerPairId(14L);
        Challenge open = buildChallenge(102, store.findPair(15L).orElseThrow(), store.findPair(13L).orElseThrow(),
                ChallengeStatus.ACCEPTED);
        store.withChallenges(won, lost, open);

        List<Standing> table = service.standings("Masculino B");

        assertEquals(List.of(11L, 12L, 13L, 14L, 15L), table.stream().map(Standing::pairId).toList());
        Standing third = table.get(2);
        assertEquals("Ana Ruiz / Lucia Gomez", third.pairName());
        assertEquals(3, third.position());
        assertEquals(2, third.played());
        assertEquals(1, third.won());
        assertEquals(1, third.lost());
    }

    @Test
    @DisplayName("standings_bareCategoryFilter_spansDivisions")
    void standings_bareCategoryFilter_spansDivisions() {
        List<Long> ids = service.standings("masculino").stream().map(Standing::pairId).toList();

        assertEquals(List.of(1L, 2L, 11L, 12L, 13L, 14L, 15L), ids);
    }

    @Test
    @DisplayName("standings_noFilter_everyRankedPair_unknownNamesFallBack")
    void standings_noFilter_everyRankedPair_unknownNamesFallBack() {
        List<Standing> table = service.standings(null);

        assertEquals(8, table.size());
        assertEquals("Unknown / Unknown", table.get(0).pairName());
    }

    @Test
    @DisplayName("standings_includeExpiredForfeits")
    void standings_includeExpiredForfeits() {
        store.withChallenges(buildChallenge(100, store.findPair(14L).orElseThrow(),
                store.findPair(12L).orElseThrow(), MATCH_DAY, NOW.minusDays(5)));

        List<Standing> table = service.standings("Masculino B");

        assertEquals(List.of(11L, 14L, 13L, 12L, 15L), table.stream().map(Standing::pairId).toList());
    }

    @Test
    @DisplayName("challengeable_sameGroupWindowAndPromotion")
    void challengeable_sameGroupWindowAndPromotion() {
        // A has two pairs, both inside its bottom window; nothing sits above B#1 in its own group
        List<Long> fromTop = service.challengeable(firstMember(11)).stream().map(ChallengeablePair::pairId).toList();
        assertEquals(List.of(1L, 2L), fromTop);

        List<Long> fromFifth = service.challengeable(firstMember(15)).stream().map(ChallengeablePair::pairId).toList();
        assertEquals(List.of(12L, 13L, 14L), fromFifth);
    }

    @Test
    @DisplayName("challengeable_playerWithoutPair_noActivePair")
    void challengeable_playerWithoutPair_noActivePair() {
        LadderException ex = assertThrows(LadderException.class, () -> service.challengeable(999L));
        assertEquals(Reason.NO_ACTIVE_PAIR, ex.getReason());
    }
}
