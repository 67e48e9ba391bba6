package com.padelrank.padelrank_api.service;

import com.padelrank.padelrank_api.model.Challenge;
import com.padelrank.padelrank_api.model.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Applies an adjudicated result to the ladder.
 *
 * Flow:
 * 1. Skip if this challenge already touched the ladder.
 * 2. Record the winner and both pre-result slots on the challenge.
 * 3. If the challenger won: same group → swap positions; different groups →
 *    swap group label and position (promotion / relegation).
 * 4. Mark ranking applied (and swap applied when slots moved).
 *
 * Callers pass pairs loaded through {@link RankingStore#lockPairs} so both rows
 * change in the same transaction.
 */
@Component
public class RankingMutator {
    private static final Logger log = LoggerFactory.getLogger(RankingMutator.class);

    private final RankingStore store;

    public RankingMutator(RankingStore store) {
        this.store = store;
    }

    /**
     * @return true if slots moved
     */
    public boolean applyResult(Challenge challenge, Pair challenger, Pair challenged, boolean challengerWon) {
        return apply(challenge, challenger, challenged, challengerWon, true);
    }

    /**
     * Forfeit: the challenger wins. Slots only move when {@code swapAllowed}
     * (same group, or a still-valid promotion challenge).
     */
    public boolean applyForfeit(Challenge challenge, Pair challenger, Pair challenged, boolean swapAllowed) {
        return apply(challenge, challenger, challenged, true, swapAllowed);
    }

    // =========================================================================
    // Core
    // =========================================================================

    private boolean apply(Challenge challenge, Pair challenger, Pair challenged,
                          boolean challengerWon, boolean swapAllowed) {
        if (challenge.isSwapApplied() || challenge.isRankingApplied()) {
            log.debug("Ranking already applied for challenge {}, skipping", challenge.getId());
            return false;
        }

        challenge.setWinnerPairId(challengerWon ? challenger.getId() : challenged.getId());
        challenge.recordPositionsBefore(challenger.getPosition(), challenged.getPosition());

        boolean swapped = false;
        if (challengerWon && swapAllowed) {
            String challengerGroup = challenger.getGroupLabel();
            Integer challengerPosition = challenger.getPosition();

            if (CategoryResolver.sameGroup(challenger, challenged)) {
                challenger.moveTo(challengerGroup, challenged.getPosition());
                challenged.moveTo(challengerGroup, challengerPosition);
            } else {
                // Promotion: the winner takes the loser's group and slot, and vice versa
                challenger.moveTo(challenged.getGroupLabel(), challenged.getPosition());
                challenged.moveTo(challengerGroup, challengerPosition);
            }
            store.savePair(challenger);
            store.savePair(challenged);
            swapped = true;

            log.info("Challenge {}: pair {} now {} #{}, pair {} now {} #{}", challenge.getId(),
                    challenger.getId(), challenger.getGroupLabel(), challenger.getPosition(),
                    challenged.getId(), challenged.getGroupLabel(), challenged.getPosition());
        }

        challenge.markRankingApplied(swapped);
        return swapped;
    }
}
