package com.padelrank.padelrank_api.service;

import com.padelrank.padelrank_api.model.SetScores;
import com.padelrank.padelrank_api.service.LadderException.Reason;

/**
 * Pure match adjudication, no dependencies.
 *
 * Rules:
 *   - Sets 1 and 2 are mandatory, scored 0-7 games, and cannot be tied.
 *   - If each side took one of them, a third set (super tie-break, 0-99 points)
 *     is mandatory and cannot be tied.
 *   - A third set after a 2-0 is rejected.
 *   - The winner is whoever takes the majority of the sets played.
 */
public class MatchAdjudicator {

    private static final int MAX_SET_GAMES = 7;
    private static final int MAX_DECIDING_SET_POINTS = 99;

    private MatchAdjudicator() {}

    /**
     * @return true if the challenger won the match
     * @throws LadderException INVALID_SCORE or MISSING_DECIDING_SET
     */
    public static boolean challengerWins(SetScores scores) {
        if (scores == null) {
            throw new LadderException(Reason.INVALID_SCORE, "A result with at least two sets is required.");
        }

        int challengerSets = 0;
        int challengedSets = 0;

        if (wonBy(scores.set1Challenger(), scores.set1Challenged(), 1, MAX_SET_GAMES)) {
            challengerSets++;
        } else {
            challengedSets++;
        }
        if (wonBy(scores.set2Challenger(), scores.set2Challenged(), 2, MAX_SET_GAMES)) {
            challengerSets++;
        } else {
            challengedSets++;
        }

        if (challengerSets == 1) {
            // Split sets: the super tie-break decides
            if (scores.set3Challenger() == null && scores.set3Challenged() == null) {
                throw new LadderException(Reason.MISSING_DECIDING_SET,
                        "Sets are tied 1-1; a third set is required.");
            }
            return wonBy(scores.set3Challenger(), scores.set3Challenged(), 3, MAX_DECIDING_SET_POINTS);
        }

        if (scores.hasDecidingSet()) {
            throw new LadderException(Reason.INVALID_SCORE,
                    "The match was decided in two sets; no third set may be submitted.");
        }
        return challengerSets == 2;
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    /**
     * Validate one set and report whether the challenger took it.
     */
    private static boolean wonBy(Integer challenger, Integer challenged, int setNumber, int max) {
        if (challenger == null || challenged == null) {
            throw new LadderException(Reason.INVALID_SCORE, "Set " + setNumber + " is incomplete.");
        }
        if (challenger < 0 || challenged < 0 || challenger > max || challenged > max) {
            throw new LadderException(Reason.INVALID_SCORE,
                    "Set " + setNumber + " scores must be between 0 and " + max + ".");
        }
        if (challenger.equals(challenged)) {
            throw new LadderException(Reason.INVALID_SCORE, "Set " + setNumber + " cannot end tied.");
        }
        return challenger > challenged;
    }
}
