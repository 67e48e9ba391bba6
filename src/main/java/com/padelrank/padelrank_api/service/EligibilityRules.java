package com.padelrank.padelrank_api.service;

import com.padelrank.padelrank_api.config.LadderRulesProperties;
import com.padelrank.padelrank_api.model.ChallengeStatus;
import com.padelrank.padelrank_api.model.Pair;
import com.padelrank.padelrank_api.service.LadderException.Reason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;

/**
 * Decides whether one pair may challenge another.
 *
 * Checks run in a fixed order and stop at the first failure:
 * 1. Category match.
 * 2. Weekly cap for both pairs (Monday-Sunday week of the proposed date).
 * 3. Same group: challenged must be strictly above, at most maxSlotGap slots.
 * 4. Different groups: only source-division → target-division promotion challenges.
 */
@Component
public class EligibilityRules {
    private static final Logger log = LoggerFactory.getLogger(EligibilityRules.class);

    private final RankingStore store;
    private final LadderRulesProperties rules;

    public EligibilityRules(RankingStore store, LadderRulesProperties rules) {
        this.store = store;
        this.rules = rules;
    }

    // =========================================================================
    // Full validation (create / reschedule)
    // =========================================================================

    /**
     * @param excludeChallengeId challenge being rescheduled, left out of its own weekly count; null on create
     * @throws LadderException with the first failing rule
     */
    public void validate(Pair challenger, Pair challenged, LocalDate proposedDate, Long excludeChallengeId) {
        checkCategory(challenger, challenged);
        checkWeeklyCap(challenger, proposedDate, excludeChallengeId);
        checkWeeklyCap(challenged, proposedDate, excludeChallengeId);
        checkLadderDistance(challenger, challenged);
    }

    /**
     * Everything except the weekly cap, for "who can I challenge" listings.
     */
    public boolean isChallengeable(Pair challenger, Pair challenged) {
        if (challenger.getId().equals(challenged.getId())
                || !CategoryResolver.sameCategory(challenger, challenged)) {
            return false;
        }
        if (!CategoryResolver.sameGroup(challenger, challenged)) {
            return isPromotionEligible(challenger, challenged);
        }
        Integer from = challenger.getPosition();
        Integer to = challenged.getPosition();
        return from == null || to == null || (to < from && from - to <= rules.maxSlotGap());
    }

    // =========================================================================
    // Individual rules
    // =========================================================================

    public void checkCategory(Pair challenger, Pair challenged) {
        if (!CategoryResolver.sameCategory(challenger, challenged)) {
            log.warn("Category mismatch: pair {} ({}) vs pair {} ({})",
                    challenger.getId(), challenger.getGroupLabel(),
                    challenged.getId(), challenged.getGroupLabel());
            throw new LadderException(Reason.CATEGORY_MISMATCH,
                    "Both pairs must play in the same category.");
        }
    }

    void checkWeeklyCap(Pair pair, LocalDate proposedDate, Long excludeChallengeId) {
        LocalDate weekStart = proposedDate.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        LocalDate weekEnd = weekStart.plusDays(7);

        long count = store.countChallenges(pair.getId(), ChallengeStatus.COUNTED_FOR_WEEKLY_CAP,
                weekStart, weekEnd, excludeChallengeId);
        if (count >= rules.weeklyChallengeCap()) {
            log.warn("Weekly cap reached for pair {}: {} challenges in week of {}", pair.getId(), count, weekStart);
            throw new LadderException(Reason.WEEKLY_LIMIT_EXCEEDED,
                    "Pair " + pair.getId() + " already has " + count + " challenges in the week of " + weekStart + ".");
        }
    }

    void checkLadderDistance(Pair challenger, Pair challenged) {
        if (CategoryResolver.sameGroup(challenger, challenged)) {
            checkSameGroup(challenger, challenged);
        } else {
            checkPromotion(challenger, challenged);
        }
    }

    private void checkSameGroup(Pair challenger, Pair challenged) {
        Integer from = challenger.getPosition();
        Integer to = challenged.getPosition();
        // Unranked pairs skip the position checks
        if (from == null || to == null) {
            return;
        }
        if (to >= from) {
            throw new LadderException(Reason.POSITION_ORDER_VIOLATION,
                    "Only pairs ranked above yours can be challenged (" + from + " → " + to + ").");
        }
        if (from - to > rules.maxSlotGap()) {
            throw new LadderException(Reason.MAX_SLOT_GAP_EXCEEDED,
                    "A pair can challenge at most " + rules.maxSlotGap() + " slots up (" + from + " → " + to + ").");
        }
    }

    /**
     * Cross-division rule, also re-checked when a result comes in because ranks may
     * have moved since the challenge was created.
     *
     * Allowed: the lower division's #1 against the upper division's last place, or any
     * of the lower division's top window against the upper division's bottom window.
     */
    public void checkPromotion(Pair challenger, Pair challenged) {
        if (!isPromotionEligible(challenger, challenged)) {
            throw new LadderException(Reason.INTERDIVISION_NOT_ALLOWED,
                    "Pair " + challenger.getId() + " (" + challenger.getGroupLabel() + ", " + challenger.getPosition()
                            + ") cannot challenge pair " + challenged.getId() + " (" + challenged.getGroupLabel()
                            + ", " + challenged.getPosition() + ").");
        }
    }

    public boolean isPromotionEligible(Pair challenger, Pair challenged) {
        if (!CategoryResolver.sameCategory(challenger, challenged)) {
            return false;
        }
        if (!rules.promotionSourceDivision().equalsIgnoreCase(CategoryResolver.divisionOf(challenger))
                || !rules.promotionTargetDivision().equalsIgnoreCase(CategoryResolver.divisionOf(challenged))) {
            return false;
        }

        Integer from = challenger.getPosition();
        Integer to = challenged.getPosition();
        if (from == null || to == null) {
            return false;
        }

        Integer lastInTarget = store.findMaxActivePosition(challenged.getGroupLabel()).orElse(null);
        if (lastInTarget == null) {
            return false;
        }

        // Direct match: top of the lower division against the very last of the upper one
        if (from == 1 && to.equals(lastInTarget)) {
            return true;
        }

        int window = rules.promotionWindow();
        boolean challengerInTopWindow = from >= 1 && from <= window;
        int bottomWindowStart = Math.max(1, lastInTarget - window + 1);
        boolean challengedInBottomWindow = to >= bottomWindowStart && to <= lastInTarget;
        return challengerInTopWindow && challengedInBottomWindow;
    }
}
