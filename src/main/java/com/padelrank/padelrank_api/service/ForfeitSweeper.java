package com.padelrank.padelrank_api.service;

import com.padelrank.padelrank_api.config.LadderRulesProperties;
import com.padelrank.padelrank_api.model.Challenge;
import com.padelrank.padelrank_api.model.ChallengeStatus;
import com.padelrank.padelrank_api.model.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionOperations;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Resolves challenges left pending past the grace period: the challenger wins by forfeit.
 *
 * There is no background scheduler. ChallengeService calls {@link #sweepExpired} at the
 * start of every operation, so an expired challenge is never shown as still pending.
 *
 * Each challenge is resolved in its own transaction. A failing record is logged and
 * skipped; the sweep carries on with the rest.
 */
@Component
public class ForfeitSweeper {
    private static final Logger log = LoggerFactory.getLogger(ForfeitSweeper.class);

    private final RankingStore store;
    private final EligibilityRules eligibilityRules;
    private final RankingMutator rankingMutator;
    private final ChallengeNotifier notifier;
    private final LadderRulesProperties rules;
    private final TransactionOperations transaction;

    public ForfeitSweeper(RankingStore store,
                          EligibilityRules eligibilityRules,
                          RankingMutator rankingMutator,
                          ChallengeNotifier notifier,
                          LadderRulesProperties rules,
                          @Qualifier("perRecordTransaction") TransactionOperations transaction) {
        this.store = store;
        this.eligibilityRules = eligibilityRules;
        this.rankingMutator = rankingMutator;
        this.notifier = notifier;
        this.rules = rules;
        this.transaction = transaction;
    }

    /**
     * @return number of challenges resolved as forfeits
     */
    public int sweepExpired(LocalDateTime now) {
        LocalDateTime cutoff = now.minus(rules.forfeitGracePeriod());
        // Ids only: the caller's persistence context must not hold the pre-forfeit entities
        List<Long> expired = transaction.execute(status -> store.findPendingCreatedBefore(cutoff).stream()
                .map(Challenge::getId)
                .toList());
        if (expired == null || expired.isEmpty()) {
            return 0;
        }

        int resolved = 0;
        for (Long challengeId : expired) {
            try {
                Boolean done = transaction.execute(status -> resolveForfeit(challengeId, now));
                if (Boolean.TRUE.equals(done)) {
                    resolved++;
                }
            } catch (RuntimeException e) {
                log.warn("Forfeit of challenge {} failed, skipping: {}", challengeId, e.getMessage(), e);
            }
        }

        if (resolved > 0) {
            log.info("Forfeit sweep resolved {} of {} expired challenges", resolved, expired.size());
        }
        return resolved;
    }

    private boolean resolveForfeit(Long challengeId, LocalDateTime now) {
        Challenge challenge = store.lockChallenge(challengeId)
                .orElseThrow(() -> new IllegalStateException("Challenge vanished: " + challengeId));
        // Resolved or answered by another transaction
        if (challenge.getStatus() != ChallengeStatus.PENDING) {
            return false;
        }

        Map<Long, Pair> locked = store.lockPairs(
                        List.of(challenge.getChallengerPairId(), challenge.getChallengedPairId()))
                .stream().collect(Collectors.toMap(Pair::getId, Function.identity()));
        Pair challenger = locked.get(challenge.getChallengerPairId());
        Pair challenged = locked.get(challenge.getChallengedPairId());
        if (challenger == null || challenged == null) {
            throw new IllegalStateException("Pairs of challenge " + challengeId + " not found");
        }

        if (!CategoryResolver.sameCategory(challenger, challenged)) {
            log.warn("Challenge {} links pairs of different categories; left pending", challengeId);
            return false;
        }

        boolean swapAllowed = CategoryResolver.sameGroup(challenger, challenged)
                || eligibilityRules.isPromotionEligible(challenger, challenged);
        rankingMutator.applyForfeit(challenge, challenger, challenged, swapAllowed);

        challenge.setPlayedDate(now.toLocalDate());
        challenge.setStatus(ChallengeStatus.PLAYED);
        store.saveChallenge(challenge);

        log.info("Challenge {} resolved by forfeit: pair {} wins (swap applied: {})",
                challengeId, challenger.getId(), challenge.isSwapApplied());
        notifier.resultRecorded(challenge, challenger, challenged);
        return true;
    }
}
