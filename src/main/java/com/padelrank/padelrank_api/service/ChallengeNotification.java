package com.padelrank.padelrank_api.service;

import com.fasterxml.jackson.annotation.JsonValue;
import com.padelrank.padelrank_api.model.Challenge;

/**
 * Structured payload sent to clients on /user/queue/challenge-updates.
 *
 * Position fields are the pairs' slots after the event; the "before" fields and
 * slotAtStake are only populated on RESULT.
 */
public record ChallengeNotification(
        Event event,
        Long challengeId,
        String title,
        String status,
        Long challengerPairId,
        Long challengedPairId,
        Long winnerPairId,
        String scheduledDate,
        String scheduledTime,
        // Ranking fields
        String challengerGroup,
        Integer challengerPosition,
        String challengedGroup,
        Integer challengedPosition,
        Integer challengerPositionBefore,
        Integer challengedPositionBefore,
        Integer slotAtStake,
        boolean swapApplied
) {
    public enum Event {
        CREATED,
        RESCHEDULED,
        RESULT;

        @JsonValue
        public String wireName() {
            return name().toLowerCase();
        }
    }

    static ChallengeNotification of(Event event, Challenge c,
                                    String challengerGroup, Integer challengerPosition,
                                    String challengedGroup, Integer challengedPosition) {
        return new ChallengeNotification(
                event,
                c.getId(),
                c.getTitle(),
                c.getStatus().getLabel(),
                c.getChallengerPairId(),
                c.getChallengedPairId(),
                c.getWinnerPairId(),
                c.getScheduledDate() != null ? c.getScheduledDate().toString() : null,
                c.getScheduledTime() != null ? c.getScheduledTime().toString() : null,
                challengerGroup, challengerPosition,
                challengedGroup, challengedPosition,
                c.getChallengerPositionBefore(),
                c.getChallengedPositionBefore(),
                c.getSlotAtStake(),
                c.isSwapApplied()
        );
    }
}
