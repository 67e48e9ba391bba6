package com.padelrank.padelrank_api.service;

import com.padelrank.padelrank_api.model.Challenge;
import com.padelrank.padelrank_api.model.Pair;
import com.padelrank.padelrank_api.service.ChallengeNotification.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Builds challenge notifications and hands them to the {@link NotificationDispatcher}
 * once the surrounding transaction has committed. Outside a transaction they go out
 * immediately. Delivery failures are logged and never reach the caller.
 */
@Component
public class ChallengeNotifier {
    private static final Logger log = LoggerFactory.getLogger(ChallengeNotifier.class);

    private final NotificationDispatcher dispatcher;

    public ChallengeNotifier(NotificationDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    public void created(Challenge challenge, Pair challenger, Pair challenged) {
        send(Event.CREATED, challenge, challenger, challenged,
                "New challenge",
                challenge.getTitle() + " on " + challenge.getScheduledDate() + " at " + challenge.getScheduledTime());
    }

    public void rescheduled(Challenge challenge, Pair challenger, Pair challenged) {
        send(Event.RESCHEDULED, challenge, challenger, challenged,
                "Challenge rescheduled",
                challenge.getTitle() + " moved to " + challenge.getScheduledDate() + " at " + challenge.getScheduledTime());
    }

    public void resultRecorded(Challenge challenge, Pair challenger, Pair challenged) {
        boolean challengerWon = challenger.getId().equals(challenge.getWinnerPairId());
        String outcome = challengerWon ? "Challenger wins" : "Challenged pair holds the slot";
        if (challenge.isSwapApplied()) {
            outcome += ", slots swapped";
        }
        send(Event.RESULT, challenge, challenger, challenged, "Challenge result", challenge.getTitle() + ": " + outcome);
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private void send(Event event, Challenge challenge, Pair challenger, Pair challenged,
                      String title, String body) {
        Set<Long> recipients = new LinkedHashSet<>();
        recipients.addAll(challenger.getMemberIds());
        recipients.addAll(challenged.getMemberIds());

        // Snapshot now; entities may change after commit
        ChallengeNotification payload = ChallengeNotification.of(event, challenge,
                challenger.getGroupLabel(), challenger.getPosition(),
                challenged.getGroupLabel(), challenged.getPosition());

        Runnable dispatch = () -> dispatchQuietly(recipients, title, body, payload);
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    dispatch.run();
                }
            });
        } else {
            dispatch.run();
        }
    }

    private void dispatchQuietly(Set<Long> recipients, String title, String body, ChallengeNotification payload) {
        try {
            dispatcher.notify(recipients, title, body, payload);
            log.debug("Sent {} notification for challenge {} to players {}",
                    payload.event().wireName(), payload.challengeId(), recipients);
        } catch (RuntimeException e) {
            log.error("Failed to send {} notification for challenge {}", payload.event().wireName(),
                    payload.challengeId(), e);
        }
    }
}
