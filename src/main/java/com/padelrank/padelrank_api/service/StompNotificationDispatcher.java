package com.padelrank.padelrank_api.service;

import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.util.Collection;

/**
 * Pushes challenge updates over STOMP to /user/queue/challenge-updates.
 * STOMP users are keyed by player id (see WebSocketConfig).
 */
@Component
public class StompNotificationDispatcher implements NotificationDispatcher {

    static final String DESTINATION = "/queue/challenge-updates";

    private final SimpMessagingTemplate messagingTemplate;

    public StompNotificationDispatcher(SimpMessagingTemplate messagingTemplate) {
        this.messagingTemplate = messagingTemplate;
    }

    @Override
    public void notify(Collection<Long> recipientPlayerIds, String title, String body, ChallengeNotification payload) {
        Message message = new Message(title, body, payload);
        for (Long playerId : recipientPlayerIds) {
            messagingTemplate.convertAndSendToUser(playerId.toString(), DESTINATION, message);
        }
    }

    /** What the client receives. */
    public record Message(String title, String body, ChallengeNotification data) {}
}
