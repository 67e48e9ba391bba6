package com.padelrank.padelrank_api.service;

import java.util.Collection;

/**
 * Delivers challenge notifications to players. Fire-and-forget: implementations may
 * throw, but callers never let a delivery failure affect ladder state.
 */
public interface NotificationDispatcher {

    void notify(Collection<Long> recipientPlayerIds, String title, String body, ChallengeNotification payload);
}
