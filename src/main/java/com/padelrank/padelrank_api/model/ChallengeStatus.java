package com.padelrank.padelrank_api.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * PENDING → ACCEPTED → PLAYED is the happy path. PENDING → REJECTED is a dead end,
 * and a PENDING challenge left untouched past the grace period is resolved to PLAYED
 * as a forfeit. PLAYED and REJECTED are terminal.
 */
public enum ChallengeStatus {
    PENDING("Pendiente"),
    ACCEPTED("Aceptado"),
    PLAYED("Jugado"),
    REJECTED("Rechazado");

    /** Statuses that count towards the weekly challenge cap. */
    public static final Set<ChallengeStatus> COUNTED_FOR_WEEKLY_CAP =
            EnumSet.of(PENDING, ACCEPTED, PLAYED);

    /** Statuses shown in the "upcoming" listing. */
    public static final Set<ChallengeStatus> OPEN = EnumSet.of(PENDING, ACCEPTED);

    private final String label;

    ChallengeStatus(String label) {
        this.label = label;
    }

    /** League-facing name, as shown to players. */
    public String getLabel() {
        return label;
    }
}
