package com.padelrank.padelrank_api.service;

import lombok.Getter;

/**
 * Every refusal of the ladder rules, with the specific reason. Nothing is
 * downgraded to a generic failure; the API layer maps {@link Kind} to a status.
 */
@Getter
public class LadderException extends RuntimeException {

    public enum Kind {
        NOT_FOUND,
        CONFLICT,
        RULE_VIOLATION,
        FORBIDDEN,
        VALIDATION
    }

    public enum Reason {
        PAIR_NOT_FOUND(Kind.NOT_FOUND),
        CHALLENGE_NOT_FOUND(Kind.NOT_FOUND),
        NO_ACTIVE_PAIR(Kind.NOT_FOUND),

        ALREADY_RESOLVED(Kind.CONFLICT),
        ALREADY_REJECTED(Kind.CONFLICT),
        INVALID_TRANSITION(Kind.CONFLICT),

        CATEGORY_MISMATCH(Kind.RULE_VIOLATION),
        WEEKLY_LIMIT_EXCEEDED(Kind.RULE_VIOLATION),
        POSITION_ORDER_VIOLATION(Kind.RULE_VIOLATION),
        MAX_SLOT_GAP_EXCEEDED(Kind.RULE_VIOLATION),
        INTERDIVISION_NOT_ALLOWED(Kind.RULE_VIOLATION),
        INVALID_SCORE(Kind.RULE_VIOLATION),
        MISSING_DECIDING_SET(Kind.RULE_VIOLATION),

        NOT_A_PARTICIPANT(Kind.FORBIDDEN),

        SELF_CHALLENGE(Kind.VALIDATION),
        INVALID_TIME_SLOT(Kind.VALIDATION);

        private final Kind kind;

        Reason(Kind kind) {
            this.kind = kind;
        }

        public Kind kind() {
            return kind;
        }

        /** Wire form, e.g. "max_slot_gap_exceeded". */
        public String code() {
            return name().toLowerCase();
        }
    }

    private final Reason reason;

    public LadderException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Kind getKind() {
        return reason.kind();
    }
}
