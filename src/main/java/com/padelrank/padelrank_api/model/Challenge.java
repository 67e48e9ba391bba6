package com.padelrank.padelrank_api.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

@Entity
@Table(name = "challenges")
public class Challenge {

    @Getter
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Getter
    @Column(name = "challenger_pair_id", nullable = false)
    private Long challengerPairId;

    @Getter
    @Column(name = "challenged_pair_id", nullable = false)
    private Long challengedPairId;

    // Only set once resolved; always one of the two participants.
    @Getter
    @Column(name = "winner_pair_id")
    private Long winnerPairId;

    @Getter @Setter
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ChallengeStatus status = ChallengeStatus.PENDING;

    @Getter @Setter
    @Column(name = "scheduled_date", nullable = false)
    private LocalDate scheduledDate;

    @Getter @Setter
    @Column(name = "scheduled_time", nullable = false)
    private LocalTime scheduledTime;

    @Getter @Setter
    @Column(name = "played_date")
    private LocalDate playedDate;

    @Getter @Setter
    @Column(length = 255)
    private String observation;

    @Getter @Setter
    @Column(nullable = false)
    private String title;

    // =========================================================================
    // Set scores. The third set is only present when the first two were split.
    // =========================================================================
    @Getter
    private Integer set1Challenger;

    @Getter
    private Integer set1Challenged;

    @Getter
    private Integer set2Challenger;

    @Getter
    private Integer set2Challenged;

    @Getter
    private Integer set3Challenger;

    @Getter
    private Integer set3Challenged;

    // =========================================================================
    // Ranking audit fields. Flags only ever go from false to true.
    // =========================================================================
    @Getter @Setter
    @Column(name = "weekly_limit_ok", nullable = false)
    private boolean weeklyLimitOk = true;

    @Getter
    @Column(name = "swap_applied", nullable = false)
    private boolean swapApplied = false;

    @Getter
    @Column(name = "ranking_applied", nullable = false)
    private boolean rankingApplied = false;

    @Getter
    @Column(name = "challenger_position_before")
    private Integer challengerPositionBefore;

    @Getter
    @Column(name = "challenged_position_before")
    private Integer challengedPositionBefore;

    @Getter
    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @Getter
    @UpdateTimestamp
    private LocalDateTime updatedAt;

    // Constructors
    public Challenge() {}

    public Challenge(Long challengerPairId, Long challengedPairId,
                     LocalDate scheduledDate, LocalTime scheduledTime) {
        this.challengerPairId = challengerPairId;
        this.challengedPairId = challengedPairId;
        this.scheduledDate = scheduledDate;
        this.scheduledTime = scheduledTime;
    }

    public boolean involves(Long pairId) {
        return challengerPairId.equals(pairId) || challengedPairId.equals(pairId);
    }

    public void setWinnerPairId(Long winnerPairId) {
        if (winnerPairId != null && !involves(winnerPairId)) {
            throw new IllegalArgumentException(
                    "Winner " + winnerPairId + " is not part of challenge " + id);
        }
        this.winnerPairId = winnerPairId;
    }

    public void recordScores(SetScores scores) {
        this.set1Challenger = scores.set1Challenger();
        this.set1Challenged = scores.set1Challenged();
        this.set2Challenger = scores.set2Challenger();
        this.set2Challenged = scores.set2Challenged();
        this.set3Challenger = scores.set3Challenger();
        this.set3Challenged = scores.set3Challenged();
    }

    /** Snapshot of both pairs' slots before the result touched the ladder. */
    public void recordPositionsBefore(Integer challengerPosition, Integer challengedPosition) {
        this.challengerPositionBefore = challengerPosition;
        this.challengedPositionBefore = challengedPosition;
    }

    public void markRankingApplied(boolean swapped) {
        this.rankingApplied = true;
        if (swapped) {
            this.swapApplied = true;
        }
    }

    /** The better of the two pre-result slots, i.e. the slot the challenger played for. */
    public Integer getSlotAtStake() {
        if (challengerPositionBefore == null) return challengedPositionBefore;
        if (challengedPositionBefore == null) return challengerPositionBefore;
        return Math.min(challengerPositionBefore, challengedPositionBefore);
    }
}
