package com.padelrank.padelrank_api.model;

import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.List;

/**
 * A doubles pair occupying one slot of a group ladder.
 *
 * The group label combines category and division ("Masculino B"). The optional
 * `category` column is the explicit category; when it is blank the category is
 * read from the label (see CategoryResolver).
 *
 * `position` is 1-based, lower is better, and only set while the pair is active.
 */
@Entity
@Table(name = "pairs")
public class Pair {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "player1_id", nullable = false)
    private Long player1Id;

    @Column(name = "player2_id", nullable = false)
    private Long player2Id;

    @Column(name = "captain_id", nullable = false)
    private Long captainId;

    @Column(name = "group_label", nullable = false, length = 50)
    private String groupLabel;

    @Column(length = 20)
    private String category;

    @Column(name = "slot_position")
    private Integer position;

    private boolean active = true;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;

    public Pair() {}
    public Pair(Long player1Id, Long player2Id, Long captainId, String groupLabel, Integer position) {
        this.player1Id = player1Id;
        this.player2Id = player2Id;
        this.captainId = captainId;
        this.groupLabel = groupLabel;
        this.position = position;
    }

    // Getters
    public Long getId() { return id; }
    public Long getPlayer1Id() { return player1Id; }
    public Long getPlayer2Id() { return player2Id; }
    public Long getCaptainId() { return captainId; }
    public String getGroupLabel() { return groupLabel; }
    public String getCategory() { return category; }
    public Integer getPosition() { return position; }
    public boolean isActive() { return active; }
    public LocalDateTime getCreatedAt() { return createdAt; }
    public LocalDateTime getUpdatedAt() { return updatedAt; }

    // Setters
    public void setCategory(String category) { this.category = category; }

    /** Moves the pair to a slot (and possibly another group). Used by RankingMutator only. */
    public void moveTo(String groupLabel, Integer position) {
        this.groupLabel = groupLabel;
        this.position = position;
    }

    public boolean hasMember(Long playerId) {
        return playerId != null && (playerId.equals(player1Id) || playerId.equals(player2Id));
    }

    public List<Long> getMemberIds() {
        return List.of(player1Id, player2Id);
    }
}
