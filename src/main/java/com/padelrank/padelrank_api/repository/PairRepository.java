package com.padelrank.padelrank_api.repository;

import com.padelrank.padelrank_api.model.Pair;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface PairRepository extends JpaRepository<Pair, Long> {

    Optional<Pair> findByIdAndActiveTrue(Long id);

    @Query("""
        SELECT p FROM Pair p
        WHERE p.player1Id = :playerId OR p.player2Id = :playerId
        ORDER BY p.id ASC
        """)
    List<Pair> findAllByMember(@Param("playerId") Long playerId);

    @Query("""
        SELECT p FROM Pair p
        WHERE p.active = true
        AND (p.player1Id = :playerId OR p.player2Id = :playerId)
        ORDER BY p.id ASC
        """)
    List<Pair> findActiveByMember(@Param("playerId") Long playerId);

    // =========================================================================
    // Ladder queries
    // =========================================================================

    /**
     * Active pairs that hold a slot, ladder order (group, then position).
     */
    @Query("""
        SELECT p FROM Pair p
        WHERE p.active = true AND p.position IS NOT NULL
        ORDER BY p.groupLabel ASC, p.position ASC
        """)
    List<Pair> findRanked();

    /**
     * Last occupied slot of a group. Empty when the group has no ranked pairs.
     * Labels compare trimmed and upper-cased; pass the label already normalised.
     */
    @Query("""
        SELECT MAX(p.position) FROM Pair p
        WHERE p.active = true AND UPPER(TRIM(p.groupLabel)) = :normalizedLabel
        """)
    Optional<Integer> findMaxActivePosition(@Param("normalizedLabel") String normalizedLabel);

    // =========================================================================
    // Pessimistic locking for slot swaps
    // =========================================================================

    /**
     * Load pairs by ID with pessimistic write lock, ordered by ID ASC.
     *
     * CRITICAL: always lock in ascending ID order so two swaps touching the
     * same pairs cannot deadlock. Lock timeout of 5 seconds.
     */
    @Query("SELECT p FROM Pair p WHERE p.id IN :ids ORDER BY p.id ASC")
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints({@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000")})
    List<Pair> findAllByIdWithLock(@Param("ids") Collection<Long> ids);
}
