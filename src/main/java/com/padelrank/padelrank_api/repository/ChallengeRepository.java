package com.padelrank.padelrank_api.repository;

import com.padelrank.padelrank_api.model.Challenge;
import com.padelrank.padelrank_api.model.ChallengeStatus;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface ChallengeRepository extends JpaRepository<Challenge, Long> {

    /**
     * Challenges of one pair scheduled in [from, toExclusive), in the given statuses.
     * Pass an id that cannot exist (0) as excludeId to count everything.
     */
    @Query("""
        SELECT COUNT(c) FROM Challenge c
        WHERE (c.challengerPairId = :pairId OR c.challengedPairId = :pairId)
        AND c.status IN :statuses
        AND c.scheduledDate >= :fromDate AND c.scheduledDate < :toDate
        AND c.id <> :excludeId
        """)
    long countInWindow(@Param("pairId") Long pairId,
                       @Param("statuses") Collection<ChallengeStatus> statuses,
                       @Param("fromDate") LocalDate fromDate,
                       @Param("toDate") LocalDate toDate,
                       @Param("excludeId") Long excludeId);

    @Query("""
        SELECT c FROM Challenge c
        WHERE c.status = :status AND c.createdAt < :cutoff
        ORDER BY c.createdAt ASC
        """)
    List<Challenge> findByStatusCreatedBefore(@Param("status") ChallengeStatus status,
                                              @Param("cutoff") LocalDateTime cutoff);

    List<Challenge> findByStatusInOrderByScheduledDateAscScheduledTimeAsc(Collection<ChallengeStatus> statuses);

    /**
     * Full history of any of the given pairs, newest first.
     */
    @Query("""
        SELECT c FROM Challenge c
        WHERE c.challengerPairId IN :pairIds OR c.challengedPairId IN :pairIds
        ORDER BY c.scheduledDate DESC, c.scheduledTime DESC
        """)
    List<Challenge> findByPairs(@Param("pairIds") Collection<Long> pairIds);

    @Query("""
        SELECT c FROM Challenge c
        WHERE (c.challengerPairId IN :pairIds OR c.challengedPairId IN :pairIds)
        AND c.status IN :statuses
        AND c.scheduledDate >= :fromDate
        ORDER BY c.scheduledDate ASC, c.scheduledTime ASC
        """)
    List<Challenge> findByPairsScheduledFrom(@Param("pairIds") Collection<Long> pairIds,
                                             @Param("statuses") Collection<ChallengeStatus> statuses,
                                             @Param("fromDate") LocalDate fromDate);

    // =========================================================================
    // Standings counters
    // =========================================================================

    @Query("""
        SELECT COUNT(c) FROM Challenge c
        WHERE c.status = com.padelrank.padelrank_api.model.ChallengeStatus.PLAYED
        AND (c.challengerPairId = :pairId OR c.challengedPairId = :pairId)
        """)
    long countPlayedByPair(@Param("pairId") Long pairId);

    @Query("""
        SELECT COUNT(c) FROM Challenge c
        WHERE c.status = com.padelrank.padelrank_api.model.ChallengeStatus.PLAYED
        AND c.winnerPairId = :pairId
        """)
    long countWonByPair(@Param("pairId") Long pairId);

    // =========================================================================
    // Pessimistic locking for state transitions
    // =========================================================================

    /**
     * Load a challenge with a pessimistic write lock. Every transition re-reads the
     * status through this, so two writers cannot both act on the same PENDING row.
     * Lock it before the pairs; the pair locks follow in ascending id order.
     */
    @Query("SELECT c FROM Challenge c WHERE c.id = :id")
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints({@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000")})
    Optional<Challenge> findByIdWithLock(@Param("id") Long id);
}
