package com.padelrank.padelrank_api.controller;

import com.padelrank.padelrank_api.model.Challenge;
import com.padelrank.padelrank_api.model.SetScores;
import com.padelrank.padelrank_api.service.ChallengeService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;

@RestController
@RequestMapping("/api/challenges")
@CrossOrigin(origins = "*")
public class ChallengeController {

    private final ChallengeService challengeService;

    public ChallengeController(ChallengeService challengeService) {
        this.challengeService = challengeService;
    }

    // =========================================================================
    // Lifecycle
    // =========================================================================

    /**
     * POST /api/challenges: the challenger pair is the caller's active pair.
     */
    @PostMapping
    public ResponseEntity<ChallengeResponse> create(@RequestBody CreateChallengeRequest request,
                                                    Authentication authentication) {
        Challenge challenge = challengeService.create(playerId(authentication),
                request.challengedPairId(), request.date(), request.time(), request.observation());
        return ResponseEntity.status(HttpStatus.CREATED).body(ChallengeResponse.from(challenge));
    }

    @PostMapping("/{id}/accept")
    public ChallengeResponse accept(@PathVariable Long id, Authentication authentication) {
        return ChallengeResponse.from(challengeService.accept(playerId(authentication), id));
    }

    @PostMapping("/{id}/reject")
    public ChallengeResponse reject(@PathVariable Long id, Authentication authentication) {
        return ChallengeResponse.from(challengeService.reject(playerId(authentication), id));
    }

    @PostMapping("/{id}/reschedule")
    public ChallengeResponse reschedule(@PathVariable Long id,
                                        @RequestBody RescheduleRequest request,
                                        Authentication authentication) {
        return ChallengeResponse.from(challengeService.reschedule(
                playerId(authentication), id, request.date(), request.time()));
    }

    @PostMapping("/{id}/result")
    public ChallengeResponse submitResult(@PathVariable Long id,
                                          @RequestBody ResultRequest request,
                                          Authentication authentication) {
        return ChallengeResponse.from(challengeService.submitResult(
                playerId(authentication), id, request.toScores()));
    }

    // =========================================================================
    // Queries
    // =========================================================================

    /**
     * GET /api/challenges/upcoming: pending and accepted, league-wide.
     */
    @GetMapping("/upcoming")
    public List<ChallengeResponse> upcoming() {
        return challengeService.listUpcoming().stream().map(ChallengeResponse::from).toList();
    }

    @GetMapping("/pair/{pairId}")
    public List<ChallengeResponse> byPair(@PathVariable Long pairId) {
        return challengeService.listByPair(pairId).stream().map(ChallengeResponse::from).toList();
    }

    @GetMapping("/mine")
    public List<ChallengeResponse> mine(Authentication authentication) {
        return challengeService.listMine(playerId(authentication)).stream().map(ChallengeResponse::from).toList();
    }

    @GetMapping("/mine/upcoming")
    public List<ChallengeResponse> myUpcoming(Authentication authentication) {
        return challengeService.listMyUpcoming(playerId(authentication)).stream()
                .map(ChallengeResponse::from).toList();
    }

    @GetMapping("/{id}")
    public ChallengeResponse get(@PathVariable Long id, Authentication authentication) {
        return ChallengeResponse.from(challengeService.getForParticipant(playerId(authentication), id));
    }

    @GetMapping("/{id}/public")
    public ChallengeResponse getPublic(@PathVariable Long id) {
        return ChallengeResponse.from(challengeService.getPublic(id));
    }

    private static Long playerId(Authentication authentication) {
        return Long.valueOf(authentication.getName());
    }

    // =========================================================================
    // DTOs
    // =========================================================================

    public record CreateChallengeRequest(Long challengedPairId, LocalDate date, LocalTime time, String observation) {
    }

    public record RescheduleRequest(LocalDate date, LocalTime time) {
    }

    public record ResultRequest(
            Integer set1Challenger, Integer set1Challenged,
            Integer set2Challenger, Integer set2Challenged,
            Integer set3Challenger, Integer set3Challenged
    ) {
        SetScores toScores() {
            return new SetScores(set1Challenger, set1Challenged, set2Challenger, set2Challenged,
                    set3Challenger, set3Challenged);
        }
    }

    public record ChallengeResponse(
            Long id,
            Long challengerPairId,
            Long challengedPairId,
            Long winnerPairId,
            String status,
            LocalDate date,
            LocalTime time,
            LocalDate playedDate,
            String title,
            String observation,
            // Sets
            Integer set1Challenger, Integer set1Challenged,
            Integer set2Challenger, Integer set2Challenged,
            Integer set3Challenger, Integer set3Challenged,
            // Ranking audit
            boolean weeklyLimitOk,
            boolean swapApplied,
            boolean rankingApplied,
            Integer challengerPositionBefore,
            Integer challengedPositionBefore,
            Integer slotAtStake,
            LocalDateTime createdAt,
            LocalDateTime updatedAt
    ) {
        static ChallengeResponse from(Challenge c) {
            return new ChallengeResponse(
                    c.getId(),
                    c.getChallengerPairId(),
                    c.getChallengedPairId(),
                    c.getWinnerPairId(),
                    c.getStatus().getLabel(),
                    c.getScheduledDate(),
                    c.getScheduledTime(),
                    c.getPlayedDate(),
                    c.getTitle(),
                    c.getObservation(),
                    c.getSet1Challenger(), c.getSet1Challenged(),
                    c.getSet2Challenger(), c.getSet2Challenged(),
                    c.getSet3Challenger(), c.getSet3Challenged(),
                    c.isWeeklyLimitOk(),
                    c.isSwapApplied(),
                    c.isRankingApplied(),
                    c.getChallengerPositionBefore(),
                    c.getChallengedPositionBefore(),
                    c.getSlotAtStake(),
                    c.getCreatedAt(),
                    c.getUpdatedAt()
            );
        }
    }
}
