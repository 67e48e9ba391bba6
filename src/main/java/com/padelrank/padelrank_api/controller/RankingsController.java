package com.padelrank.padelrank_api.controller;

import com.padelrank.padelrank_api.service.StandingsService;
import com.padelrank.padelrank_api.service.StandingsService.ChallengeablePair;
import com.padelrank.padelrank_api.service.StandingsService.Standing;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/rankings")
@CrossOrigin(origins = "*")
public class RankingsController {

    private final StandingsService standingsService;

    public RankingsController(StandingsService standingsService) {
        this.standingsService = standingsService;
    }

    /**
     * GET /api/rankings?group=Masculino%20B
     * GET /api/rankings?group=Femenino   (whole category)
     */
    @GetMapping
    public List<Standing> standings(@RequestParam(required = false) String group) {
        return standingsService.standings(group);
    }

    /**
     * GET /api/rankings/challengeable: pairs the caller's pair may challenge.
     */
    @GetMapping("/challengeable")
    public List<ChallengeablePair> challengeable(Authentication authentication) {
        return standingsService.challengeable(Long.valueOf(authentication.getName()));
    }
}
