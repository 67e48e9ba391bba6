package com.padelrank.padelrank_api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * League rule thresholds, bound once from {@code padelrank.rules.*} and handed to the
 * rules components at construction.
 *
 * @param maxSlotGap              how many slots above itself a pair may challenge in its own group
 * @param weeklyChallengeCap      challenges per pair per Monday-Sunday week (pending, accepted or played)
 * @param forfeitGracePeriod      how long a challenge may stay pending before the challenger wins by forfeit
 * @param promotionWindow         size of the top-of-lower / bottom-of-upper windows for cross-division challenges
 * @param promotionSourceDivision division allowed to challenge upwards
 * @param promotionTargetDivision division it may challenge into
 */
@ConfigurationProperties(prefix = "padelrank.rules")
public record LadderRulesProperties(
        @DefaultValue("3") int maxSlotGap,
        @DefaultValue("2") int weeklyChallengeCap,
        @DefaultValue("P3D") Duration forfeitGracePeriod,
        @DefaultValue("3") int promotionWindow,
        @DefaultValue("B") String promotionSourceDivision,
        @DefaultValue("A") String promotionTargetDivision
) {
    public static LadderRulesProperties defaults() {
        return new LadderRulesProperties(3, 2, Duration.ofDays(3), 3, "B", "A");
    }
}
