package com.padelrank.padelrank_api.model;

/**
 * Set-by-set result as submitted, from the challenger's point of view.
 * Third-set fields are null when only two sets were played.
 */
public record SetScores(
        Integer set1Challenger, Integer set1Challenged,
        Integer set2Challenger, Integer set2Challenged,
        Integer set3Challenger, Integer set3Challenged
) {
    public static SetScores twoSets(int s1Challenger, int s1Challenged,
                                    int s2Challenger, int s2Challenged) {
        return new SetScores(s1Challenger, s1Challenged, s2Challenger, s2Challenged, null, null);
    }

    public static SetScores threeSets(int s1Challenger, int s1Challenged,
                                      int s2Challenger, int s2Challenged,
                                      int s3Challenger, int s3Challenged) {
        return new SetScores(s1Challenger, s1Challenged, s2Challenger, s2Challenged,
                s3Challenger, s3Challenged);
    }

    public boolean hasDecidingSet() {
        return set3Challenger != null || set3Challenged != null;
    }
}
