package org.jstats.cricketlens_api.modules.match_report.stats;

/**
 * One completed over.
 *
 * @param number            0-indexed over number
 * @param bowler            bowler of the last delivery in the over
 * @param runs              runs conceded, extras included
 * @param wickets           wickets lost (retirements excluded)
 * @param deliveries        all deliveries, wides and no-balls included
 * @param validBalls        deliveries that count toward the over
 * @param cumulativeRuns    team score after the over
 * @param cumulativeWickets team wickets after the over
 * @param overRunRate       runs x 6 / valid balls for this over
 * @param matchRunRate      cumulative runs x 6 / cumulative valid balls
 * @param maiden            no runs off six valid balls
 */
public record OverSummary(
        int number,
        String bowler,
        int runs,
        int wickets,
        int fours,
        int sixes,
        int extras,
        int dots,
        int deliveries,
        int validBalls,
        int cumulativeRuns,
        int cumulativeWickets,
        double overRunRate,
        double matchRunRate,
        boolean maiden
) {
    /** 1-based number as shown on a scorecard. */
    public int displayNumber() {
        return number + 1;
    }
}
