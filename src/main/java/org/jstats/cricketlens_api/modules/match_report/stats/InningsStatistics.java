package org.jstats.cricketlens_api.modules.match_report.stats;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregated statistics of one innings. Tables keep first-appearance order.
 */
public record InningsStatistics(
        int number,
        String battingTeam,
        String bowlingTeam,
        int runs,
        int wickets,
        int extras,
        int fours,
        int sixes,
        int deliveries,
        int validBalls,
        double runRate,
        List<OverSummary> overs,
        List<PhaseSplit> phases,
        List<Partnership> partnerships,
        List<BatterStat> batters,
        List<BowlerStat> bowlers,
        List<FielderStat> fielders,
        Map<MatchupKey, MatchupStat> matchups,
        List<DeliveryWarning> warnings
) {

    public InningsStatistics {
        overs = List.copyOf(overs);
        phases = List.copyOf(phases);
        partnerships = List.copyOf(partnerships);
        batters = List.copyOf(batters);
        bowlers = List.copyOf(bowlers);
        fielders = List.copyOf(fielders);
        // copyOf would drop the insertion order
        matchups = Collections.unmodifiableMap(new LinkedHashMap<>(matchups));
        warnings = List.copyOf(warnings);
    }

    public String oversNotation() {
        return Rates.oversNotation(validBalls);
    }

    /** Bowlers faced by the batter, in order of first meeting. */
    public List<Map.Entry<String, MatchupStat>> matchupsForBatter(String batter) {
        List<Map.Entry<String, MatchupStat>> out = new ArrayList<>();
        matchups.forEach((key, stat) -> {
            if (key.batter().equals(batter)) out.add(Map.entry(key.bowler(), stat));
        });
        return out;
    }

    /** Batters faced by the bowler, in order of first meeting. */
    public List<Map.Entry<String, MatchupStat>> matchupsForBowler(String bowler) {
        List<Map.Entry<String, MatchupStat>> out = new ArrayList<>();
        matchups.forEach((key, stat) -> {
            if (key.bowler().equals(bowler)) out.add(Map.entry(key.batter(), stat));
        });
        return out;
    }
}
