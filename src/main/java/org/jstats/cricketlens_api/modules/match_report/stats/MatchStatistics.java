package org.jstats.cricketlens_api.modules.match_report.stats;

import org.jstats.cricketlens_api.modules.match_report.model.MatchRecord;

import java.util.List;

/**
 * @param match    the parsed match
 * @param innings  per-innings statistics in batting order
 * @param totals   totals across all innings
 * @param warnings every non-fatal anomaly, innings by innings
 */
public record MatchStatistics(
        MatchRecord match,
        List<InningsStatistics> innings,
        Totals totals,
        List<DeliveryWarning> warnings
) {

    public MatchStatistics {
        innings = List.copyOf(innings);
        warnings = List.copyOf(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public record Totals(int runs, int wickets, int fours, int sixes, int extras, int validBalls) {

        static Totals of(List<InningsStatistics> innings) {
            int runs = 0, wickets = 0, fours = 0, sixes = 0, extras = 0, validBalls = 0;
            for (InningsStatistics i : innings) {
                runs += i.runs();
                wickets += i.wickets();
                fours += i.fours();
                sixes += i.sixes();
                extras += i.extras();
                validBalls += i.validBalls();
            }
            return new Totals(runs, wickets, fours, sixes, extras, validBalls);
        }
    }
}
