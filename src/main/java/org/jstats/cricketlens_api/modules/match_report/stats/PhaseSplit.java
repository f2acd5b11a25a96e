package org.jstats.cricketlens_api.modules.match_report.stats;

import java.util.List;

/**
 * Totals of the completed overs that fall in one phase.
 */
public record PhaseSplit(
        Phase phase,
        int firstOver,
        int lastOver,
        int overs,
        int runs,
        int wickets,
        int fours,
        int sixes,
        int extras,
        int dots,
        int validBalls,
        double runRate
) {

    static PhaseSplit of(Phase phase, List<OverSummary> overs) {
        int runs = 0, wickets = 0, fours = 0, sixes = 0, extras = 0, dots = 0, validBalls = 0;
        int first = Integer.MAX_VALUE, last = -1;
        for (OverSummary o : overs) {
            runs += o.runs();
            wickets += o.wickets();
            fours += o.fours();
            sixes += o.sixes();
            extras += o.extras();
            dots += o.dots();
            validBalls += o.validBalls();
            first = Math.min(first, o.number());
            last = Math.max(last, o.number());
        }
        if (overs.isEmpty()) first = -1;
        return new PhaseSplit(phase, first, last, overs.size(), runs, wickets, fours, sixes, extras,
                dots, validBalls, Rates.runRate(runs, validBalls));
    }

    public boolean isEmpty() {
        return overs == 0;
    }
}
