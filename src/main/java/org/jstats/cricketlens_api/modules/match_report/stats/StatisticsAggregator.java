package org.jstats.cricketlens_api.modules.match_report.stats;

import org.jspecify.annotations.NullMarked;
import org.jstats.cricketlens_api.modules.match_report.config.ReportProperties;
import org.jstats.cricketlens_api.modules.match_report.model.Innings;
import org.jstats.cricketlens_api.modules.match_report.model.MatchRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives batting, bowling, fielding, partnership, over and phase statistics from a parsed match.
 * <p>
 * Stateless: every call builds its own running state, so separate matches can be aggregated
 * concurrently. Anomalies inside an innings never abort the match; they are returned as
 * {@link DeliveryWarning}s.
 */
@Service
@NullMarked
public class StatisticsAggregator {

    private static final Logger log = LoggerFactory.getLogger(StatisticsAggregator.class);

    private final ReportProperties properties;

    public StatisticsAggregator(ReportProperties properties) {
        this.properties = properties;
    }

    public MatchStatistics aggregate(MatchRecord match) {
        PhasePolicy phasePolicy = properties.phasePolicyFor(match.matchType());

        List<InningsStatistics> innings = new ArrayList<>(match.innings().size());
        List<DeliveryWarning> warnings = new ArrayList<>();
        for (int i = 0; i < match.innings().size(); i++) {
            Innings source = match.innings().get(i);
            InningsStatistics stats = new InningsAggregator(i, source, match, phasePolicy).aggregate();
            innings.add(stats);
            warnings.addAll(stats.warnings());

            if (log.isDebugEnabled()) {
                log.debug("Innings {} ({}): {}/{} in {} overs, {} partnerships, {} warnings",
                        stats.number(), stats.battingTeam(), stats.runs(), stats.wickets(),
                        stats.oversNotation(), stats.partnerships().size(), stats.warnings().size());
            }
        }

        if (!warnings.isEmpty() && log.isWarnEnabled()) {
            log.warn("{} vs {} on {}: {} data warnings", match.teamOne(), match.teamTwo(), match.date(),
                    warnings.size());
            for (DeliveryWarning w : warnings) {
                log.warn("  innings {} {} [{}]: {}", w.innings(), w.fieldPath(), w.kind(), w.message());
            }
        }

        return new MatchStatistics(match, innings, MatchStatistics.Totals.of(innings), warnings);
    }
}
