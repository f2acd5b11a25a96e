package org.jstats.cricketlens_api.modules.match_report.ingest;

import org.jstats.cricketlens_api.modules.match_report.stats.DeliveryWarning;
import org.jstats.cricketlens_api.modules.match_report.stats.MatchStatistics;

import java.util.List;

/**
 * Result of processing one match file. Callers decide whether a document with warnings is
 * still worth indexing.
 */
public record MatchReport(MatchDocument document, MatchStatistics statistics) {

    public List<DeliveryWarning> warnings() {
        return statistics.warnings();
    }
}
