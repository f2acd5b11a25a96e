package org.jstats.cricketlens_api.modules.match_report.controller;

import org.jstats.cricketlens_api.modules.match_report.ingest.MatchDocumentMetadata;
import org.jstats.cricketlens_api.modules.match_report.ingest.MatchReport;
import org.jstats.cricketlens_api.modules.match_report.stats.DeliveryWarning;
import org.jstats.cricketlens_api.modules.match_report.stats.InningsStatistics;

import java.util.List;

/**
 * Response DTO for a rendered match report.
 *
 * @param text     the rendered report
 * @param metadata metadata to index the report with
 * @param innings  headline figures per innings
 * @param warnings non-fatal data anomalies
 */
public record MatchReportResponse(
        String text,
        MatchDocumentMetadata metadata,
        List<InningsLine> innings,
        List<DeliveryWarning> warnings
) {

    public record InningsLine(
            int number,
            String battingTeam,
            int runs,
            int wickets,
            String overs,
            double runRate,
            int partnerships
    ) {
        static InningsLine of(InningsStatistics s) {
            return new InningsLine(s.number(), s.battingTeam(), s.runs(), s.wickets(), s.oversNotation(),
                    s.runRate(), s.partnerships().size());
        }
    }

    public static MatchReportResponse of(MatchReport report) {
        return new MatchReportResponse(
                report.document().text(),
                report.document().metadata(),
                report.statistics().innings().stream().map(InningsLine::of).toList(),
                report.warnings());
    }
}
