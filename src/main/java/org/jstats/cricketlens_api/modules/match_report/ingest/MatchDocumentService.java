package org.jstats.cricketlens_api.modules.match_report.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.NullMarked;
import org.jstats.cricketlens_api.modules.match_report.model.MatchRecord;
import org.jstats.cricketlens_api.modules.match_report.parse.MalformedMatchException;
import org.jstats.cricketlens_api.modules.match_report.parse.MatchRecordParser;
import org.jstats.cricketlens_api.modules.match_report.render.MatchReportRenderer;
import org.jstats.cricketlens_api.modules.match_report.stats.MatchStatistics;
import org.jstats.cricketlens_api.modules.match_report.stats.StatisticsAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.document.Document;
import org.springframework.stereotype.Service;

import java.util.function.Supplier;

/**
 * Parse, aggregate and render one match, producing the unit the indexing side ingests.
 */
@Service
@NullMarked
public class MatchDocumentService {

    private static final Logger log = LoggerFactory.getLogger(MatchDocumentService.class);

    private final MatchRecordParser parser;
    private final StatisticsAggregator aggregator;
    private final MatchReportRenderer renderer;

    public MatchDocumentService(
            MatchRecordParser parser,
            StatisticsAggregator aggregator,
            MatchReportRenderer renderer) {
        this.parser = parser;
        this.aggregator = aggregator;
        this.renderer = renderer;
    }

    public MatchReport process(String filename, String json) {
        return process(filename, parseLogged(filename, () -> parser.parse(json)));
    }

    public MatchReport process(String filename, JsonNode root) {
        return process(filename, parseLogged(filename, () -> parser.parse(root)));
    }

    private MatchReport process(String filename, MatchRecord match) {
        MatchStatistics stats = aggregator.aggregate(match);
        String text = renderer.render(stats);

        var document = new MatchDocument(text, metadata(filename, match));
        if (log.isInfoEnabled()) {
            log.info("Rendered {} ({} vs {}): {} innings, {} chars, {} warnings", filename,
                    match.teamOne(), match.teamTwo(), stats.innings().size(), text.length(),
                    stats.warnings().size());
        }
        return new MatchReport(document, stats);
    }

    /**
     * Spring AI document for the vector store side, keyed by match id.
     */
    public Document toDocument(MatchDocument document) {
        MatchDocumentMetadata metadata = document.metadata();
        return new Document(metadata.matchId(), document.text(), metadata.asMap());
    }

    static MatchDocumentMetadata metadata(String filename, MatchRecord match) {
        return new MatchDocumentMetadata(
                filename,
                matchId(filename),
                match.teams(),
                match.date(),
                match.venue(),
                match.event());
    }

    static String matchId(String filename) {
        int dot = filename.lastIndexOf('.');
        return dot > 0 ? filename.substring(0, dot) : filename;
    }

    private static MatchRecord parseLogged(String filename, Supplier<MatchRecord> parse) {
        try {
            return parse.get();
        } catch (MalformedMatchException ex) {
            if (log.isWarnEnabled()) {
                log.warn("Rejected {}: {}", filename, ex.getMessage());
            }
            throw ex;
        }
    }
}
