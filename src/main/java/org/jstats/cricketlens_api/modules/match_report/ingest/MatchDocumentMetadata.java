package org.jstats.cricketlens_api.modules.match_report.ingest;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Metadata stored next to a rendered report by the indexing side.
 *
 * @param filename source file name
 * @param matchId  file name without its extension
 * @param teams    both team names
 * @param date     first match date
 * @param venue    ground name
 * @param event    event name
 */
public record MatchDocumentMetadata(
        String filename,
        @JsonProperty("match_id") String matchId,
        List<String> teams,
        String date,
        String venue,
        String event
) {

    public MatchDocumentMetadata {
        teams = List.copyOf(teams);
    }

    public Map<String, Object> asMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("filename", filename);
        map.put("match_id", matchId);
        map.put("teams", teams);
        map.put("date", date);
        map.put("venue", venue);
        map.put("event", event);
        return map;
    }
}
