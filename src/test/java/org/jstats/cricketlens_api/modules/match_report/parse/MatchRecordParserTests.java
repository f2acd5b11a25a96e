package org.jstats.cricketlens_api.modules.match_report.parse;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jstats.cricketlens_api.modules.match_report.MatchFixtures;
import org.jstats.cricketlens_api.modules.match_report.config.ReportProperties;
import org.jstats.cricketlens_api.modules.match_report.model.Delivery;
import org.jstats.cricketlens_api.modules.match_report.model.DismissalKind;
import org.jstats.cricketlens_api.modules.match_report.model.MatchRecord;
import org.jstats.cricketlens_api.modules.match_report.model.Wicket;
import org.jstats.cricketlens_api.modules.match_report.stats.MatchStatistics;
import org.jstats.cricketlens_api.modules.match_report.stats.StatisticsAggregator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MatchRecordParserTests {

    MatchRecordParser parser;

    @BeforeEach
    void setUp() {
        parser = new MatchRecordParser(new ObjectMapper());
    }

    @Test
    void parsesFullMatchRecord() {
        MatchRecord match = parser.parse(MatchFixtures.resource("jamaica_windward.json"));

        assertEquals(List.of("Jamaica", "Windward Islands"), match.teams());
        assertEquals("2024-01-18", match.date());
        assertEquals("Sabina Park, Kingston", match.venue());
        assertEquals("CG United Super50 Cup", match.event());
        assertEquals("T20", match.matchType());
        assertEquals("male", match.gender());
        assertEquals("2023/24", match.season());
        assertEquals(new MatchRecord.Toss("Windward Islands", "field"), match.toss());
        assertEquals(List.of("GO Brathwaite", "N Duguid"), match.officials().umpires());
        assertEquals(List.of("RD Richards"), match.officials().matchReferees());
        assertEquals(4, match.playersOf("Jamaica").size());
        assertEquals("Jamaica", match.outcome().winner());
        assertEquals(Map.of("runs", 14), match.outcome().margin());

        assertEquals(2, match.innings().size());
        assertEquals("Jamaica", match.innings().get(0).team());
        assertEquals(13, match.innings().get(0).deliveryCount());
        assertEquals(1, match.innings().get(0).overs().get(1).number());
    }

    @Test
    void normalizesExtrasAndWickets() {
        MatchRecord match = parser.parse(MatchFixtures.resource("jamaica_windward.json"));
        var firstOver = match.innings().get(0).overs().get(0).deliveries();

        Delivery wide = firstOver.get(1);
        assertTrue(wide.extras().wide());
        assertFalse(wide.isValid());
        assertEquals(1, wide.runs().total());

        Delivery caught = firstOver.get(5);
        assertTrue(caught.isDot());
        Wicket w = caught.wickets().get(0);
        assertEquals("J Blackwood", w.playerOut());
        assertEquals(DismissalKind.CAUGHT, w.kind());
        assertEquals(List.of(new Wicket.Fielder("D Shepherd", "slip")), w.fielders());

        Delivery runOut = match.innings().get(0).overs().get(1).deliveries().get(2);
        assertEquals(DismissalKind.RUN_OUT, runOut.wickets().get(0).kind());
        assertEquals(2, runOut.wickets().get(0).fielders().size());
    }

    @Test
    void missingDescriptiveFields_defaultToUnknown() {
        MatchRecord match = parser.parse("""
                {"innings": [{"overs": [{"over": 0, "deliveries": [{"runs": {"total": 0}}]}]}]}
                """);

        assertEquals("Unknown", match.teamOne());
        assertEquals("Unknown", match.venue());
        assertEquals("Unknown", match.date());
        assertEquals("Unknown", match.event());
        assertNull(match.toss());
        assertNull(match.outcome());
        assertTrue(match.officials().umpires().isEmpty());

        Delivery d = match.innings().get(0).overs().get(0).deliveries().get(0);
        assertEquals("Unknown", match.innings().get(0).team());
        assertEquals("Unknown", d.batter());
        assertEquals("Unknown", d.bowler());
        assertTrue(d.wickets().isEmpty());
    }

    @Test
    void eventMayBeAPlainString() {
        MatchRecord match = parser.parse("""
                {"info": {"event": "Friendly"}, "innings": []}
                """);
        assertEquals("Friendly", match.event());
        assertTrue(match.innings().isEmpty());
    }

    @Test
    void unknownDismissalLabel_mapsToOther_andKeepsRawLabel() {
        MatchRecord match = parser.parse("""
                {"innings": [{"overs": [{"over": 0, "deliveries": [
                  {"batter": "A", "bowler": "X", "non_striker": "B", "runs": {"total": 0},
                   "wickets": [{"player_out": "A", "kind": "mankad special"}]}
                ]}]}]}
                """);
        Wicket w = match.innings().get(0).overs().get(0).deliveries().get(0).wickets().get(0);
        assertEquals(DismissalKind.OTHER, w.kind());
        assertEquals("mankad special", w.rawKind());
    }

    @Test
    void missingInnings_isFatal() {
        var ex = assertThrows(MalformedMatchException.class,
                () -> parser.parse("{\"info\": {\"teams\": [\"A\", \"B\"]}}"));
        assertEquals("innings", ex.getFieldPath());
    }

    @Test
    void missingOvers_isFatal_withPath() {
        var ex = assertThrows(MalformedMatchException.class,
                () -> parser.parse("{\"innings\": [{\"team\": \"A\"}]}"));
        assertEquals("innings[0].overs", ex.getFieldPath());
    }

    @Test
    void missingDeliveries_isFatal_withPath() {
        var ex = assertThrows(MalformedMatchException.class,
                () -> parser.parse("{\"innings\": [{\"overs\": [{\"over\": 0}, {\"over\": 1}]}]}"));
        assertEquals("innings[0].overs[0].deliveries", ex.getFieldPath());
    }

    @Test
    void nonNumericOverIndex_isFatal() {
        var ex = assertThrows(MalformedMatchException.class,
                () -> parser.parse("{\"innings\": [{\"overs\": [{\"over\": \"first\", \"deliveries\": []}]}]}"));
        assertEquals("innings[0].overs[0].over", ex.getFieldPath());
    }

    @Test
    void nonNumericRuns_isFatal() {
        var ex = assertThrows(MalformedMatchException.class, () -> parser.parse("""
                {"innings": [{"overs": [{"over": 0, "deliveries": [{"runs": {"total": "four"}}]}]}]}
                """));
        assertEquals("innings[0].overs[0].deliveries[0].runs.total", ex.getFieldPath());
    }

    @Test
    void inningsForUnlistedTeam_isFatal() {
        var ex = assertThrows(MalformedMatchException.class, () -> parser.parse("""
                {"info": {"teams": ["Jamaica", "Barbados"]},
                 "innings": [{"team": "Guyana", "overs": []}]}
                """));
        assertEquals("innings[0].team", ex.getFieldPath());
    }

    @Test
    void invalidJson_isFatal() {
        var ex = assertThrows(MalformedMatchException.class, () -> parser.parse("{not json"));
        assertEquals("$", ex.getFieldPath());
    }

    @Test
    void negativeRunValue_isFatal() {
        var ex = assertThrows(MalformedMatchException.class, () -> parser.parse("""
                {"innings": [{"overs": [{"over": 0, "deliveries": [
                    {"runs": {"batter": 0, "extras": -1, "total": -1}, "extras": {"byes": -1}}]}]}]}
                """));
        assertEquals("innings[0].overs[0].deliveries[0].runs.extras", ex.getFieldPath());
    }

    @Test
    void paddedNames_areTrimmedAlike_inPlayerListsAndDeliveries() {
        MatchRecord match = parser.parse("""
                {"info": {"teams": [" Jamaica", "Barbados "],
                          "players": {" Jamaica": ["A Smith ", " B Jones"], "Barbados ": ["C Brown"]}},
                 "innings": [{"team": "Jamaica", "overs": [{"over": 0, "deliveries": [
                    {"batter": "A Smith ", "non_striker": "B Jones", "bowler": " C Brown",
                     "runs": {"batter": 1, "extras": 0, "total": 1}}]}]}]}
                """);

        assertEquals(List.of("Jamaica", "Barbados"), match.teams());
        assertEquals(List.of("A Smith", "B Jones"), match.playersOf("Jamaica"));
        assertEquals("A Smith", match.innings().get(0).overs().get(0).deliveries().get(0).batter());

        MatchStatistics stats = new StatisticsAggregator(ReportProperties.defaults()).aggregate(match);
        assertTrue(stats.warnings().isEmpty(), () -> stats.warnings().toString());
    }

    @Test
    void marginKeys_keepSourceOrder() {
        MatchRecord match = parser.parse("""
                {"info": {"outcome": {"winner": "A", "method": "D/L", "by": {"wickets": 3, "runs": 12}}},
                 "innings": []}
                """);

        assertEquals(List.of("wickets", "runs"), List.copyOf(match.outcome().margin().keySet()));
    }
}
