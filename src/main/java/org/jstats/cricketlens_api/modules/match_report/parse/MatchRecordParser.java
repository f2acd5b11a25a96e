package org.jstats.cricketlens_api.modules.match_report.parse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.jstats.cricketlens_api.modules.match_report.model.Delivery;
import org.jstats.cricketlens_api.modules.match_report.model.DismissalKind;
import org.jstats.cricketlens_api.modules.match_report.model.Innings;
import org.jstats.cricketlens_api.modules.match_report.model.MatchRecord;
import org.jstats.cricketlens_api.modules.match_report.model.Over;
import org.jstats.cricketlens_api.modules.match_report.model.Wicket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.jstats.cricketlens_api.modules.match_report.model.MatchRecord.UNKNOWN;

/**
 * Turns a raw match tree into a {@link MatchRecord}.
 * <p>
 * Descriptive fields fall back to {@value MatchRecord#UNKNOWN}. The innings, overs and
 * deliveries arrays are mandatory; without them there is nothing to aggregate.
 */
@Component
@NullMarked
public class MatchRecordParser {

    private static final Logger log = LoggerFactory.getLogger(MatchRecordParser.class);

    private final ObjectMapper mapper;

    public MatchRecordParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public MatchRecord parse(String json) {
        try {
            return parse(mapper.readTree(json));
        } catch (JsonProcessingException jpe) {
            throw new MalformedMatchException("$", "not valid JSON: " + jpe.getOriginalMessage());
        }
    }

    public MatchRecord parse(@Nullable JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new MalformedMatchException("$", "match record must be a JSON object");
        }

        JsonNode info = root.path("info");
        List<String> teams = textList(info.path("teams"));
        if (teams.size() > 2) {
            throw new MalformedMatchException("info.teams", "expected two teams, got " + teams.size());
        }

        List<Innings> innings = parseInnings(root.get("innings"), teams);

        var record = new MatchRecord(
                teams,
                firstText(info.path("dates")),
                text(info, "venue"),
                eventName(info.path("event")),
                text(info, "match_type"),
                text(info, "gender"),
                text(info, "season"),
                parseToss(info.path("toss")),
                parseOfficials(info.path("officials")),
                parsePlayers(info.path("players")),
                parseOutcome(info.path("outcome")),
                innings);

        if (log.isDebugEnabled()) {
            log.debug("Parsed match {} vs {} on {}: {} innings", record.teamOne(), record.teamTwo(),
                    record.date(), innings.size());
        }
        return record;
    }

    // ---------- ball-level structure ----------

    private List<Innings> parseInnings(@Nullable JsonNode node, List<String> teams) {
        JsonNode array = requireArray(node, "innings");
        List<Innings> innings = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            String path = "innings[" + i + "]";
            JsonNode in = array.get(i);
            if (!in.isObject()) {
                throw new MalformedMatchException(path, "innings entry must be an object");
            }
            String team = text(in, "team");
            if (teams.size() == 2 && !UNKNOWN.equals(team) && !teams.contains(team)) {
                throw new MalformedMatchException(path + ".team", "unknown team '" + team + "'");
            }
            innings.add(new Innings(team, parseOvers(in.get("overs"), path + ".overs")));
        }
        return innings;
    }

    private List<Over> parseOvers(@Nullable JsonNode node, String path) {
        JsonNode array = requireArray(node, path);
        List<Over> overs = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            String overPath = path + "[" + i + "]";
            JsonNode over = array.get(i);
            JsonNode number = over.get("over");
            if (number == null || !number.canConvertToInt() || !number.isIntegralNumber()) {
                throw new MalformedMatchException(overPath + ".over", "over index must be an integer");
            }
            if (number.intValue() < 0) {
                throw new MalformedMatchException(overPath + ".over", "over index must not be negative");
            }
            String deliveriesPath = overPath + ".deliveries";
            JsonNode deliveries = requireArray(over.get("deliveries"), deliveriesPath);
            List<Delivery> parsed = new ArrayList<>(deliveries.size());
            for (int d = 0; d < deliveries.size(); d++) {
                parsed.add(parseDelivery(deliveries.get(d), deliveriesPath + "[" + d + "]"));
            }
            overs.add(new Over(number.intValue(), parsed));
        }
        return overs;
    }

    private Delivery parseDelivery(JsonNode node, String path) {
        if (!node.isObject()) {
            throw new MalformedMatchException(path, "delivery must be an object");
        }
        JsonNode runs = node.path("runs");
        var parsedRuns = new Delivery.Runs(
                intValue(runs, "batter", path + ".runs"),
                intValue(runs, "extras", path + ".runs"),
                intValue(runs, "total", path + ".runs"));

        JsonNode extras = node.path("extras");
        var parsedExtras = new Delivery.Extras(
                extras.has("wides"),
                extras.has("noballs"),
                intValue(extras, "wides", path + ".extras"),
                intValue(extras, "noballs", path + ".extras"),
                intValue(extras, "byes", path + ".extras"),
                intValue(extras, "legbyes", path + ".extras"),
                intValue(extras, "penalty", path + ".extras"));

        List<Wicket> wickets = new ArrayList<>();
        JsonNode wicketsNode = node.get("wickets");
        if (wicketsNode != null && !wicketsNode.isNull()) {
            JsonNode array = requireArray(wicketsNode, path + ".wickets");
            for (JsonNode w : array) {
                wickets.add(parseWicket(w));
            }
        }

        return new Delivery(
                text(node, "batter"),
                text(node, "non_striker"),
                text(node, "bowler"),
                parsedRuns,
                parsedExtras,
                wickets);
    }

    private Wicket parseWicket(JsonNode node) {
        String rawKind = text(node, "kind");
        List<Wicket.Fielder> fielders = new ArrayList<>();
        for (JsonNode f : node.path("fielders")) {
            fielders.add(new Wicket.Fielder(text(f, "name"), text(f, "position")));
        }
        return new Wicket(text(node, "player_out"), DismissalKind.fromLabel(rawKind), rawKind, fielders);
    }

    // ---------- match info ----------

    private MatchRecord.@Nullable Toss parseToss(JsonNode toss) {
        if (!toss.isObject()) return null;
        return new MatchRecord.Toss(text(toss, "winner"), text(toss, "decision"));
    }

    private MatchRecord.Officials parseOfficials(JsonNode officials) {
        if (!officials.isObject()) return MatchRecord.Officials.none();
        return new MatchRecord.Officials(
                textList(officials.path("umpires")),
                textList(officials.path("tv_umpires")),
                textList(officials.path("reserve_umpires")),
                textList(officials.path("match_referees")));
    }

    private Map<String, List<String>> parsePlayers(JsonNode players) {
        Map<String, List<String>> out = new LinkedHashMap<>();
        if (!players.isObject()) return out;
        players.fields().forEachRemaining(e -> out.put(e.getKey().trim(), textList(e.getValue())));
        return out;
    }

    private MatchRecord.@Nullable Outcome parseOutcome(JsonNode outcome) {
        if (!outcome.isObject()) return null;
        Map<String, Integer> margin = new LinkedHashMap<>();
        outcome.path("by").fields().forEachRemaining(e -> {
            if (e.getValue().canConvertToInt()) margin.put(e.getKey(), e.getValue().intValue());
        });
        return new MatchRecord.Outcome(
                optionalText(outcome, "winner"),
                margin,
                optionalText(outcome, "method"),
                optionalText(outcome, "result"));
    }

    private static String eventName(JsonNode event) {
        if (event.isTextual()) return event.asText();
        return text(event, "name");
    }

    // ---------- node helpers ----------

    private static JsonNode requireArray(@Nullable JsonNode node, String path) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            throw new MalformedMatchException(path, "missing");
        }
        if (!node.isArray()) {
            throw new MalformedMatchException(path, "expected an array");
        }
        return node;
    }

    private static String text(JsonNode node, String field) {
        String value = optionalText(node, field);
        return value == null ? UNKNOWN : value;
    }

    private static @Nullable String optionalText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) return null;
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }

    private static String firstText(JsonNode array) {
        List<String> values = textList(array);
        return values.isEmpty() ? UNKNOWN : values.get(0);
    }

    private static List<String> textList(JsonNode array) {
        if (!array.isArray()) return List.of();
        List<String> out = new ArrayList<>(array.size());
        for (JsonNode n : array) {
            if (!n.isValueNode() || n.isNull()) continue;
            String text = n.asText().trim();
            if (!text.isEmpty()) out.add(text);
        }
        return out;
    }

    private static int intValue(JsonNode node, String field, String path) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return 0;
        if (!value.isIntegralNumber() || !value.canConvertToInt()) {
            throw new MalformedMatchException(path + "." + field, "expected an integer");
        }
        if (value.intValue() < 0) {
            throw new MalformedMatchException(path + "." + field, "must not be negative");
        }
        return value.intValue();
    }
}
