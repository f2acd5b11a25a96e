package org.jstats.cricketlens_api.modules.match_report;

import org.jstats.cricketlens_api.modules.match_report.model.Delivery;
import org.jstats.cricketlens_api.modules.match_report.model.DismissalKind;
import org.jstats.cricketlens_api.modules.match_report.model.Innings;
import org.jstats.cricketlens_api.modules.match_report.model.MatchRecord;
import org.jstats.cricketlens_api.modules.match_report.model.Over;
import org.jstats.cricketlens_api.modules.match_report.model.Wicket;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Builders for hand-made matches used across the tests.
 */
public final class MatchFixtures {

    public static final String HOME = "Alpha";
    public static final String AWAY = "Beta";

    private MatchFixtures() {
    }

    public static String resource(String name) {
        try (InputStream in = MatchFixtures.class.getResourceAsStream("/matches/" + name)) {
            if (in == null) throw new IllegalArgumentException("no fixture " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static Delivery ball(String batter, String nonStriker, String bowler, int runs) {
        return new Delivery(batter, nonStriker, bowler, new Delivery.Runs(runs, 0, runs), Delivery.Extras.none(), List.of());
    }

    public static Delivery wide(String batter, String nonStriker, String bowler, int wides) {
        return new Delivery(batter, nonStriker, bowler, new Delivery.Runs(0, wides, wides),
                new Delivery.Extras(true, false, wides, 0, 0, 0, 0), List.of());
    }

    public static Delivery noBall(String batter, String nonStriker, String bowler, int batterRuns) {
        return new Delivery(batter, nonStriker, bowler, new Delivery.Runs(batterRuns, 1, batterRuns + 1),
                new Delivery.Extras(false, true, 0, 1, 0, 0, 0), List.of());
    }

    public static Delivery legBye(String batter, String nonStriker, String bowler, int runs) {
        return new Delivery(batter, nonStriker, bowler, new Delivery.Runs(0, runs, runs),
                new Delivery.Extras(false, false, 0, 0, 0, runs, 0), List.of());
    }

    /** A dot ball on which the striker is out. */
    public static Delivery out(String batter, String nonStriker, String bowler, DismissalKind kind,
                               Wicket.Fielder... fielders) {
        return withWickets(ball(batter, nonStriker, bowler, 0), wicket(batter, kind, fielders));
    }

    public static Delivery withWickets(Delivery d, Wicket... wickets) {
        return new Delivery(d.batter(), d.nonStriker(), d.bowler(), d.runs(), d.extras(), Arrays.asList(wickets));
    }

    public static Wicket wicket(String playerOut, DismissalKind kind, Wicket.Fielder... fielders) {
        return new Wicket(playerOut, kind, kind.label(), Arrays.asList(fielders));
    }

    public static Wicket.Fielder fielder(String name, String position) {
        return new Wicket.Fielder(name, position);
    }

    public static Over over(int number, Delivery... deliveries) {
        return new Over(number, Arrays.asList(deliveries));
    }

    /** Six dot balls. */
    public static Over maidenOver(int number, String batter, String nonStriker, String bowler) {
        List<Delivery> balls = new ArrayList<>();
        for (int i = 0; i < 6; i++) balls.add(ball(batter, nonStriker, bowler, 0));
        return new Over(number, balls);
    }

    public static Innings innings(String team, Over... overs) {
        return new Innings(team, Arrays.asList(overs));
    }

    public static MatchRecord match(String matchType, Innings... innings) {
        return match(matchType, Map.of(), innings);
    }

    public static MatchRecord match(String matchType, Map<String, List<String>> players, Innings... innings) {
        return new MatchRecord(
                List.of(HOME, AWAY),
                "2024-03-01",
                "Test Ground",
                "Test Cup",
                matchType,
                "male",
                "2024",
                null,
                MatchRecord.Officials.none(),
                players,
                null,
                Arrays.asList(innings));
    }
}
