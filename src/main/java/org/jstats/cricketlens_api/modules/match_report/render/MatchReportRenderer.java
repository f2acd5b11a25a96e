package org.jstats.cricketlens_api.modules.match_report.render;

import org.jspecify.annotations.NullMarked;
import org.jstats.cricketlens_api.modules.match_report.config.ReportProperties;
import org.jstats.cricketlens_api.modules.match_report.model.MatchRecord;
import org.jstats.cricketlens_api.modules.match_report.stats.BatterStat;
import org.jstats.cricketlens_api.modules.match_report.stats.BowlerStat;
import org.jstats.cricketlens_api.modules.match_report.stats.FielderStat;
import org.jstats.cricketlens_api.modules.match_report.stats.InningsStatistics;
import org.jstats.cricketlens_api.modules.match_report.stats.MatchStatistics;
import org.jstats.cricketlens_api.modules.match_report.stats.MatchupStat;
import org.jstats.cricketlens_api.modules.match_report.stats.OverSummary;
import org.jstats.cricketlens_api.modules.match_report.stats.Partnership;
import org.jstats.cricketlens_api.modules.match_report.stats.PhaseSplit;
import org.jstats.cricketlens_api.modules.match_report.stats.Rates;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Formats aggregated statistics as a plain-text match report. Nothing is recomputed here apart
 * from shares of a total; sections whose source data is absent are left out.
 */
@Component
@NullMarked
public class MatchReportRenderer {

    private final ReportProperties properties;

    public MatchReportRenderer(ReportProperties properties) {
        this.properties = properties;
    }

    public String render(MatchStatistics stats) {
        List<String> out = new ArrayList<>();
        MatchRecord match = stats.match();

        header(match, out);
        playingXi(match, out);
        tossAndOfficials(match, out);

        for (InningsStatistics innings : stats.innings()) {
            out.add("Innings " + innings.number() + ": " + innings.battingTeam());
            inningsSummary(innings, out);
            overByOver(innings, out);
            phases(innings, out);
            partnerships(innings, out);
            matchups(innings, out);
            batting(innings, out);
            bowling(innings, out);
            wicketShare(innings, out);
            fielding(innings, out);
            out.add("");
        }

        matchSummary(stats.totals(), out);
        result(match, out);

        return String.join("\n", out).stripTrailing();
    }

    private void header(MatchRecord match, List<String> out) {
        out.add("Match Analysis: " + match.teamOne() + " vs " + match.teamTwo());
        out.add("Date: " + match.date());
        out.add("Venue: " + match.venue());
        out.add("Event: " + match.event());
        out.add("Match Type: " + match.matchType());
        out.add("Gender: " + match.gender());
        out.add("Season: " + match.season());
        out.add("");
    }

    private void playingXi(MatchRecord match, List<String> out) {
        for (String team : match.teams()) {
            List<String> players = match.playersOf(team);
            if (players.isEmpty()) continue;
            out.add(team + " Playing XI:");
            players.forEach(p -> out.add("- " + p));
            out.add("");
        }
    }

    private void tossAndOfficials(MatchRecord match, List<String> out) {
        boolean any = false;
        if (match.toss() != null) {
            out.add("Toss: " + match.toss().winner() + " won and chose to " + match.toss().decision());
            any = true;
        }
        MatchRecord.Officials officials = match.officials();
        any |= joined("Umpires", officials.umpires(), out);
        any |= joined("TV Umpires", officials.tvUmpires(), out);
        any |= joined("Reserve Umpires", officials.reserveUmpires(), out);
        any |= joined("Match Referees", officials.matchReferees(), out);
        if (any) out.add("");
    }

    private static boolean joined(String label, List<String> names, List<String> out) {
        if (names.isEmpty()) return false;
        out.add(label + ": " + String.join(", ", names));
        return true;
    }

    private void inningsSummary(InningsStatistics innings, List<String> out) {
        out.add("");
        out.add("Innings Summary for " + innings.battingTeam() + ":");
        out.add("Total Score: " + innings.runs() + "/" + innings.wickets()
                + " (" + innings.oversNotation() + " overs)");
        out.add("Run Rate: " + f2(innings.runRate()));
        out.add("Extras: " + innings.extras());
        out.add("Boundaries: " + innings.fours() + " fours, " + innings.sixes() + " sixes");
    }

    private void overByOver(InningsStatistics innings, List<String> out) {
        if (innings.overs().isEmpty()) return;
        out.add("");
        out.add("Detailed Over-by-Over Analysis:");
        for (OverSummary o : innings.overs()) {
            out.add("Over " + o.displayNumber() + " (" + o.bowler() + "): "
                    + o.runs() + " runs (" + o.extras() + " extras), "
                    + o.wickets() + " wickets, "
                    + o.fours() + " fours, " + o.sixes() + " sixes, "
                    + o.dots() + " dots | "
                    + "Score: " + o.cumulativeRuns() + "/" + o.cumulativeWickets()
                    + " (Over RR: " + f2(o.overRunRate()) + ", Match RR: " + f2(o.matchRunRate()) + ")"
                    + (o.maiden() ? " - maiden" : ""));
        }
    }

    private void phases(InningsStatistics innings, List<String> out) {
        List<PhaseSplit> played = innings.phases().stream().filter(p -> !p.isEmpty()).toList();
        if (played.isEmpty()) return;
        out.add("");
        out.add("Phase Analysis:");
        for (PhaseSplit p : played) {
            out.add(p.phase().displayName() + " (overs " + (p.firstOver() + 1) + "-" + (p.lastOver() + 1) + "): "
                    + "Runs: " + p.runs() + ", Wickets: " + p.wickets()
                    + ", Run Rate: " + f2(p.runRate())
                    + ", Boundaries: " + p.fours() + " fours, " + p.sixes() + " sixes"
                    + ", Extras: " + p.extras() + ", Dots: " + p.dots());
        }
    }

    private void partnerships(InningsStatistics innings, List<String> out) {
        if (innings.partnerships().isEmpty()) return;
        out.add("");
        out.add("Partnership Analysis:");
        for (Partnership p : innings.partnerships()) {
            out.add(p.getNumber() + ". " + String.join(" & ", p.getBatters())
                    + " (from " + p.getStartScore() + " to " + p.getEndScore()
                    + (p.isEndedByWicket() ? ", ended by wicket" : ", unbroken") + ")");
            out.add("Runs: " + p.getRuns() + " (" + p.getBalls() + " balls, RR: " + f2(p.getRunRate()) + ")");
            out.add("Boundaries: " + p.getFours() + " fours, " + p.getSixes() + " sixes ("
                    + f1(p.getBoundaryPercent()) + "% boundary rate)");
            out.add("Dot Balls: " + p.getDots() + " (" + f1(p.getDotPercent()) + "%)");

            if (p.getRuns() >= properties.partnershipBreakdownMinRuns()) {
                out.add("vs Bowlers:");
                for (Map.Entry<String, MatchupStat> e : p.getVsBowlers().entrySet()) {
                    MatchupStat s = e.getValue();
                    if (s.getBalls() == 0) continue;
                    out.add("  " + e.getKey() + ": " + s.getRuns() + "/" + s.getBalls() + " balls "
                            + "(RR: " + f2(s.getRunRate()) + ", "
                            + "Boundaries: " + s.getFours() + "x4 " + s.getSixes() + "x6, "
                            + "Dots: " + s.getDots() + ")");
                }
            }
        }
    }

    private void matchups(InningsStatistics innings, List<String> out) {
        List<String> lines = new ArrayList<>();
        for (BatterStat batter : innings.batters()) {
            List<Map.Entry<String, MatchupStat>> faced = innings.matchupsForBatter(batter.getName()).stream()
                    .filter(e -> e.getValue().getBalls() > 0)
                    .toList();
            if (faced.isEmpty()) continue;
            lines.add("");
            lines.add(batter.getName() + " against:");
            for (Map.Entry<String, MatchupStat> e : faced) {
                MatchupStat s = e.getValue();
                lines.add("  " + e.getKey() + ": " + s.getRuns() + " runs (" + s.getBalls() + " balls, "
                        + "SR: " + f1(s.getStrikeRate()) + ", "
                        + "Boundaries: " + s.getFours() + "x4 " + s.getSixes() + "x6 ("
                        + f1(s.getBoundaryPercent()) + "%), "
                        + "Dots: " + s.getDots() + " (" + f1(s.getDotPercent()) + "%)"
                        + (s.getDismissals() > 0 ? ", Dismissed " + s.getDismissals() + " time(s)" : "")
                        + ")");
            }
        }
        if (lines.isEmpty()) return;
        out.add("");
        out.add("Batter vs Bowler Analysis:");
        out.addAll(lines);
    }

    private void batting(InningsStatistics innings, List<String> out) {
        if (innings.batters().isEmpty()) return;
        out.add("");
        out.add("Batting Statistics:");
        for (BatterStat b : innings.batters()) {
            String status = b.getHowOut() == null ? "not out" : b.getHowOut().describe();
            out.add(b.getName() + ": " + b.getRuns() + " runs (" + b.getBalls() + " balls, "
                    + b.getFours() + " fours, " + b.getSixes() + " sixes, SR: " + f2(b.getStrikeRate())
                    + ") - " + status);
        }
    }

    private void bowling(InningsStatistics innings, List<String> out) {
        if (innings.bowlers().isEmpty()) return;
        out.add("");
        out.add("Bowling Statistics:");
        for (BowlerStat b : innings.bowlers()) {
            out.add(b.getName() + ": " + b.getWickets() + "/" + b.getRuns()
                    + " (" + b.getOversNotation() + " overs, " + b.getMaidens() + " maidens, "
                    + "Econ: " + f2(b.getEconomy())
                    + ", Dots: " + b.getDots()
                    + ", Wides: " + b.getWides() + ", No-balls: " + b.getNoBalls() + ")");
        }
    }

    private void wicketShare(InningsStatistics innings, List<String> out) {
        int total = innings.bowlers().stream().mapToInt(BowlerStat::getWickets).sum();
        if (total == 0) return;
        out.add("");
        out.add("Wicket Analysis:");
        for (BowlerStat b : innings.bowlers()) {
            if (b.getWickets() == 0) continue;
            out.add(b.getName() + ": " + b.getWickets() + " (" + f1(Rates.percent(b.getWickets(), total)) + "%)");
        }
    }

    private void fielding(InningsStatistics innings, List<String> out) {
        List<FielderStat> credited = innings.fielders().stream().filter(f -> f.getDismissals() > 0).toList();
        if (credited.isEmpty()) return;
        out.add("");
        out.add("Fielding Analysis:");
        for (FielderStat f : credited) {
            List<String> parts = new ArrayList<>();
            if (f.getCatches() > 0) {
                parts.add(f.getCatches() + " catch" + (f.getCatches() > 1 ? "es" : "")
                        + " (" + byPosition(f.getCatchesByPosition(), "at") + ")");
            }
            if (f.getStumpings() > 0) {
                parts.add(f.getStumpings() + " stumping" + (f.getStumpings() > 1 ? "s" : ""));
            }
            if (f.getRunOuts() > 0) {
                parts.add(f.getRunOuts() + " run out" + (f.getRunOuts() > 1 ? "s" : "")
                        + " (" + byPosition(f.getRunOutsByPosition(), "from") + ")");
            }
            out.add(f.getName() + ": " + String.join(", ", parts));
        }
    }

    private static String byPosition(Map<String, Integer> counts, String preposition) {
        return counts.entrySet().stream()
                .map(e -> e.getValue() + " " + preposition + " " + e.getKey())
                .collect(Collectors.joining(", "));
    }

    private void matchSummary(MatchStatistics.Totals totals, List<String> out) {
        out.add("Match Summary:");
        out.add("Total Runs Scored: " + totals.runs());
        out.add("Total Wickets: " + totals.wickets());
        out.add("Total Boundaries: " + totals.fours() + " fours, " + totals.sixes() + " sixes");
        out.add("Total Extras: " + totals.extras());
    }

    private void result(MatchRecord match, List<String> out) {
        MatchRecord.Outcome outcome = match.outcome();
        if (outcome == null) return;
        if (outcome.winner() != null) {
            out.add("");
            out.add("Result: " + outcome.winner() + " won");
            if (!outcome.margin().isEmpty()) {
                out.add("Margin: " + outcome.margin().entrySet().stream()
                        .map(e -> "by " + e.getValue() + " " + e.getKey())
                        .collect(Collectors.joining(", ")));
            }
            if (outcome.method() != null) {
                out.add("Method: " + outcome.method());
            }
        } else if (outcome.result() != null) {
            out.add("");
            out.add("Result: " + outcome.result());
        }
    }

    private static String f2(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }

    private static String f1(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }
}
