package org.jstats.cricketlens_api.modules.match_report.model;

import org.jspecify.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Normalized, immutable view of one match.
 *
 * @param teams     ordered pair of team names
 * @param date      first listed match date
 * @param venue     ground name
 * @param event     event / competition name
 * @param matchType format label, e.g. T20, ODI, Test
 * @param gender    male / female
 * @param season    season label
 * @param toss      toss result, if recorded
 * @param officials match officials
 * @param players   playing XI keyed by team name, in listing order
 * @param outcome   match outcome, if recorded
 * @param innings   innings in batting order
 */
public record MatchRecord(
        List<String> teams,
        String date,
        String venue,
        String event,
        String matchType,
        String gender,
        String season,
        @Nullable Toss toss,
        Officials officials,
        Map<String, List<String>> players,
        @Nullable Outcome outcome,
        List<Innings> innings
) {
    public static final String UNKNOWN = "Unknown";

    public MatchRecord {
        teams = List.copyOf(teams);
        players = Map.copyOf(players);
        innings = List.copyOf(innings);
    }

    public String teamOne() {
        return teams.isEmpty() ? UNKNOWN : teams.get(0);
    }

    public String teamTwo() {
        return teams.size() < 2 ? UNKNOWN : teams.get(1);
    }

    /**
     * The side that did not bat in the given innings.
     */
    public String opponentOf(String battingTeam) {
        if (battingTeam.equals(teamOne())) return teamTwo();
        if (battingTeam.equals(teamTwo())) return teamOne();
        return UNKNOWN;
    }

    public List<String> playersOf(String team) {
        return players.getOrDefault(team, List.of());
    }

    public boolean hasPlayerLists() {
        return !players.isEmpty();
    }

    public record Toss(String winner, String decision) {}

    public record Officials(
            List<String> umpires,
            List<String> tvUmpires,
            List<String> reserveUmpires,
            List<String> matchReferees
    ) {
        public Officials {
            umpires = List.copyOf(umpires);
            tvUmpires = List.copyOf(tvUmpires);
            reserveUmpires = List.copyOf(reserveUmpires);
            matchReferees = List.copyOf(matchReferees);
        }

        public static Officials none() {
            return new Officials(List.of(), List.of(), List.of(), List.of());
        }
    }

    /**
     * Either a winner with a margin (e.g. {@code runs -> 23}) or a plain result such as "tie".
     */
    public record Outcome(
            @Nullable String winner,
            Map<String, Integer> margin,
            @Nullable String method,
            @Nullable String result
    ) {
        public Outcome {
            // keeps the source order of the margin keys
            margin = Collections.unmodifiableMap(new LinkedHashMap<>(margin));
        }
    }
}
