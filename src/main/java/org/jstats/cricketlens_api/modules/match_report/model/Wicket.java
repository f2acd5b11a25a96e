package org.jstats.cricketlens_api.modules.match_report.model;

import java.util.List;

/**
 * @param playerOut dismissed batter
 * @param kind      dismissal kind
 * @param rawKind   the kind label as it appeared in the source, kept for unrecognized labels
 * @param fielders  credited fielders, in source order
 */
public record Wicket(String playerOut, DismissalKind kind, String rawKind, List<Fielder> fielders) {

    public Wicket {
        fielders = List.copyOf(fielders);
    }

    public record Fielder(String name, String position) {}
}
