package org.jstats.cricketlens_api.modules.match_report.stats;

/**
 * Key of the sparse batter-by-bowler table. The bowler's view of a matchup is the same entry.
 */
public record MatchupKey(String batter, String bowler) {}
