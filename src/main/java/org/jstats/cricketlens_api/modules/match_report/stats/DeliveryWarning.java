package org.jstats.cricketlens_api.modules.match_report.stats;

/**
 * Non-fatal anomaly found while aggregating an innings.
 *
 * @param innings   1-based innings number
 * @param fieldPath path of the offending field, e.g. {@code innings[0].overs[3].deliveries[2]}
 * @param kind      category
 * @param message   human readable detail
 */
public record DeliveryWarning(int innings, String fieldPath, Kind kind, String message) {

    public enum Kind {
        /** Inconsistent or unprocessable delivery. */
        DELIVERY,
        /** Player name missing, or not in either team's playing XI. */
        UNKNOWN_PLAYER_REFERENCE
    }
}
