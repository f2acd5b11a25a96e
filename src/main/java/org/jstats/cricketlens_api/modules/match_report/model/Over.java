package org.jstats.cricketlens_api.modules.match_report.model;

import java.util.List;

/**
 * @param number     0-indexed over number
 * @param deliveries deliveries in bowling order, wides and no-balls included
 */
public record Over(int number, List<Delivery> deliveries) {

    public Over {
        deliveries = List.copyOf(deliveries);
    }
}
