package org.jstats.cricketlens_api.modules.match_report.model;

import java.util.List;

public record Innings(String team, List<Over> overs) {

    public Innings {
        overs = List.copyOf(overs);
    }

    public int deliveryCount() {
        return overs.stream().mapToInt(o -> o.deliveries().size()).sum();
    }
}
