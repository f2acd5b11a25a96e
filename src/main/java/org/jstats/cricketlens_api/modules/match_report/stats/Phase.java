package org.jstats.cricketlens_api.modules.match_report.stats;

public enum Phase {
    POWERPLAY("Powerplay"),
    MIDDLE("Middle Overs"),
    DEATH("Death Overs");

    private final String displayName;

    Phase(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
