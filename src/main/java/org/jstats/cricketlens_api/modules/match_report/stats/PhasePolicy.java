package org.jstats.cricketlens_api.modules.match_report.stats;

/**
 * Over ranges of the three phases. Powerplay is {@code [0, powerplayOvers)}, middle is
 * {@code [powerplayOvers, deathStartOver)} and death is everything from {@code deathStartOver}.
 */
public record PhasePolicy(int powerplayOvers, int deathStartOver) {

    public static final PhasePolicy T20 = new PhasePolicy(6, 16);
    public static final PhasePolicy ODI = new PhasePolicy(10, 40);

    public PhasePolicy {
        if (powerplayOvers < 0 || deathStartOver < powerplayOvers) {
            throw new IllegalArgumentException(
                    "invalid phase boundaries: powerplay=" + powerplayOvers + ", death=" + deathStartOver);
        }
    }

    public Phase phaseOf(int overNumber) {
        if (overNumber < powerplayOvers) return Phase.POWERPLAY;
        if (overNumber < deathStartOver) return Phase.MIDDLE;
        return Phase.DEATH;
    }
}
