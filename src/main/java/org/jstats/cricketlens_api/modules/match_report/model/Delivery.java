package org.jstats.cricketlens_api.modules.match_report.model;

import java.util.List;

public record Delivery(
        String batter,
        String nonStriker,
        String bowler,
        Runs runs,
        Extras extras,
        List<Wicket> wickets
) {

    public Delivery {
        wickets = List.copyOf(wickets);
    }

    /** Counts toward the six-ball over and the strike-rate / economy denominators. */
    public boolean isValid() {
        return !extras.wide() && !extras.noBall();
    }

    public boolean isDot() {
        return isValid() && runs.total() == 0;
    }

    public boolean isFour() {
        return runs.batter() == 4;
    }

    public boolean isSix() {
        return runs.batter() == 6;
    }

    public boolean hasWickets() {
        return !wickets.isEmpty();
    }

    public record Runs(int batter, int extras, int total) {

        public static Runs zero() {
            return new Runs(0, 0, 0);
        }

        public boolean isConsistent() {
            return batter + extras == total;
        }
    }

    /**
     * Extras detail. A wide or no-ball key present in the source marks the delivery even when
     * its value is zero, so the flags are kept apart from the run values.
     */
    public record Extras(boolean wide, boolean noBall,
                         int wides, int noBalls, int byes, int legByes, int penalty) {

        public static Extras none() {
            return new Extras(false, false, 0, 0, 0, 0, 0);
        }

        public int total() {
            return wides + noBalls + byes + legByes + penalty;
        }
    }
}
