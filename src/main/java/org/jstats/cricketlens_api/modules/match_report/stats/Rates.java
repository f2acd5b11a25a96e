package org.jstats.cricketlens_api.modules.match_report.stats;

/**
 * Rate formulas. Every rate is 0 when its denominator is 0.
 */
public final class Rates {

    private Rates() {
    }

    /** Runs per 100 balls. */
    public static double strikeRate(int runs, int balls) {
        return balls == 0 ? 0.0 : runs * 100.0 / balls;
    }

    /** Runs per six valid balls. */
    public static double runRate(int runs, int validBalls) {
        return validBalls == 0 ? 0.0 : runs * 6.0 / validBalls;
    }

    /** Runs per over, with overs as a fractional value. */
    public static double economy(int runs, double overs) {
        return overs == 0.0 ? 0.0 : runs / overs;
    }

    public static double overs(int validBalls) {
        return validBalls / 6.0;
    }

    public static double percent(int part, int whole) {
        return whole == 0 ? 0.0 : part * 100.0 / whole;
    }

    /** Cricket notation: 19 valid balls is "3.1". */
    public static String oversNotation(int validBalls) {
        return (validBalls / 6) + "." + (validBalls % 6);
    }
}
