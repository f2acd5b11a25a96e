package org.jstats.cricketlens_api.modules.match_report.stats;

/**
 * Counters for one pairing: a batter against a bowler, or a partnership against a bowler.
 */
public class MatchupStat {

    private int runs;
    private int balls;
    private int fours;
    private int sixes;
    private int dots;
    private int dismissals;

    private double strikeRate;
    private double runRate;

    void addRuns(int r) { runs += r; }
    void addBall() { balls++; }
    void addFour() { fours++; }
    void addSix() { sixes++; }
    void addDot() { dots++; }
    void addDismissal() { dismissals++; }

    void finish() {
        strikeRate = Rates.strikeRate(runs, balls);
        runRate = Rates.runRate(runs, balls);
    }

    public int getRuns() { return runs; }
    public int getBalls() { return balls; }
    public int getFours() { return fours; }
    public int getSixes() { return sixes; }
    public int getDots() { return dots; }

    /** Dismissals of the batter credited to the bowler; equals the bowler's wickets in this pairing. */
    public int getDismissals() { return dismissals; }

    public double getStrikeRate() { return strikeRate; }
    public double getRunRate() { return runRate; }

    public double getBoundaryPercent() {
        return Rates.percent(fours + sixes, balls);
    }

    public double getDotPercent() {
        return Rates.percent(dots, balls);
    }
}
