package org.jstats.cricketlens_api.modules.match_report.stats;

public class BowlerStat {

    private final String name;

    private int validBalls;
    private int runs;
    private int wickets;
    private int maidens;
    private int fours;
    private int sixes;
    private int dots;
    private int wides;
    private int noBalls;

    private double overs;
    private double economy;

    BowlerStat(String name) {
        this.name = name;
    }

    void addBall() { validBalls++; }
    void addRuns(int r) { runs += r; }
    void addWicket() { wickets++; }
    void addMaiden() { maidens++; }
    void addFour() { fours++; }
    void addSix() { sixes++; }
    void addDot() { dots++; }
    void addWides(int w) { wides += w; }
    void addNoBalls(int n) { noBalls += n; }

    void finish() {
        overs = Rates.overs(validBalls);
        economy = Rates.economy(runs, overs);
    }

    public String getName() { return name; }
    public int getValidBalls() { return validBalls; }

    /** All runs scored off this bowler's deliveries, extras included. */
    public int getRuns() { return runs; }

    public int getWickets() { return wickets; }
    public int getMaidens() { return maidens; }
    public int getFours() { return fours; }
    public int getSixes() { return sixes; }
    public int getDots() { return dots; }
    public int getWides() { return wides; }
    public int getNoBalls() { return noBalls; }

    /** Completed overs plus the balls of an unfinished one, as sixths. Not rounded. */
    public double getOvers() { return overs; }

    public String getOversNotation() {
        return Rates.oversNotation(validBalls);
    }

    public double getEconomy() { return economy; }
}
