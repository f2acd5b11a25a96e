package org.jstats.cricketlens_api.modules.match_report.stats;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs added by one pair of batters. Opened on the first delivery the pair faces together and
 * closed when a wicket falls or the innings ends.
 */
public class Partnership {

    private final int number;
    private final List<String> batters;
    private final int startScore;
    private final Map<String, MatchupStat> vsBowlers = new LinkedHashMap<>();

    private int runs;
    private int balls;
    private int fours;
    private int sixes;
    private int dots;
    private int endScore;
    private boolean endedByWicket;

    private double runRate;
    private double boundaryPercent;
    private double dotPercent;

    Partnership(int number, String striker, String nonStriker, int startScore) {
        this.number = number;
        this.batters = List.of(striker, nonStriker);
        this.startScore = startScore;
        this.endScore = startScore;
    }

    MatchupStat against(String bowler) {
        return vsBowlers.computeIfAbsent(bowler, b -> new MatchupStat());
    }

    void addRuns(int r) { runs += r; }
    void addBall() { balls++; }
    void addFour() { fours++; }
    void addSix() { sixes++; }
    void addDot() { dots++; }

    void close(int teamScore, boolean byWicket) {
        endScore = teamScore;
        endedByWicket = byWicket;
        runRate = Rates.runRate(runs, balls);
        boundaryPercent = Rates.percent(fours + sixes, balls);
        dotPercent = Rates.percent(dots, balls);
        vsBowlers.values().forEach(MatchupStat::finish);
    }

    /** 1-based position in the innings. */
    public int getNumber() { return number; }
    public List<String> getBatters() { return batters; }
    public int getStartScore() { return startScore; }
    public int getEndScore() { return endScore; }
    public boolean isEndedByWicket() { return endedByWicket; }

    /** Team runs, extras included. */
    public int getRuns() { return runs; }

    public int getBalls() { return balls; }
    public int getFours() { return fours; }
    public int getSixes() { return sixes; }
    public int getDots() { return dots; }
    public double getRunRate() { return runRate; }
    public double getBoundaryPercent() { return boundaryPercent; }
    public double getDotPercent() { return dotPercent; }

    public Map<String, MatchupStat> getVsBowlers() {
        return Collections.unmodifiableMap(vsBowlers);
    }
}
