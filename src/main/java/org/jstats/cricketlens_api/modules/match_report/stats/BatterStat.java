package org.jstats.cricketlens_api.modules.match_report.stats;

import org.jspecify.annotations.Nullable;
import org.jstats.cricketlens_api.modules.match_report.model.DismissalKind;

import java.util.List;

public class BatterStat {

    private final String name;

    private int runs;
    private int balls;
    private int fours;
    private int sixes;
    private int dots;
    private int dismissals;
    private @Nullable Dismissal howOut;

    private double strikeRate;

    BatterStat(String name) {
        this.name = name;
    }

    void addRuns(int r) { runs += r; }
    void addBall() { balls++; }
    void addFour() { fours++; }
    void addSix() { sixes++; }
    void addDot() { dots++; }
    void addDismissal() { dismissals++; }

    void dismissedBy(Dismissal dismissal) {
        this.howOut = dismissal;
    }

    void finish() {
        strikeRate = Rates.strikeRate(runs, balls);
    }

    public String getName() { return name; }
    public int getRuns() { return runs; }
    public int getBalls() { return balls; }
    public int getFours() { return fours; }
    public int getSixes() { return sixes; }
    public int getDots() { return dots; }

    /** Dismissals credited to a bowler. Run outs and retirements are not counted here. */
    public int getDismissals() { return dismissals; }

    public double getStrikeRate() { return strikeRate; }

    public @Nullable Dismissal getHowOut() { return howOut; }

    public boolean isOut() {
        return howOut != null && howOut.kind() != DismissalKind.RETIRED_HURT;
    }

    /**
     * @param kind     dismissal kind
     * @param label    source label of the kind
     * @param bowler   bowler of the delivery
     * @param fielders names of the listed fielders
     */
    public record Dismissal(DismissalKind kind, String label, String bowler, List<String> fielders) {

        public Dismissal {
            fielders = List.copyOf(fielders);
        }

        /** Scorecard style description, e.g. "c Smith b Jones". */
        public String describe() {
            String catcher = fielders.isEmpty() ? "" : fielders.get(0);
            return switch (kind) {
                case BOWLED -> "b " + bowler;
                case CAUGHT -> catcher.isEmpty() ? "c ? b " + bowler : "c " + catcher + " b " + bowler;
                case CAUGHT_AND_BOWLED -> "c & b " + bowler;
                case LBW -> "lbw b " + bowler;
                case STUMPED -> "st " + (catcher.isEmpty() ? "?" : catcher) + " b " + bowler;
                case HIT_WICKET -> "hit wicket b " + bowler;
                case RUN_OUT -> fielders.isEmpty() ? "run out" : "run out (" + String.join("/", fielders) + ")";
                case OTHER -> label;
                default -> kind.label();
            };
        }
    }
}
