package org.jstats.cricketlens_api.modules.match_report.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed set of dismissal kinds. Each kind states whether the bowler is credited with the
 * wicket and how the listed fielders are credited.
 */
public enum DismissalKind {

    BOWLED("bowled", true, FieldingCredit.NONE),
    CAUGHT("caught", true, FieldingCredit.FIRST_FIELDER_CATCH),
    CAUGHT_AND_BOWLED("caught and bowled", true, FieldingCredit.BOWLER_CATCH),
    LBW("lbw", true, FieldingCredit.NONE),
    STUMPED("stumped", true, FieldingCredit.ALL_FIELDERS_STUMPING),
    HIT_WICKET("hit wicket", true, FieldingCredit.NONE),
    RUN_OUT("run out", false, FieldingCredit.ALL_FIELDERS_RUN_OUT),
    RETIRED_HURT("retired hurt", false, FieldingCredit.NONE),
    RETIRED_OUT("retired out", false, FieldingCredit.NONE),
    OBSTRUCTING_THE_FIELD("obstructing the field", false, FieldingCredit.NONE),
    HANDLED_THE_BALL("handled the ball", false, FieldingCredit.NONE),
    HIT_THE_BALL_TWICE("hit the ball twice", false, FieldingCredit.NONE),
    TIMED_OUT("timed out", false, FieldingCredit.NONE),
    // unrecognized labels; the bowler keeps the credit
    OTHER("other", true, FieldingCredit.NONE);

    public enum FieldingCredit {
        NONE,
        FIRST_FIELDER_CATCH,
        BOWLER_CATCH,
        ALL_FIELDERS_STUMPING,
        ALL_FIELDERS_RUN_OUT
    }

    private static final Map<String, DismissalKind> BY_LABEL = Arrays.stream(values())
            .filter(k -> k != OTHER)
            .collect(Collectors.toUnmodifiableMap(k -> k.label, Function.identity()));

    private final String label;
    private final boolean bowlerCredited;
    private final FieldingCredit fieldingCredit;

    DismissalKind(String label, boolean bowlerCredited, FieldingCredit fieldingCredit) {
        this.label = label;
        this.bowlerCredited = bowlerCredited;
        this.fieldingCredit = fieldingCredit;
    }

    public String label() {
        return label;
    }

    public boolean isBowlerCredited() {
        return bowlerCredited;
    }

    public FieldingCredit fieldingCredit() {
        return fieldingCredit;
    }

    /** True when the dismissal should list at least one fielder. */
    public boolean expectsFielders() {
        return fieldingCredit == FieldingCredit.FIRST_FIELDER_CATCH
                || fieldingCredit == FieldingCredit.ALL_FIELDERS_STUMPING
                || fieldingCredit == FieldingCredit.ALL_FIELDERS_RUN_OUT;
    }

    public static DismissalKind fromLabel(String label) {
        if (label == null) return OTHER;
        return BY_LABEL.getOrDefault(label.trim().toLowerCase(Locale.ROOT), OTHER);
    }
}
