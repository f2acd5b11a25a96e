package org.jstats.cricketlens_api.modules.match_report.stats;

import org.jspecify.annotations.Nullable;
import org.jstats.cricketlens_api.modules.match_report.model.Delivery;
import org.jstats.cricketlens_api.modules.match_report.model.DismissalKind;
import org.jstats.cricketlens_api.modules.match_report.model.Innings;
import org.jstats.cricketlens_api.modules.match_report.model.MatchRecord;
import org.jstats.cricketlens_api.modules.match_report.model.Over;
import org.jstats.cricketlens_api.modules.match_report.model.Wicket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.jstats.cricketlens_api.modules.match_report.model.MatchRecord.UNKNOWN;

/**
 * Running state of a single pass over one innings. Instances are single-use and never shared;
 * the delivery order matters because partnerships and overs accumulate incrementally.
 */
final class InningsAggregator {

    private static final Logger log = LoggerFactory.getLogger(InningsAggregator.class);

    private final int number;
    private final String path;
    private final Innings innings;
    private final MatchRecord match;
    private final PhasePolicy phasePolicy;
    private final Set<String> knownPlayers = new HashSet<>();
    private final Set<String> reportedPlayers = new HashSet<>();

    private final Map<String, BatterStat> batters = new LinkedHashMap<>();
    private final Map<String, BowlerStat> bowlers = new LinkedHashMap<>();
    private final Map<String, FielderStat> fielders = new LinkedHashMap<>();
    private final Map<MatchupKey, MatchupStat> matchups = new LinkedHashMap<>();
    private final List<Partnership> partnerships = new ArrayList<>();
    private final List<OverSummary> overs = new ArrayList<>();
    private final List<DeliveryWarning> warnings = new ArrayList<>();

    private @Nullable Partnership partnership;
    private OverAccumulator over = new OverAccumulator(0);

    private int runs;
    private int wickets;
    private int extras;
    private int fours;
    private int sixes;
    private int deliveries;
    private int validBalls;

    InningsAggregator(int index, Innings innings, MatchRecord match, PhasePolicy phasePolicy) {
        this.number = index + 1;
        this.path = "innings[" + index + "]";
        this.innings = innings;
        this.match = match;
        this.phasePolicy = phasePolicy;
        match.players().values().forEach(knownPlayers::addAll);
    }

    InningsStatistics aggregate() {
        int previousOver = -1;
        List<Over> inningsOvers = innings.overs();
        for (int o = 0; o < inningsOvers.size(); o++) {
            Over source = inningsOvers.get(o);
            String overPath = path + ".overs[" + o + "]";
            if (source.number() <= previousOver) {
                warn(overPath + ".over", DeliveryWarning.Kind.DELIVERY,
                        "over " + source.number() + " follows over " + previousOver);
            }
            if (source.deliveries().isEmpty()) {
                warn(overPath + ".deliveries", DeliveryWarning.Kind.DELIVERY, "over has no deliveries");
            }
            previousOver = source.number();
            over = new OverAccumulator(source.number());

            List<Delivery> balls = source.deliveries();
            for (int d = 0; d < balls.size(); d++) {
                String deliveryPath = overPath + ".deliveries[" + d + "]";
                try {
                    onDelivery(balls.get(d), deliveryPath);
                } catch (RuntimeException ex) {
                    log.warn("Failed to aggregate {}: {}", deliveryPath, ex.getMessage(), ex);
                    warn(deliveryPath, DeliveryWarning.Kind.DELIVERY,
                            "delivery could not be aggregated: " + ex.getMessage());
                }
            }
            closeOver();
        }

        if (partnership != null) {
            closePartnership(false);
        }

        batters.values().forEach(BatterStat::finish);
        bowlers.values().forEach(BowlerStat::finish);
        matchups.values().forEach(MatchupStat::finish);

        return new InningsStatistics(
                number,
                innings.team(),
                match.opponentOf(innings.team()),
                runs, wickets, extras, fours, sixes, deliveries, validBalls,
                Rates.runRate(runs, validBalls),
                overs,
                phaseSplits(),
                partnerships,
                new ArrayList<>(batters.values()),
                new ArrayList<>(bowlers.values()),
                new ArrayList<>(fielders.values()),
                matchups,
                warnings);
    }

    private void onDelivery(Delivery delivery, String deliveryPath) {
        String striker = checkPlayer(delivery.batter(), deliveryPath + ".batter");
        String nonStriker = checkPlayer(delivery.nonStriker(), deliveryPath + ".non_striker");
        String bowlerName = checkPlayer(delivery.bowler(), deliveryPath + ".bowler");

        Delivery.Runs r = delivery.runs();
        if (!r.isConsistent()) {
            warn(deliveryPath + ".runs", DeliveryWarning.Kind.DELIVERY,
                    "total " + r.total() + " is not batter " + r.batter() + " + extras " + r.extras());
        }

        boolean valid = delivery.isValid();
        boolean dot = delivery.isDot();

        deliveries++;
        over.deliveries++;
        over.bowler = bowlerName;
        if (valid) {
            validBalls++;
            over.validBalls++;
        }
        if (dot) {
            over.dots++;
        }

        if (partnership == null) {
            partnership = new Partnership(partnerships.size() + 1, striker, nonStriker, runs);
        }
        Partnership pair = partnership;
        BatterStat batter = batter(striker);
        batter(nonStriker);
        BowlerStat bowler = bowler(bowlerName);
        MatchupStat matchup = matchup(striker, bowlerName);
        MatchupStat pairVsBowler = pair.against(bowlerName);

        runs += r.total();
        extras += r.extras();
        over.runs += r.total();
        over.extras += r.extras();
        pair.addRuns(r.total());
        pairVsBowler.addRuns(r.total());
        bowler.addRuns(r.total());
        bowler.addWides(delivery.extras().wides());
        bowler.addNoBalls(delivery.extras().noBalls());
        batter.addRuns(r.batter());
        matchup.addRuns(r.batter());

        if (delivery.isFour()) {
            fours++;
            over.fours++;
            pair.addFour();
            pairVsBowler.addFour();
            batter.addFour();
            matchup.addFour();
            bowler.addFour();
        } else if (delivery.isSix()) {
            sixes++;
            over.sixes++;
            pair.addSix();
            pairVsBowler.addSix();
            batter.addSix();
            matchup.addSix();
            bowler.addSix();
        }

        if (valid) {
            pair.addBall();
            pairVsBowler.addBall();
            batter.addBall();
            matchup.addBall();
            bowler.addBall();
        }
        if (dot) {
            pair.addDot();
            pairVsBowler.addDot();
            batter.addDot();
            matchup.addDot();
            bowler.addDot();
        }

        if (delivery.hasWickets()) {
            List<Wicket> fallen = delivery.wickets();
            for (int w = 0; w < fallen.size(); w++) {
                onWicket(fallen.get(w), bowlerName, striker, nonStriker, deliveryPath + ".wickets[" + w + "]");
            }
            closePartnership(true);
        }
    }

    private void onWicket(Wicket wicket, String bowlerName, String striker, String nonStriker, String wicketPath) {
        DismissalKind kind = wicket.kind();
        String out = checkPlayer(wicket.playerOut(), wicketPath + ".player_out");

        if (!out.equals(striker) && !out.equals(nonStriker)) {
            warn(wicketPath + ".player_out", DeliveryWarning.Kind.DELIVERY,
                    out + " is not at the crease (" + striker + ", " + nonStriker + ")");
        }
        if (kind == DismissalKind.OTHER) {
            warn(wicketPath + ".kind", DeliveryWarning.Kind.DELIVERY,
                    "unrecognized dismissal kind '" + wicket.rawKind() + "'");
        }
        if (kind.expectsFielders() && wicket.fielders().isEmpty()) {
            warn(wicketPath + ".fielders", DeliveryWarning.Kind.DELIVERY,
                    kind.label() + " without a credited fielder");
        }

        if (kind != DismissalKind.RETIRED_HURT) {
            wickets++;
            over.wickets++;
        }

        BatterStat dismissed = batter(out);
        if (kind.isBowlerCredited()) {
            dismissed.addDismissal();
            matchup(out, bowlerName).addDismissal();
            bowler(bowlerName).addWicket();
        }

        List<String> names = new ArrayList<>();
        List<Wicket.Fielder> listed = wicket.fielders();
        for (int f = 0; f < listed.size(); f++) {
            names.add(checkPlayer(listed.get(f).name(), wicketPath + ".fielders[" + f + "].name"));
        }
        creditFielders(kind, listed, bowlerName);
        dismissed.dismissedBy(new BatterStat.Dismissal(kind, wicket.rawKind(), bowlerName, names));
    }

    private void creditFielders(DismissalKind kind, List<Wicket.Fielder> listed, String bowlerName) {
        switch (kind.fieldingCredit()) {
            case FIRST_FIELDER_CATCH -> {
                if (!listed.isEmpty()) {
                    Wicket.Fielder catcher = listed.get(0);
                    fielder(catcher.name()).addCatch(catcher.position());
                }
            }
            case BOWLER_CATCH -> fielder(bowlerName).addCatch("bowler");
            case ALL_FIELDERS_STUMPING -> listed.forEach(f -> fielder(f.name()).addStumping(f.position()));
            case ALL_FIELDERS_RUN_OUT -> listed.forEach(f -> fielder(f.name()).addRunOut(f.position()));
            case NONE -> {
            }
        }
    }

    private void closeOver() {
        boolean maiden = over.runs == 0 && over.validBalls == 6;
        if (maiden && bowlers.containsKey(over.bowler)) {
            bowlers.get(over.bowler).addMaiden();
        }
        overs.add(new OverSummary(
                over.number,
                over.bowler,
                over.runs,
                over.wickets,
                over.fours,
                over.sixes,
                over.extras,
                over.dots,
                over.deliveries,
                over.validBalls,
                runs,
                wickets,
                Rates.runRate(over.runs, over.validBalls),
                Rates.runRate(runs, validBalls),
                maiden));
    }

    private void closePartnership(boolean byWicket) {
        if (partnership == null) return;
        partnership.close(runs, byWicket);
        partnerships.add(partnership);
        partnership = null;
    }

    private List<PhaseSplit> phaseSplits() {
        Map<Phase, List<OverSummary>> byPhase = new EnumMap<>(Phase.class);
        for (Phase phase : Phase.values()) {
            byPhase.put(phase, new ArrayList<>());
        }
        for (OverSummary summary : overs) {
            byPhase.get(phasePolicy.phaseOf(summary.number())).add(summary);
        }
        List<PhaseSplit> splits = new ArrayList<>();
        byPhase.forEach((phase, list) -> splits.add(PhaseSplit.of(phase, list)));
        return splits;
    }

    // ---------- tables ----------

    private BatterStat batter(String name) {
        return batters.computeIfAbsent(name, BatterStat::new);
    }

    private BowlerStat bowler(String name) {
        return bowlers.computeIfAbsent(name, BowlerStat::new);
    }

    private FielderStat fielder(String name) {
        return fielders.computeIfAbsent(name, FielderStat::new);
    }

    private MatchupStat matchup(String batter, String bowler) {
        return matchups.computeIfAbsent(new MatchupKey(batter, bowler), k -> new MatchupStat());
    }

    // ---------- warnings ----------

    /**
     * Missing names land in the {@value MatchRecord#UNKNOWN} bucket; names outside both playing
     * XIs are kept as given. Either case is reported once per innings.
     */
    private String checkPlayer(String name, String fieldPath) {
        if (UNKNOWN.equals(name)) {
            warn(fieldPath, DeliveryWarning.Kind.UNKNOWN_PLAYER_REFERENCE, "player name missing");
        } else if (!knownPlayers.isEmpty() && !knownPlayers.contains(name) && reportedPlayers.add(name)) {
            warn(fieldPath, DeliveryWarning.Kind.UNKNOWN_PLAYER_REFERENCE,
                    name + " is not in either team's players list");
        }
        return name;
    }

    private void warn(String fieldPath, DeliveryWarning.Kind kind, String message) {
        warnings.add(new DeliveryWarning(number, fieldPath, kind, message));
    }

    private static final class OverAccumulator {
        private final int number;
        private String bowler = UNKNOWN;
        private int runs;
        private int wickets;
        private int fours;
        private int sixes;
        private int extras;
        private int dots;
        private int deliveries;
        private int validBalls;

        private OverAccumulator(int number) {
            this.number = number;
        }
    }
}
