package org.jstats.cricketlens_api.modules.match_report.config;

import org.jspecify.annotations.Nullable;
import org.jstats.cricketlens_api.modules.match_report.stats.PhasePolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Tuning of the aggregation and the rendered report.
 *
 * @param partnershipBreakdownMinRuns partnerships with at least this many runs get a per-bowler breakdown
 * @param defaultPhases               phase boundaries for formats without an entry in {@code phases}
 * @param phases                      phase boundaries keyed by match type (case-insensitive)
 */
@ConfigurationProperties(prefix = "cricketlens.report")
public record ReportProperties(
        @DefaultValue("20") int partnershipBreakdownMinRuns,
        @Nullable PhasePolicy defaultPhases,
        @Nullable Map<String, PhasePolicy> phases) {

    private static final Map<String, PhasePolicy> BUILT_IN = Map.of(
            "T20", PhasePolicy.T20,
            "IT20", PhasePolicy.T20,
            "ODI", PhasePolicy.ODI,
            "ODM", PhasePolicy.ODI);

    public ReportProperties {
        if (defaultPhases == null) defaultPhases = PhasePolicy.T20;
        Map<String, PhasePolicy> merged = new HashMap<>(BUILT_IN);
        if (phases != null) {
            phases.forEach((type, policy) -> merged.put(type.toUpperCase(Locale.ROOT), policy));
        }
        phases = Map.copyOf(merged);
    }

    public static ReportProperties defaults() {
        return new ReportProperties(20, null, null);
    }

    public PhasePolicy phasePolicyFor(String matchType) {
        PhasePolicy configured = phases.get(matchType.toUpperCase(Locale.ROOT));
        return configured != null ? configured : defaultPhases;
    }
}
