package org.jstats.cricketlens_api.modules.match_report.stats;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class FielderStat {

    private final String name;

    private final Map<String, Integer> catchesByPosition = new LinkedHashMap<>();
    private final Map<String, Integer> stumpingsByPosition = new LinkedHashMap<>();
    private final Map<String, Integer> runOutsByPosition = new LinkedHashMap<>();

    FielderStat(String name) {
        this.name = name;
    }

    void addCatch(String position) {
        catchesByPosition.merge(position, 1, Integer::sum);
    }

    void addStumping(String position) {
        stumpingsByPosition.merge(position, 1, Integer::sum);
    }

    void addRunOut(String position) {
        runOutsByPosition.merge(position, 1, Integer::sum);
    }

    public String getName() { return name; }

    public int getCatches() { return total(catchesByPosition); }
    public int getStumpings() { return total(stumpingsByPosition); }
    public int getRunOuts() { return total(runOutsByPosition); }

    public int getDismissals() {
        return getCatches() + getStumpings() + getRunOuts();
    }

    public Map<String, Integer> getCatchesByPosition() {
        return Collections.unmodifiableMap(catchesByPosition);
    }

    public Map<String, Integer> getStumpingsByPosition() {
        return Collections.unmodifiableMap(stumpingsByPosition);
    }

    public Map<String, Integer> getRunOutsByPosition() {
        return Collections.unmodifiableMap(runOutsByPosition);
    }

    private static int total(Map<String, Integer> byPosition) {
        return byPosition.values().stream().mapToInt(Integer::intValue).sum();
    }
}
