package com.github.trinity.samplingimager;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-point diagnostics, parallel-indexed with the {@link IndicatorField}.
 *
 * @author Sean Phillips
 */
public final class Diagnostics {

    private final List<PointDiagnostics> points;

    public Diagnostics(List<PointDiagnostics> points) {
        this.points = Collections.unmodifiableList(new ArrayList<>(points));
    }

    public int size() {
        return points.size();
    }

    public PointDiagnostics get(int index) {
        return points.get(index);
    }

    public List<PointDiagnostics> asList() {
        return points;
    }

    public List<Integer> illConditionedIndices() {
        List<Integer> indices = new ArrayList<>();
        for (int i = 0; i < points.size(); i++) {
            if (points.get(i).isIllConditioned()) {
                indices.add(i);
            }
        }
        return indices;
    }

    public int illConditionedCount() {
        return (int) points.stream().filter(PointDiagnostics::isIllConditioned).count();
    }

    public int minRetainedRank() {
        return points.stream().mapToInt(PointDiagnostics::getRetainedRank).min().orElse(0);
    }

    public int maxRetainedRank() {
        return points.stream().mapToInt(PointDiagnostics::getRetainedRank).max().orElse(0);
    }
}
