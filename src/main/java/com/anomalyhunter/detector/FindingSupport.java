package com.anomalyhunter.detector;

import java.util.Collection;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

final class FindingSupport {

    static final int MIN_SEVERITY = 1;
    static final int MAX_SEVERITY = 10;

    /** Severity and confidence reported for series too short or too flat to analyze. */
    static final int DEGENERATE_SEVERITY = MIN_SEVERITY;
    static final double DEGENERATE_CONFIDENCE = 0.1;

    private FindingSupport() {}

    static SortedSet<Integer> indices(Collection<Integer> indices) {
        return Collections.unmodifiableSortedSet(new TreeSet<>(indices));
    }

    static SortedSet<Integer> noIndices() {
        return Collections.unmodifiableSortedSet(new TreeSet<>());
    }

    static double clampConfidence(double confidence) {
        return Math.min(1.0, Math.max(0.0, confidence));
    }

    static int clampSeverity(double severity) {
        return (int) Math.min(MAX_SEVERITY, Math.max(MIN_SEVERITY, severity));
    }
}
