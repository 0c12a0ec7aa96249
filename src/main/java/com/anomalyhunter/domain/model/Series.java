package com.anomalyhunter.domain.model;

import com.anomalyhunter.exception.InvalidInputException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable numeric time series handed to every detector of a run.
 *
 * <p>Construction validates the raw input: null and non-finite samples (NaN, infinities)
 * are dropped together with their timestamps, and anomaly indices reported by detectors
 * refer to positions in the cleaned series. An input with no finite sample left is rejected
 * with {@link InvalidInputException} before any detector is invoked.
 *
 * <p>Timestamps are optional. When supplied they must line up one-to-one with the values.
 * Metadata is an opaque string map forwarded to strategies that want it (the cluster
 * analyzer reads {@code source}).
 */
public final class Series {

    public static final String METADATA_SOURCE = "source";

    private final double[] values;
    private final List<Instant> timestamps;
    private final Map<String, String> metadata;
    private final int droppedSamples;

    private Series(double[] values, List<Instant> timestamps, Map<String, String> metadata, int droppedSamples) {
        this.values = values;
        this.timestamps = timestamps;
        this.metadata = metadata;
        this.droppedSamples = droppedSamples;
    }

    public static Series of(double... values) {
        if (values == null) {
            throw new InvalidInputException("Series values must not be null");
        }
        List<Double> boxed = new ArrayList<>(values.length);
        for (double value : values) {
            boxed.add(value);
        }
        return of(boxed, null, null);
    }

    public static Series of(List<Double> values) {
        return of(values, null, null);
    }

    /**
     * Validates and copies raw input into a Series.
     *
     * @param values     raw samples, may contain nulls or non-finite values
     * @param timestamps optional timestamps, same length as values when present
     * @param metadata   optional opaque metadata
     * @throws InvalidInputException if no finite sample remains or the timestamps do not line up
     */
    public static Series of(List<Double> values, List<Instant> timestamps, Map<String, String> metadata) {
        if (values == null || values.isEmpty()) {
            throw new InvalidInputException("Series must contain at least one sample");
        }
        boolean hasTimestamps = timestamps != null && !timestamps.isEmpty();
        if (hasTimestamps && timestamps.size() != values.size()) {
            throw new InvalidInputException(
                    "Timestamp count does not match sample count",
                    Map.of("samples", values.size(), "timestamps", timestamps.size()));
        }

        double[] cleaned = new double[values.size()];
        List<Instant> keptTimestamps = new ArrayList<>();
        int kept = 0;
        for (int i = 0; i < values.size(); i++) {
            Double value = values.get(i);
            if (value == null || !Double.isFinite(value)) {
                continue;
            }
            cleaned[kept++] = value;
            if (hasTimestamps) {
                keptTimestamps.add(timestamps.get(i));
            }
        }

        if (kept == 0) {
            throw new InvalidInputException(
                    "Series contains no finite samples", Map.of("samples", values.size()));
        }

        Map<String, String> copiedMetadata =
                metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        return new Series(
                Arrays.copyOf(cleaned, kept),
                Collections.unmodifiableList(keptTimestamps),
                copiedMetadata,
                values.size() - kept);
    }

    public int size() {
        return values.length;
    }

    public double get(int index) {
        return values[index];
    }

    /** Returns a copy of the samples; callers may mutate it freely. */
    public double[] toArray() {
        return values.clone();
    }

    public boolean hasTimestamps() {
        return !timestamps.isEmpty();
    }

    public List<Instant> getTimestamps() {
        return timestamps;
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    /** Number of null or non-finite input samples removed during validation. */
    public int getDroppedSamples() {
        return droppedSamples;
    }

    @Override
    public String toString() {
        return "Series{size=" + values.length + ", dropped=" + droppedSamples + ", metadata=" + metadata + "}";
    }
}
