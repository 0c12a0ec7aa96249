package com.anomalyhunter.domain.model;

import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** Condensed description of a series, used to query historical context. */
@Value
@Builder
public class SeriesSummary {

    int size;

    double mean;

    double stdDev;

    double min;

    double max;

    Map<String, String> metadata;
}
