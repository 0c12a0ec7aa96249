package com.anomalyhunter.domain.enums;

/** Direction of the sustained drift between the first and second half of a series. */
public enum Trend {
    UPWARD,
    DOWNWARD,
    STABLE
}
