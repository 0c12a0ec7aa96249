package com.anomalyhunter.domain.enums;

/**
 * Action tier derived deterministically from a verdict's final severity.
 *
 * <ul>
 *   <li>CRITICAL -- severity 9 and above</li>
 *   <li>HIGH -- 7 to 8</li>
 *   <li>MEDIUM -- 5 to 6</li>
 *   <li>LOW -- 3 to 4</li>
 *   <li>MINIMAL -- below 3</li>
 * </ul>
 */
public enum Recommendation {
    CRITICAL(9, "Immediate action required. Alert on-call team, investigate root cause, prepare rollback plan."),
    HIGH(7, "Investigate within 1 hour. Monitor closely, prepare mitigation steps."),
    MEDIUM(5, "Investigate within 4 hours. Log for trending analysis, check if pattern persists."),
    LOW(3, "Note and monitor. May be normal variance."),
    MINIMAL(Integer.MIN_VALUE, "No action required. Data within normal parameters.");

    private final int minSeverity;
    private final String action;

    Recommendation(int minSeverity, String action) {
        this.minSeverity = minSeverity;
        this.action = action;
    }

    public int getMinSeverity() {
        return minSeverity;
    }

    public String getAction() {
        return action;
    }

    public static Recommendation forSeverity(int severity) {
        for (Recommendation recommendation : values()) {
            if (severity >= recommendation.minSeverity) {
                return recommendation;
            }
        }
        return MINIMAL;
    }
}
