package com.anomalyhunter.domain.enums;

/**
 * The three independent detection strategies whose findings are merged into a verdict.
 *
 * <p>The key is the stable identifier used in persisted learning state, metric tags and
 * REST payloads. Renaming an enum constant is safe; changing a key orphans stored history.
 */
public enum StrategyId {
    STATISTICAL("pattern_analyst"),
    DRIFT("change_detective"),
    CLUSTER("root_cause");

    private final String key;

    StrategyId(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    /**
     * Resolve a StrategyId from its persisted key (e.g., "root_cause" → CLUSTER).
     *
     * @throws IllegalArgumentException if no strategy matches the key
     */
    public static StrategyId fromKey(String key) {
        for (StrategyId strategyId : values()) {
            if (strategyId.key.equals(key)) {
                return strategyId;
            }
        }
        throw new IllegalArgumentException("Unknown strategy key: " + key);
    }
}
