package com.anomalyhunter.exception;

import com.anomalyhunter.domain.enums.StrategyId;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;

@Getter
public class AllStrategiesFailedException extends BaseException {

    private final List<DetectorFailureException> failures;

    public AllStrategiesFailedException(List<DetectorFailureException> failures) {
        super(ErrorCode.ALL_STRATEGIES_FAILED, "All detection strategies failed", describe(failures));
        this.failures = List.copyOf(failures);
        failures.forEach(this::addSuppressed);
    }

    private static Map<String, Object> describe(List<DetectorFailureException> failures) {
        Map<String, Object> details = new LinkedHashMap<>();
        for (DetectorFailureException failure : failures) {
            StrategyId strategyId = failure.getStrategyId();
            details.put(strategyId.getKey(), failure.getMessage());
        }
        return details;
    }
}
