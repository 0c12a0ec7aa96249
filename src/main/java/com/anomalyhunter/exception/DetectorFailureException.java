package com.anomalyhunter.exception;

import com.anomalyhunter.domain.enums.StrategyId;
import java.util.Map;
import lombok.Getter;

/**
 * A single detector threw or exceeded its timeout. Recovered inside the synthesis step;
 * the run continues with the remaining strategies.
 */
@Getter
public class DetectorFailureException extends BaseException {

    private final StrategyId strategyId;

    public DetectorFailureException(StrategyId strategyId, String message, Throwable cause) {
        super(ErrorCode.DETECTOR_FAILURE, message, Map.of("strategy", strategyId.getKey()), cause);
        this.strategyId = strategyId;
    }
}
