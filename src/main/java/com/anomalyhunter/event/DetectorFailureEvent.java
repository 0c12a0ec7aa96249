package com.anomalyhunter.event;

import com.anomalyhunter.domain.enums.StrategyId;
import org.springframework.context.ApplicationEvent;

/**
 * Published when a single detector throws or times out during an investigation. The run
 * itself continues with the remaining strategies.
 */
public class DetectorFailureEvent extends ApplicationEvent {

    private final StrategyId strategyId;
    private final String reason;

    public DetectorFailureEvent(Object source, StrategyId strategyId, String reason) {
        super(source);
        this.strategyId = strategyId;
        this.reason = reason;
    }

    public StrategyId getStrategyId() {
        return strategyId;
    }

    public String getReason() {
        return reason;
    }
}
