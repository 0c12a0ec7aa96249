package com.anomalyhunter.detector;

import com.anomalyhunter.domain.enums.StrategyId;
import com.anomalyhunter.domain.model.Finding;
import com.anomalyhunter.domain.model.Series;

/**
 * One independent detection strategy.
 *
 * <p>Implementations are stateless and treat the series as read-only, so the synthesis
 * step can run all of them concurrently on the same input. A degenerate series (constant,
 * or shorter than the strategy's window) yields a finding with no anomalies rather than an
 * exception. Any exception that does escape is treated as a failure of this strategy only.
 */
public interface AnomalyDetector {

    StrategyId getStrategyId();

    Finding detect(Series series);
}
