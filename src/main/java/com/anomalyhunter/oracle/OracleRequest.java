package com.anomalyhunter.oracle;

import com.anomalyhunter.domain.enums.StrategyId;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class OracleRequest {

    StrategyId strategyId;

    /** The detector's evidence bag, as it will appear in the finding. */
    Map<String, Object> evidence;

    /** Context strings from the {@link HistoricalContextProvider}; empty when none is configured. */
    List<String> historicalContext;
}
