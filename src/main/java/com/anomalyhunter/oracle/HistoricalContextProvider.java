package com.anomalyhunter.oracle;

import com.anomalyhunter.domain.model.SeriesSummary;
import java.util.List;

/**
 * Optional source of prior-pattern context (knowledge base, incident archive) that is
 * forwarded to the oracle. Its absence only affects the prose, never a detector's numbers.
 */
public interface HistoricalContextProvider {

    List<String> query(SeriesSummary seriesSummary);
}
