package com.anomalyhunter.oracle;

import com.anomalyhunter.exception.OracleUnavailableException;

/**
 * External reasoning capability that turns a detector's evidence into prose and a severity.
 *
 * <p>No implementation ships with the service; register a bean to enable it. Detectors never
 * depend on an answer: any failure, including {@link OracleUnavailableException}, a timeout or
 * an open circuit, makes the detector apply its deterministic fallback formula.
 */
public interface TextAndSeverityOracle {

    /**
     * @throws OracleUnavailableException if the backing service cannot be reached
     */
    OracleAssessment assess(OracleRequest request);
}
