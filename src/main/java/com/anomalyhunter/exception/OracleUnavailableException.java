package com.anomalyhunter.exception;

/**
 * Thrown by {@code TextAndSeverityOracle} implementations when the backing service
 * cannot be reached. Never fatal: detectors fall back to their deterministic formulas.
 */
public class OracleUnavailableException extends BaseException {

    public OracleUnavailableException(String message) {
        super(ErrorCode.ORACLE_UNAVAILABLE, message);
    }

    public OracleUnavailableException(String message, Throwable cause) {
        super(ErrorCode.ORACLE_UNAVAILABLE, message, cause);
    }
}
