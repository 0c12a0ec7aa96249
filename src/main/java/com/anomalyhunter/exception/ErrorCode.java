package com.anomalyhunter.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    NOT_FOUND("NOT_FOUND", 404),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    DETECTOR_FAILURE("DETECTOR_FAILURE", 500),
    LEARNING_STORE_ERROR("LEARNING_STORE_ERROR", 500),
    ALL_STRATEGIES_FAILED("ALL_STRATEGIES_FAILED", 503),
    ORACLE_UNAVAILABLE("ORACLE_UNAVAILABLE", 503),
    INVESTIGATION_CANCELLED("INVESTIGATION_CANCELLED", 503);

    private final String code;
    private final int httpStatus;
}
