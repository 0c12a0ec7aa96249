package com.anomalyhunter.exception;

import java.util.Map;

/**
 * Rejects a series before any detector runs: empty input, only non-finite samples,
 * or a timestamp list that does not line up with the values.
 */
public class InvalidInputException extends BaseException {

    public InvalidInputException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public InvalidInputException(String message, Map<String, Object> details) {
        super(ErrorCode.VALIDATION_ERROR, message, details);
    }
}
