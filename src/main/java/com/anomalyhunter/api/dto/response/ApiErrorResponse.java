package com.anomalyhunter.api.dto.response;

import com.anomalyhunter.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;
import lombok.Value;

/**
 * Error envelope written by {@code GlobalExceptionHandler}. {@code details} carries the
 * exception's structured context, e.g. the per-strategy failure messages of an
 * {@code ALL_STRATEGIES_FAILED} error.
 */
@Getter
public class ApiErrorResponse {

    private final boolean success = false;
    private final ErrorBody error;

    private ApiErrorResponse(ErrorBody error) {
        this.error = error;
    }

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        return new ApiErrorResponse(ErrorBody.builder()
                .code(errorCode.getCode())
                .message(message)
                .details(details == null || details.isEmpty() ? null : details)
                .path(path)
                .timestamp(Instant.now())
                .build());
    }

    @Value
    @Builder
    public static class ErrorBody {
        String code;
        String message;
        Map<String, Object> details;
        String path;
        Instant timestamp;
    }
}
