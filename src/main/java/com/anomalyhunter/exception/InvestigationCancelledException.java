package com.anomalyhunter.exception;

public class InvestigationCancelledException extends BaseException {

    public InvestigationCancelledException(String message) {
        super(ErrorCode.INVESTIGATION_CANCELLED, message);
    }

    public InvestigationCancelledException(String message, Throwable cause) {
        super(ErrorCode.INVESTIGATION_CANCELLED, message, cause);
    }
}
