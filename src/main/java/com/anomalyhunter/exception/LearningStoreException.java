package com.anomalyhunter.exception;

/**
 * Wraps failures of the durable learning-state store. Retried by the persister and
 * logged once retries are exhausted; never propagated to a caller waiting for a verdict.
 */
public class LearningStoreException extends BaseException {

    public LearningStoreException(String message, Throwable cause) {
        super(ErrorCode.LEARNING_STORE_ERROR, message, cause);
    }
}
