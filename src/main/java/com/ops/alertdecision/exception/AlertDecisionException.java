package com.ops.alertdecision.exception;

import lombok.Getter;

/**
 * Base of the failures raised at the engine's external seams (historical store, classifier,
 * ingestion). Components inside the pipeline catch these at their boundary and fall back.
 */
@Getter
public abstract class AlertDecisionException extends RuntimeException {

    private final ErrorCode errorCode;

    protected AlertDecisionException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected AlertDecisionException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
