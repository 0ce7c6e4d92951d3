package com.ops.alertdecision.exception;

public class ClassifierException extends AlertDecisionException {

    public ClassifierException(String message) {
        super(ErrorCode.CLASSIFIER_ERROR, message);
    }

    public ClassifierException(String message, Throwable cause) {
        super(ErrorCode.CLASSIFIER_ERROR, message, cause);
    }
}
