package com.ops.alertdecision.exception;

import lombok.Getter;

/**
 * An ingested alert is missing a required field or carries an inconsistent value.
 */
@Getter
public class InvalidAlertException extends AlertDecisionException {

    private final String field;

    public InvalidAlertException(String message, String field) {
        super(ErrorCode.INVALID_ALERT, message);
        this.field = field;
    }
}
