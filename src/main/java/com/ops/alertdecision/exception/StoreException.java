package com.ops.alertdecision.exception;

/**
 * Historical alert store query or append failed (connectivity, timeout, bad record).
 */
public class StoreException extends AlertDecisionException {

    public StoreException(String message) {
        super(ErrorCode.STORE_ERROR, message);
    }

    public StoreException(String message, Throwable cause) {
        super(ErrorCode.STORE_ERROR, message, cause);
    }
}
