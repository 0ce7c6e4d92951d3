package com.ops.alertdecision.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    INVALID_ALERT("INVALID_ALERT", 400),
    STORE_ERROR("STORE_ERROR", 503),
    CLASSIFIER_ERROR("CLASSIFIER_ERROR", 502);

    private final String code;
    private final int httpStatus;
}
