package com.growthpilot.platform.scheduler.client;

import lombok.Getter;

import java.time.Duration;

@Getter
public class PlatformClientException extends RuntimeException {

    private final FailureClass failureClass;
    private final String errorCode;
    private final Integer httpStatus;
    private final Duration retryAfter;

    public PlatformClientException(FailureClass failureClass, String errorCode, String message,
                                   Integer httpStatus, Duration retryAfter, Throwable cause) {
        super(message, cause);
        this.failureClass = failureClass;
        this.errorCode = errorCode;
        this.httpStatus = httpStatus;
        this.retryAfter = retryAfter;
    }

    public PlatformClientException(FailureClass failureClass, String errorCode, String message) {
        this(failureClass, errorCode, message, null, null, null);
    }

    public static PlatformClientException fromStatus(int status, String message, Duration retryAfter, Throwable cause) {
        String code = status == 429 ? "RATE_LIMITED" : "HTTP_" + status;
        return new PlatformClientException(classifyStatus(status), code, message, status, retryAfter, cause);
    }

    /** Failure reported in a 2xx body by the connector. */
    public static PlatformClientException fromErrorCode(String errorCode, String message) {
        return new PlatformClientException(classifyErrorCode(errorCode),
                errorCode != null ? errorCode : "UNKNOWN", message);
    }

    public static FailureClass classifyStatus(int status) {
        if (status == 408 || status == 429 || status >= 500) {
            return FailureClass.TRANSIENT;
        }
        return FailureClass.PERMANENT;
    }

    public static FailureClass classifyErrorCode(String errorCode) {
        boolean retryable = errorCode != null && (
                errorCode.contains("TIMEOUT") ||
                errorCode.contains("RATE_LIMIT") ||
                errorCode.contains("SERVICE_UNAVAILABLE") ||
                errorCode.contains("CONNECTION") ||
                errorCode.contains("500")
        );
        return retryable ? FailureClass.TRANSIENT : FailureClass.PERMANENT;
    }

    public boolean isTransient() {
        return failureClass == FailureClass.TRANSIENT;
    }

    public boolean isRateLimited() {
        return (httpStatus != null && httpStatus == 429)
                || (errorCode != null && errorCode.contains("RATE_LIMIT"));
    }
}
