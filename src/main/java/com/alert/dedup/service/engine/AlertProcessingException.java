package com.alert.dedup.service.engine;

/**
 * Exception describing a failure while processing a single alert.
 *
 * The pipeline recovers these locally; they are logged and reported in
 * stage results, never thrown to the caller.
 */
public class AlertProcessingException extends RuntimeException {

    public static final String SUPPRESSION_RULE_FAILED = "SUPPRESSION_RULE_FAILED";

    private final String alertId;
    private final String errorCode;

    public AlertProcessingException(String message, String alertId, String errorCode, Throwable cause) {
        super(message, cause);
        this.alertId = alertId;
        this.errorCode = errorCode;
    }

    public String getAlertId() {
        return alertId;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
