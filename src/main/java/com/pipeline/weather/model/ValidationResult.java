package com.pipeline.weather.model;

import java.io.Serializable;

/**
 * 单条原始读数的校验结果：要么是校验通过的读数，要么是拒绝原因
 */
public class ValidationResult implements Serializable {
    private final ValidatedReading reading;
    private final RejectionReason reason;
    private final String message;

    private ValidationResult(ValidatedReading reading, RejectionReason reason, String message) {
        this.reading = reading;
        this.reason = reason;
        this.message = message;
    }

    public static ValidationResult success(ValidatedReading reading) {
        return new ValidationResult(reading, null, null);
    }

    public static ValidationResult rejected(RejectionReason reason, String message) {
        return new ValidationResult(null, reason, message);
    }

    public boolean isValid() { return reading != null; }
    public ValidatedReading getReading() { return reading; }
    public RejectionReason getReason() { return reason; }
    public String getMessage() { return message; }

    @Override
    public String toString() {
        return isValid() ? "ValidationResult{valid}" : "ValidationResult{" + reason + ": " + message + "}";
    }
}
