package com.phillippitts.transcripteval.exception;

/**
 * Thrown when a configured threshold cannot be used as a number.
 * The configuration layer catches it and falls back to the documented default.
 */
public class InvalidThresholdException extends TranscriptEvalException {

    private final String settingName;
    private final String rawValue;

    public InvalidThresholdException(String settingName, String rawValue, String reason) {
        super("Invalid value for " + settingName + "='" + rawValue + "': " + reason);
        this.settingName = settingName;
        this.rawValue = rawValue;
    }

    public InvalidThresholdException(String settingName, String rawValue, Throwable cause) {
        super("Invalid value for " + settingName + "='" + rawValue + "'", cause);
        this.settingName = settingName;
        this.rawValue = rawValue;
    }

    public String getSettingName() {
        return settingName;
    }

    public String getRawValue() {
        return rawValue;
    }
}
