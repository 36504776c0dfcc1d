package com.imageinsight.describer.exception;

/**
 * The caller asked for a run that cannot be started.
 */
public class InvalidRunRequestException extends DescriberException {

    public InvalidRunRequestException(String message) {
        super("INVALID_REQUEST", message);
    }

    public InvalidRunRequestException(String message, Throwable cause) {
        super("INVALID_REQUEST", message, cause);
    }

    public static InvalidRunRequestException missingApiKey() {
        return new InvalidRunRequestException("API key is required. Please configure your vision API key.");
    }

    public static InvalidRunRequestException missingRunId() {
        return new InvalidRunRequestException("Run id must not be blank.");
    }

    public static InvalidRunRequestException noFields() {
        return new InvalidRunRequestException(
                "No fields selected. Choose at least one field (Alt Text, Caption, or Description).");
    }

    public static InvalidRunRequestException noItems() {
        return new InvalidRunRequestException("No images supplied.");
    }

    public static InvalidRunRequestException duplicateItemId(String id) {
        return new InvalidRunRequestException("Duplicate image id: " + id);
    }

    public static InvalidRunRequestException unknownField(String key) {
        return new InvalidRunRequestException("Unknown field: " + key);
    }
}
