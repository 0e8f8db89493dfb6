package com.xksgroup.hlsmanifest.exception;

/**
 * The manifest parser could not make sense of its input.
 */
public class ManifestParseException extends RuntimeException {

    public ManifestParseException(String message) {
        super(message);
    }

    public ManifestParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
