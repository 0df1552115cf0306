package com.wifi.features.extractor.exception;

/**
 * Exception thrown when the Kismet device inventory cannot be fetched or parsed.
 */
public class DeviceSourceException extends RuntimeException {

    public DeviceSourceException(String message) {
        super(message);
    }

    public DeviceSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
