package com.spatialassistant.session;

/**
 * A capture or playback device could not be opened.
 */
public class DeviceAcquisitionException extends SessionException {
    public DeviceAcquisitionException(String message) {
        super(message);
    }

    public DeviceAcquisitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
