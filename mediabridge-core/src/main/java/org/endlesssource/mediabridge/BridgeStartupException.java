package org.endlesssource.mediabridge;

/**
 * Fatal problem while assembling the bridge: missing token, unreadable
 * configuration or no usable playback engine.
 */
public class BridgeStartupException extends RuntimeException {

    public BridgeStartupException(String message) {
        super(message);
    }

    public BridgeStartupException(String message, Throwable cause) {
        super(message, cause);
    }
}
