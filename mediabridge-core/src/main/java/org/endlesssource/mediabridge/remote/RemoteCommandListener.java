package org.endlesssource.mediabridge.remote;

/**
 * Receives commands arriving on the inbound channel. Called on the transport's
 * thread; implementations must hand work off without blocking.
 */
public interface RemoteCommandListener {

    default void onPlaystate(PlaystateCommand command) {}

    default void onGeneralCommand(GeneralCommand command) {}

    default void onPlayRequest(PlayRequest request) {}
}
