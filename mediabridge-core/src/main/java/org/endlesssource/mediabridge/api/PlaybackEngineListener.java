package org.endlesssource.mediabridge.api;

/**
 * Listener for local playback engine notifications
 */
public interface PlaybackEngineListener {

    /**
     * Called when the playback state changes. A track change while playing
     * is reported as {@code PLAYING -> PLAYING}.
     * @param oldState The previous state
     * @param newState The new state
     */
    default void onPlaybackStateChanged(PlaybackState oldState, PlaybackState newState) {}

    /**
     * Called after the engine seeked
     * @param positionMs The new position in milliseconds
     */
    default void onSeeked(long positionMs) {}

    /**
     * Called when the mixer volume changes
     * @param volume The new volume, 0-100
     */
    default void onVolumeChanged(int volume) {}
}
