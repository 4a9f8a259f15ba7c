package org.endlesssource.mediabridge.api;

/**
 * Playback state of the local engine
 */
public enum PlaybackState {
    PLAYING,
    PAUSED,
    STOPPED;

    /**
     * @return true while something is loaded for playback (playing or paused)
     */
    public boolean isActive() {
        return this == PLAYING || this == PAUSED;
    }
}
