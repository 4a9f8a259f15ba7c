package org.endlesssource.mediabridge.api;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.stream.Collectors;

/**
 * The local playback engine the bridge mirrors to the remote session.
 * Queries are synchronous; implementations must be safe to call from
 * the bridge worker and the heartbeat thread at the same time.
 */
public interface PlaybackEngine extends AutoCloseable {

    /**
     * Get the track currently loaded for playback
     * @return Optional containing the track, or empty if nothing is current
     */
    Optional<Track> getCurrentTrack();

    /**
     * @return true if the mixer is muted
     */
    boolean isMuted();

    /**
     * @return mixer volume, 0-100
     */
    int getVolume();

    /**
     * @return play position of the current track in milliseconds
     */
    long getTimePosition();

    /**
     * @return the current playback state
     */
    PlaybackState getState();

    /**
     * @return index of the current track in the tracklist, or empty if nothing is current
     */
    OptionalInt getTracklistIndex();

    /**
     * @return the tracklist, in play order
     */
    List<TracklistEntry> getTracklist();

    /**
     * @return the tracks of the tracklist, in play order
     */
    default List<Track> getTracks() {
        return getTracklist().stream().map(TracklistEntry::track).collect(Collectors.toList());
    }

    /**
     * Skip to the next track
     * @return true if the command was sent successfully
     */
    boolean next();

    /**
     * Go to the previous track
     * @return true if the command was sent successfully
     */
    boolean previous();

    /**
     * Pause playback
     * @return true if the command was sent successfully
     */
    boolean pause();

    /**
     * Resume paused playback
     * @return true if the command was sent successfully
     */
    boolean resume();

    /**
     * Stop playback
     * @return true if the command was sent successfully
     */
    boolean stop();

    /**
     * Seek within the current track
     * @param positionMs target position in milliseconds
     * @return true if the command was sent successfully
     */
    boolean seek(long positionMs);

    /**
     * @param volume new mixer volume; engines clamp to 0-100
     * @return true if the command was sent successfully
     */
    boolean setVolume(int volume);

    /**
     * @param mute new mute state
     * @return true if the command was sent successfully
     */
    boolean setMute(boolean mute);

    /**
     * Remove every track from the tracklist
     * @return true if the command was sent successfully
     */
    boolean clearTracklist();

    /**
     * Append tracks to the end of the tracklist
     * @param uris local URIs to add
     * @return the entries created, in order
     */
    List<TracklistEntry> addTracks(List<String> uris);

    /**
     * Insert tracks into the tracklist
     * @param uris local URIs to add
     * @param atPosition index the first new track will have
     * @return the entries created, in order
     */
    List<TracklistEntry> addTracks(List<String> uris, int atPosition);

    /**
     * Start playing the given tracklist entry
     * @param entry entry to play
     * @return true if the command was sent successfully
     */
    boolean play(TracklistEntry entry);

    /**
     * Add a listener for engine notifications
     * @param listener The listener to add
     */
    void addListener(PlaybackEngineListener listener);

    /**
     * Remove a listener
     * @param listener The listener to remove
     */
    void removeListener(PlaybackEngineListener listener);

    /**
     * Release resources held by this engine.
     */
    @Override
    void close();
}
