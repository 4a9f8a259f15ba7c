package org.endlesssource.mediabridge.mpris;

import org.endlesssource.mediabridge.api.PlaybackEngine;
import org.endlesssource.mediabridge.api.PlaybackEngineListener;
import org.endlesssource.mediabridge.api.PlaybackState;
import org.endlesssource.mediabridge.api.StreamUrlResolver;
import org.endlesssource.mediabridge.api.Track;
import org.endlesssource.mediabridge.api.TrackUris;
import org.endlesssource.mediabridge.api.TracklistEntry;
import org.freedesktop.dbus.DBusPath;
import org.freedesktop.dbus.connections.impl.DBusConnection;
import org.freedesktop.dbus.exceptions.DBusException;
import org.freedesktop.dbus.interfaces.Properties;
import org.freedesktop.dbus.types.Variant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * {@link PlaybackEngine} driving an MPRIS2 player that implements the TrackList interface.
 *
 * <p>MPRIS has no mute; muting stores the volume and sets it to zero. Notifications are
 * produced by polling the player at a fixed delay.</p>
 */
class MprisPlaybackEngine implements PlaybackEngine {
    private static final Logger logger = LoggerFactory.getLogger(MprisPlaybackEngine.class);
    private static final long SEEK_DETECTION_TOLERANCE_MS = 1500L;

    private final AutoCloseable connection;
    private final String busName;
    private final MprisPlayer player;
    private final MprisTrackList trackList;
    private final Properties properties;
    private final StreamUrlResolver streamUrlResolver;
    private final List<PlaybackEngineListener> listeners = new CopyOnWriteArrayList<>();
    private final ScheduledExecutorService executor;

    // playable URL -> local URI, for reading back what we queued
    private final Map<String, String> urisByPlayable = new ConcurrentHashMap<>();
    // object path <-> tlid
    private final Map<String, Long> tlidsByPath = new ConcurrentHashMap<>();
    private final Map<Long, String> pathsByTlid = new ConcurrentHashMap<>();
    private final AtomicLong nextTlid = new AtomicLong(1);

    private final Object mixerLock = new Object();
    private boolean muted;
    private int volumeBeforeMute;

    private volatile boolean closed;
    private PlaybackState lastState = PlaybackState.STOPPED;
    private String lastTrackId;
    private int lastVolume = -1;
    private long lastPositionMs;
    private long lastPollNanos = System.nanoTime();

    MprisPlaybackEngine(DBusConnection connection,
                        String busName,
                        StreamUrlResolver streamUrlResolver,
                        Duration pollInterval) throws DBusException {
        this(connection, busName,
                connection.getRemoteObject(busName, MprisPlaybackEngineProvider.OBJECT_PATH, MprisPlayer.class),
                connection.getRemoteObject(busName, MprisPlaybackEngineProvider.OBJECT_PATH, MprisTrackList.class),
                connection.getRemoteObject(busName, MprisPlaybackEngineProvider.OBJECT_PATH, Properties.class),
                streamUrlResolver, pollInterval);
    }

    MprisPlaybackEngine(AutoCloseable connection,
                        String busName,
                        MprisPlayer player,
                        MprisTrackList trackList,
                        Properties properties,
                        StreamUrlResolver streamUrlResolver,
                        Duration pollInterval) {
        this.connection = connection;
        this.busName = busName;
        this.player = player;
        this.trackList = trackList;
        this.properties = properties;
        this.streamUrlResolver = streamUrlResolver;
        this.executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "mediabridge-mpris-poll");
            thread.setDaemon(true);
            return thread;
        });

        // Warm the baseline so the first poll only reports real changes.
        checkForChanges();
        executor.scheduleWithFixedDelay(this::checkForChanges,
                pollInterval.toMillis(), pollInterval.toMillis(), TimeUnit.MILLISECONDS);
        logger.info("Driving MPRIS player {}", busName);
    }

    String getBusName() {
        return busName;
    }

    @Override
    public Optional<Track> getCurrentTrack() {
        return readMetadata().flatMap(this::toTrack);
    }

    @Override
    public boolean isMuted() {
        synchronized (mixerLock) {
            return muted;
        }
    }

    @Override
    public int getVolume() {
        synchronized (mixerLock) {
            return muted ? volumeBeforeMute : readVolume();
        }
    }

    @Override
    public long getTimePosition() {
        try {
            return MprisValues.toMillis(properties.Get(MprisPlayer.INTERFACE, "Position"));
        } catch (Exception e) {
            logger.debug("Failed to get position from {}: {}", busName, e.getMessage());
            return 0L;
        }
    }

    @Override
    public PlaybackState getState() {
        try {
            return MprisValues.parsePlaybackStatus(properties.Get(MprisPlayer.INTERFACE, "PlaybackStatus"));
        } catch (Exception e) {
            logger.debug("Failed to get playback status from {}: {}", busName, e.getMessage());
            return PlaybackState.STOPPED;
        }
    }

    @Override
    public OptionalInt getTracklistIndex() {
        Optional<String> current = readMetadata().flatMap(MprisMetadataUtils::trackId);
        if (current.isEmpty()) {
            return OptionalInt.empty();
        }
        int index = readTrackPaths().indexOf(current.get());
        return index >= 0 ? OptionalInt.of(index) : OptionalInt.empty();
    }

    @Override
    public List<TracklistEntry> getTracklist() {
        List<String> paths = readTrackPaths();
        if (paths.isEmpty()) {
            return List.of();
        }
        try {
            List<DBusPath> trackIds = paths.stream().map(DBusPath::new).toList();
            List<Map<String, Variant<?>>> metadata = trackList.GetTracksMetadata(trackIds);
            List<TracklistEntry> entries = new ArrayList<>(metadata.size());
            for (Map<String, Variant<?>> raw : metadata) {
                MprisMetadataUtils.toMetadataMap(raw).ifPresent(map -> {
                    Optional<String> path = MprisMetadataUtils.trackId(map);
                    Optional<Track> track = toTrack(map);
                    if (path.isPresent() && track.isPresent()) {
                        entries.add(new TracklistEntry(tlidFor(path.get()), track.get()));
                    }
                });
            }
            return entries;
        } catch (Exception e) {
            logger.warn("Failed to read tracklist from {}: {}", busName, e.getMessage());
            return List.of();
        }
    }

    @Override
    public boolean next() {
        try {
            player.Next();
            return true;
        } catch (Exception e) {
            logger.warn("Failed to skip to next: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public boolean previous() {
        try {
            player.Previous();
            return true;
        } catch (Exception e) {
            logger.warn("Failed to go to previous: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public boolean pause() {
        try {
            player.Pause();
            return true;
        } catch (Exception e) {
            logger.warn("Failed to pause: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public boolean resume() {
        try {
            player.Play();
            return true;
        } catch (Exception e) {
            logger.warn("Failed to resume: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public boolean stop() {
        try {
            player.Stop();
            return true;
        } catch (Exception e) {
            logger.warn("Failed to stop: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public boolean seek(long positionMs) {
        try {
            Optional<String> trackId = readMetadata().flatMap(MprisMetadataUtils::trackId);
            if (trackId.isEmpty()) {
                logger.debug("Cannot seek because current track id is unavailable");
                return false;
            }
            player.SetPosition(new DBusPath(trackId.get()), MprisValues.toMicros(positionMs));
            return true;
        } catch (Exception e) {
            logger.warn("Failed to seek: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public boolean setVolume(int volume) {
        synchronized (mixerLock) {
            int clamped = MprisValues.clampVolume(volume);
            if (muted) {
                volumeBeforeMute = clamped;
                return true;
            }
            return writeVolume(clamped);
        }
    }

    @Override
    public boolean setMute(boolean mute) {
        synchronized (mixerLock) {
            if (mute == muted) {
                return true;
            }
            if (mute) {
                volumeBeforeMute = readVolume();
                if (writeVolume(0)) {
                    muted = true;
                    return true;
                }
                return false;
            }
            if (writeVolume(volumeBeforeMute)) {
                muted = false;
                return true;
            }
            return false;
        }
    }

    @Override
    public boolean clearTracklist() {
        try {
            for (String path : readTrackPaths()) {
                trackList.RemoveTrack(new DBusPath(path));
                forget(path);
            }
            return true;
        } catch (Exception e) {
            logger.warn("Failed to clear tracklist: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public List<TracklistEntry> addTracks(List<String> uris) {
        return insertAfter(uris, lastPath(readTrackPaths()));
    }

    @Override
    public List<TracklistEntry> addTracks(List<String> uris, int atPosition) {
        List<String> paths = readTrackPaths();
        if (atPosition <= 0) {
            return insertAfter(uris, MprisTrackList.NO_TRACK);
        }
        if (atPosition >= paths.size()) {
            return insertAfter(uris, lastPath(paths));
        }
        return insertAfter(uris, paths.get(atPosition - 1));
    }

    @Override
    public boolean play(TracklistEntry entry) {
        String path = pathsByTlid.get(entry.tlid());
        if (path == null) {
            logger.warn("Unknown tracklist entry {}", entry.tlid());
            return false;
        }
        try {
            trackList.GoTo(new DBusPath(path));
            player.Play();
            return true;
        } catch (Exception e) {
            logger.warn("Failed to play {}: {}", entry.track().uri(), e.getMessage());
            return false;
        }
    }

    @Override
    public void addListener(PlaybackEngineListener listener) {
        listeners.add(listener);
    }

    @Override
    public void removeListener(PlaybackEngineListener listener) {
        listeners.remove(listener);
    }

    @Override
    public void close() {
        closed = true;
        listeners.clear();
        executor.shutdownNow();
        try {
            connection.close();
        } catch (Exception e) {
            logger.error("Failed to close D-Bus connection", e);
        }
    }

    /**
     * Adds the tracks one by one, each after the previous, and maps the object paths
     * the player assigned back to entries.
     */
    private List<TracklistEntry> insertAfter(List<String> uris, String afterPath) {
        List<TracklistEntry> added = new ArrayList<>(uris.size());
        String after = afterPath;
        Set<String> known = new HashSet<>(readTrackPaths());
        try {
            for (String uri : uris) {
                String playable = toPlayable(uri);
                trackList.AddTrack(playable, new DBusPath(after), false);
                Optional<String> created = readTrackPaths().stream()
                        .filter(path -> !known.contains(path))
                        .findFirst();
                if (created.isEmpty()) {
                    logger.warn("Player did not add {}", uri);
                    continue;
                }
                known.add(created.get());
                after = created.get();
                added.add(new TracklistEntry(tlidFor(created.get()), Track.of(uri)));
            }
        } catch (Exception e) {
            logger.warn("Failed to add tracks: {}", e.getMessage());
        }
        return added;
    }

    private String toPlayable(String uri) {
        if (!TrackUris.isItemUri(uri)) {
            return uri;
        }
        String playable = streamUrlResolver.streamUrl(TrackUris.itemId(uri));
        urisByPlayable.put(playable, uri);
        return playable;
    }

    private Optional<Track> toTrack(Map<String, Object> metadata) {
        return MprisMetadataUtils.stringValue(metadata, MprisMetadataUtils.URL)
                .map(url -> new Track(urisByPlayable.getOrDefault(url, url),
                        MprisMetadataUtils.stringValue(metadata, MprisMetadataUtils.TITLE).orElse("")));
    }

    private long tlidFor(String path) {
        return tlidsByPath.computeIfAbsent(path, key -> {
            long tlid = nextTlid.getAndIncrement();
            pathsByTlid.put(tlid, key);
            return tlid;
        });
    }

    private void forget(String path) {
        Long tlid = tlidsByPath.remove(path);
        if (tlid != null) {
            pathsByTlid.remove(tlid);
        }
    }

    private static String lastPath(List<String> paths) {
        return paths.isEmpty() ? MprisTrackList.NO_TRACK : paths.get(paths.size() - 1);
    }

    private Optional<Map<String, Object>> readMetadata() {
        try {
            return MprisMetadataUtils.toMetadataMap(properties.Get(MprisPlayer.INTERFACE, "Metadata"));
        } catch (Exception e) {
            logger.debug("Failed to get metadata from {}: {}", busName, e.getMessage());
            return Optional.empty();
        }
    }

    private List<String> readTrackPaths() {
        try {
            return MprisMetadataUtils.paths(properties.Get(MprisTrackList.INTERFACE, "Tracks"));
        } catch (Exception e) {
            logger.debug("Failed to get tracks from {}: {}", busName, e.getMessage());
            return List.of();
        }
    }

    private int readVolume() {
        try {
            return MprisValues.toPercent(properties.Get(MprisPlayer.INTERFACE, "Volume"));
        } catch (Exception e) {
            logger.debug("Failed to get volume from {}: {}", busName, e.getMessage());
            return 0;
        }
    }

    private boolean writeVolume(int percent) {
        try {
            properties.Set(MprisPlayer.INTERFACE, "Volume", MprisValues.toMprisVolume(percent));
            return true;
        } catch (Exception e) {
            logger.warn("Failed to set volume: {}", e.getMessage());
            return false;
        }
    }

    synchronized void checkForChanges() {
        if (closed) {
            return;
        }

        try {
            long nowNanos = System.nanoTime();
            PlaybackState state = getState();
            String trackId = readMetadata().flatMap(MprisMetadataUtils::trackId).orElse(null);
            long positionMs = getTimePosition();
            boolean isMuted = isMuted();
            int volume = readVolume();

            PlaybackState previousState = lastState;
            boolean trackChanged = !Objects.equals(trackId, lastTrackId);
            if (state != previousState) {
                fire(listener -> listener.onPlaybackStateChanged(previousState, state));
            } else if (state == PlaybackState.PLAYING && trackChanged && lastTrackId != null) {
                fire(listener -> listener.onPlaybackStateChanged(PlaybackState.PLAYING, PlaybackState.PLAYING));
            } else if (!trackChanged && state.isActive()) {
                long expected = lastPositionMs;
                if (state == PlaybackState.PLAYING) {
                    expected += TimeUnit.NANOSECONDS.toMillis(nowNanos - lastPollNanos);
                }
                if (Math.abs(positionMs - expected) > SEEK_DETECTION_TOLERANCE_MS) {
                    fire(listener -> listener.onSeeked(positionMs));
                }
            }

            // volume moves while muted are our own doing
            if (!isMuted && lastVolume >= 0 && volume != lastVolume) {
                fire(listener -> listener.onVolumeChanged(volume));
            }

            lastState = state;
            lastTrackId = trackId;
            lastPositionMs = positionMs;
            lastPollNanos = nowNanos;
            if (!isMuted) {
                lastVolume = volume;
            }
        } catch (Exception e) {
            logger.debug("Error checking for changes in {}: {}", busName, e.getMessage());
        }
    }

    private void fire(Consumer<PlaybackEngineListener> event) {
        listeners.forEach(event);
    }
}
