package org.endlesssource.mediabridge.mpris;

import org.endlesssource.mediabridge.EngineSupport;
import org.endlesssource.mediabridge.api.PlaybackEngine;
import org.endlesssource.mediabridge.spi.EngineContext;
import org.endlesssource.mediabridge.spi.PlaybackEngineProvider;
import org.freedesktop.dbus.connections.impl.DBusConnection;
import org.freedesktop.dbus.connections.impl.DBusConnectionBuilder;
import org.freedesktop.dbus.exceptions.DBusException;
import org.freedesktop.dbus.interfaces.DBus;
import org.freedesktop.dbus.interfaces.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

public final class MprisPlaybackEngineProvider implements PlaybackEngineProvider {
    private static final Logger logger = LoggerFactory.getLogger(MprisPlaybackEngineProvider.class);

    static final String BUS_NAME_PREFIX = "org.mpris.MediaPlayer2.";
    static final String ROOT_INTERFACE = "org.mpris.MediaPlayer2";
    static final String OBJECT_PATH = "/org/mpris/MediaPlayer2";

    @Override
    public String engineId() {
        return "mpris";
    }

    boolean supportsCurrentOs() {
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        return os.contains("nix") || os.contains("nux");
    }

    @Override
    public EngineSupport probeSupport() {
        if (!supportsCurrentOs()) {
            return EngineSupport.unavailable(engineId(), "Current OS is not Linux");
        }
        try {
            Class.forName("org.freedesktop.dbus.connections.impl.DBusConnectionBuilder");
            return EngineSupport.available(engineId());
        } catch (ClassNotFoundException e) {
            return EngineSupport.unavailable(engineId(), "Missing D-Bus runtime classes");
        }
    }

    @Override
    public PlaybackEngine create(EngineContext context) {
        DBusConnection connection = null;
        try {
            connection = DBusConnectionBuilder.forSessionBus().build();
            String filter = context.config().playerFilter();
            Optional<String> busName = choosePlayer(connection, filter);
            if (busName.isEmpty()) {
                throw new IllegalStateException(filter.isEmpty()
                        ? "No MPRIS player found on the session bus"
                        : "No MPRIS player matching '" + filter + "' found on the session bus");
            }
            return new MprisPlaybackEngine(connection, busName.get(), context.streamUrlResolver(),
                    context.config().options().getEnginePollInterval());
        } catch (DBusException e) {
            closeQuietly(connection);
            throw new RuntimeException("Failed to initialize MPRIS engine: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            closeQuietly(connection);
            throw e;
        }
    }

    /**
     * Picks the first player whose bus name contains {@code filter}, preferring players
     * that expose the TrackList interface.
     */
    static Optional<String> choosePlayer(DBusConnection connection, String filter) throws DBusException {
        DBus dbus = connection.getRemoteObject("org.freedesktop.DBus", "/org/freedesktop/DBus", DBus.class);
        List<String> candidates = new ArrayList<>();
        for (String name : dbus.ListNames()) {
            if (matches(name, filter)) {
                candidates.add(name);
            }
        }
        for (String name : candidates) {
            if (hasTrackList(connection, name)) {
                return Optional.of(name);
            }
        }
        if (!candidates.isEmpty()) {
            logger.warn("No MPRIS player with a TrackList found, using {}", candidates.get(0));
        }
        return candidates.stream().findFirst();
    }

    static boolean matches(String busName, String filter) {
        if (!busName.startsWith(BUS_NAME_PREFIX)) {
            return false;
        }
        return filter == null || filter.isEmpty()
                || busName.substring(BUS_NAME_PREFIX.length()).toLowerCase(Locale.ROOT)
                .contains(filter.toLowerCase(Locale.ROOT));
    }

    private static boolean hasTrackList(DBusConnection connection, String busName) {
        try {
            Properties properties = connection.getRemoteObject(busName, OBJECT_PATH, Properties.class);
            Object value = MprisMetadataUtils.unwrap(properties.Get(ROOT_INTERFACE, "HasTrackList"));
            return Boolean.TRUE.equals(value);
        } catch (Exception e) {
            logger.debug("Failed to read HasTrackList from {}: {}", busName, e.getMessage());
            return false;
        }
    }

    private static void closeQuietly(DBusConnection connection) {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (Exception e) {
            logger.debug("Failed to close D-Bus connection: {}", e.getMessage());
        }
    }
}
