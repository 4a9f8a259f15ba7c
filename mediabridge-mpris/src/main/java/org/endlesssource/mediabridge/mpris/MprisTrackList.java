package org.endlesssource.mediabridge.mpris;

import org.freedesktop.dbus.DBusPath;
import org.freedesktop.dbus.annotations.DBusInterfaceName;
import org.freedesktop.dbus.interfaces.DBusInterface;
import org.freedesktop.dbus.types.Variant;

import java.util.List;
import java.util.Map;

@DBusInterfaceName(MprisTrackList.INTERFACE)
interface MprisTrackList extends DBusInterface {
    String INTERFACE = "org.mpris.MediaPlayer2.TrackList";
    /** Passed as {@code afterTrack} to insert at the head of the list. */
    String NO_TRACK = "/org/mpris/MediaPlayer2/TrackList/NoTrack";

    List<Map<String, Variant<?>>> GetTracksMetadata(List<DBusPath> trackIds);
    void AddTrack(String uri, DBusPath afterTrack, boolean setAsCurrent);
    void RemoveTrack(DBusPath trackId);
    void GoTo(DBusPath trackId);
}
