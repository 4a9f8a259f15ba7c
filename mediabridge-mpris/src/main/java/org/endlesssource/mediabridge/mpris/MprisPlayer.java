package org.endlesssource.mediabridge.mpris;

import org.freedesktop.dbus.DBusPath;
import org.freedesktop.dbus.annotations.DBusInterfaceName;
import org.freedesktop.dbus.interfaces.DBusInterface;

@DBusInterfaceName(MprisPlayer.INTERFACE)
interface MprisPlayer extends DBusInterface {
    String INTERFACE = "org.mpris.MediaPlayer2.Player";

    void Next();
    void Previous();
    void Pause();
    void Stop();
    void Play();
    void SetPosition(DBusPath trackId, long position);
}
