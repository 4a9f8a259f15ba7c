package org.endlesssource.mediabridge.mpris;

import org.endlesssource.mediabridge.api.PlaybackState;

/**
 * Unit and enum conversions between MPRIS and the engine API.
 */
final class MprisValues {
    private MprisValues() {
    }

    static PlaybackState parsePlaybackStatus(Object status) {
        Object unwrapped = MprisMetadataUtils.unwrap(status);
        if (!(unwrapped instanceof String text)) {
            return PlaybackState.STOPPED;
        }
        switch (text.toLowerCase()) {
            case "playing":
                return PlaybackState.PLAYING;
            case "paused":
                return PlaybackState.PAUSED;
            default:
                return PlaybackState.STOPPED;
        }
    }

    /**
     * MPRIS volume is a double where 1.0 is full volume.
     */
    static int toPercent(Object volume) {
        Object unwrapped = MprisMetadataUtils.unwrap(volume);
        if (!(unwrapped instanceof Number number)) {
            return 0;
        }
        return clampVolume((int) Math.round(number.doubleValue() * 100.0d));
    }

    static double toMprisVolume(int percent) {
        return clampVolume(percent) / 100.0d;
    }

    static int clampVolume(int percent) {
        return Math.max(0, Math.min(100, percent));
    }

    /**
     * MPRIS positions are microseconds.
     */
    static long toMillis(Object micros) {
        Object unwrapped = MprisMetadataUtils.unwrap(micros);
        if (!(unwrapped instanceof Number number)) {
            return 0L;
        }
        return Math.max(0L, number.longValue() / 1000L);
    }

    static long toMicros(long millis) {
        return Math.max(0L, millis) * 1000L;
    }
}
