package org.endlesssource.mediabridge.command;

import org.endlesssource.mediabridge.api.PlaybackEngine;
import org.endlesssource.mediabridge.api.PlaybackState;
import org.endlesssource.mediabridge.api.TrackUris;
import org.endlesssource.mediabridge.api.TracklistEntry;
import org.endlesssource.mediabridge.remote.GeneralCommand;
import org.endlesssource.mediabridge.remote.PlayRequest;
import org.endlesssource.mediabridge.remote.PlaystateCommand;
import org.endlesssource.mediabridge.remote.RemoteCommandListener;
import org.endlesssource.mediabridge.report.ProgressSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Applies commands received from the server to the local engine.
 * Unknown commands are ignored.
 */
public class RemoteCommandDispatcher implements RemoteCommandListener {
    private static final Logger logger = LoggerFactory.getLogger(RemoteCommandDispatcher.class);
    static final int VOLUME_STEP = 5;

    private final PlaybackEngine engine;
    private final Duration seekSettleDelay;

    public RemoteCommandDispatcher(PlaybackEngine engine, Duration seekSettleDelay) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.seekSettleDelay = Objects.requireNonNull(seekSettleDelay, "seekSettleDelay must not be null");
    }

    @Override
    public void onPlaystate(PlaystateCommand command) {
        switch (command.command()) {
            case PlaystateCommand.NEXT_TRACK -> engine.next();
            case PlaystateCommand.PREVIOUS_TRACK -> engine.previous();
            case PlaystateCommand.PLAY_PAUSE -> {
                if (engine.getState() == PlaybackState.PLAYING) {
                    engine.pause();
                } else {
                    engine.resume();
                }
            }
            case PlaystateCommand.STOP -> engine.stop();
            case PlaystateCommand.SEEK -> command.seekPositionTicks().ifPresentOrElse(
                    ticks -> engine.seek(ProgressSnapshot.ticksToMillis(ticks)),
                    () -> logger.debug("Seek command without position, ignoring"));
            default -> logger.debug("Ignoring playstate command {}", command.command());
        }
    }

    @Override
    public void onGeneralCommand(GeneralCommand command) {
        switch (command.name()) {
            case GeneralCommand.SET_VOLUME -> command.argument("Volume").ifPresentOrElse(
                    this::setVolume,
                    () -> logger.debug("SetVolume without volume argument, ignoring"));
            case GeneralCommand.VOLUME_UP -> engine.setVolume(engine.getVolume() + VOLUME_STEP);
            case GeneralCommand.VOLUME_DOWN -> engine.setVolume(engine.getVolume() - VOLUME_STEP);
            case GeneralCommand.TOGGLE_MUTE -> engine.setMute(!engine.isMuted());
            default -> logger.debug("Ignoring general command {}", command.name());
        }
    }

    @Override
    public void onPlayRequest(PlayRequest request) {
        List<String> uris = TrackUris.toUris(request.itemIds());

        switch (request.playCommand()) {
            case PlayRequest.PLAY_NOW -> {
                engine.clearTracklist();
                List<TracklistEntry> entries = engine.addTracks(uris);
                int startIndex = request.startIndex().orElse(0);
                if (startIndex < 0 || startIndex >= entries.size()) {
                    logger.warn("Start index {} outside of {} queued tracks, not starting playback",
                            startIndex, entries.size());
                    return;
                }
                engine.play(entries.get(startIndex));
            }
            case PlayRequest.PLAY_LAST -> {
                // "Play next" in the web client: right after the current track
                OptionalInt current = engine.getTracklistIndex();
                int position = current.isPresent() ? current.getAsInt() + 1 : 0;
                engine.addTracks(uris, position);
            }
            // "Add to play queue" in the web client
            case PlayRequest.PLAY_NEXT -> engine.addTracks(uris);
            default -> {
                logger.debug("Ignoring play command {}", request.playCommand());
                return;
            }
        }

        long startTicks = request.startPositionTicks().orElse(0L);
        if (startTicks != 0) {
            if (awaitPlaybackSettled()) {
                engine.seek(ProgressSnapshot.ticksToMillis(startTicks));
            }
        }
    }

    private void setVolume(String value) {
        try {
            engine.setVolume(Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            logger.debug("Ignoring SetVolume with invalid volume '{}'", value);
        }
    }

    /**
     * The engine loses seeks issued right after playback starts, so wait before seeking.
     * @return false if interrupted while waiting
     */
    private boolean awaitPlaybackSettled() {
        if (seekSettleDelay.isZero()) {
            return true;
        }
        try {
            Thread.sleep(seekSettleDelay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.debug("Interrupted before seeking to start position");
            return false;
        }
    }
}
