package org.endlesssource.mediabridge;

import org.endlesssource.mediabridge.api.PlaybackEngine;
import org.endlesssource.mediabridge.spi.EngineContext;
import org.endlesssource.mediabridge.spi.PlaybackEngineProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.stream.Collectors;

public final class PlaybackEngineFactory {
    private static final Logger logger = LoggerFactory.getLogger(PlaybackEngineFactory.class);

    private PlaybackEngineFactory() {}

    /**
     * Create the playback engine requested by the configuration, or the first available one
     * when no engine id is configured.
     * @param context Engine context
     * @return connected playback engine
     * @throws UnsupportedOperationException if no matching provider is available
     * @throws RuntimeException if a provider is available but initialization fails
     */
    public static PlaybackEngine createEngine(EngineContext context) {
        Objects.requireNonNull(context, "context must not be null");
        Optional<String> requested = context.config().engineId();
        logger.debug("Creating playback engine, requested={}", requested.orElse("<any>"));
        List<PlaybackEngineProvider> candidates = loadProviders().stream()
                .filter(provider -> requested.map(id -> id.equalsIgnoreCase(provider.engineId())).orElse(true))
                .sorted(Comparator.comparing(PlaybackEngineProvider::engineId))
                .toList();

        if (candidates.isEmpty()) {
            throw new UnsupportedOperationException("No playback engine provider found"
                    + requested.map(id -> " for id: " + id).orElse(""));
        }

        List<String> reasons = new ArrayList<>();
        for (PlaybackEngineProvider provider : candidates) {
            logger.debug("Probing provider {}", provider.engineId());
            EngineSupport support = provider.probeSupport();
            if (support.available()) {
                logger.info("Using playback engine {}", provider.engineId());
                return provider.create(context);
            }
            reasons.add(provider.engineId() + ": " + support.reason());
        }

        throw new UnsupportedOperationException("No playback engine is runtime-available: "
                + String.join("; ", reasons));
    }

    /**
     * Get engines present on the classpath.
     */
    public static List<String> getCompiledEngines() {
        return loadProviders().stream()
                .map(PlaybackEngineProvider::engineId)
                .distinct()
                .sorted()
                .collect(Collectors.toList());
    }

    /**
     * Get engines that are runtime-available right now.
     */
    public static List<String> getRuntimeAvailableEngines() {
        return loadProviders().stream()
                .map(PlaybackEngineProvider::probeSupport)
                .filter(EngineSupport::available)
                .map(EngineSupport::engine)
                .distinct()
                .sorted()
                .collect(Collectors.toList());
    }

    private static List<PlaybackEngineProvider> loadProviders() {
        ServiceLoader<PlaybackEngineProvider> loader = ServiceLoader.load(PlaybackEngineProvider.class);
        List<PlaybackEngineProvider> providers = new ArrayList<>();
        loader.iterator().forEachRemaining(providers::add);
        if (logger.isDebugEnabled()) {
            logger.debug("Discovered engine providers: {}",
                    providers.stream().map(PlaybackEngineProvider::engineId).collect(Collectors.joining(", ")));
        }
        return providers;
    }
}
