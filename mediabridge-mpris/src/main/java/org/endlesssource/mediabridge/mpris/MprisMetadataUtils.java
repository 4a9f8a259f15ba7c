package org.endlesssource.mediabridge.mpris;

import org.freedesktop.dbus.DBusPath;
import org.freedesktop.dbus.types.Variant;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

final class MprisMetadataUtils {
    static final String TRACK_ID = "mpris:trackid";
    static final String URL = "xesam:url";
    static final String TITLE = "xesam:title";

    private MprisMetadataUtils() {
    }

    static Optional<Map<String, Object>> toMetadataMap(Object metadata) {
        if (metadata == null) {
            return Optional.empty();
        }

        Object value;
        if (metadata instanceof Variant<?> metadataVariant) {
            value = metadataVariant.getValue();
        } else if (metadata instanceof Map<?, ?>) {
            // some players hand out the bare map
            value = metadata;
        } else {
            return Optional.empty();
        }

        if (!(value instanceof Map<?, ?> rawMetadata) || rawMetadata.isEmpty()) {
            return Optional.empty();
        }

        return Optional.of(normalizeMap(rawMetadata));
    }

    static Optional<String> stringValue(Map<String, Object> metadata, String key) {
        Object value = metadata.get(key);
        if (value instanceof String text && !text.isEmpty()) {
            return Optional.of(text);
        }
        return Optional.empty();
    }

    static Optional<String> trackId(Map<String, Object> metadata) {
        Object value = metadata.get(TRACK_ID);
        if (value instanceof DBusPath path) {
            return Optional.of(path.getPath());
        }
        if (value instanceof String text && !text.isEmpty()) {
            return Optional.of(text);
        }
        return Optional.empty();
    }

    /**
     * @return object paths contained in a property value, in order
     */
    static List<String> paths(Object value) {
        Object unwrapped = unwrap(value);
        if (!(unwrapped instanceof List<?> list)) {
            return List.of();
        }
        List<String> paths = new ArrayList<>(list.size());
        for (Object element : list) {
            if (element instanceof DBusPath path) {
                paths.add(path.getPath());
            } else if (element instanceof String text) {
                paths.add(text);
            }
        }
        return paths;
    }

    private static Map<String, Object> normalizeMap(Map<?, ?> rawMap) {
        Map<String, Object> normalized = new HashMap<>();
        rawMap.forEach((key, rawValue) -> {
            if (key instanceof String keyStr) {
                normalized.put(keyStr, unwrap(rawValue));
            }
        });
        return normalized;
    }

    static Object unwrap(Object value) {
        if (value instanceof Variant<?> variant) {
            return unwrap(variant.getValue());
        }

        if (value instanceof Map<?, ?> nestedMap) {
            return normalizeMap(nestedMap);
        }

        if (value instanceof Collection<?> collection) {
            return collection.stream()
                    .map(MprisMetadataUtils::unwrap)
                    .collect(Collectors.toList());
        }

        if (value != null && value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> unwrapped = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                unwrapped.add(unwrap(Array.get(value, i)));
            }
            return unwrapped;
        }

        return value;
    }
}
