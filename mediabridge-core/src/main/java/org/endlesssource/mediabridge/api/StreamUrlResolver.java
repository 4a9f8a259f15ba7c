package org.endlesssource.mediabridge.api;

/**
 * Resolves a remote item id to a URL a local player can stream.
 */
@FunctionalInterface
public interface StreamUrlResolver {

    /**
     * @param itemId remote item id
     * @return streamable URL for the item
     */
    String streamUrl(String itemId);
}
