package io.invsync.core;

/**
 * Receives live updates for one subscribed document.
 */
@FunctionalInterface
public interface DocumentListener {

    void onEvent(DocumentEvent event);

    /**
     * Stream failure. The subscription stays registered; the store is expected
     * to resume delivery once it recovers.
     */
    default void onError(StoreException error) {
        // ignored by default
    }
}
