package com.swing.cache;

/**
 * Lifecycle of the universe cache as seen by readers.
 */
public enum CacheState {

    /** No refresh has succeeded yet. */
    EMPTY,
    /** Current generation is younger than the TTL. */
    FRESH,
    /** Current generation has outlived the TTL; the next read triggers a refresh. */
    STALE,
    /** A refresh is in flight; readers keep getting the last good generation. */
    REFRESHING
}
