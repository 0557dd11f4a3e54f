package io.invsync.sync.view;

/** Result of a page request made through a {@link ViewSession}. */
public enum PageOutcome {
    /** A non-empty page was merged into the view. */
    LOADED,
    /** The collection is exhausted; nothing more to fetch. */
    REACHED_END,
    /** A page request for the current generation is already in flight. */
    ALREADY_LOADING,
    /** The result arrived after a reload or after the session ended and was dropped. */
    DISCARDED
}
