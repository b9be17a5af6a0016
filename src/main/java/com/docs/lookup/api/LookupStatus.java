package com.docs.lookup.api;

/**
 * Outcome category of a lookup.
 */
public enum LookupStatus {
    /** Documentation content was returned, possibly stale. */
    FOUND,
    /** The token at the cursor could not be identified; nothing was fetched. */
    UNRESOLVABLE,
    /** The symbol was identified but its documentation could not be obtained. */
    UNAVAILABLE,
    /** The cache layer failed for a reason other than fetching. */
    CACHE_ERROR
}
