package com.docs.lookup.warm;

/**
 * Outcome of one warming run.
 *
 * @param requested     distinct keys in the run
 * @param alreadyCached keys skipped because a valid entry existed
 * @param warmed        keys fetched and stored by the run
 * @param failed        keys whose fetch failed; warming continues past them
 */
public record WarmResult(int requested, int alreadyCached, int warmed, int failed) {
}
