package com.docs.lookup.fetch;

/**
 * Blocking pause between fetch attempts. Replaced in tests to avoid real waiting.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
