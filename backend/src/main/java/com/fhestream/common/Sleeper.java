package com.fhestream.common;

/**
 * Blocking pause used between retries. Swapped for a recording no-op in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
