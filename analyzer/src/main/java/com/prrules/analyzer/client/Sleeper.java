package com.prrules.analyzer.client;

/**
 * Blocks the calling thread. Extracted so that rate-limit waits can be observed in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
