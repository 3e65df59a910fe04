package com.dealwatch.feed;

/**
 * Time-based wait used between detail batches and before retries.
 */
@FunctionalInterface
public interface Sleeper {
    Sleeper SYSTEM = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
