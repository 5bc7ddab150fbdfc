package dev.pekelund.receiptscan.retry;

import java.time.Duration;

/**
 * Waits between attempts. Swapped out in tests so backoff never blocks.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
