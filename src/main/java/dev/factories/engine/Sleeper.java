package dev.factories.engine;

import java.time.Duration;

/**
 * Pause between poll attempts. Swapped out in tests so poll loops run instantly.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
