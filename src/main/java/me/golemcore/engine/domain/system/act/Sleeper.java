package me.golemcore.engine.domain.system.act;

/**
 * Pauses the calling thread. Replaced in tests so pacing costs no wall time.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
