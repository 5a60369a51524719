package com.gs.ep.pagetranslator.model.translation;

/**
 * Blocks the calling worker between retry attempts.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = millis -> Thread.sleep(millis);

    void sleep(long millis) throws InterruptedException;
}
