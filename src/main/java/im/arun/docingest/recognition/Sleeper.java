package im.arun.docingest.recognition;

/**
 * Backoff pause between attempts.
 */
@FunctionalInterface
public interface Sleeper {
    Sleeper THREAD = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
