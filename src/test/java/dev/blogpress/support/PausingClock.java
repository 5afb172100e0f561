package dev.blogpress.support;

import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * {@link MutableClock} whose next read can be made to block, to freeze a caller at a known point.
 */
public class PausingClock extends MutableClock {

    private volatile CountDownLatch paused;
    private volatile CountDownLatch resume;

    public PausingClock(Instant start) {
        super(start);
    }

    public void pauseNextRead() {
        paused = new CountDownLatch(1);
        resume = new CountDownLatch(1);
    }

    public boolean awaitPaused() throws InterruptedException {
        return paused.await(5, TimeUnit.SECONDS);
    }

    public void resume() {
        resume.countDown();
    }

    @Override
    public Instant instant() {
        CountDownLatch pausedLatch = paused;
        if (pausedLatch != null && pausedLatch.getCount() > 0) {
            pausedLatch.countDown();
            try {
                resume.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        return super.instant();
    }
}
