package fr.lapetina.mockllm.loadgen;

import fr.lapetina.mockllm.loadgen.behavior.UserBehavior;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One simulated user: waits a random interval, runs one weighted task, repeats.
 *
 * Stopping is cooperative. {@link #requestStop()} is noticed between sleep chunks and
 * between tasks; a task already running is never interrupted.
 */
public final class VirtualUser implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(VirtualUser.class);

    static final Duration DEFAULT_SLEEP_CHUNK = Duration.ofMillis(200);

    private final int id;
    private final UserBehavior behavior;
    private final Random random;
    private final long sleepChunkMillis;
    private final CountDownLatch finished = new CountDownLatch(1);
    private volatile boolean stopRequested;
    private volatile int completedTasks;

    public VirtualUser(int id, UserBehavior behavior, Random random, Duration sleepChunk) {
        this.id = id;
        this.behavior = behavior;
        this.random = random;
        this.sleepChunkMillis = Math.max(1, sleepChunk.toMillis());
    }

    public VirtualUser(int id, UserBehavior behavior, Random random) {
        this(id, behavior, random, DEFAULT_SLEEP_CHUNK);
    }

    @Override
    public void run() {
        MDC.put("userId", behavior.getName() + "-" + id);
        log.debug("Virtual user started: id={}, type={}", id, behavior.getName());
        try {
            behavior.onStart();
            while (!stopRequested) {
                if (!waitBetweenTasks()) {
                    break;
                }
                behavior.runNextTask(random);
                completedTasks++;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Virtual user interrupted: id={}", id);
        } catch (RuntimeException e) {
            log.error("Virtual user failed: id={}, type={}", id, behavior.getName(), e);
        } finally {
            log.debug("Virtual user stopped: id={}, tasks={}", id, completedTasks);
            MDC.remove("userId");
            finished.countDown();
        }
    }

    /**
     * Sleeps a uniform random wait in chunks.
     *
     * @return false if a stop was requested during the wait
     */
    private boolean waitBetweenTasks() throws InterruptedException {
        long min = behavior.getMinWait().toMillis();
        long max = behavior.getMaxWait().toMillis();
        long remaining = max > min ? min + (long) (random.nextDouble() * (max - min)) : min;

        while (remaining > 0) {
            if (stopRequested) {
                return false;
            }
            long chunk = Math.min(sleepChunkMillis, remaining);
            Thread.sleep(chunk);
            remaining -= chunk;
        }
        return !stopRequested;
    }

    public void requestStop() {
        stopRequested = true;
    }

    public boolean isStopRequested() {
        return stopRequested;
    }

    public boolean awaitFinished(Duration timeout) throws InterruptedException {
        return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean isFinished() {
        return finished.getCount() == 0;
    }

    public int getId() {
        return id;
    }

    public String getType() {
        return behavior.getName();
    }

    public int getCompletedTasks() {
        return completedTasks;
    }
}
