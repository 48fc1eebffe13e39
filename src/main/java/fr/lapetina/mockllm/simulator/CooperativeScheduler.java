package fr.lapetina.mockllm.simulator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Single-threaded event loop that runs all simulated work.
 *
 * Sleeps are scheduled continuations and never occupy the loop thread, so thousands
 * of simulated requests can wait concurrently. Work submitted with {@link #submit(Supplier)}
 * runs inline on the loop thread: a long computation blocks every other continuation
 * until it returns. The CPU-stress mode relies on exactly that.
 */
public final class CooperativeScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CooperativeScheduler.class);

    private final ScheduledExecutorService loop;
    private volatile Thread loopThread;

    public CooperativeScheduler(String name) {
        this.loop = Executors.newSingleThreadScheduledExecutor(new LoopThreadFactory(name));
        log.info("Cooperative scheduler created: name={}", name);
    }

    public CooperativeScheduler() {
        this("simulation-loop");
    }

    /**
     * Returns a future completed on the loop thread once the delay has elapsed.
     */
    public CompletableFuture<Void> sleep(Duration delay) {
        CompletableFuture<Void> future = new CompletableFuture<>();
        loop.schedule(() -> future.complete(null), Math.max(0, delay.toNanos()), TimeUnit.NANOSECONDS);
        return future;
    }

    /**
     * Runs the task on the loop thread.
     */
    public <T> CompletableFuture<T> submit(Supplier<T> task) {
        return CompletableFuture.supplyAsync(task, loop);
    }

    /**
     * Runs the task on the loop thread after the delay.
     */
    public void runAfter(Duration delay, Runnable task) {
        loop.schedule(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Scheduled task failed", e);
            }
        }, Math.max(0, delay.toNanos()), TimeUnit.NANOSECONDS);
    }

    /**
     * Runs the task on the loop thread every period, starting one period from now.
     */
    public void runEvery(Duration period, Runnable task) {
        long nanos = Math.max(1, period.toNanos());
        loop.scheduleAtFixedRate(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Periodic task failed", e);
            }
        }, nanos, nanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Executor view of the loop, for async continuations.
     */
    public Executor executor() {
        return loop;
    }

    public boolean isLoopThread() {
        return Thread.currentThread() == loopThread;
    }

    @Override
    public void close() {
        loop.shutdownNow();
        try {
            if (!loop.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Cooperative scheduler did not terminate in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Cooperative scheduler stopped");
    }

    private final class LoopThreadFactory implements ThreadFactory {
        private final String name;

        LoopThreadFactory(String name) {
            this.name = name;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            loopThread = t;
            return t;
        }
    }
}
