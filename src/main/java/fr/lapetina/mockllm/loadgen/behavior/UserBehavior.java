package fr.lapetina.mockllm.loadgen.behavior;

import java.time.Duration;
import java.util.Random;

/**
 * What a virtual user does between waits.
 *
 * An instance belongs to exactly one virtual user and is only called from that user's
 * thread, so implementations may keep per-user state (a session, an agent id) without
 * synchronisation.
 */
public interface UserBehavior {

    /**
     * Returns the name of this behaviour for configuration and logs.
     */
    String getName();

    /**
     * Lower bound of the random wait before each task.
     */
    Duration getMinWait();

    /**
     * Upper bound of the random wait before each task.
     */
    Duration getMaxWait();

    /**
     * Called once before the first wait.
     */
    default void onStart() throws InterruptedException {
        // Default no-op
    }

    /**
     * Picks one task by weight and runs it to completion.
     */
    void runNextTask(Random random) throws InterruptedException;
}
