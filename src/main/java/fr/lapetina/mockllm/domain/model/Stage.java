package fr.lapetina.mockllm.domain.model;

import java.time.Duration;
import java.util.Objects;

/**
 * One step of a load shape.
 *
 * @param endsAt      cumulative elapsed time at which the stage ends
 * @param concurrency target number of virtual users
 * @param spawnRate   users started or stopped per second while converging on the target
 */
public record Stage(Duration endsAt, int concurrency, int spawnRate) {

    public Stage {
        Objects.requireNonNull(endsAt, "endsAt is required");
        if (endsAt.isNegative() || endsAt.isZero()) {
            throw new IllegalArgumentException("endsAt must be positive, got " + endsAt);
        }
        if (concurrency < 0) {
            throw new IllegalArgumentException("concurrency must not be negative, got " + concurrency);
        }
        if (spawnRate <= 0) {
            throw new IllegalArgumentException("spawnRate must be positive, got " + spawnRate);
        }
    }

    public static Stage of(Duration endsAt, int concurrency, int spawnRate) {
        return new Stage(endsAt, concurrency, spawnRate);
    }
}
