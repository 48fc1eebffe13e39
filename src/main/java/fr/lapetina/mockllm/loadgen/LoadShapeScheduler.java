package fr.lapetina.mockllm.loadgen;

import fr.lapetina.mockllm.domain.model.Stage;
import fr.lapetina.mockllm.infrastructure.config.SimulatorConfig;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Maps elapsed run time to the active load stage.
 *
 * Pure and thread-safe: {@link #tick(Duration)} depends only on its argument. The active
 * stage is the first whose {@code endsAt} threshold lies strictly after the elapsed time;
 * once the last threshold is reached the shape is exhausted and the run must stop.
 */
public final class LoadShapeScheduler {

    private final List<Stage> stages;

    public LoadShapeScheduler(List<Stage> stages) {
        if (stages == null || stages.isEmpty()) {
            throw new IllegalArgumentException("At least one stage is required");
        }
        for (int i = 1; i < stages.size(); i++) {
            if (stages.get(i).endsAt().compareTo(stages.get(i - 1).endsAt()) <= 0) {
                throw new IllegalArgumentException("Stage thresholds must be strictly increasing, stage "
                        + i + " ends at " + stages.get(i).endsAt() + " after " + stages.get(i - 1).endsAt());
            }
        }
        this.stages = List.copyOf(stages);
    }

    /**
     * Warm-up, load, stress and cool-down over two minutes.
     */
    public static LoadShapeScheduler defaultShape() {
        return new LoadShapeScheduler(List.of(
                Stage.of(Duration.ofSeconds(30), 10, 5),
                Stage.of(Duration.ofSeconds(60), 50, 10),
                Stage.of(Duration.ofSeconds(90), 100, 20),
                Stage.of(Duration.ofSeconds(120), 10, 5)
        ));
    }

    public static LoadShapeScheduler fromConfig(List<SimulatorConfig.StageConfig> configs) {
        List<Stage> stages = new ArrayList<>();
        if (configs != null) {
            for (SimulatorConfig.StageConfig config : configs) {
                stages.add(Stage.of(Duration.ofMillis(config.getEndsAtMs()), config.getUsers(), config.getSpawnRate()));
            }
        }
        return new LoadShapeScheduler(stages);
    }

    /**
     * Returns the stage active at the elapsed time, or empty once the shape is exhausted.
     */
    public Optional<Stage> tick(Duration elapsed) {
        int index = stageIndex(elapsed);
        return index >= 0 ? Optional.of(stages.get(index)) : Optional.empty();
    }

    /**
     * Index of the active stage, -1 once exhausted.
     */
    public int stageIndex(Duration elapsed) {
        for (int i = 0; i < stages.size(); i++) {
            if (elapsed.compareTo(stages.get(i).endsAt()) < 0) {
                return i;
            }
        }
        return -1;
    }

    public List<Stage> getStages() {
        return stages;
    }

    public Duration totalDuration() {
        return stages.get(stages.size() - 1).endsAt();
    }
}
