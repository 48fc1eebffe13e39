package fr.lapetina.mockllm.simulator;

import fr.lapetina.mockllm.domain.model.SimulationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holder of the chaos state shared by every request handler.
 *
 * The state is an immutable {@link SimulationState} swapped atomically; readers take a
 * snapshot and never lock. Mutations are idempotent and affect subsequent reads only.
 * The leaked buffer lives beside the snapshot because it only grows until {@link #reset()}.
 */
public final class ChaosController {

    private static final Logger log = LoggerFactory.getLogger(ChaosController.class);

    public static final double SPIKE_LATENCY_MIN = 3.0;
    public static final double SPIKE_LATENCY_MAX = 8.0;

    private final SimulationState baseline;
    private final AtomicReference<SimulationState> state;

    private final List<byte[]> leakedBlocks = new ArrayList<>();
    private final AtomicLong leakedBytes = new AtomicLong();

    public ChaosController(double baselineLatencyMin, double baselineLatencyMax) {
        this.baseline = SimulationState.baseline(baselineLatencyMin, baselineLatencyMax);
        this.state = new AtomicReference<>(baseline);
    }

    public ChaosController() {
        this(0.5, 2.0);
    }

    public SimulationState snapshot() {
        return state.get();
    }

    public SimulationState getBaseline() {
        return baseline;
    }

    public void activateLatencySpike() {
        state.updateAndGet(s -> s.withLatency(SPIKE_LATENCY_MIN, SPIKE_LATENCY_MAX));
        log.warn("Chaos: latency spike activated, latencyMin={}, latencyMax={}",
                SPIKE_LATENCY_MIN, SPIKE_LATENCY_MAX);
    }

    public void activateMemoryLeak() {
        state.updateAndGet(s -> s.withMemoryLeak(true));
        log.warn("Chaos: memory leak activated");
    }

    public void activateCpuStress() {
        state.updateAndGet(s -> s.withCpuStress(true));
        log.warn("Chaos: CPU stress activated");
    }

    /**
     * Sets the probability that a chat request fails with service unavailable.
     *
     * @throws IllegalArgumentException if the rate is outside [0, 1]
     */
    public void setErrorRate(double rate) {
        if (Double.isNaN(rate) || rate < 0.0 || rate > 1.0) {
            throw new IllegalArgumentException("Error rate must be in [0, 1], got " + rate);
        }
        state.updateAndGet(s -> s.withErrorRate(rate));
        log.warn("Chaos: error rate set, errorRate={}", rate);
    }

    /**
     * Restores the baseline state and releases the leaked buffer.
     */
    public void reset() {
        state.set(baseline);
        synchronized (leakedBlocks) {
            leakedBlocks.clear();
            leakedBytes.set(0);
        }
        log.info("Chaos: system normalized, latencyMin={}, latencyMax={}",
                baseline.latencyMin(), baseline.latencyMax());
    }

    /**
     * Appends a block to the leaked buffer.
     *
     * @return total leaked bytes after the append
     */
    public long leak(int blockBytes) {
        byte[] block = new byte[blockBytes];
        // Touch the pages so the allocation is resident
        for (int i = 0; i < block.length; i += 4096) {
            block[i] = 'x';
        }
        synchronized (leakedBlocks) {
            leakedBlocks.add(block);
            return leakedBytes.addAndGet(blockBytes);
        }
    }

    public long getLeakedBytes() {
        return leakedBytes.get();
    }
}
