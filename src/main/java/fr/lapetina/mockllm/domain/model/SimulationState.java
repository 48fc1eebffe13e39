package fr.lapetina.mockllm.domain.model;

/**
 * Immutable snapshot of the chaos configuration, read by every request handler.
 * Latencies are in seconds.
 */
public record SimulationState(
        double latencyMin,
        double latencyMax,
        double errorRate,
        boolean memoryLeakActive,
        boolean cpuStressActive
) {
    public SimulationState {
        if (latencyMin < 0 || latencyMin > latencyMax) {
            throw new IllegalArgumentException(
                    "Latency bounds must satisfy 0 <= min <= max, got [" + latencyMin + ", " + latencyMax + "]");
        }
        if (errorRate < 0.0 || errorRate > 1.0) {
            throw new IllegalArgumentException("Error rate must be in [0, 1], got " + errorRate);
        }
    }

    /**
     * Healthy state with the given latency bounds.
     */
    public static SimulationState baseline(double latencyMin, double latencyMax) {
        return new SimulationState(latencyMin, latencyMax, 0.0, false, false);
    }

    public SimulationState withLatency(double min, double max) {
        return new SimulationState(min, max, errorRate, memoryLeakActive, cpuStressActive);
    }

    public SimulationState withErrorRate(double rate) {
        return new SimulationState(latencyMin, latencyMax, rate, memoryLeakActive, cpuStressActive);
    }

    public SimulationState withMemoryLeak(boolean active) {
        return new SimulationState(latencyMin, latencyMax, errorRate, active, cpuStressActive);
    }

    public SimulationState withCpuStress(boolean active) {
        return new SimulationState(latencyMin, latencyMax, errorRate, memoryLeakActive, active);
    }
}
