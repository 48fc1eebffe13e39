package fr.lapetina.mockllm.simulator;

/**
 * Result of an analysis request.
 */
public record AnalyzeResult(String status, Mode mode) {

    public enum Mode {
        IO_BOUND,
        CPU_BOUND
    }

    public static AnalyzeResult ioBound() {
        return new AnalyzeResult("Analysis Complete", Mode.IO_BOUND);
    }

    public static AnalyzeResult cpuBound() {
        return new AnalyzeResult("Heavy Analysis Complete", Mode.CPU_BOUND);
    }
}
