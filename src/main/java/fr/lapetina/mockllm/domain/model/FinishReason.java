package fr.lapetina.mockllm.domain.model;

/**
 * Why a candidate stopped generating.
 */
public enum FinishReason {
    STOP
}
