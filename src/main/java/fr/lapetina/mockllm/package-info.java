/**
 * Mock generative-AI server with chaos injection, and the staged load generator that
 * exercises it.
 *
 * <h2>Architecture</h2>
 * <pre>
 *  HTTP workers ──► InferenceSimulator ──► CooperativeScheduler (single loop thread)
 *                        │
 *                        └── ChaosController (atomic snapshot, mutated by /admin)
 *
 *  LoadTestRunner ──► VirtualUser threads ──► LoadHttpClient ──► target
 *                              │
 *                              └── RequestEventPipeline (Disruptor) ──► stats / metrics / alerts
 * </pre>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * try (SimulatorFactory factory = SimulatorFactory.create("simulator.yaml")) {
 *     HttpServer server = factory.createHttpServer();
 *     server.start();
 * }
 * }</pre>
 */
package fr.lapetina.mockllm;
