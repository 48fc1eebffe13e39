package fr.lapetina.mockllm.infrastructure.metrics;

import fr.lapetina.mockllm.domain.model.SimulationState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Request counters and latency timers per endpoint
 * - Injected error counter
 * - Chaos state gauges (latency bounds, error rate, leak size)
 * - Load generator response times and active user gauge
 * - JVM and system metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Timer> latencyTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> requestCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> loadTestTimers = new ConcurrentHashMap<>();

    private final Counter injectedErrors;
    private final AtomicInteger activeUsers = new AtomicInteger(0);

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        this.injectedErrors = Counter.builder(prefix + "_injected_errors_total")
                .description("Requests failed by the injected error rate")
                .register(registry);

        Gauge.builder(prefix + "_loadtest_active_users", activeUsers, AtomicInteger::get)
                .description("Virtual users currently running")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("mock_llm");
    }

    /**
     * Registers gauges reading the chaos snapshot and the leaked buffer size on every scrape.
     */
    public void registerChaosGauges(Supplier<SimulationState> state, Supplier<Number> leakedBytes) {
        Gauge.builder(prefix + "_chaos_latency_min_seconds", state, s -> s.get().latencyMin())
                .description("Current lower latency bound")
                .register(registry);
        Gauge.builder(prefix + "_chaos_latency_max_seconds", state, s -> s.get().latencyMax())
                .description("Current upper latency bound")
                .register(registry);
        Gauge.builder(prefix + "_chaos_error_rate", state, s -> s.get().errorRate())
                .description("Current injected error probability")
                .register(registry);
        Gauge.builder(prefix + "_chaos_cpu_stress", state, s -> s.get().cpuStressActive() ? 1 : 0)
                .description("CPU stress mode (0=off, 1=on)")
                .register(registry);
        Gauge.builder(prefix + "_chaos_leaked_bytes", leakedBytes, s -> s.get().doubleValue())
                .description("Bytes held by the simulated memory leak")
                .register(registry);
    }

    /**
     * Increments the request counter for an endpoint/status combination.
     */
    public void incrementRequestCount(String endpoint, int status) {
        String key = endpoint + ":" + status;
        requestCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_requests_total")
                        .description("Total number of requests")
                        .tag("endpoint", endpoint)
                        .tag("status", String.valueOf(status))
                        .register(registry)
        ).increment();
    }

    /**
     * Records request latency.
     */
    public void recordLatency(String endpoint, Duration latency) {
        latencyTimers.computeIfAbsent(endpoint, k ->
                Timer.builder(prefix + "_request_latency")
                        .description("Request latency")
                        .tag("endpoint", endpoint)
                        .publishPercentileHistogram()
                        .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                        .register(registry)
        ).record(latency);
    }

    public void incrementInjectedErrors() {
        injectedErrors.increment();
    }

    /**
     * Records a load generator request outcome.
     */
    public void recordLoadTestRequest(String name, boolean success, Duration responseTime) {
        String key = name + ":" + success;
        loadTestTimers.computeIfAbsent(key, k ->
                Timer.builder(prefix + "_loadtest_response_time")
                        .description("Virtual user request response time")
                        .tag("name", name)
                        .tag("success", String.valueOf(success))
                        .publishPercentiles(0.5, 0.95, 0.99)
                        .register(registry)
        ).record(responseTime);
    }

    public void setActiveUsers(int value) {
        activeUsers.set(value);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
