package fr.lapetina.mockllm.loadgen.event;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.mockllm.domain.model.RequestOutcome;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Aggregates count, failures, response times and failure messages per request name.
 */
public final class StatsHandler implements EventHandler<RequestEvent> {

    private final Map<String, RequestStats> statsByName = new ConcurrentHashMap<>();

    @Override
    public void onEvent(RequestEvent event, long sequence, boolean endOfBatch) {
        RequestOutcome outcome = event.getOutcome();
        if (outcome == null) {
            return;
        }
        statsByName
                .computeIfAbsent(outcome.name(), name -> new RequestStats(outcome.requestType(), name))
                .record(outcome);
    }

    /**
     * Returns summaries sorted by request name.
     */
    public List<RequestStats.Summary> getSummaries() {
        List<RequestStats.Summary> summaries = new ArrayList<>();
        for (RequestStats stats : statsByName.values()) {
            summaries.add(stats.snapshot());
        }
        summaries.sort(Comparator.comparing(RequestStats.Summary::name));
        return summaries;
    }

    public RequestStats.Summary getSummary(String name) {
        RequestStats stats = statsByName.get(name);
        return stats != null ? stats.snapshot() : null;
    }

    public long getTotalCount() {
        long total = 0;
        for (RequestStats stats : statsByName.values()) {
            total += stats.snapshot().count();
        }
        return total;
    }
}
