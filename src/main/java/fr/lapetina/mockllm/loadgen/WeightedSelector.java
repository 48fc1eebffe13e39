package fr.lapetina.mockllm.loadgen;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Picks items at random in proportion to their integer weights.
 *
 * An item with weight 3 is chosen three times as often as an item with weight 1.
 * Immutable and thread-safe as long as the supplied {@link Random} is.
 */
public final class WeightedSelector<T> {

    private final List<T> items;
    private final int[] cumulativeWeights;
    private final int totalWeight;

    private WeightedSelector(List<T> items, int[] cumulativeWeights) {
        this.items = Collections.unmodifiableList(items);
        this.cumulativeWeights = cumulativeWeights;
        this.totalWeight = cumulativeWeights[cumulativeWeights.length - 1];
    }

    public T select(Random random) {
        int point = random.nextInt(totalWeight);
        for (int i = 0; i < cumulativeWeights.length; i++) {
            if (point < cumulativeWeights[i]) {
                return items.get(i);
            }
        }
        // Unreachable: point < totalWeight == last cumulative weight
        return items.get(items.size() - 1);
    }

    public List<T> getItems() {
        return items;
    }

    public int getTotalWeight() {
        return totalWeight;
    }

    public static <T> Builder<T> builder() {
        return new Builder<>();
    }

    public static final class Builder<T> {
        private final List<T> items = new ArrayList<>();
        private final List<Integer> weights = new ArrayList<>();

        /**
         * Adds an item. Zero weights are allowed and never selected.
         */
        public Builder<T> add(T item, int weight) {
            if (weight < 0) {
                throw new IllegalArgumentException("Weight must not be negative, got " + weight);
            }
            items.add(item);
            weights.add(weight);
            return this;
        }

        public WeightedSelector<T> build() {
            int[] cumulative = new int[items.size()];
            int running = 0;
            for (int i = 0; i < items.size(); i++) {
                running += weights.get(i);
                cumulative[i] = running;
            }
            if (running <= 0) {
                throw new IllegalStateException("At least one item with a positive weight is required");
            }
            return new WeightedSelector<>(new ArrayList<>(items), cumulative);
        }
    }
}
