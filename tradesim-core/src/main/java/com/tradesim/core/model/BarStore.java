package com.tradesim.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Read-only, strictly time-ordered sequence of bars for one simulation run.
 * Indexed access fails fast on out-of-range indices.
 */
public final class BarStore {

    private final List<Bar> bars;

    public BarStore(List<Bar> bars) {
        Objects.requireNonNull(bars, "bars");
        List<Bar> copy = new ArrayList<>(bars.size());
        long previous = Long.MIN_VALUE;
        for (int i = 0; i < bars.size(); i++) {
            Bar bar = Objects.requireNonNull(bars.get(i), "bar at index " + i);
            if (i > 0 && bar.timestamp() <= previous) {
                throw new IllegalArgumentException(String.format(
                    "Bars must be strictly time-ordered: index %d has timestamp %d after %d",
                    i, bar.timestamp(), previous));
            }
            previous = bar.timestamp();
            copy.add(bar);
        }
        this.bars = Collections.unmodifiableList(copy);
    }

    public int size() {
        return bars.size();
    }

    public boolean isEmpty() {
        return bars.isEmpty();
    }

    public Bar get(int index) {
        return bars.get(Objects.checkIndex(index, bars.size()));
    }

    /**
     * Bars strictly before {@code index}. The returned view is unmodifiable.
     */
    public List<Bar> history(int index) {
        Objects.checkIndex(index, bars.size());
        return bars.subList(0, index);
    }

    public Bar last() {
        if (bars.isEmpty()) {
            throw new IndexOutOfBoundsException("Bar store is empty");
        }
        return bars.get(bars.size() - 1);
    }

    public List<Bar> asList() {
        return bars;
    }

    public Stream<Bar> stream() {
        return bars.stream();
    }
}
