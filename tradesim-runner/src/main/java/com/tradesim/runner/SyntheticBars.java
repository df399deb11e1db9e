package com.tradesim.runner;

import com.tradesim.core.model.Bar;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Deterministic generated bar series for demo runs.
 */
public final class SyntheticBars {

    public static final long START_TIMESTAMP = 1_700_000_000_000L;
    public static final long BAR_MILLIS = 60_000L;

    private SyntheticBars() {
    }

    /**
     * Closes alternate +0.2% / -0.15%; each bar opens at the previous close.
     */
    public static List<Bar> oscillating(int count, double startPrice) {
        List<Bar> bars = new ArrayList<>(count);
        double price = startPrice;
        for (int i = 0; i < count; i++) {
            double open = price;
            double close = price * (1 + (i % 2 == 0 ? 0.002 : -0.0015));
            bars.add(new Bar(START_TIMESTAMP + i * BAR_MILLIS, open,
                Math.max(open, close) * 1.001, Math.min(open, close) * 0.999, close, 1000 + i * 10));
            price = close;
        }
        return bars;
    }

    /**
     * Gaussian random walk with about 1% moves per bar. The same seed gives the same series.
     */
    public static List<Bar> randomWalk(int count, double startPrice, long seed) {
        Random random = new Random(seed);
        List<Bar> bars = new ArrayList<>(count);
        double price = startPrice;
        for (int i = 0; i < count; i++) {
            double open = price;
            double close = Math.max(0.01, open * (1 + random.nextGaussian() * 0.01));
            double wick = Math.abs(random.nextGaussian()) * 0.003;
            double high = Math.max(open, close) * (1 + wick);
            double low = Math.min(open, close) * (1 - wick);
            double volume = 800 + random.nextDouble() * 400;
            bars.add(new Bar(START_TIMESTAMP + i * BAR_MILLIS, open, high, low, close, volume));
            price = close;
        }
        return bars;
    }
}
