package com.tradesim.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Immutable, validated configuration for one backtest run.
 *
 * @param maxShareOfBar    fraction of a bar's volume a run may consume on that bar
 * @param slippageSpreadPct fixed spread component of market-order slippage, as a price fraction
 * @param impactSensitivity exponent applied to (fill qty / bar volume) for market impact, in (0, 1]
 * @param latencyBars      bars an order waits after creation before it may fill
 * @param warmupBars       first bar index the signal strategy is invoked on
 * @param shareBarVolume   true: all orders on a bar draw from one liquidity budget
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SimulationConfig(
    String instrument,
    double startingCash,
    double makerFeeRate,
    double takerFeeRate,
    double maxShareOfBar,
    double slippageSpreadPct,
    double impactSensitivity,
    int latencyBars,
    int warmupBars,
    boolean shareBarVolume,
    boolean verbose
) {
    public static final String DEFAULT_INSTRUMENT = "BTC-USDT";
    public static final double DEFAULT_STARTING_CASH = 10000.0;
    public static final double DEFAULT_FEE_RATE = 0.0006;
    public static final double DEFAULT_MAX_SHARE_OF_BAR = 0.05;
    public static final double DEFAULT_SLIPPAGE_SPREAD_PCT = 0.0005;
    public static final double DEFAULT_IMPACT_SENSITIVITY = 1.0;

    public SimulationConfig {
        if (instrument == null || instrument.isBlank()) {
            throw new IllegalArgumentException("instrument is required");
        }
        requireNonNegative("startingCash", startingCash);
        requireNonNegative("makerFeeRate", makerFeeRate);
        requireNonNegative("takerFeeRate", takerFeeRate);
        requireNonNegative("maxShareOfBar", maxShareOfBar);
        requireNonNegative("slippageSpreadPct", slippageSpreadPct);
        if (!(impactSensitivity > 0 && impactSensitivity <= 1)) {
            throw new IllegalArgumentException("impactSensitivity must be in (0, 1]: " + impactSensitivity);
        }
        if (latencyBars < 0) {
            throw new IllegalArgumentException("latencyBars must be >= 0: " + latencyBars);
        }
        if (warmupBars < 0) {
            throw new IllegalArgumentException("warmupBars must be >= 0: " + warmupBars);
        }
    }

    /**
     * Create default config
     */
    public static SimulationConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .instrument(instrument)
            .startingCash(startingCash)
            .makerFeeRate(makerFeeRate)
            .takerFeeRate(takerFeeRate)
            .maxShareOfBar(maxShareOfBar)
            .slippageSpreadPct(slippageSpreadPct)
            .impactSensitivity(impactSensitivity)
            .latencyBars(latencyBars)
            .warmupBars(warmupBars)
            .shareBarVolume(shareBarVolume)
            .verbose(verbose);
    }

    private static void requireNonNegative(String name, double value) {
        if (!Double.isFinite(value) || value < 0) {
            throw new IllegalArgumentException(name + " must be a non-negative number: " + value);
        }
    }

    public static class Builder {
        private String instrument = DEFAULT_INSTRUMENT;
        private double startingCash = DEFAULT_STARTING_CASH;
        private double makerFeeRate = DEFAULT_FEE_RATE;
        private double takerFeeRate = DEFAULT_FEE_RATE;
        private double maxShareOfBar = DEFAULT_MAX_SHARE_OF_BAR;
        private double slippageSpreadPct = DEFAULT_SLIPPAGE_SPREAD_PCT;
        private double impactSensitivity = DEFAULT_IMPACT_SENSITIVITY;
        private int latencyBars;
        private int warmupBars;
        private boolean shareBarVolume = true;
        private boolean verbose;

        public Builder instrument(String instrument) { this.instrument = instrument; return this; }
        public Builder startingCash(double startingCash) { this.startingCash = startingCash; return this; }

        /**
         * Flat fee rate applied to both maker and taker fills.
         */
        public Builder feeRate(double feeRate) {
            this.makerFeeRate = feeRate;
            this.takerFeeRate = feeRate;
            return this;
        }

        public Builder makerFeeRate(double makerFeeRate) { this.makerFeeRate = makerFeeRate; return this; }
        public Builder takerFeeRate(double takerFeeRate) { this.takerFeeRate = takerFeeRate; return this; }
        public Builder maxShareOfBar(double maxShareOfBar) { this.maxShareOfBar = maxShareOfBar; return this; }
        public Builder slippageSpreadPct(double slippageSpreadPct) { this.slippageSpreadPct = slippageSpreadPct; return this; }
        public Builder impactSensitivity(double impactSensitivity) { this.impactSensitivity = impactSensitivity; return this; }
        public Builder latencyBars(int latencyBars) { this.latencyBars = latencyBars; return this; }
        public Builder warmupBars(int warmupBars) { this.warmupBars = warmupBars; return this; }
        public Builder shareBarVolume(boolean shareBarVolume) { this.shareBarVolume = shareBarVolume; return this; }
        public Builder verbose(boolean verbose) { this.verbose = verbose; return this; }

        public SimulationConfig build() {
            return new SimulationConfig(instrument, startingCash, makerFeeRate, takerFeeRate,
                maxShareOfBar, slippageSpreadPct, impactSensitivity, latencyBars, warmupBars,
                shareBarVolume, verbose);
        }
    }
}
