package com.tradesim.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * User-editable simulation settings, stored as YAML.
 * Getters fall back to defaults for missing or out-of-range values;
 * {@link #toConfig()} produces the validated run configuration.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SimulationSettings {

    private static final Logger log = LoggerFactory.getLogger(SimulationSettings.class);

    private String instrument = SimulationConfig.DEFAULT_INSTRUMENT;
    private double startingCash = SimulationConfig.DEFAULT_STARTING_CASH;
    private double feeRate = SimulationConfig.DEFAULT_FEE_RATE;
    private Double makerFeeRate = null;  // null = use feeRate
    private Double takerFeeRate = null;  // null = use feeRate
    private double maxShareOfBar = SimulationConfig.DEFAULT_MAX_SHARE_OF_BAR;
    private double slippageSpreadPct = SimulationConfig.DEFAULT_SLIPPAGE_SPREAD_PCT;
    private double impactSensitivity = SimulationConfig.DEFAULT_IMPACT_SENSITIVITY;
    private int latencyBars = 0;
    private int warmupBars = 0;
    private boolean shareBarVolume = true;
    private boolean verbose = false;

    public SimulationSettings() {
        // For Jackson
    }

    /**
     * Create default settings
     */
    public static SimulationSettings defaults() {
        return new SimulationSettings();
    }

    /**
     * Load settings from a YAML file. A missing file yields defaults.
     */
    public static SimulationSettings load(Path path) throws IOException {
        if (!Files.exists(path)) {
            log.debug("No settings file at {}, using defaults", path);
            return new SimulationSettings();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(path.toFile(), SimulationSettings.class);
    }

    public void save(Path path) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        mapper.writeValue(path.toFile(), this);
    }

    /**
     * Apply {@code tradesim.*} system property overrides (e.g. -Dtradesim.latencyBars=2).
     */
    public SimulationSettings applySystemOverrides() {
        instrument = System.getProperty("tradesim.instrument", instrument);
        startingCash = doubleProperty("tradesim.startingCash", startingCash);
        feeRate = doubleProperty("tradesim.feeRate", feeRate);
        makerFeeRate = optionalDoubleProperty("tradesim.makerFeeRate", makerFeeRate);
        takerFeeRate = optionalDoubleProperty("tradesim.takerFeeRate", takerFeeRate);
        maxShareOfBar = doubleProperty("tradesim.maxShareOfBar", maxShareOfBar);
        slippageSpreadPct = doubleProperty("tradesim.slippageSpreadPct", slippageSpreadPct);
        impactSensitivity = doubleProperty("tradesim.impactSensitivity", impactSensitivity);
        latencyBars = (int) doubleProperty("tradesim.latencyBars", latencyBars);
        warmupBars = (int) doubleProperty("tradesim.warmupBars", warmupBars);
        if (System.getProperty("tradesim.shareBarVolume") != null) {
            shareBarVolume = Boolean.getBoolean("tradesim.shareBarVolume");
        }
        if (System.getProperty("tradesim.verbose") != null) {
            verbose = Boolean.getBoolean("tradesim.verbose");
        }
        return this;
    }

    private static double doubleProperty(String key, double fallback) {
        String value = System.getProperty(key);
        if (value == null) return fallback;
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-numeric system property {}={}", key, value);
            return fallback;
        }
    }

    private static Double optionalDoubleProperty(String key, Double fallback) {
        double value = doubleProperty(key, Double.NaN);
        return Double.isNaN(value) ? fallback : Double.valueOf(value);
    }

    // Getters and setters

    public String getInstrument() {
        return instrument != null && !instrument.isBlank() ? instrument : SimulationConfig.DEFAULT_INSTRUMENT;
    }

    public void setInstrument(String instrument) {
        this.instrument = instrument;
    }

    public double getStartingCash() {
        return startingCash >= 0 ? startingCash : SimulationConfig.DEFAULT_STARTING_CASH;
    }

    public void setStartingCash(double startingCash) {
        this.startingCash = startingCash;
    }

    public double getFeeRate() {
        return feeRate >= 0 ? feeRate : SimulationConfig.DEFAULT_FEE_RATE;
    }

    public void setFeeRate(double feeRate) {
        this.feeRate = feeRate;
    }

    public Double getMakerFeeRate() {
        return makerFeeRate;
    }

    public void setMakerFeeRate(Double makerFeeRate) {
        this.makerFeeRate = makerFeeRate;
    }

    public Double getTakerFeeRate() {
        return takerFeeRate;
    }

    public void setTakerFeeRate(Double takerFeeRate) {
        this.takerFeeRate = takerFeeRate;
    }

    public double getMaxShareOfBar() {
        return maxShareOfBar >= 0 ? maxShareOfBar : SimulationConfig.DEFAULT_MAX_SHARE_OF_BAR;
    }

    public void setMaxShareOfBar(double maxShareOfBar) {
        this.maxShareOfBar = maxShareOfBar;
    }

    public double getSlippageSpreadPct() {
        return slippageSpreadPct >= 0 ? slippageSpreadPct : SimulationConfig.DEFAULT_SLIPPAGE_SPREAD_PCT;
    }

    public void setSlippageSpreadPct(double slippageSpreadPct) {
        this.slippageSpreadPct = slippageSpreadPct;
    }

    public double getImpactSensitivity() {
        return impactSensitivity > 0 && impactSensitivity <= 1
            ? impactSensitivity : SimulationConfig.DEFAULT_IMPACT_SENSITIVITY;
    }

    public void setImpactSensitivity(double impactSensitivity) {
        this.impactSensitivity = impactSensitivity;
    }

    public int getLatencyBars() {
        return Math.max(0, latencyBars);
    }

    public void setLatencyBars(int latencyBars) {
        this.latencyBars = latencyBars;
    }

    public int getWarmupBars() {
        return Math.max(0, warmupBars);
    }

    public void setWarmupBars(int warmupBars) {
        this.warmupBars = warmupBars;
    }

    public boolean isShareBarVolume() {
        return shareBarVolume;
    }

    public void setShareBarVolume(boolean shareBarVolume) {
        this.shareBarVolume = shareBarVolume;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public void setVerbose(boolean verbose) {
        this.verbose = verbose;
    }

    /**
     * Convert to SimulationConfig for running a backtest
     */
    public SimulationConfig toConfig() {
        return new SimulationConfig(
            getInstrument(),
            getStartingCash(),
            makerFeeRate != null && makerFeeRate >= 0 ? makerFeeRate : getFeeRate(),
            takerFeeRate != null && takerFeeRate >= 0 ? takerFeeRate : getFeeRate(),
            getMaxShareOfBar(),
            getSlippageSpreadPct(),
            getImpactSensitivity(),
            getLatencyBars(),
            getWarmupBars(),
            isShareBarVolume(),
            isVerbose()
        );
    }
}
