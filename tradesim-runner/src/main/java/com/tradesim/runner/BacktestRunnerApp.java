package com.tradesim.runner;

import com.tradesim.core.exception.SimulationException;
import com.tradesim.core.model.Bar;
import com.tradesim.core.model.SimulationConfig;
import com.tradesim.core.model.SimulationSettings;
import com.tradesim.data.BacktestResult;
import com.tradesim.data.BacktestResultWriter;
import com.tradesim.data.BarCsvReader;
import com.tradesim.engine.Backtester;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Command-line backtest of the pullback strategy.
 *
 * <pre>
 *   --bars &lt;csv&gt;     OHLCV bars to replay
 *   --demo &lt;n&gt;       generate n random-walk bars instead (default 500)
 *   --seed &lt;n&gt;       random-walk seed (default 42)
 *   --config &lt;yaml&gt;  simulation settings, tradesim.* system properties override them
 *   --out &lt;json&gt;     export results
 *   --verbose        log every order event
 * </pre>
 */
public class BacktestRunnerApp {
    private static final Logger LOG = LoggerFactory.getLogger(BacktestRunnerApp.class);

    static final int DEFAULT_DEMO_BARS = 500;
    static final int DEFAULT_SEED = 42;

    public static void main(String[] args) {
        try {
            run(args);
        } catch (SimulationException | IOException | IllegalArgumentException e) {
            LOG.error("Backtest failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    static BacktestResult run(String[] args) throws SimulationException, IOException {
        SimulationConfig config = loadConfig(args);
        List<Bar> bars = loadBars(args);
        if (bars.isEmpty()) {
            throw new IllegalArgumentException("No bars to replay");
        }

        Backtester backtester = new Backtester(bars, config);
        new PullbackStrategy().runOn(backtester);
        BacktestResult result = BacktestResult.of(backtester);

        LOG.info("Performance: {}", result.performance().getSummary());
        LOG.info("Portfolio:   {}", result.portfolio().getSummary());

        String out = getArg(args, "--out", null);
        if (out != null) {
            new BacktestResultWriter().write(Path.of(out), result);
        }
        return result;
    }

    private static SimulationConfig loadConfig(String[] args) throws IOException {
        String configPath = getArg(args, "--config", null);
        SimulationSettings settings = configPath != null
            ? SimulationSettings.load(Path.of(configPath))
            : SimulationSettings.defaults();
        settings.applySystemOverrides();
        if (hasArg(args, "--verbose")) {
            settings.setVerbose(true);
        }
        SimulationConfig config = settings.toConfig();
        LOG.info("Config: {} cash={} maker={} taker={} maxShare={} latency={} warmup={}",
            config.instrument(), config.startingCash(), config.makerFeeRate(), config.takerFeeRate(),
            config.maxShareOfBar(), config.latencyBars(), config.warmupBars());
        return config;
    }

    private static List<Bar> loadBars(String[] args) throws SimulationException {
        String barsPath = getArg(args, "--bars", null);
        if (barsPath != null) {
            List<Bar> bars = BarCsvReader.read(Path.of(barsPath));
            LOG.info("Loaded {} bars from {}", bars.size(), barsPath);
            return bars;
        }
        int count = getIntArg(args, "--demo", DEFAULT_DEMO_BARS);
        int seed = getIntArg(args, "--seed", DEFAULT_SEED);
        LOG.info("Generating {} random-walk bars (seed {})", count, seed);
        return SyntheticBars.randomWalk(count, 100.0, seed);
    }

    private static boolean hasArg(String[] args, String flag) {
        for (String arg : args) {
            if (arg.equals(flag)) return true;
        }
        return false;
    }

    private static String getArg(String[] args, String flag, String defaultValue) {
        for (int i = 0; i < args.length - 1; i++) {
            if (args[i].equals(flag)) {
                return args[i + 1];
            }
        }
        return defaultValue;
    }

    private static int getIntArg(String[] args, String flag, int defaultValue) {
        String value = getArg(args, flag, null);
        if (value == null) return defaultValue;
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            LOG.warn("Ignoring non-numeric {} {}, using {}", flag, value, defaultValue);
            return defaultValue;
        }
    }
}
