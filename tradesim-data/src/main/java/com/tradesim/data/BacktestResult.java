package com.tradesim.data;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.tradesim.core.model.SimulationConfig;
import com.tradesim.engine.Backtester;
import com.tradesim.engine.report.PerformanceReport;
import com.tradesim.engine.report.PortfolioSummary;

import java.time.Instant;

/**
 * Exported outcome of one backtest run.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BacktestResult(
    SimulationConfig config,
    int barCount,
    PerformanceReport performance,
    PortfolioSummary portfolio,
    Instant exportedAt
) {
    /**
     * Snapshot the current state of a run.
     */
    public static BacktestResult of(Backtester backtester) {
        return new BacktestResult(
            backtester.getConfig(),
            backtester.getBars().size(),
            backtester.computePerformance(),
            backtester.computePortfolio(),
            Instant.now()
        );
    }
}
