package com.tradesim.engine.report;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Cash, position and equity after replaying every fill against the bar series.
 *
 * @param totalReturnPercent (endingEquity - startingCash) / startingCash * 100
 * @param maxDrawdownPercent largest peak-to-trough equity decline, in percent
 */
public record PortfolioSummary(
    double startingCash,
    double endingCash,
    double endingPosition,
    double endingEquity,
    double totalFees,
    double totalReturnPercent,
    double maxDrawdownPercent,
    List<EquityPoint> equityCurve
) {
    @JsonIgnore
    public boolean isFlat() {
        return Math.abs(endingPosition) < 1e-12;
    }

    /**
     * Get summary string
     */
    @JsonIgnore
    public String getSummary() {
        return String.format("equity %.2f -> %.2f (%+.2f%%), max drawdown %.2f%%, position %.6f",
            startingCash, endingEquity, totalReturnPercent, maxDrawdownPercent, endingPosition);
    }
}
