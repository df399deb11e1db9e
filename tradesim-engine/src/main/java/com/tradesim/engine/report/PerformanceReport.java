package com.tradesim.engine.report;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Execution statistics over every order that traded at least once.
 *
 * @param averageFillPrice mean of the per-trade volume-weighted average prices
 */
public record PerformanceReport(
    @JsonProperty("total_trades") int totalTrades,
    @JsonProperty("buy_trades") int buyTrades,
    @JsonProperty("sell_trades") int sellTrades,
    @JsonProperty("avg_fill_price") double averageFillPrice,
    @JsonProperty("total_fees") double totalFees,
    @JsonProperty("total_notional") double totalNotional,
    @JsonProperty("total_qty") double totalQuantity,
    @JsonProperty("trade_details") List<TradeDetail> tradeDetails
) {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Create empty report (no trades)
     */
    public static PerformanceReport empty() {
        return new PerformanceReport(0, 0, 0, 0, 0, 0, 0, List.of());
    }

    /**
     * The report as plain nested maps and lists with snake_case keys.
     */
    public Map<String, Object> toMap() {
        return MAPPER.convertValue(this, new TypeReference<LinkedHashMap<String, Object>>() {});
    }

    /**
     * Get summary string
     */
    @JsonIgnore
    public String getSummary() {
        return String.format("%d trades (%d buy / %d sell), avg fill %.4f, notional %.2f, fees %.4f",
            totalTrades, buyTrades, sellTrades, averageFillPrice, totalNotional, totalFees);
    }
}
