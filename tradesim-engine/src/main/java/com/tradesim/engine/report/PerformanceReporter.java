package com.tradesim.engine.report;

import com.tradesim.core.model.OrderSide;
import com.tradesim.engine.order.TradeRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Read-only aggregation of trade records into a {@link PerformanceReport}.
 * Records with no executions are left out. Portfolio-level P&L is {@link PortfolioLedger}'s job.
 */
public class PerformanceReporter {

    public PerformanceReport compute(List<TradeRecord> records) {
        if (records == null || records.isEmpty()) {
            return PerformanceReport.empty();
        }

        List<TradeDetail> details = new ArrayList<>();
        int buys = 0;
        int sells = 0;
        double sumAvgPrice = 0;
        double totalFees = 0;
        double totalNotional = 0;
        double totalQuantity = 0;

        for (TradeRecord record : records) {
            if (!record.hasExecutions()) {
                continue;
            }
            TradeDetail detail = TradeDetail.of(record);
            details.add(detail);

            if (detail.side() == OrderSide.BUY) {
                buys++;
            } else {
                sells++;
            }
            sumAvgPrice += detail.avgPrice();
            totalFees += detail.fees();
            totalNotional += detail.notional();
            totalQuantity += detail.quantity();
        }

        if (details.isEmpty()) {
            return PerformanceReport.empty();
        }

        return new PerformanceReport(
            details.size(),
            buys,
            sells,
            sumAvgPrice / details.size(),
            totalFees,
            totalNotional,
            totalQuantity,
            List.copyOf(details)
        );
    }
}
