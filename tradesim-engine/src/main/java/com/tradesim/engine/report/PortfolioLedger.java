package com.tradesim.engine.report;

import com.tradesim.core.model.Bar;
import com.tradesim.core.model.BarStore;
import com.tradesim.core.model.Fill;
import com.tradesim.core.model.OrderSide;
import com.tradesim.engine.order.TradeRecord;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Single-instrument cash/position replay of a run's fills, marked at each bar close.
 * Buys pay notional plus fee, sells receive notional minus fee. Selling more than is held
 * leaves a negative position.
 */
public final class PortfolioLedger {

    private PortfolioLedger() {
    }

    public static PortfolioSummary replay(BarStore bars, List<TradeRecord> records, double startingCash) {
        // bar timestamp -> signed fills, in submission order
        Map<Long, List<SignedFill>> fillsByBar = new HashMap<>();
        for (TradeRecord record : records) {
            OrderSide side = record.getOrder().side();
            for (Fill fill : record.getFills()) {
                fillsByBar.computeIfAbsent(fill.barTimestamp(), ts -> new ArrayList<>())
                    .add(new SignedFill(side, fill));
            }
        }

        double cash = startingCash;
        double position = 0;
        double fees = 0;
        double peak = startingCash;
        double maxDrawdown = 0;
        List<EquityPoint> curve = new ArrayList<>(bars.size());

        for (Bar bar : bars.asList()) {
            for (SignedFill signed : fillsByBar.getOrDefault(bar.timestamp(), List.of())) {
                Fill fill = signed.fill();
                double notional = fill.notionalValue();
                if (signed.side() == OrderSide.BUY) {
                    cash -= notional + fill.fee();
                    position += fill.quantity();
                } else {
                    cash += notional - fill.fee();
                    position -= fill.quantity();
                }
                fees += fill.fee();
            }

            double equity = cash + position * bar.close();
            curve.add(new EquityPoint(bar.timestamp(), cash, position, equity));

            if (equity > peak) {
                peak = equity;
            }
            if (peak > 0) {
                maxDrawdown = Math.max(maxDrawdown, (peak - equity) / peak * 100);
            }
        }

        double endingEquity = curve.isEmpty() ? cash : curve.get(curve.size() - 1).equity();
        double totalReturn = startingCash > 0 ? (endingEquity - startingCash) / startingCash * 100 : 0;

        return new PortfolioSummary(startingCash, cash, position, endingEquity, fees,
            totalReturn, maxDrawdown, List.copyOf(curve));
    }

    private record SignedFill(OrderSide side, Fill fill) {
    }
}
