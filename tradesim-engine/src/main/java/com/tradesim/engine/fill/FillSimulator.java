package com.tradesim.engine.fill;

import com.tradesim.core.model.Bar;
import com.tradesim.core.model.Fill;
import com.tradesim.core.model.LiquidityRole;
import com.tradesim.core.model.OrderSide;
import com.tradesim.core.model.SimulationConfig;
import com.tradesim.engine.order.Order;

/**
 * Decides how much of an order fills against one bar, at what price and fee.
 *
 * Market orders fill at the bar open plus a fixed spread and a volume-dependent impact, and pay
 * the taker rate. Limit orders fill only when the bar range crosses the limit, at min(limit, open)
 * for buys and max(limit, open) for sells, and pay the maker rate.
 * All quantity is bounded by {@code bar.volume * maxShareOfBar}.
 */
public class FillSimulator {

    /** Impact fraction used when a bar reports no volume to measure participation against. */
    public static final double EMERGENCY_SLIPPAGE = 0.10;

    private final SimulationConfig config;

    public FillSimulator(SimulationConfig config) {
        this.config = config;
    }

    /**
     * Attempt a fill with a private liquidity budget for this bar.
     */
    public FillResult simulate(Order order, Bar bar, double remainingQuantity) {
        return simulate(order, bar, remainingQuantity, BarLiquidity.of(volumeCap(bar)));
    }

    /**
     * Attempt a fill drawing from {@code liquidity}, which is debited by the consumed quantity.
     */
    public FillResult simulate(Order order, Bar bar, double remainingQuantity, BarLiquidity liquidity) {
        if (!(remainingQuantity > 0) || !(volumeCap(bar) > 0)) {
            return FillResult.none();
        }

        return switch (order.kind()) {
            case MARKET -> simulateMarket(order, bar, remainingQuantity, liquidity);
            case LIMIT -> simulateLimit(order, bar, remainingQuantity, liquidity);
        };
    }

    private FillResult simulateMarket(Order order, Bar bar, double remaining, BarLiquidity liquidity) {
        double quantity = Math.min(remaining, liquidity.takerAvailable());
        if (!(quantity > 0)) {
            return FillResult.none();
        }
        double price = marketFillPrice(order.side(), bar, quantity);
        double fee = price * quantity * config.takerFeeRate();
        liquidity.consume(quantity, LiquidityRole.TAKER);
        return FillResult.of(new Fill(bar.timestamp(), price, quantity, fee, LiquidityRole.TAKER));
    }

    private FillResult simulateLimit(Order order, Bar bar, double remaining, BarLiquidity liquidity) {
        double limit = order.limitPrice();
        if (!crosses(order.side(), limit, bar)) {
            return FillResult.none();
        }
        double quantity = Math.min(remaining, liquidity.makerAvailable());
        if (!(quantity > 0)) {
            return FillResult.none();
        }
        double price = limitFillPrice(order.side(), limit, bar);
        double fee = price * quantity * config.makerFeeRate();
        liquidity.consume(quantity, LiquidityRole.MAKER);
        return FillResult.of(new Fill(bar.timestamp(), price, quantity, fee, LiquidityRole.MAKER));
    }

    /**
     * Maximum quantity consumable from this bar.
     */
    public double volumeCap(Bar bar) {
        return bar.volume() * config.maxShareOfBar();
    }

    /**
     * Open price moved against the taker by spread and impact. Sell prices floor at zero.
     */
    public double marketFillPrice(OrderSide side, Bar bar, double quantity) {
        double base = bar.open();
        double spread = base * config.slippageSpreadPct();
        double impact = marketImpact(base, quantity, bar.volume());
        if (side == OrderSide.BUY) {
            return base + spread + impact;
        }
        return Math.max(0, base - spread - impact);
    }

    /**
     * Price offset for taking {@code quantity} out of {@code volume}:
     * {@code base * (quantity / volume) ^ impactSensitivity}.
     */
    public double marketImpact(double basePrice, double quantity, double volume) {
        if (volume <= 0) {
            return basePrice * EMERGENCY_SLIPPAGE;
        }
        return basePrice * Math.pow(quantity / volume, config.impactSensitivity());
    }

    /**
     * Buy limits fill when the low trades through the limit, sell limits when the high does.
     */
    public boolean crosses(OrderSide side, double limitPrice, Bar bar) {
        if (side == OrderSide.BUY) {
            return bar.low() <= limitPrice;
        }
        return bar.high() >= limitPrice;
    }

    /**
     * Buy: min(limit, open). Sell: max(limit, open).
     */
    public double limitFillPrice(OrderSide side, double limitPrice, Bar bar) {
        if (side == OrderSide.BUY) {
            return Math.min(limitPrice, bar.open());
        }
        return Math.max(limitPrice, bar.open());
    }
}
