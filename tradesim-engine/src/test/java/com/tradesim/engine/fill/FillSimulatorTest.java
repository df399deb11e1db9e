package com.tradesim.engine.fill;

import com.tradesim.core.model.Bar;
import com.tradesim.core.model.Fill;
import com.tradesim.core.model.LiquidityRole;
import com.tradesim.core.model.OrderKind;
import com.tradesim.core.model.OrderSide;
import com.tradesim.core.model.SimulationConfig;
import com.tradesim.engine.order.Order;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FillSimulator pricing, fees and volume constraints.
 */
class FillSimulatorTest {

    private static final double EPS = 1e-9;

    private SimulationConfig config;
    private FillSimulator simulator;
    private Bar bar;

    @BeforeEach
    void setUp() {
        config = SimulationConfig.builder()
            .maxShareOfBar(0.02)
            .slippageSpreadPct(0.0005)
            .impactSensitivity(1.0)
            .takerFeeRate(0.001)
            .makerFeeRate(0.0002)
            .build();
        simulator = new FillSimulator(config);
        // open 100, high 101, low 99, close 100.5, volume 1000 -> cap 20
        bar = new Bar(1_000L, 100.0, 101.0, 99.0, 100.5, 1000.0);
    }

    private Order market(OrderSide side, double qty) {
        return new Order("o", "BTC-USDT", side, qty, OrderKind.MARKET, null, 0, null);
    }

    private Order limit(OrderSide side, double qty, double price) {
        return new Order("o", "BTC-USDT", side, qty, OrderKind.LIMIT, price, 0, null);
    }

    @Nested
    @DisplayName("Market Orders")
    class MarketOrderTests {

        @Test
        @DisplayName("Buy fills up to the volume cap at open plus spread plus impact")
        void buyPricing() {
            FillResult result = simulator.simulate(market(OrderSide.BUY, 50), bar, 50);

            assertTrue(result.isFilled());
            Fill fill = result.fill().orElseThrow();
            assertEquals(20.0, fill.quantity(), EPS);
            assertEquals(20.0, result.consumedQuantity(), EPS);
            // 100 + 100 * 0.0005 + 100 * (20 / 1000)
            assertEquals(102.05, fill.price(), EPS);
            assertEquals(102.05 * 20 * 0.001, fill.fee(), EPS);
            assertEquals(LiquidityRole.TAKER, fill.liquidity());
            assertEquals(bar.timestamp(), fill.barTimestamp());
        }

        @Test
        @DisplayName("Sell receives open minus spread minus impact")
        void sellPricing() {
            Fill fill = simulator.simulate(market(OrderSide.SELL, 5), bar, 5).fill().orElseThrow();

            assertEquals(5.0, fill.quantity(), EPS);
            assertEquals(100 - 0.05 - 0.5, fill.price(), EPS);
            assertEquals(99.45 * 5 * 0.001, fill.fee(), EPS);
        }

        @Test
        @DisplayName("Consumes only the remaining quantity")
        void boundedByRemaining() {
            FillResult result = simulator.simulate(market(OrderSide.BUY, 50), bar, 3);
            assertEquals(3.0, result.consumedQuantity(), EPS);
        }

        @Test
        @DisplayName("Impact sensitivity below one makes small participation costlier")
        void impactSensitivity() {
            FillSimulator sqrt = new FillSimulator(config.toBuilder().impactSensitivity(0.5).build());
            assertEquals(10.0, sqrt.marketImpact(100.0, 10, 1000), EPS);
            assertEquals(1.0, simulator.marketImpact(100.0, 10, 1000), EPS);
        }

        @Test
        @DisplayName("Zero volume impact falls back to emergency slippage")
        void zeroVolumeImpact() {
            assertEquals(100.0 * FillSimulator.EMERGENCY_SLIPPAGE, simulator.marketImpact(100.0, 1, 0), EPS);
        }

        @Test
        @DisplayName("Sell price never goes negative")
        void sellPriceFloor() {
            FillSimulator wide = new FillSimulator(config.toBuilder().maxShareOfBar(1.0).build());
            Bar thin = new Bar(1_000L, 100.0, 101.0, 99.0, 100.0, 10.0);

            Fill fill = wide.simulate(market(OrderSide.SELL, 10), thin, 10).fill().orElseThrow();

            assertEquals(0.0, fill.price(), EPS);
            assertEquals(0.0, fill.fee(), EPS);
        }
    }

    @Nested
    @DisplayName("Limit Orders")
    class LimitOrderTests {

        @Test
        @DisplayName("Buy limit inside the range fills at the limit with maker fee and half cap")
        void buyLimitCrossed() {
            FillResult result = simulator.simulate(limit(OrderSide.BUY, 50, 99.5), bar, 50);

            Fill fill = result.fill().orElseThrow();
            assertEquals(10.0, fill.quantity(), EPS);
            assertEquals(99.5, fill.price(), EPS);
            assertEquals(99.5 * 10 * 0.0002, fill.fee(), EPS);
            assertEquals(LiquidityRole.MAKER, fill.liquidity());
        }

        @Test
        @DisplayName("Buy limit above the open fills at the open")
        void buyLimitAboveOpen() {
            Fill fill = simulator.simulate(limit(OrderSide.BUY, 1, 100.8), bar, 1).fill().orElseThrow();
            assertEquals(100.0, fill.price(), EPS);
        }

        @Test
        @DisplayName("Buy limit below the low does not fill")
        void buyLimitNotCrossed() {
            FillResult result = simulator.simulate(limit(OrderSide.BUY, 1, 98.5), bar, 1);
            assertFalse(result.isFilled());
            assertEquals(0.0, result.consumedQuantity());
        }

        @Test
        @DisplayName("Sell limit inside the range fills at the limit")
        void sellLimitCrossed() {
            Fill fill = simulator.simulate(limit(OrderSide.SELL, 1, 100.8), bar, 1).fill().orElseThrow();
            assertEquals(100.8, fill.price(), EPS);
        }

        @Test
        @DisplayName("Sell limit below the open fills at the open")
        void sellLimitBelowOpen() {
            Fill fill = simulator.simulate(limit(OrderSide.SELL, 1, 99.2), bar, 1).fill().orElseThrow();
            assertEquals(100.0, fill.price(), EPS);
        }

        @Test
        @DisplayName("Sell limit above the high does not fill")
        void sellLimitNotCrossed() {
            assertFalse(simulator.simulate(limit(OrderSide.SELL, 1, 101.5), bar, 1).isFilled());
        }

        @Test
        @DisplayName("Touching the limit exactly counts as crossed")
        void exactTouchCrosses() {
            assertTrue(simulator.crosses(OrderSide.BUY, 99.0, bar));
            assertTrue(simulator.crosses(OrderSide.SELL, 101.0, bar));
        }
    }

    @Nested
    @DisplayName("Volume Constraints")
    class VolumeTests {

        @Test
        @DisplayName("Zero volume bar yields no fill for any order kind")
        void zeroVolumeNoFill() {
            Bar empty = new Bar(1_000L, 100.0, 101.0, 99.0, 100.5, 0.0);

            assertFalse(simulator.simulate(market(OrderSide.BUY, 1), empty, 1).isFilled());
            assertFalse(simulator.simulate(limit(OrderSide.BUY, 1, 100.5), empty, 1).isFilled());
            assertEquals(0.0, simulator.volumeCap(empty));
        }

        @Test
        @DisplayName("Zero share of bar yields no fill")
        void zeroShareNoFill() {
            FillSimulator none = new FillSimulator(config.toBuilder().maxShareOfBar(0).build());
            assertFalse(none.simulate(market(OrderSide.BUY, 1), bar, 1).isFilled());
        }

        @Test
        @DisplayName("Shared budget: a limit order only gets what market orders left")
        void sharedBudget() {
            BarLiquidity liquidity = BarLiquidity.of(simulator.volumeCap(bar));

            FillResult first = simulator.simulate(market(OrderSide.BUY, 15), bar, 15, liquidity);
            FillResult second = simulator.simulate(limit(OrderSide.BUY, 10, 100.5), bar, 10, liquidity);
            FillResult third = simulator.simulate(market(OrderSide.SELL, 10), bar, 10, liquidity);

            assertEquals(15.0, first.consumedQuantity(), EPS);
            assertEquals(5.0, second.consumedQuantity(), EPS);
            assertFalse(third.isFilled());
            assertEquals(20.0, liquidity.consumed(), EPS);
        }

        @Test
        @DisplayName("Maker half-cap is shared between limit orders")
        void makerCapShared() {
            BarLiquidity liquidity = BarLiquidity.of(20);

            FillResult first = simulator.simulate(limit(OrderSide.BUY, 8, 100.5), bar, 8, liquidity);
            FillResult second = simulator.simulate(limit(OrderSide.BUY, 8, 100.5), bar, 8, liquidity);

            assertEquals(8.0, first.consumedQuantity(), EPS);
            assertEquals(2.0, second.consumedQuantity(), EPS);
            assertEquals(10.0, liquidity.takerAvailable(), EPS);
            assertEquals(0.0, liquidity.makerAvailable(), EPS);
        }
    }
}
