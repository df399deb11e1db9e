package com.tradesim.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradesim.core.exception.OrderRejectedException;
import com.tradesim.core.model.Bar;
import com.tradesim.core.model.Fill;
import com.tradesim.core.model.OrderKind;
import com.tradesim.core.model.OrderRequest;
import com.tradesim.core.model.OrderSide;
import com.tradesim.core.model.OrderStatus;
import com.tradesim.core.model.SimulationConfig;
import com.tradesim.engine.order.OrderEvent;
import com.tradesim.engine.order.TradeRecord;
import com.tradesim.engine.report.PerformanceReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for the Backtester over synthetic oscillating bars.
 */
class BacktesterTest {

    private static final String INST = "BTC-USDT";

    private List<Bar> bars;

    @BeforeEach
    void setUp() {
        bars = TestBars.oscillating();
    }

    @Nested
    @DisplayName("Execution Scenarios")
    class ScenarioTests {

        @Test
        @DisplayName("Oversized market order is capped by bar volume")
        void volumeCappedMarketOrder() throws Exception {
            Backtester bt = new Backtester(bars, SimulationConfig.builder().maxShareOfBar(0.02).build());

            TradeRecord record = bt.submitOrder(INST, OrderSide.BUY, 200, OrderKind.MARKET, null, 0, null, null);
            bt.stepBar(0);

            assertEquals(OrderStatus.PARTIAL, record.getStatus());
            assertEquals(20.0, record.getExecutedQuantity(), 1e-9);
            assertEquals(1, record.getFillCount());
            // open 100 + spread 0.05 + impact 100 * (20 / 1000)
            assertEquals(102.05, record.getFills().get(0).price(), 1e-9);
        }

        @Test
        @DisplayName("Limit orders fill only when the bar crosses them")
        void limitCrossing() throws Exception {
            Backtester bt = new Backtester(bars, SimulationConfig.builder().maxShareOfBar(0.02).build());
            Bar first = bars.get(0);

            TradeRecord crossed = bt.submitOrder(INST, OrderSide.BUY, 5, OrderKind.LIMIT,
                first.high() * 1.001, 0, null, null);
            TradeRecord resting = bt.submitOrder(INST, OrderSide.BUY, 5, OrderKind.LIMIT,
                first.low() * 0.95, 0, null, null);
            bt.stepBar(0);

            assertEquals(OrderStatus.FILLED, crossed.getStatus());
            assertEquals(first.open(), crossed.getAvgPrice(), 1e-9);
            assertEquals(first.open() * 5 * SimulationConfig.DEFAULT_FEE_RATE, crossed.getTotalFees(), 1e-9);

            assertEquals(OrderStatus.SUBMITTED, resting.getStatus());
            assertEquals(0.0, resting.getExecutedQuantity());
        }

        @Test
        @DisplayName("Signal run produces a buy and a sell with fees")
        void signalRun() throws Exception {
            Backtester bt = new Backtester(bars, SimulationConfig.defaults());

            bt.runSignals((index, bar, history, context) -> {
                if (index == 1) {
                    return Optional.of(OrderRequest.market(OrderSide.BUY, 2));
                }
                if (index == 5) {
                    return Optional.of(OrderRequest.market(OrderSide.SELL, 2));
                }
                return Optional.empty();
            });

            PerformanceReport report = bt.computePerformance();
            assertEquals(2, report.totalTrades());
            assertEquals(1, report.buyTrades());
            assertEquals(1, report.sellTrades());
            assertTrue(report.totalFees() > 0);
            assertEquals(4.0, report.totalQuantity(), 1e-9);

            Map<String, Object> map = report.toMap();
            for (String key : List.of("total_trades", "avg_fill_price", "total_fees", "total_notional",
                    "total_qty", "trade_details")) {
                assertTrue(map.containsKey(key), "missing " + key);
            }
            assertTrue(bt.computePortfolio().isFlat());
        }

        @Test
        @DisplayName("JSON request without an order type is submitted as a market order")
        void jsonRequestDefaultsToMarket() throws Exception {
            Backtester bt = new Backtester(bars, SimulationConfig.defaults());
            OrderRequest request = new ObjectMapper().readValue("{\"side\":\"buy\",\"quantity\":2}", OrderRequest.class);

            TradeRecord record = bt.submitOrder(request, 0);
            bt.stepBar(0);

            assertEquals(OrderKind.MARKET, record.getOrder().kind());
            assertEquals(2.0, record.getOrder().quantity());
            assertEquals(OrderStatus.FILLED, record.getStatus());
        }

        @Test
        @DisplayName("Latency delays the first fill")
        void latency() throws Exception {
            Backtester bt = new Backtester(bars, SimulationConfig.builder().latencyBars(2).build());
            TradeRecord record = bt.submitOrder(INST, OrderSide.BUY, 1, OrderKind.MARKET, null, 0, null, null);

            bt.stepThroughBars(0, 1);
            assertEquals(0.0, record.getExecutedQuantity());

            bt.stepBar(2);
            assertTrue(record.getExecutedQuantity() > 0);
        }

        @Test
        @DisplayName("Identical runs produce identical fills")
        void deterministic() throws Exception {
            assertEquals(fillsOf(runMixed()), fillsOf(runMixed()));
        }

        private Backtester runMixed() throws OrderRejectedException {
            Backtester bt = new Backtester(bars, SimulationConfig.builder().maxShareOfBar(0.01).build());
            bt.submitOrder(INST, OrderSide.BUY, 25, OrderKind.MARKET, null, 0, null, null);
            bt.submitOrder(INST, OrderSide.SELL, 12, OrderKind.LIMIT, 100.3, 2, 10, null);
            bt.stepThroughBars(0);
            return bt;
        }

        private List<Fill> fillsOf(Backtester bt) {
            List<Fill> fills = new ArrayList<>();
            bt.trades().forEach(t -> fills.addAll(t.getFills()));
            return fills;
        }
    }

    @Nested
    @DisplayName("Signal Loop")
    class SignalLoopTests {

        @Test
        @DisplayName("Strategy is first called at the warm-up index with prior bars as history")
        void warmup() throws Exception {
            Backtester bt = new Backtester(bars, SimulationConfig.builder().warmupBars(5).build());
            List<Integer> indices = new ArrayList<>();
            List<Integer> historySizes = new ArrayList<>();

            bt.runSignals((index, bar, history, context) -> {
                indices.add(index);
                historySizes.add(history.size());
                assertSame(bars.get(index), bar);
                return Optional.empty();
            });

            assertEquals(5, indices.get(0));
            assertEquals(bars.size() - 5, indices.size());
            assertEquals(5, historySizes.get(0));
            assertEquals(bars.size() - 1, historySizes.get(historySizes.size() - 1));
        }

        @Test
        @DisplayName("Orders submitted by a signal may fill on their own bar")
        void fillsOnSignalBar() throws Exception {
            Backtester bt = new Backtester(bars, SimulationConfig.defaults());

            bt.runSignals((index, bar, history, context) ->
                index == 3 ? Optional.of(OrderRequest.market(OrderSide.BUY, 1)) : Optional.empty());

            TradeRecord record = bt.trades().get(0);
            assertEquals(OrderStatus.FILLED, record.getStatus());
            assertEquals(bars.get(3).timestamp(), record.getFills().get(0).barTimestamp());
        }

        @Test
        @DisplayName("Context state survives across bars")
        void contextState() throws Exception {
            Backtester bt = new Backtester(bars, SimulationConfig.defaults());

            SignalContext context = bt.runSignals((index, bar, history, ctx) -> {
                ctx.put("count", ctx.getOrDefault("count", Integer.class, 0) + 1);
                return Optional.empty();
            });

            assertEquals(bars.size(), context.get("count", Integer.class));
        }

        @Test
        @DisplayName("Invalid signal aborts the run")
        void invalidSignal() {
            Backtester bt = new Backtester(bars, SimulationConfig.defaults());

            OrderRejectedException e = assertThrows(OrderRejectedException.class, () ->
                bt.runSignals((index, bar, history, context) ->
                    Optional.of(OrderRequest.market(OrderSide.BUY, -1))));
            assertEquals(OrderRejectedException.INVALID_QUANTITY, e.getRejectReason());
        }
    }

    @Nested
    @DisplayName("Argument Checks")
    class ArgumentTests {

        @Test
        @DisplayName("Bar indices outside the series are rejected")
        void badIndex() {
            Backtester bt = new Backtester(bars, SimulationConfig.defaults());

            assertThrows(IndexOutOfBoundsException.class, () ->
                bt.submitOrder(INST, OrderSide.BUY, 1, OrderKind.MARKET, null, bars.size(), null, null));
            assertThrows(IndexOutOfBoundsException.class, () ->
                bt.submitOrder(INST, OrderSide.BUY, 1, OrderKind.MARKET, null, -1, null, null));
            assertThrows(IndexOutOfBoundsException.class, () -> bt.stepBar(bars.size()));
        }

        @Test
        @DisplayName("Out-of-order bars are refused")
        void unorderedBars() {
            List<Bar> reversed = new ArrayList<>(bars.subList(0, 3));
            java.util.Collections.reverse(reversed);

            assertThrows(IllegalArgumentException.class, () -> new Backtester(reversed, SimulationConfig.defaults()));
        }

        @Test
        @DisplayName("Cancelling through the backtester stops further fills")
        void cancel() throws Exception {
            Backtester bt = new Backtester(bars, SimulationConfig.builder().maxShareOfBar(0.01).build());
            TradeRecord record = bt.submitOrder(INST, OrderSide.BUY, 100, OrderKind.MARKET, null, 0, null, "big");

            bt.stepBar(0);
            assertTrue(bt.cancelOrder("big", 0));
            bt.stepThroughBars(1);

            assertEquals(OrderStatus.CANCELLED, record.getStatus());
            assertEquals(1, record.getFillCount());
        }
    }

    @Nested
    @DisplayName("Invariants Under Load")
    class StressTests {

        @Test
        @DisplayName("Many overlapping orders keep quantities and states consistent")
        void overlappingOrders() throws Exception {
            List<Bar> longSeries = TestBars.oscillating(200, 100.0);
            Backtester bt = new Backtester(longSeries, SimulationConfig.builder()
                .maxShareOfBar(0.01).latencyBars(1).build());

            Map<String, Double> lastExecuted = new HashMap<>();
            Set<String> terminal = new HashSet<>();
            bt.addOrderListener((OrderEvent event) -> {
                assertFalse(terminal.contains(event.orderId()), "event after terminal for " + event.orderId());
                double previous = lastExecuted.getOrDefault(event.orderId(), 0.0);
                assertTrue(event.executedQuantity() >= previous, "executed quantity went down");
                lastExecuted.put(event.orderId(), event.executedQuantity());
                if (event.status().isTerminal()) {
                    terminal.add(event.orderId());
                }
            });

            bt.runSignals((index, bar, history, context) -> {
                if (index % 5 != 0) {
                    return Optional.empty();
                }
                OrderSide side = (index / 5) % 2 == 0 ? OrderSide.BUY : OrderSide.SELL;
                if (index % 3 == 0) {
                    double limit = side == OrderSide.BUY ? bar.close() * 0.999 : bar.close() * 1.001;
                    return Optional.of(OrderRequest.limit(side, 7 + index % 11, limit).withTimeInForce(8));
                }
                return Optional.of(OrderRequest.market(side, 4 + index % 13));
            });

            assertEquals(40, bt.trades().size());
            for (TradeRecord record : bt.trades()) {
                assertTrue(record.getExecutedQuantity() <= record.getOrder().quantity());
                assertEquals(record.getFills().stream().mapToDouble(Fill::quantity).sum(),
                    record.getExecutedQuantity(), 1e-9);
                if (record.getStatus() == OrderStatus.FILLED) {
                    assertEquals(record.getOrder().quantity(), record.getExecutedQuantity(), 1e-9);
                }
                if (record.hasExecutions()) {
                    double min = record.getFills().stream().mapToDouble(Fill::price).min().orElseThrow();
                    double max = record.getFills().stream().mapToDouble(Fill::price).max().orElseThrow();
                    assertTrue(record.getAvgPrice() >= min - 1e-9 && record.getAvgPrice() <= max + 1e-9);
                    assertTrue(record.getTotalFees() > 0);
                }
            }
        }
    }
}
