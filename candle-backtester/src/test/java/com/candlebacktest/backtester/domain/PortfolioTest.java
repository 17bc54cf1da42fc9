package com.candlebacktest.backtester.domain;

import com.candlebacktest.backtester.exception.BacktestException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Portfolio operations.
 */
class PortfolioTest {

    private static final double EPS = 1e-9;

    private DiagnosticsSink diagnostics;
    private Portfolio portfolio;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticsSink();
        portfolio = Portfolio.builder()
                .initialBalance(10_000)
                .commissionRate(0.001)
                .diagnostics(diagnostics)
                .build();
    }

    @Test
    void testBuyAll_SpendsCashNetOfCommission() {
        // Act
        Optional<Trade> trade = portfolio.applyAdvice(0, Advice.buyAll(), TestCandles.candle(0, 100));

        // Assert - qty = 10000 * 0.999 / 100
        assertTrue(trade.isPresent());
        assertEquals(99.9, portfolio.getAssetQuantity(), EPS);
        assertEquals(9990.0, trade.get().getNotional(), EPS);
        assertEquals(9.99, trade.get().getCommission(), EPS);
        assertEquals(0.01, portfolio.getCash(), EPS, "Commission on the commission stays as cash");
        assertEquals(100.0, portfolio.getEntryPrice(), EPS);
        assertEquals(Trade.Side.BUY, trade.get().getSide());
        assertEquals(1, trade.get().getSequence());
    }

    @Test
    void testRoundTrip_RealizedPnl() {
        // Arrange
        portfolio.applyAdvice(0, Advice.buyAll(), TestCandles.candle(0, 100));

        // Act
        Trade sell = portfolio.applyAdvice(1, Advice.sellAll(), TestCandles.candle(1, 110)).orElseThrow();

        // Assert - proceeds 10989 - 10.989, cost 9990
        assertEquals(988.011, sell.getRealizedPnl(), EPS);
        assertEquals(10978.021, portfolio.getCash(), EPS);
        assertEquals(0.0, portfolio.getAssetQuantity());
        assertNull(portfolio.getEntryPrice(), "Entry price should clear when flat");
        assertEquals(9.99 + 10.989, portfolio.getTotalCommission(), EPS);
    }

    @Test
    void testAccountingIdentity() {
        // Arrange
        portfolio.applyAdvice(0, Advice.buy(30), TestCandles.candle(0, 100));
        portfolio.applyAdvice(1, Advice.sell(10), TestCandles.candle(1, 120));
        portfolio.applyAdvice(2, Advice.buy(5), TestCandles.candle(2, 90));
        double price = 105;

        // Act
        double buyCommissions = portfolio.getTrades().stream()
                .filter(t -> !t.isSell())
                .mapToDouble(Trade::getCommission)
                .sum();
        double expected = portfolio.getInitialBalance() + portfolio.getRealizedPnl()
                + portfolio.unrealizedPnl(price) - buyCommissions;

        // Assert
        assertEquals(expected, portfolio.equity(price), 1e-6);
    }

    @Test
    void testBuyUnits_InsufficientFunds() {
        // Act - 200 units at 100 need 20020 with only 10000
        Optional<Trade> trade = portfolio.applyAdvice(0, Advice.buy(200), TestCandles.candle(0, 100));

        // Assert
        assertTrue(trade.isEmpty());
        assertEquals(10_000.0, portfolio.getCash());
        assertEquals(0.0, portfolio.getAssetQuantity());
        assertEquals(1, diagnostics.count(Diagnostic.Type.INSUFFICIENT_FUNDS));
    }

    @Test
    void testSell_WithoutPosition_NoOp() {
        Optional<Trade> trade = portfolio.applyAdvice(0, Advice.sellAll(), TestCandles.candle(0, 100));

        assertTrue(trade.isEmpty());
        assertEquals(10_000.0, portfolio.getCash());
        assertEquals(0, diagnostics.size(), "Selling while flat is silent");
    }

    @Test
    void testSellUnits_MoreThanHeld_ClampedWithDiagnostic() {
        // Arrange
        portfolio.applyAdvice(0, Advice.buy(10), TestCandles.candle(0, 100));

        // Act
        Trade sell = portfolio.applyAdvice(1, Advice.sell(20), TestCandles.candle(1, 100)).orElseThrow();

        // Assert
        assertEquals(10.0, sell.getQuantity(), EPS);
        assertEquals(0.0, portfolio.getAssetQuantity());
        assertNull(portfolio.getEntryPrice());
        assertEquals(1, diagnostics.count(Diagnostic.Type.INSUFFICIENT_POSITION));
    }

    @Test
    void testPartialSell_KeepsEntryPrice() {
        // Arrange
        portfolio.applyAdvice(0, Advice.buy(10), TestCandles.candle(0, 100));

        // Act
        Trade sell = portfolio.applyAdvice(1, Advice.sell(4), TestCandles.candle(1, 120)).orElseThrow();

        // Assert - 4 * 120 * 0.999 - 400
        assertEquals(79.52, sell.getRealizedPnl(), EPS);
        assertEquals(6.0, portfolio.getAssetQuantity(), EPS);
        assertEquals(100.0, portfolio.getEntryPrice(), EPS);
    }

    @Test
    void testAddOnBuy_WeightedEntryPrice() {
        // Arrange
        Portfolio free = Portfolio.builder().initialBalance(10_000).commissionRate(0).build();

        // Act
        free.applyAdvice(0, Advice.buy(10), TestCandles.candle(0, 100));
        free.applyAdvice(1, Advice.buy(10), TestCandles.candle(1, 200));

        // Assert
        assertEquals(150.0, free.getEntryPrice(), EPS);
        assertEquals(20.0, free.getAssetQuantity(), EPS);
    }

    @Test
    void testFixedSlippage_AlwaysAdverse() {
        // Arrange
        Portfolio slipped = Portfolio.builder()
                .initialBalance(10_000)
                .commissionRate(0)
                .slippageModel(new FixedSlippage(0.01))
                .build();

        // Act
        Trade buy = slipped.applyAdvice(0, Advice.buyAll(), TestCandles.candle(0, 100)).orElseThrow();
        Trade sell = slipped.applyAdvice(1, Advice.sellAll(), TestCandles.candle(1, 100)).orElseThrow();

        // Assert
        assertEquals(101.0, buy.getPrice(), EPS);
        assertEquals(99.0, sell.getPrice(), EPS);
        assertTrue(sell.getRealizedPnl() < 0, "Flat price with slippage should lose money");
        assertEquals(10_000.0 * 99 / 101, slipped.getCash(), 1e-6);
        assertEquals(buy.getSlippage() + sell.getSlippage(), slipped.getTotalSlippage(), EPS);
    }

    @Test
    void testRandomSlippage_SameSeedSameFills() {
        Portfolio first = Portfolio.builder().initialBalance(1000).commissionRate(0)
                .slippageModel(new RandomSlippage(0.02, new Random(9))).build();
        Portfolio second = Portfolio.builder().initialBalance(1000).commissionRate(0)
                .slippageModel(new RandomSlippage(0.02, new Random(9))).build();

        double firstPrice = first.applyAdvice(0, Advice.buyAll(), TestCandles.candle(0, 50)).orElseThrow().getPrice();
        double secondPrice = second.applyAdvice(0, Advice.buyAll(), TestCandles.candle(0, 50)).orElseThrow().getPrice();

        assertEquals(firstPrice, secondPrice);
        assertTrue(firstPrice >= 50 && firstPrice <= 51);
    }

    @Test
    void testMinLotSize_FloorsQuantity() {
        // Arrange
        Portfolio lots = Portfolio.builder().initialBalance(1000).commissionRate(0).minLotSize(1).build();

        // Act
        Trade trade = lots.applyAdvice(0, Advice.buyAll(), TestCandles.candle(0, 300)).orElseThrow();

        // Assert
        assertEquals(3.0, trade.getQuantity(), EPS);
        assertEquals(100.0, lots.getCash(), EPS);
    }

    @Test
    void testMinLotSize_BelowLot_RecordsDiagnostic() {
        // Arrange
        DiagnosticsSink sink = new DiagnosticsSink();
        Portfolio lots = Portfolio.builder().initialBalance(1000).commissionRate(0).minLotSize(10)
                .diagnostics(sink).build();

        // Act
        Optional<Trade> trade = lots.applyAdvice(0, Advice.buyAll(), TestCandles.candle(0, 300));

        // Assert
        assertTrue(trade.isEmpty());
        assertEquals(1000.0, lots.getCash());
        assertEquals(1, sink.count(Diagnostic.Type.ORDER_BELOW_MIN_LOT));
    }

    @Test
    void testNonPositivePrice_RecordsDiagnostic() {
        Candle zero = Candle.builder().timestamp(TestCandles.START).open(0).high(0).low(0).close(0).volume(1).build();

        Optional<Trade> trade = portfolio.applyAdvice(0, Advice.buyAll(), zero);

        assertTrue(trade.isEmpty());
        assertEquals(1, diagnostics.count(Diagnostic.Type.INVALID_PRICE));
    }

    @Test
    void testNoneAdvice_NoTrade() {
        assertTrue(portfolio.applyAdvice(0, Advice.none(), TestCandles.candle(0, 100)).isEmpty());
        assertTrue(portfolio.getTrades().isEmpty());
    }

    @Test
    void testBuyAll_NoCash_NoOp() {
        Portfolio free = Portfolio.builder().initialBalance(1000).commissionRate(0).build();
        free.applyAdvice(0, Advice.buyAll(), TestCandles.candle(0, 10));

        assertEquals(0.0, free.getCash());
        assertTrue(free.applyAdvice(1, Advice.buyAll(), TestCandles.candle(1, 10)).isEmpty());
        assertEquals(1, free.getTrades().size());
    }

    @Test
    void testInvalidConfiguration_Throws() {
        assertThrows(IllegalArgumentException.class,
                () -> Portfolio.builder().initialBalance(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> Portfolio.builder().initialBalance(100).commissionRate(1.0).build());
        assertThrows(IllegalArgumentException.class,
                () -> Portfolio.builder().initialBalance(100).minLotSize(-1).build());
    }

    @Test
    void testTradeHistory_MaintainsOrder() {
        // Act
        portfolio.applyAdvice(0, Advice.buy(10), TestCandles.candle(0, 100));
        portfolio.applyAdvice(1, Advice.buy(5), TestCandles.candle(1, 101));
        portfolio.applyAdvice(2, Advice.sellAll(), TestCandles.candle(2, 102));

        // Assert
        assertEquals(3, portfolio.getTrades().size());
        for (int i = 0; i < 3; i++) {
            assertEquals(i + 1, portfolio.getTrades().get(i).getSequence());
            assertEquals(i, portfolio.getTrades().get(i).getCandleIndex());
        }
        assertThrows(UnsupportedOperationException.class, () -> portfolio.getTrades().clear());
    }

    @Test
    void testSnapshot() {
        portfolio.applyAdvice(0, Advice.buy(10), TestCandles.candle(0, 100));

        Position position = portfolio.snapshot();

        assertEquals(8999.0, position.getCash(), EPS);
        assertEquals(10.0, position.getAssetQuantity(), EPS);
        assertFalse(position.isFlat());
    }

    @Test
    void testInvariantViolation_IsFatal() {
        // Arrange - a sell slippage rate above 1 drives the fill price below zero
        Portfolio broken = Portfolio.builder().initialBalance(10).commissionRate(0)
                .slippageModel((side, candle) -> side == Trade.Side.BUY ? 0.0 : 2.0).build();
        broken.applyAdvice(0, Advice.buyAll(), TestCandles.candle(0, 10));

        // Act & Assert
        BacktestException e = assertThrows(BacktestException.class,
                () -> broken.applyAdvice(1, Advice.sellAll(), TestCandles.candle(1, 10)));
        assertEquals(BacktestException.ErrorCode.INVARIANT_VIOLATION, e.getErrorCode());
        assertEquals(1, e.getCandleIndex());
    }
}
