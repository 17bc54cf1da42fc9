package com.candlebacktest.backtester.infrastructure;

import com.candlebacktest.backtester.domain.PerformanceSummary;
import com.candlebacktest.backtester.domain.Trade;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes run events to the log.
 */
@Component
@Slf4j
public class LoggingBacktestSubscriber implements BacktestEventSubscriber {

    @Override
    public void onEvent(BacktestEvent event) {
        switch (event.getType()) {
            case TRADE -> {
                Trade trade = event.getTrade();
                log.info("[{}] {} {} at {} (candle {}): {}", event.getRunId(), trade.getSide(),
                        trade.getQuantity(), trade.getPrice(), trade.getCandleIndex(), trade.getReason());
            }
            case REPORT -> {
                PerformanceSummary summary = event.getResult().getSummary();
                log.info("[{}] {} finished {}: {} trades, final equity {}, ROI {}%", event.getRunId(),
                        event.getResult().getStrategyName(), event.getResult().getStatus(),
                        summary.getTotalTrades(), summary.getFinalEquity(), summary.getRoi() * 100);
            }
        }
    }
}
