package com.candlebacktest.backtester;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Candle Backtester service.
 * Exposes the backtest engine over HTTP and publishes run events to background subscribers.
 */
@SpringBootApplication
public class CandleBacktesterApplication {

    public static void main(String[] args) {
        SpringApplication.run(CandleBacktesterApplication.class, args);
    }

}
