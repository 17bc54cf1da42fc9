package com.candlebacktest.backtester.controller.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.Map;

/**
 * Request DTO for running a backtest over CSV candles sent in the body.
 * Unset numeric fields fall back to the configured defaults.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BacktestRequest {

    @NotBlank(message = "CSV data is required")
    private String csv;

    @NotBlank(message = "Strategy name is required")
    private String strategyName;

    private Map<String, Object> parameters;

    @Positive(message = "Initial balance must be positive")
    private Double initialBalance;

    @DecimalMin(value = "0", message = "Commission rate must not be negative")
    @DecimalMax(value = "1", inclusive = false, message = "Commission rate must be below 1")
    private Double commissionRate;

    @DecimalMin(value = "0", message = "Slippage rate must not be negative")
    @DecimalMax(value = "1", inclusive = false, message = "Slippage rate must be below 1")
    private Double slippageRate;

    @PositiveOrZero(message = "Minimum lot size must not be negative")
    private Double minLotSize;

    private Boolean strictMode;

    private Long seed;

    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate startDate;

    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate endDate;

    @JsonIgnore
    @AssertTrue(message = "Start date must not be after end date")
    public boolean isDateRangeValid() {
        return startDate == null || endDate == null || !startDate.isAfter(endDate);
    }
}
