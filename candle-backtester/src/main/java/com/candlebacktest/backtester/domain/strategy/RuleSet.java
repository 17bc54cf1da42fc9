package com.candlebacktest.backtester.domain.strategy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Singular;

import java.util.List;

/**
 * Declarative strategy definition: enter when every entry condition holds, exit when any
 * exit condition holds or a stop-loss / take-profit level is reached.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RuleSet {

    private String name;

    @Singular("entry")
    private List<RuleCondition> entry;

    @Singular("exit")
    private List<RuleCondition> exit;

    private Double stopLossPercent;
    private Double takeProfitPercent;

    public void validate() {
        if (entry == null || entry.isEmpty()) {
            throw new IllegalArgumentException("Rule set needs at least one entry condition");
        }
        boolean hasExit = (exit != null && !exit.isEmpty()) || stopLossPercent != null || takeProfitPercent != null;
        if (!hasExit) {
            throw new IllegalArgumentException("Rule set needs an exit condition, a stop loss or a take profit");
        }
        entry.forEach(RuleCondition::validate);
        if (exit != null) {
            exit.forEach(RuleCondition::validate);
        }
        if (stopLossPercent != null && !(stopLossPercent > 0)) {
            throw new IllegalArgumentException("Stop loss percent must be positive");
        }
        if (takeProfitPercent != null && !(takeProfitPercent > 0)) {
            throw new IllegalArgumentException("Take profit percent must be positive");
        }
    }
}
