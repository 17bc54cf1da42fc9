package com.candlebacktest.backtester.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Strategy name plus parameters, as read from a strategy JSON file or a request.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class StrategyDefinition {

    private String name;
    private Map<String, Object> parameters = new LinkedHashMap<>();
}
