package com.example.kosagent.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 所有提供方均失败。携带每个提供方最后一次失败原因
 */
@Getter
public class GatewayExhaustedException extends KosAgentException {

    private final Map<String, String> lastFailures;

    public GatewayExhaustedException(Map<String, String> lastFailures) {
        super(describe(lastFailures));
        this.lastFailures = Collections.unmodifiableMap(new LinkedHashMap<>(lastFailures));
    }

    private static String describe(Map<String, String> failures) {
        if (failures.isEmpty()) {
            return "没有可用的模型提供方";
        }
        return "所有模型提供方均调用失败: " + failures.entrySet().stream()
            .map(e -> e.getKey() + " -> " + e.getValue())
            .collect(Collectors.joining("; "));
    }
}
