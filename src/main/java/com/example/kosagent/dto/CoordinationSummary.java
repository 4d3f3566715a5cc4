package com.example.kosagent.dto;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * 多 Agent 协同汇总
 */
@Value
@Builder
public class CoordinationSummary {

    String strategyId;

    int targetUsers;

    int generated;

    int failed;

    int persisted;

    double averageQuality;

    Map<String, Double> expectedOutcomes;

    String summary;
}
