package com.example.kosagent.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 任务分析结果
 */
@Value
@Builder
public class TaskAnalysis {

    String objective;

    /**
     * 运营目标类型：ACQUISITION / ENGAGEMENT / CONVERSION
     */
    String objectiveType;

    List<String> keywords;

    String rawAnalysis;
}
