package com.example.kosagent.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 内容策略
 */
@Value
@Builder
public class ContentStrategy {

    /**
     * 由任务与目标用户确定的稳定标识，用于草稿幂等落库
     */
    String strategyId;

    String objective;

    String objectiveType;

    List<String> targetUserIds;

    String tone;

    List<String> contentTypes;

    List<String> keyMessages;

    List<String> engagementTactics;

    String rawPlan;

    String provider;
}
