package com.example.kosagent.llm;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * 提供方当前状态快照（排名、健康度）
 */
@Value
@Builder
public class ProviderStatus {

    String name;

    int rank;

    int configuredPriority;

    double health;

    long totalAttempts;

    long totalFailures;

    ProviderCapability capability;

    String lastFailure;

    Instant lastFailureAt;
}
