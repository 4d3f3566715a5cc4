package com.example.kosagent.storage;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 生成的内容草稿，以 (userId, strategyId) 幂等落库
 */
@Value
@Builder(toBuilder = true)
public class ContentDraft {

    String userId;

    String strategyId;

    String title;

    String body;

    List<String> hashtags;

    double qualityScore;

    LocalDateTime createdAt;
}
