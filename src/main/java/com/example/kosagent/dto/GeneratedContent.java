package com.example.kosagent.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * 针对单个目标用户生成的内容
 */
@Value
@Builder(toBuilder = true)
public class GeneratedContent {

    String userId;

    String strategyId;

    String contentType;

    String title;

    String body;

    List<String> hashtags;

    double qualityScore;

    Map<String, Boolean> qualityChecks;

    List<String> recommendations;

    boolean persisted;

    /**
     * 生成失败原因，成功时为空
     */
    String error;

    public boolean isSuccess() {
        return error == null;
    }
}
