package com.example.kosagent.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 单个用户的语义洞察
 */
@Value
@Builder
public class UserInsight {

    String userId;

    String nickname;

    int indexedDocuments;

    /**
     * 相关度最高的若干原文片段
     */
    List<String> evidence;

    double averageSimilarity;
}
