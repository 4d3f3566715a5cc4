package com.example.kosagent.index;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * 索引状态
 */
@Value
@Builder
public class IndexStats {

    int totalDocuments;

    Map<SourceType, Long> documentsByType;

    long embeddingCalls;

    long staleRefreshes;
}
