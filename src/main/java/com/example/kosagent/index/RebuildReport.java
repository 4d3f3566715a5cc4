package com.example.kosagent.index;

import lombok.Builder;
import lombok.Value;

/**
 * 重建索引结果
 */
@Value
@Builder
public class RebuildReport {

    SourceType sourceType;

    /**
     * 因为其它实例正在重建而跳过
     */
    boolean skipped;

    int loaded;

    int embedded;

    int removed;

    long durationMs;

    public static RebuildReport skipped(SourceType sourceType) {
        return RebuildReport.builder().sourceType(sourceType).skipped(true).build();
    }
}
