package com.example.kosagent.index;

import lombok.NonNull;
import lombok.Value;

/**
 * 索引文档主键 (sourceType, sourceId)
 */
@Value
public class DocumentKey {

    @NonNull
    SourceType sourceType;

    @NonNull
    String sourceId;

    public static DocumentKey of(SourceType sourceType, String sourceId) {
        return new DocumentKey(sourceType, sourceId);
    }

    @Override
    public String toString() {
        return sourceType + ":" + sourceId;
    }
}
