package com.example.kosagent.index;

import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * 单个用户在各类来源中的已索引内容
 */
@Value
public class UserInsights {

    String userId;

    Map<SourceType, List<IndexedDocument>> documentsByType;

    public int total() {
        return documentsByType.values().stream().mapToInt(List::size).sum();
    }

    public boolean isEmpty() {
        return total() == 0;
    }
}
