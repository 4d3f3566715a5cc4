package com.example.kosagent.scoring;

import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 用户价值分，score ∈ [0, 10]
 *
 * 构造后不可变：components 与 reasons 都是只读副本。
 */
@Value
public class ValueScore {

    String userId;

    double score;

    /**
     * 各信号贡献（有序）
     */
    Map<String, Double> components;

    List<String> reasons;

    public ValueScore(String userId, double score, Map<String, Double> components, List<String> reasons) {
        this.userId = userId;
        this.score = score;
        this.components = Collections.unmodifiableMap(new LinkedHashMap<>(components));
        this.reasons = List.copyOf(reasons);
    }
}
