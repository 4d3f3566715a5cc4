package com.example.kosagent.llm;

import com.example.kosagent.context.CancellationToken;
import lombok.Builder;
import lombok.Value;

/**
 * 单次调用的约束
 */
@Value
@Builder(toBuilder = true)
public class LlmConstraints {

    String systemPrompt;

    Integer maxTokens;

    Double temperature;

    /**
     * 允许使用的最高成本档位，null 表示不限
     */
    Integer maxCostTier;

    /**
     * 本次调用优先尝试的提供方（仅影响本次顺序）
     */
    String preferredProvider;

    @Builder.Default
    CancellationToken token = CancellationToken.none();

    public static LlmConstraints defaults() {
        return LlmConstraints.builder().build();
    }

    public static LlmConstraints system(String systemPrompt, CancellationToken token) {
        return LlmConstraints.builder()
            .systemPrompt(systemPrompt)
            .token(token)
            .build();
    }
}
