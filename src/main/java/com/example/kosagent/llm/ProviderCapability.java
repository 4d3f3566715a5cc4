package com.example.kosagent.llm;

import lombok.Builder;
import lombok.Value;

/**
 * 提供方能力元数据
 */
@Value
@Builder
public class ProviderCapability {

    /**
     * 可接受的最大提示长度（字符）
     */
    int maxContextChars;

    /**
     * 成本档位，数值越大越贵
     */
    int costTier;
}
