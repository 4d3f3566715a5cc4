package com.example.kosagent.llm;

import lombok.Builder;
import lombok.Value;

/**
 * 网关返回的完整结果（失败尝试的输出不会出现在这里）
 */
@Value
@Builder
public class LlmResponse {

    String provider;

    String content;

    /**
     * 本次 invoke 累计尝试次数（含失败的提供方）
     */
    int attempts;

    long latencyMs;
}
