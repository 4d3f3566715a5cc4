package com.example.kosagent.llm;

import com.example.kosagent.context.CancellationToken;
import lombok.Builder;
import lombok.Value;

/**
 * 发给单个提供方的请求
 */
@Value
@Builder
public class LlmRequest {

    String systemPrompt;

    String prompt;

    Integer maxTokens;

    Double temperature;

    CancellationToken token;
}
