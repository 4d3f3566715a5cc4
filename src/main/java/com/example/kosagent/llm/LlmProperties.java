package com.example.kosagent.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;

/**
 * 模型提供方配置，对应 application.yml 中的 kos.llm
 *
 * kos:
 *   llm:
 *     max-retries: 2
 *     initial-backoff-ms: 500
 *     providers:
 *       - name: qwen
 *         base-url: https://dashscope.aliyuncs.com/compatible-mode/v1
 *         api-key: ${QWEN_MODEL_API_KEY:}
 *         model: qwen-plus
 *         cost-tier: 1
 *
 * providers 的顺序即初始优先级，运行期间会按健康度重新排序。
 */
@ConfigurationProperties(prefix = "kos.llm")
public record LlmProperties(
        List<ProviderConfig> providers,
        @DefaultValue("2") int maxRetries,
        @DefaultValue("500") long initialBackoffMs,
        @DefaultValue("2.0") double backoffMultiplier,
        @DefaultValue("20") int healthWindow
) {

    public LlmProperties {
        providers = providers == null ? List.of() : List.copyOf(providers);
    }

    public record ProviderConfig(
            String name,
            String baseUrl,
            String apiKey,
            String model,
            @DefaultValue("60") int timeoutSeconds,
            @DefaultValue("32000") int maxContextChars,
            @DefaultValue("1") int costTier,
            @DefaultValue("0.7") double temperature,
            @DefaultValue("4000") int maxTokens
    ) {}
}
