package com.example.kosagent.config;

import com.example.kosagent.llm.LlmGateway;
import com.example.kosagent.llm.LlmProperties;
import com.example.kosagent.llm.LlmProvider;
import com.example.kosagent.llm.OpenAiCompatibleProvider;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.ArrayList;
import java.util.List;

/**
 * 模型网关装配
 *
 * 每个配置的提供方一个 WebClient，重试策略统一由 RetryRegistry 给出。
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(LlmProperties.class)
public class LlmGatewayConfig {

    // 模型响应可能较长，放宽默认 256KB 的缓冲上限
    private static final int MAX_IN_MEMORY_SIZE = 4 * 1024 * 1024;

    @Bean
    public RetryRegistry llmRetryRegistry(LlmProperties properties) {
        return RetryRegistry.of(LlmGateway.retryConfig(properties));
    }

    @Bean
    public LlmGateway llmGateway(LlmProperties properties, RetryRegistry llmRetryRegistry) {
        List<LlmProvider> providers = new ArrayList<>();
        for (LlmProperties.ProviderConfig config : properties.providers()) {
            if (config.baseUrl() == null || config.baseUrl().isBlank()) {
                log.warn("[LlmConfig] 提供方 {} 未配置 base-url，已忽略", config.name());
                continue;
            }
            if (config.apiKey() == null || config.apiKey().isBlank()) {
                log.warn("[LlmConfig] 提供方 {} 未配置 api-key", config.name());
            }
            providers.add(new OpenAiCompatibleProvider(config, webClient(config.baseUrl())));
        }
        if (providers.isEmpty()) {
            log.warn("[LlmConfig] 没有可用的模型提供方，所有模型调用都会失败");
        }
        return new LlmGateway(providers, llmRetryRegistry, properties.healthWindow());
    }

    static WebClient webClient(String baseUrl) {
        return WebClient.builder()
            .baseUrl(baseUrl)
            .exchangeStrategies(ExchangeStrategies.builder()
                .codecs(c -> c.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_SIZE))
                .build())
            .build();
    }
}
