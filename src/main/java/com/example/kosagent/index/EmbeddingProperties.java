package com.example.kosagent.index;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * 向量化服务配置（OpenAI 兼容 /embeddings），对应 kos.embedding
 */
@ConfigurationProperties(prefix = "kos.embedding")
public record EmbeddingProperties(
        String baseUrl,
        String apiKey,
        @DefaultValue("text-embedding-v3") String model,
        @DefaultValue("30") int timeoutSeconds,
        @DefaultValue("8000") int maxInputChars
) {}
