package com.example.kosagent.config;

import com.example.kosagent.index.EmbeddingProperties;
import com.example.kosagent.index.EmbeddingProvider;
import com.example.kosagent.index.HttpEmbeddingProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(EmbeddingProperties.class)
public class EmbeddingConfig {

    @Bean
    public EmbeddingProvider embeddingProvider(EmbeddingProperties properties) {
        return new HttpEmbeddingProvider(LlmGatewayConfig.webClient(properties.baseUrl()), properties);
    }
}
