package com.example.kosagent.index;

import com.example.kosagent.context.CancellationToken;
import com.example.kosagent.exception.NodeTimeoutException;
import com.example.kosagent.exception.TransientProviderException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.Exceptions;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI 兼容接口的向量化实现
 */
@Slf4j
public class HttpEmbeddingProvider implements EmbeddingProvider {

    private static final String PROVIDER = "embedding";

    private final WebClient webClient;
    private final EmbeddingProperties properties;

    public HttpEmbeddingProvider(WebClient webClient, EmbeddingProperties properties) {
        this.webClient = webClient;
        this.properties = properties;
    }

    @Override
    @SuppressWarnings("unchecked")
    public double[] embed(String text, CancellationToken token) {
        String input = text == null ? "" : text;
        if (input.length() > properties.maxInputChars()) {
            input = input.substring(0, properties.maxInputChars());
        }

        Map<String, Object> payload = new HashMap<>();
        payload.put("model", properties.model());
        payload.put("input", input);

        Map<String, Object> response;
        try {
            response = webClient.post()
                .uri("/embeddings")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + (properties.apiKey() == null ? "" : properties.apiKey()))
                .bodyValue(payload)
                .retrieve()
                .bodyToMono(Map.class)
                .timeout(Duration.ofSeconds(properties.timeoutSeconds()))
                .takeUntilOther(token.whenCancelled())
                .block();
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            log.warn("[Embedding] 向量化失败: {}", cause.getMessage());
            throw new TransientProviderException(PROVIDER, "向量化失败: " + cause.getMessage(), cause);
        }

        if (response == null) {
            if (token.isCancelled()) {
                throw new NodeTimeoutException("向量化调用被取消");
            }
            throw new TransientProviderException(PROVIDER, "向量化响应为空");
        }

        Object data = response.get("data");
        if (data instanceof List && !((List<?>) data).isEmpty() && ((List<?>) data).get(0) instanceof Map) {
            Object embedding = ((Map<String, Object>) ((List<?>) data).get(0)).get("embedding");
            if (embedding instanceof List) {
                List<?> values = (List<?>) embedding;
                double[] vector = new double[values.size()];
                for (int i = 0; i < values.size(); i++) {
                    vector[i] = ((Number) values.get(i)).doubleValue();
                }
                return vector;
            }
        }
        throw new TransientProviderException(PROVIDER, "响应中没有 data[0].embedding");
    }
}
