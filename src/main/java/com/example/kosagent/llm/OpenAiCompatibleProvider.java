package com.example.kosagent.llm;

import com.example.kosagent.context.CancellationToken;
import com.example.kosagent.exception.NodeTimeoutException;
import com.example.kosagent.exception.PermanentProviderException;
import com.example.kosagent.exception.ProviderException;
import com.example.kosagent.exception.TransientProviderException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.Exceptions;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * OpenAI 兼容接口（/chat/completions）的提供方实现
 *
 * 通义千问、DeepSeek、OpenAI 等均走同一协议，只是 baseUrl / model 不同。
 */
@Slf4j
public class OpenAiCompatibleProvider implements LlmProvider {

    private final LlmProperties.ProviderConfig config;
    private final WebClient webClient;
    private final ProviderCapability capability;

    public OpenAiCompatibleProvider(LlmProperties.ProviderConfig config, WebClient webClient) {
        this.config = config;
        this.webClient = webClient;
        this.capability = ProviderCapability.builder()
            .maxContextChars(config.maxContextChars())
            .costTier(config.costTier())
            .build();
    }

    @Override
    public String name() {
        return config.name();
    }

    @Override
    public ProviderCapability capability() {
        return capability;
    }

    @Override
    @SuppressWarnings("unchecked")
    public String complete(LlmRequest request) {
        CancellationToken token = request.getToken() != null ? request.getToken() : CancellationToken.none();

        Map<String, Object> payload = new HashMap<>();
        payload.put("model", config.model());
        payload.put("stream", false);
        payload.put("temperature", request.getTemperature() != null ? request.getTemperature() : config.temperature());
        payload.put("max_tokens", request.getMaxTokens() != null ? request.getMaxTokens() : config.maxTokens());

        List<Map<String, Object>> messages = new ArrayList<>();
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(Map.of("role", "system", "content", request.getSystemPrompt()));
        }
        messages.add(Map.of("role", "user", "content", request.getPrompt()));
        payload.put("messages", messages);

        Map<String, Object> response;
        try {
            response = webClient.post()
                .uri("/chat/completions")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + (config.apiKey() == null ? "" : config.apiKey()))
                .bodyValue(payload)
                .retrieve()
                .onStatus(HttpStatusCode::isError, resp -> resp.bodyToMono(String.class)
                    .defaultIfEmpty("")
                    .map(body -> classify(resp.statusCode().value(), body)))
                .bodyToMono(Map.class)
                .timeout(Duration.ofSeconds(config.timeoutSeconds()))
                .takeUntilOther(token.whenCancelled())
                .block();
        } catch (ProviderException e) {
            throw e;
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof TimeoutException) {
                throw new TransientProviderException(name(), "请求超时(" + config.timeoutSeconds() + "s)", cause);
            }
            if (cause instanceof WebClientRequestException) {
                throw new TransientProviderException(name(), "网络异常: " + cause.getMessage(), cause);
            }
            throw new TransientProviderException(name(), "调用异常: " + cause.getMessage(), cause);
        }

        if (response == null) {
            if (token.isCancelled()) {
                throw new NodeTimeoutException("模型调用被取消: " + name());
            }
            throw new TransientProviderException(name(), "响应为空");
        }

        Object choices = response.get("choices");
        if (choices instanceof List && !((List<?>) choices).isEmpty()) {
            Object first = ((List<?>) choices).get(0);
            if (first instanceof Map) {
                Object message = ((Map<String, Object>) first).get("message");
                if (message instanceof Map) {
                    Object content = ((Map<String, Object>) message).get("content");
                    if (content instanceof String && !((String) content).isBlank()) {
                        return (String) content;
                    }
                }
            }
        }
        throw new TransientProviderException(name(), "响应中没有 choices[0].message.content");
    }

    /**
     * 429 / 408 / 5xx 视为可重试，其余 4xx 直接换下一个提供方
     */
    static ProviderException classify(String provider, int status, String body) {
        String brief = body == null ? "" : (body.length() > 200 ? body.substring(0, 200) : body);
        if (status == 429 || status == 408 || status >= 500) {
            return new TransientProviderException(provider, "HTTP " + status + " " + brief);
        }
        return new PermanentProviderException(provider, "HTTP " + status + " " + brief);
    }

    private ProviderException classify(int status, String body) {
        log.warn("[LlmProvider] {} 返回 HTTP {}", name(), status);
        return classify(name(), status, body);
    }
}
