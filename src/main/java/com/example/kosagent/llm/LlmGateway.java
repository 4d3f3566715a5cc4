package com.example.kosagent.llm;

import com.example.kosagent.context.CancellationToken;
import com.example.kosagent.exception.GatewayExhaustedException;
import com.example.kosagent.exception.ProviderException;
import com.example.kosagent.exception.TransientProviderException;
import io.github.resilience4j.core.IntervalBiFunction;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * 多提供方模型网关
 *
 * 调用链：
 *   invoke(prompt, constraints)
 *     └─ 按当前排名依次尝试提供方（跳过上下文不足 / 超出成本档位的）
 *           └─ Retry（仅对 TransientProviderException 指数退避重试，退避不超过令牌剩余时间，取消后不再重试）
 *                 └─ provider.complete(request)
 *     └─ 全部失败 → GatewayExhaustedException
 *
 * 每次尝试都会更新该提供方的健康度；每次 invoke 结束后按健康度重新排名，
 * 健康度相同时保持配置顺序。
 */
@Slf4j
public class LlmGateway {

    private final List<Slot> slots;
    private final RetryRegistry retryRegistry;
    private final Object rankLock = new Object();
    private volatile List<Slot> ranking;

    public LlmGateway(List<LlmProvider> providers, LlmProperties properties) {
        this(providers, RetryRegistry.of(retryConfig(properties)), properties.healthWindow());
    }

    public LlmGateway(List<LlmProvider> providers, RetryRegistry retryRegistry, int healthWindow) {
        List<Slot> list = new ArrayList<>();
        for (int i = 0; i < providers.size(); i++) {
            list.add(new Slot(providers.get(i), i, new ProviderHealth(healthWindow)));
        }
        this.slots = List.copyOf(list);
        this.ranking = this.slots;
        this.retryRegistry = retryRegistry;
        log.info("[Gateway] 已加载 {} 个模型提供方: {}", slots.size(),
            slots.stream().map(s -> s.provider.name()).collect(Collectors.toList()));
    }

    /**
     * 最多 maxRetries 次重试（即单个提供方 maxRetries + 1 次尝试），只重试瞬时错误
     */
    public static RetryConfig retryConfig(LlmProperties properties) {
        return RetryConfig.custom()
            .maxAttempts(properties.maxRetries() + 1)
            .intervalFunction(IntervalFunction.ofExponentialBackoff(
                Duration.ofMillis(Math.max(1, properties.initialBackoffMs())),
                properties.backoffMultiplier()))
            .retryOnException(e -> e instanceof TransientProviderException)
            .build();
    }

    public LlmResponse invoke(String prompt, LlmConstraints constraints) {
        LlmConstraints c = constraints != null ? constraints : LlmConstraints.defaults();
        CancellationToken token = c.getToken() != null ? c.getToken() : CancellationToken.none();
        long start = System.currentTimeMillis();

        Map<String, String> failures = new LinkedHashMap<>();
        AtomicInteger attempts = new AtomicInteger();
        try {
            for (Slot slot : orderFor(c)) {
                token.throwIfCancelled("gateway:" + slot.provider.name());

                String skipReason = skipReason(slot.provider.capability(), prompt, c);
                if (skipReason != null) {
                    log.debug("[Gateway] 跳过 {}: {}", slot.provider.name(), skipReason);
                    failures.put(slot.provider.name(), skipReason);
                    continue;
                }

                LlmRequest request = LlmRequest.builder()
                    .systemPrompt(c.getSystemPrompt())
                    .prompt(prompt)
                    .maxTokens(c.getMaxTokens())
                    .temperature(c.getTemperature())
                    .token(token)
                    .build();

                Supplier<String> attempt = () -> {
                    token.throwIfCancelled("gateway-attempt:" + slot.provider.name());
                    attempts.incrementAndGet();
                    try {
                        String content = slot.provider.complete(request);
                        slot.health.recordSuccess();
                        return content;
                    } catch (ProviderException e) {
                        slot.health.recordFailure(e.getMessage());
                        log.warn("[Gateway] {} 调用失败 (retryable={}): {}",
                            slot.provider.name(), e.isRetryable(), e.getMessage());
                        throw e;
                    }
                };

                Retry retry = cancellable(retryRegistry.retry(slot.provider.name()), token);
                try {
                    String content = Retry.decorateSupplier(retry, attempt).get();
                    long latency = System.currentTimeMillis() - start;
                    log.info("[Gateway] {} 调用成功，累计尝试 {} 次，耗时 {}ms",
                        slot.provider.name(), attempts.get(), latency);
                    return LlmResponse.builder()
                        .provider(slot.provider.name())
                        .content(content)
                        .attempts(attempts.get())
                        .latencyMs(latency)
                        .build();
                } catch (ProviderException e) {
                    failures.put(slot.provider.name(), e.getMessage());
                    log.warn("[Gateway] {} 已放弃，切换下一个提供方", slot.provider.name());
                }
            }
        } finally {
            rerank();
        }

        // 因取消而放弃重试时按超时上报
        token.throwIfCancelled("gateway:exhausted");
        log.error("[Gateway] 所有提供方均失败: {}", failures);
        throw new GatewayExhaustedException(failures);
    }

    /**
     * 按令牌收紧重试：已取消时不再重试，退避等待截断到截止时间，醒来后由尝试入口的检查点中止
     */
    static Retry cancellable(Retry template, CancellationToken token) {
        RetryConfig base = template.getRetryConfig();
        Predicate<Throwable> retryable = base.getExceptionPredicate();
        IntervalBiFunction<Object> backoff = base.getIntervalBiFunction();
        RetryConfig config = RetryConfig.<Object>from(base)
            .retryOnException(e -> !token.isCancelled() && retryable.test(e))
            .intervalBiFunction((attempt, outcome) -> {
                long wait = backoff.apply(attempt, outcome);
                Duration remaining = token.remaining();
                return remaining == null ? wait : Math.min(wait, remaining.toMillis());
            })
            .build();
        return Retry.of(template.getName(), config);
    }

    public LlmResponse invoke(String prompt) {
        return invoke(prompt, LlmConstraints.defaults());
    }

    private String skipReason(ProviderCapability capability, String prompt, LlmConstraints c) {
        int length = prompt == null ? 0 : prompt.length();
        if (c.getSystemPrompt() != null) {
            length += c.getSystemPrompt().length();
        }
        if (capability.getMaxContextChars() > 0 && length > capability.getMaxContextChars()) {
            return "上下文超限(" + length + " > " + capability.getMaxContextChars() + ")";
        }
        if (c.getMaxCostTier() != null && capability.getCostTier() > c.getMaxCostTier()) {
            return "成本档位 " + capability.getCostTier() + " 超出上限 " + c.getMaxCostTier();
        }
        return null;
    }

    private List<Slot> orderFor(LlmConstraints c) {
        List<Slot> order = new ArrayList<>(ranking);
        if (c.getPreferredProvider() != null) {
            order.stream()
                .filter(s -> s.provider.name().equals(c.getPreferredProvider()))
                .findFirst()
                .ifPresent(preferred -> {
                    order.remove(preferred);
                    order.add(0, preferred);
                });
        }
        return order;
    }

    /**
     * 按健康度降序重排，稳定排序保证同分时维持配置顺序
     */
    private void rerank() {
        synchronized (rankLock) {
            List<Slot> next = new ArrayList<>(slots);
            Map<Slot, Double> scores = new LinkedHashMap<>();
            next.forEach(s -> scores.put(s, s.health.score()));
            next.sort(Comparator.comparingDouble((Slot s) -> scores.get(s)).reversed()
                .thenComparingInt(s -> s.priority));
            ranking = List.copyOf(next);
        }
    }

    /**
     * 当前排名顺序下的提供方名
     */
    public List<String> rankedProviderNames() {
        return ranking.stream().map(s -> s.provider.name()).collect(Collectors.toList());
    }

    public double healthOf(String providerName) {
        return slots.stream()
            .filter(s -> s.provider.name().equals(providerName))
            .findFirst()
            .map(s -> s.health.score())
            .orElseThrow(() -> new IllegalArgumentException("未知提供方: " + providerName));
    }

    public List<ProviderStatus> providerSnapshots() {
        List<Slot> current = ranking;
        List<ProviderStatus> result = new ArrayList<>();
        for (int i = 0; i < current.size(); i++) {
            Slot s = current.get(i);
            result.add(ProviderStatus.builder()
                .name(s.provider.name())
                .rank(i + 1)
                .configuredPriority(s.priority + 1)
                .health(s.health.score())
                .totalAttempts(s.health.totalAttempts())
                .totalFailures(s.health.totalFailures())
                .capability(s.provider.capability())
                .lastFailure(s.health.lastFailure())
                .lastFailureAt(s.health.lastFailureAt())
                .build());
        }
        return result;
    }

    private static final class Slot {
        private final LlmProvider provider;
        private final int priority;
        private final ProviderHealth health;

        private Slot(LlmProvider provider, int priority, ProviderHealth health) {
            this.provider = provider;
            this.priority = priority;
            this.health = health;
        }
    }
}
