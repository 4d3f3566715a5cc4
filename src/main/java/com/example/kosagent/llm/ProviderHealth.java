package com.example.kosagent.llm;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * 提供方滚动健康度：最近 N 次尝试中的成功率
 *
 * 每个提供方一把锁，不同提供方之间互不阻塞。
 */
public class ProviderHealth {

    private final int window;
    private final Deque<Boolean> outcomes = new ArrayDeque<>();
    private long totalAttempts;
    private long totalFailures;
    private String lastFailure;
    private Instant lastFailureAt;

    public ProviderHealth(int window) {
        if (window < 1) {
            throw new IllegalArgumentException("health window must be >= 1");
        }
        this.window = window;
    }

    public synchronized void recordSuccess() {
        push(true);
    }

    public synchronized void recordFailure(String reason) {
        push(false);
        totalFailures++;
        lastFailure = reason;
        lastFailureAt = Instant.now();
    }

    private void push(boolean ok) {
        outcomes.addLast(ok);
        if (outcomes.size() > window) {
            outcomes.removeFirst();
        }
        totalAttempts++;
    }

    /**
     * 窗口内成功率；尚无尝试时为 1.0（中性）
     */
    public synchronized double score() {
        if (outcomes.isEmpty()) {
            return 1.0;
        }
        long ok = outcomes.stream().filter(Boolean::booleanValue).count();
        return (double) ok / outcomes.size();
    }

    public synchronized long totalAttempts() {
        return totalAttempts;
    }

    public synchronized long totalFailures() {
        return totalFailures;
    }

    public synchronized String lastFailure() {
        return lastFailure;
    }

    public synchronized Instant lastFailureAt() {
        return lastFailureAt;
    }
}
