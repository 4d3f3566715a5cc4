package com.example.kosagent.context;

import com.example.kosagent.exception.NodeTimeoutException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 运行级取消令牌
 *
 * 一次运行只有一个截止时间，所有挂起点（模型调用、索引调用）共享同一个令牌：
 * 1. 阻塞等待的 HTTP 调用通过 {@link #whenCancelled()} 提前结束
 * 2. 节点/网关在检查点调用 {@link #throwIfCancelled(String)}
 */
@Slf4j
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final Sinks.One<Boolean> signal = Sinks.one();
    private final long deadlineNanos;

    private CancellationToken(long deadlineNanos) {
        this.deadlineNanos = deadlineNanos;
    }

    public static CancellationToken withTimeout(Duration timeout) {
        return new CancellationToken(System.nanoTime() + timeout.toNanos());
    }

    /**
     * 不设截止时间（仅可手动取消），用于运行之外的直接调用
     */
    public static CancellationToken none() {
        return new CancellationToken(Long.MAX_VALUE);
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            signal.tryEmitValue(Boolean.TRUE);
            log.debug("[Cancellation] 已发出取消信号");
        }
    }

    public boolean isCancelled() {
        if (!cancelled.get() && deadlineNanos != Long.MAX_VALUE && System.nanoTime() >= deadlineNanos) {
            cancel();
        }
        return cancelled.get();
    }

    /**
     * 距截止时间的剩余时长；无截止时间时返回 null
     */
    public Duration remaining() {
        if (deadlineNanos == Long.MAX_VALUE) {
            return null;
        }
        return Duration.ofNanos(Math.max(0, deadlineNanos - System.nanoTime()));
    }

    public void throwIfCancelled(String checkpoint) {
        if (isCancelled()) {
            throw new NodeTimeoutException("运行已取消，中止于: " + checkpoint);
        }
    }

    /**
     * 取消时发出一个值，可与 Reactor 的 takeUntilOther 组合
     */
    public Mono<Boolean> whenCancelled() {
        return signal.asMono();
    }
}
