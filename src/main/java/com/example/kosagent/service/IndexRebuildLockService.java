package com.example.kosagent.service;

import com.example.kosagent.index.SourceType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * 索引重建锁
 *
 * 同一来源类型同一时刻只允许一个实例重建，锁带租期防止进程崩溃后死锁。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IndexRebuildLockService {

    private final RedissonClient redissonClient;

    // 不等待：已有重建在进行时直接跳过
    private static final long WAIT_TIME = 0;

    // 锁自动释放时间（秒）
    private static final long LEASE_TIME = 1800;

    public boolean tryLock(SourceType sourceType) {
        RLock lock = redissonClient.getLock(getLockKey(sourceType));
        try {
            boolean acquired = lock.tryLock(WAIT_TIME, LEASE_TIME, TimeUnit.SECONDS);
            if (acquired) {
                log.info("[IndexLock] 获取重建锁成功: sourceType={}", sourceType);
            } else {
                log.warn("[IndexLock] 重建锁已被占用: sourceType={}", sourceType);
            }
            return acquired;
        } catch (InterruptedException e) {
            log.error("[IndexLock] 获取锁时被中断: sourceType={}", sourceType, e);
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public void unlock(SourceType sourceType) {
        RLock lock = redissonClient.getLock(getLockKey(sourceType));
        if (lock.isHeldByCurrentThread()) {
            lock.unlock();
            log.info("[IndexLock] 释放重建锁: sourceType={}", sourceType);
        } else {
            log.warn("[IndexLock] 尝试释放非本线程持有的锁: sourceType={}", sourceType);
        }
    }

    /**
     * 执行带锁的操作，获取锁失败时返回 defaultValue
     */
    public <T> T executeWithLock(SourceType sourceType, Supplier<T> action, T defaultValue) {
        if (tryLock(sourceType)) {
            try {
                return action.get();
            } finally {
                unlock(sourceType);
            }
        }
        return defaultValue;
    }

    private String getLockKey(SourceType sourceType) {
        return "kos:index:rebuild:" + sourceType.name().toLowerCase();
    }
}
