package com.example.kosagent.service;

import com.example.kosagent.index.SourceType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IndexRebuildLockServiceTest {

    @Mock
    private RedissonClient redissonClient;

    @Mock
    private RLock lock;

    @InjectMocks
    private IndexRebuildLockService lockService;

    @Test
    @DisplayName("拿到锁时执行并释放")
    void runsActionUnderLock() throws InterruptedException {
        when(redissonClient.getLock("kos:index:rebuild:comment")).thenReturn(lock);
        when(lock.tryLock(eq(0L), anyLong(), eq(TimeUnit.SECONDS))).thenReturn(true);
        when(lock.isHeldByCurrentThread()).thenReturn(true);

        String result = lockService.executeWithLock(SourceType.COMMENT, () -> "done", "skipped");

        assertThat(result).isEqualTo("done");
        verify(lock).unlock();
    }

    @Test
    @DisplayName("锁被占用时返回默认值，不执行操作")
    void returnsDefaultWhenLocked() throws InterruptedException {
        when(redissonClient.getLock("kos:index:rebuild:note")).thenReturn(lock);
        when(lock.tryLock(eq(0L), anyLong(), eq(TimeUnit.SECONDS))).thenReturn(false);

        String result = lockService.executeWithLock(SourceType.NOTE, () -> {
            throw new AssertionError("不应执行");
        }, "skipped");

        assertThat(result).isEqualTo("skipped");
        verify(lock, never()).unlock();
    }

    @Test
    @DisplayName("操作抛出异常时仍然释放锁")
    void releasesLockOnFailure() throws InterruptedException {
        when(redissonClient.getLock("kos:index:rebuild:analysis")).thenReturn(lock);
        when(lock.tryLock(eq(0L), anyLong(), eq(TimeUnit.SECONDS))).thenReturn(true);
        when(lock.isHeldByCurrentThread()).thenReturn(true);

        assertThatThrownBy(() -> lockService.executeWithLock(SourceType.ANALYSIS, () -> {
            throw new IllegalStateException("boom");
        }, "skipped")).isInstanceOf(IllegalStateException.class);

        verify(lock).unlock();
    }
}
