package com.example.kosagent.agent;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ForkJoinTask;
import java.util.concurrent.ForkJoinWorkerThread;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * 有界任务池
 *
 * 节点与节点内部的批量子任务（批量打分、批量生成）共用同一个池，
 * 并发度即 kos.workflow.concurrency，用于限制对外部接口的并发请求。
 * 基于 ForkJoinPool：节点内 {@link #mapBounded} 在池线程上执行时通过工作窃取完成，
 * 不会因为嵌套等待而耗尽线程。
 */
@Slf4j
public class TaskPool implements AutoCloseable {

    private final ForkJoinPool pool;

    public TaskPool(int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1");
        }
        AtomicInteger counter = new AtomicInteger();
        this.pool = new ForkJoinPool(parallelism, p -> {
            ForkJoinWorkerThread thread = ForkJoinPool.defaultForkJoinWorkerThreadFactory.newThread(p);
            thread.setName("kos-worker-" + counter.incrementAndGet());
            return thread;
        }, (t, e) -> log.error("[TaskPool] 工作线程异常退出: {}", t.getName(), e), false);
        log.info("[TaskPool] 初始化完成，并发度={}", parallelism);
    }

    public <T> ForkJoinTask<T> submit(Callable<T> task) {
        return pool.submit(task);
    }

    /**
     * 在池内并发映射，结果与输入顺序一致；任一子任务抛出异常则向上抛出
     */
    public <T, R> List<R> mapBounded(List<T> items, Function<T, R> fn) {
        List<ForkJoinTask<R>> tasks = new ArrayList<>(items.size());
        for (T item : items) {
            tasks.add(ForkJoinTask.adapt((Callable<R>) () -> fn.apply(item)));
        }
        if (ForkJoinTask.getPool() == pool) {
            ForkJoinTask.invokeAll(tasks);
        } else {
            tasks.forEach(pool::execute);
        }
        List<R> results = new ArrayList<>(tasks.size());
        for (ForkJoinTask<R> task : tasks) {
            results.add(task.join());
        }
        return results;
    }

    @Override
    public void close() {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(10, TimeUnit.SECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[TaskPool] 已关闭");
    }
}
