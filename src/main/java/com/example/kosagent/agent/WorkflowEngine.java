package com.example.kosagent.agent;

import com.example.kosagent.agent.graph.WorkflowGraph;
import com.example.kosagent.agent.graph.WorkflowPlan;
import com.example.kosagent.context.CancellationToken;
import com.example.kosagent.context.NodeContext;
import com.example.kosagent.context.WorkflowState;
import com.example.kosagent.dto.AgentResult;
import com.example.kosagent.dto.NodeStatus;
import com.example.kosagent.dto.PartialWorkflowFailure;
import com.example.kosagent.dto.RunStatus;
import com.example.kosagent.dto.WorkflowRequest;
import com.example.kosagent.dto.WorkflowResult;
import com.example.kosagent.exception.NodeTimeoutException;
import com.example.kosagent.exception.WorkflowValidationException;
import com.example.kosagent.index.RetrievalIndex;
import com.example.kosagent.llm.LlmGateway;
import com.example.kosagent.storage.StorageGateway;
import com.example.kosagent.storage.StorageSession;
import com.example.kosagent.storage.UserCriteria;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ForkJoinTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * 工作流引擎
 *
 * 执行流程：
 *   submit(request)
 *     └─ 校验请求并编译图（非法时抛出 WorkflowValidationException）
 *     └─ 在协调线程上异步执行，立即返回 runId
 *           └─ 打开存储会话（运行结束时关闭）
 *           └─ 按层级执行：同层节点并发提交到 TaskPool，按固定顺序等待并合并
 *           └─ 截止时间到达 → 取消令牌，未完成与未开始的节点记为 TIMED_OUT
 *
 * 节点抛出的任何异常都只记录在轨迹中，不会传给调用方。
 */
@Slf4j
public class WorkflowEngine implements AutoCloseable {

    private final WorkflowGraph graph;
    private final LlmGateway gateway;
    private final RetrievalIndex index;
    private final StorageGateway storageGateway;
    private final TaskPool pool;
    private final WorkflowProperties properties;
    private final List<WorkflowListener> listeners;
    private final ExecutorService coordinators;

    private final Map<String, RunHandle> runs = new ConcurrentHashMap<>();
    private final Deque<String> finishedRuns = new ConcurrentLinkedDeque<>();

    public WorkflowEngine(WorkflowGraph graph,
                          LlmGateway gateway,
                          RetrievalIndex index,
                          StorageGateway storageGateway,
                          TaskPool pool,
                          WorkflowProperties properties,
                          List<WorkflowListener> listeners) {
        this.graph = graph;
        this.gateway = gateway;
        this.index = index;
        this.storageGateway = storageGateway;
        this.pool = pool;
        this.properties = properties;
        this.listeners = listeners == null ? Collections.emptyList() : List.copyOf(listeners);
        AtomicInteger counter = new AtomicInteger();
        this.coordinators = Executors.newFixedThreadPool(Math.max(1, properties.maxConcurrentRuns()), r -> {
            Thread thread = new Thread(r, "kos-run-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    // ==================== 对外接口 ====================

    public String submit(WorkflowRequest request) {
        WorkflowState initial = initialState(request);
        Duration deadline = Duration.ofSeconds(request.getDeadlineSeconds() != null
            ? request.getDeadlineSeconds() : properties.defaultDeadlineSeconds());
        return submit(initial, deadline);
    }

    /**
     * 以给定初始状态提交运行
     */
    public String submit(WorkflowState initial, Duration deadline) {
        if (deadline == null || deadline.isNegative() || deadline.isZero()) {
            throw new WorkflowValidationException("截止时间必须为正数");
        }
        WorkflowPlan plan = graph.compile(initial.keys());

        String runId = UUID.randomUUID().toString();
        RunHandle handle = new RunHandle(runId);
        runs.put(runId, handle);
        log.info("[Engine] 提交运行: runId={}, 执行顺序={}, deadline={}s",
            runId, plan.executionOrder(), deadline.getSeconds());

        coordinators.execute(() -> run(handle, plan, initial, deadline));
        return runId;
    }

    public Optional<RunStatus> getStatus(String runId) {
        return Optional.ofNullable(runs.get(runId)).map(h -> h.status);
    }

    /**
     * 当前已记录的节点轨迹（按合并顺序）
     */
    public List<AgentResult> getTrace(String runId) {
        RunHandle handle = runs.get(runId);
        return handle == null ? Collections.emptyList() : List.copyOf(handle.trace);
    }

    /**
     * 运行结束后可用；未结束或不存在时为空
     */
    public Optional<WorkflowResult> getResult(String runId) {
        RunHandle handle = runs.get(runId);
        if (handle == null || !handle.completion.isDone()) {
            return Optional.empty();
        }
        return Optional.of(handle.completion.join());
    }

    public Optional<WorkflowResult> awaitCompletion(String runId, Duration timeout) {
        RunHandle handle = runs.get(runId);
        if (handle == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(handle.completion.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } catch (ExecutionException e) {
            throw new IllegalStateException("运行异常结束: " + runId, e.getCause());
        }
    }

    public String describeGraph() {
        return graph.visualize();
    }

    // ==================== 执行 ====================

    private WorkflowState initialState(WorkflowRequest request) {
        List<String> violations = new ArrayList<>();
        if (request == null) {
            throw new WorkflowValidationException("请求不能为空");
        }
        if (request.getTask() == null || request.getTask().isBlank()) {
            violations.add("task 不能为空");
        }
        if (request.getDeadlineSeconds() != null && request.getDeadlineSeconds() <= 0) {
            violations.add("deadlineSeconds 必须为正数");
        }
        UserCriteria criteria = request.getCriteria() != null ? request.getCriteria() : UserCriteria.defaults();
        if (criteria.getLimit() <= 0) {
            violations.add("criteria.limit 必须为正数");
        }
        if (criteria.getMinInteractions() < 0) {
            violations.add("criteria.minInteractions 不能为负数");
        }
        if (!violations.isEmpty()) {
            throw new WorkflowValidationException(violations);
        }

        Map<String, Object> initial = new LinkedHashMap<>();
        initial.put(StateKeys.REQUEST, request);
        initial.put(StateKeys.TASK, request.getTask());
        initial.put(StateKeys.CRITERIA, criteria);
        initial.put(StateKeys.AI_ENHANCED, request.isAiEnhanced());
        initial.put(StateKeys.BUSINESS_GOALS,
            request.getBusinessGoals() == null ? List.of() : List.copyOf(request.getBusinessGoals()));
        return WorkflowState.of(initial);
    }

    private void run(RunHandle handle, WorkflowPlan plan, WorkflowState initial, Duration deadline) {
        CancellationToken token = CancellationToken.withTimeout(deadline);
        handle.startedAt = Instant.now();
        handle.status = RunStatus.RUNNING;
        notifyListeners(l -> l.onRunStarted(handle.runId));

        WorkflowState state = initial;
        try (StorageSession session = storageGateway.openSession()) {
            NodeContext context = NodeContext.builder()
                .runId(handle.runId)
                .token(token)
                .gateway(gateway)
                .index(index)
                .storage(session)
                .pool(pool)
                .build();
            for (List<WorkflowPlan.Step> level : plan.levels()) {
                state = runLevel(handle, level, state, initial, context);
            }
        } catch (RuntimeException e) {
            log.error("[Engine] 运行异常中止: runId={}", handle.runId, e);
            recordUnfinished(handle, plan, NodeStatus.FAILED, "运行异常中止: " + e.getMessage());
        } finally {
            token.cancel();
        }

        finish(handle, state, token);
    }

    /**
     * 同层节点并发执行，结果按 (层级, 注册顺序) 依次合并
     */
    private WorkflowState runLevel(RunHandle handle, List<WorkflowPlan.Step> level,
                                   WorkflowState state, WorkflowState initial, NodeContext context) {
        WorkflowState snapshot = state;
        CancellationToken token = context.getToken();

        Map<String, AgentResult> decided = new HashMap<>();
        Map<String, ForkJoinTask<AgentResult>> running = new HashMap<>();
        Instant submittedAt = Instant.now();

        for (WorkflowPlan.Step step : level) {
            if (!step.getCondition().isActive(initial)) {
                decided.put(step.getName(), skipped(step, "节点未启用", true));
            } else if (token.isCancelled()) {
                decided.put(step.getName(), result(step, NodeStatus.TIMED_OUT, null,
                    "运行已超过截止时间，节点未启动", submittedAt));
            } else if (!snapshot.containsAll(step.getNode().requiredReads())) {
                Set<String> missing = new LinkedHashSet<>(step.getNode().requiredReads());
                missing.removeIf(snapshot::contains);
                decided.put(step.getName(), skipped(step, "缺少必需键: " + missing, false));
            } else {
                running.put(step.getName(), pool.submit(() -> invokeNode(step, snapshot, context)));
            }
        }

        WorkflowState merged = state;
        for (WorkflowPlan.Step step : level) {
            AgentResult result = decided.get(step.getName());
            if (result == null) {
                result = await(step, running.get(step.getName()), token, submittedAt);
            }
            record(handle, result);
            if (result.isOk()) {
                merged = merged.merge(result.getPartialState());
            }
        }
        return merged;
    }

    private AgentResult await(WorkflowPlan.Step step, ForkJoinTask<AgentResult> task,
                              CancellationToken token, Instant submittedAt) {
        try {
            Duration remaining = token.remaining();
            if (remaining == null) {
                return task.get();
            }
            return task.get(remaining.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            if (!token.isCancelled()) {
                token.cancel();
            }
            task.cancel(true);
            log.warn("[Engine] 节点 {} 超过运行截止时间，已取消", step.getName());
            return result(step, NodeStatus.TIMED_OUT, null, "运行超过截止时间，节点被取消", submittedAt);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            token.cancel();
            return result(step, NodeStatus.TIMED_OUT, null, "等待节点时被中断", submittedAt);
        } catch (CancellationException e) {
            return result(step, NodeStatus.TIMED_OUT, null, "节点任务已取消", submittedAt);
        } catch (ExecutionException e) {
            return result(step, NodeStatus.FAILED, null, String.valueOf(e.getCause()), submittedAt);
        }
    }

    private AgentResult invokeNode(WorkflowPlan.Step step, WorkflowState snapshot, NodeContext context) {
        Instant start = Instant.now();
        String name = step.getName();
        log.debug("[Engine] 执行节点: {}", name);
        try {
            context.getToken().throwIfCancelled("node:" + name);
            Map<String, Object> update = step.getNode().produceUpdate(snapshot, context);
            if (update == null) {
                update = Collections.emptyMap();
            }

            Set<String> undeclared = new LinkedHashSet<>(update.keySet());
            undeclared.removeAll(step.getNode().writes());
            if (!undeclared.isEmpty()) {
                log.error("[Engine] 节点 {} 写入未声明的键: {}", name, undeclared);
                return result(step, NodeStatus.FAILED, null, "写入未声明的键: " + undeclared, start);
            }
            return result(step, NodeStatus.OK, Collections.unmodifiableMap(new LinkedHashMap<>(update)), null, start);
        } catch (RuntimeException e) {
            if (isTimeout(e) || context.getToken().isCancelled()) {
                log.warn("[Engine] 节点 {} 因截止时间中止: {}", name, e.getMessage());
                return result(step, NodeStatus.TIMED_OUT, null, e.getMessage(), start);
            }
            log.error("[Engine] 节点 {} 执行失败: {}", name, e.getMessage(), e);
            return result(step, NodeStatus.FAILED, null, e.getMessage(), start);
        }
    }

    private static boolean isTimeout(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof NodeTimeoutException) {
                return true;
            }
        }
        return false;
    }

    private void finish(RunHandle handle, WorkflowState state, CancellationToken token) {
        List<AgentResult> trace = List.copyOf(handle.trace);
        RunStatus status = resolveStatus(trace);

        PartialWorkflowFailure failure = null;
        if (status != RunStatus.COMPLETED) {
            failure = PartialWorkflowFailure.builder()
                .runId(handle.runId)
                .status(status)
                .failedNodes(namesWith(trace, NodeStatus.FAILED))
                .timedOutNodes(namesWith(trace, NodeStatus.TIMED_OUT))
                .skippedNodes(trace.stream()
                    .filter(r -> r.getStatus() == NodeStatus.SKIPPED && !r.isDisabled())
                    .map(AgentResult::getNodeName)
                    .collect(Collectors.toList()))
                .partialState(state)
                .summary(summarize(trace))
                .build();
        }

        WorkflowResult result = WorkflowResult.builder()
            .runId(handle.runId)
            .status(status)
            .state(state)
            .failure(failure)
            .trace(trace)
            .startedAt(handle.startedAt)
            .endedAt(Instant.now())
            .build();

        handle.status = status;
        handle.completion.complete(result);
        log.info("[Engine] 运行结束: runId={}, status={}, {}", handle.runId, status, summarize(trace));
        notifyListeners(l -> l.onRunFinished(result));
        evictOldRuns(handle.runId);
    }

    /**
     * COMPLETED：所有启用节点成功
     * PARTIAL：必需节点全部成功，但有启用的可选节点失败 / 超时 / 跳过
     * FAILED：有必需节点未成功，或没有任何节点成功执行
     */
    static RunStatus resolveStatus(List<AgentResult> trace) {
        List<AgentResult> active = trace.stream().filter(r -> !r.isDisabled()).collect(Collectors.toList());
        if (active.isEmpty() || active.stream().noneMatch(AgentResult::isOk)) {
            return RunStatus.FAILED;
        }
        if (active.stream().anyMatch(r -> r.isRequired() && !r.isOk())) {
            return RunStatus.FAILED;
        }
        if (active.stream().allMatch(AgentResult::isOk)) {
            return RunStatus.COMPLETED;
        }
        return RunStatus.PARTIAL;
    }

    private void record(RunHandle handle, AgentResult result) {
        handle.trace.add(result);
        log.info("[Engine] 节点 {} -> {} ({}ms){}", result.getNodeName(), result.getStatus(), result.durationMs(),
            result.getError() != null ? " " + result.getError() : "");
        notifyListeners(l -> l.onNodeFinished(handle.runId, result));
    }

    /**
     * 运行异常中止时，为尚未记录的节点补齐轨迹
     */
    private void recordUnfinished(RunHandle handle, WorkflowPlan plan, NodeStatus status, String error) {
        Set<String> recorded = handle.trace.stream().map(AgentResult::getNodeName).collect(Collectors.toSet());
        Instant now = Instant.now();
        for (WorkflowPlan.Step step : plan.getSteps()) {
            if (!recorded.contains(step.getName())) {
                record(handle, result(step, status, null, error, now));
            }
        }
    }

    private AgentResult skipped(WorkflowPlan.Step step, String reason, boolean disabled) {
        Instant now = Instant.now();
        return AgentResult.builder()
            .nodeName(step.getName())
            .status(NodeStatus.SKIPPED)
            .partialState(Collections.emptyMap())
            .error(reason)
            .startedAt(now)
            .endedAt(now)
            .required(step.isRequired())
            .disabled(disabled)
            .level(step.getLevel())
            .build();
    }

    private AgentResult result(WorkflowPlan.Step step, NodeStatus status, Map<String, Object> update,
                               String error, Instant startedAt) {
        return AgentResult.builder()
            .nodeName(step.getName())
            .status(status)
            .partialState(update == null ? Collections.emptyMap() : update)
            .error(error)
            .startedAt(startedAt)
            .endedAt(Instant.now())
            .required(step.isRequired())
            .level(step.getLevel())
            .build();
    }

    private static List<String> namesWith(List<AgentResult> trace, NodeStatus status) {
        return trace.stream()
            .filter(r -> r.getStatus() == status)
            .map(AgentResult::getNodeName)
            .collect(Collectors.toList());
    }

    private static String summarize(List<AgentResult> trace) {
        Map<NodeStatus, Long> counts = trace.stream()
            .filter(r -> !r.isDisabled())
            .collect(Collectors.groupingBy(AgentResult::getStatus, LinkedHashMap::new, Collectors.counting()));
        long disabled = trace.stream().filter(AgentResult::isDisabled).count();
        return "节点统计 " + counts + (disabled > 0 ? ", 未启用 " + disabled : "");
    }

    private void notifyListeners(Consumer<WorkflowListener> action) {
        for (WorkflowListener listener : listeners) {
            try {
                action.accept(listener);
            } catch (RuntimeException e) {
                log.warn("[Engine] 监听器 {} 处理失败: {}", listener.getClass().getSimpleName(), e.getMessage());
            }
        }
    }

    private void evictOldRuns(String runId) {
        finishedRuns.addLast(runId);
        while (finishedRuns.size() > Math.max(1, properties.retainedRuns())) {
            String oldest = finishedRuns.pollFirst();
            if (oldest != null) {
                runs.remove(oldest);
            }
        }
    }

    @Override
    public void close() {
        coordinators.shutdownNow();
        log.info("[Engine] 已关闭");
    }

    private static final class RunHandle {
        private final String runId;
        private final List<AgentResult> trace = new CopyOnWriteArrayList<>();
        private final CompletableFuture<WorkflowResult> completion = new CompletableFuture<>();
        private volatile RunStatus status = RunStatus.PENDING;
        private volatile Instant startedAt;

        private RunHandle(String runId) {
            this.runId = runId;
        }
    }
}
