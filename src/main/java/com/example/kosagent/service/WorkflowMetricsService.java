package com.example.kosagent.service;

import com.example.kosagent.agent.StateKeys;
import com.example.kosagent.agent.WorkflowListener;
import com.example.kosagent.dto.AgentResult;
import com.example.kosagent.dto.NodeStatus;
import com.example.kosagent.dto.RunMetrics;
import com.example.kosagent.dto.WorkflowResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;

/**
 * 指标服务 - 运行结束时计算并记录评估指标
 */
@Slf4j
@Service
public class WorkflowMetricsService implements WorkflowListener {

    @Override
    public void onRunFinished(WorkflowResult result) {
        recordMetrics(calculateMetrics(result));
    }

    /**
     * 从运行轨迹和最终状态计算指标
     */
    public RunMetrics calculateMetrics(WorkflowResult result) {
        List<AgentResult> trace = result.getTrace();
        RunMetrics metrics = RunMetrics.builder()
            .runId(result.getRunId())
            .status(result.getStatus())
            .build();

        if (result.getStartedAt() != null && result.getEndedAt() != null) {
            metrics.setTotalDurationMs(Duration.between(result.getStartedAt(), result.getEndedAt()).toMillis());
        }

        // 节点统计（未启用的节点不计入）
        metrics.setOkNodes(count(trace, NodeStatus.OK));
        metrics.setFailedNodes(count(trace, NodeStatus.FAILED));
        metrics.setTimedOutNodes(count(trace, NodeStatus.TIMED_OUT));
        metrics.setSkippedNodes(count(trace, NodeStatus.SKIPPED));

        trace.stream()
            .filter(r -> !r.isDisabled())
            .max(Comparator.comparingLong(AgentResult::durationMs))
            .ifPresent(slowest -> {
                metrics.setSlowestNode(slowest.getNodeName());
                metrics.setSlowestNodeDurationMs(slowest.durationMs());
            });

        // 业务产出
        if (result.getState() != null) {
            metrics.setHighValueUsers(sizeOf(result.getState().get(StateKeys.HIGH_VALUE_USERS)));
            metrics.setGeneratedContents(sizeOf(result.getState().get(StateKeys.GENERATED_CONTENT)));
        }
        return metrics;
    }

    public void recordMetrics(RunMetrics metrics) {
        log.info("[Metrics] {}", metrics.getSummary());
    }

    private static int count(List<AgentResult> trace, NodeStatus status) {
        return (int) trace.stream().filter(r -> !r.isDisabled() && r.getStatus() == status).count();
    }

    private static int sizeOf(Object value) {
        return value instanceof List ? ((List<?>) value).size() : 0;
    }
}
