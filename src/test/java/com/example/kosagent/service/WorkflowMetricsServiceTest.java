package com.example.kosagent.service;

import com.example.kosagent.agent.StateKeys;
import com.example.kosagent.context.WorkflowState;
import com.example.kosagent.dto.AgentResult;
import com.example.kosagent.dto.NodeStatus;
import com.example.kosagent.dto.RunMetrics;
import com.example.kosagent.dto.RunStatus;
import com.example.kosagent.dto.WorkflowResult;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class WorkflowMetricsServiceTest {

    private final WorkflowMetricsService service = new WorkflowMetricsService();

    private static AgentResult node(String name, NodeStatus status, long millis, boolean disabled) {
        Instant start = Instant.parse("2024-05-01T00:00:00Z");
        return AgentResult.builder()
            .nodeName(name)
            .status(status)
            .startedAt(start)
            .endedAt(start.plusMillis(millis))
            .disabled(disabled)
            .build();
    }

    @Test
    void calculatesMetricsFromTrace() {
        Instant start = Instant.parse("2024-05-01T00:00:00Z");
        WorkflowResult result = WorkflowResult.builder()
            .runId("r1")
            .status(RunStatus.PARTIAL)
            .startedAt(start)
            .endedAt(start.plusMillis(1500))
            .trace(List.of(
                node("task_analysis", NodeStatus.SKIPPED, 0, true),
                node("user_analysis", NodeStatus.OK, 300, false),
                node("content_generation", NodeStatus.OK, 900, false),
                node("coordination", NodeStatus.FAILED, 10, false)))
            .state(WorkflowState.of(Map.of(
                StateKeys.HIGH_VALUE_USERS, List.of("U1", "U2"),
                StateKeys.GENERATED_CONTENT, List.of("c1"))))
            .build();

        RunMetrics metrics = service.calculateMetrics(result);

        assertThat(metrics.getTotalDurationMs()).isEqualTo(1500);
        assertThat(metrics.getOkNodes()).isEqualTo(2);
        assertThat(metrics.getFailedNodes()).isEqualTo(1);
        assertThat(metrics.getSkippedNodes()).isZero();
        assertThat(metrics.getSlowestNode()).isEqualTo("content_generation");
        assertThat(metrics.getHighValueUsers()).isEqualTo(2);
        assertThat(metrics.getGeneratedContents()).isEqualTo(1);
        assertThat(metrics.getSummary()).contains("run=r1").contains("status=PARTIAL");
    }
}
