package com.example.kosagent.dto;

import com.example.kosagent.context.WorkflowState;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * 运行终态
 *
 * COMPLETED 时 failure 为空；PARTIAL / FAILED 时 failure 描述缺失的部分。
 */
@Value
@Builder
public class WorkflowResult {

    String runId;

    RunStatus status;

    WorkflowState state;

    PartialWorkflowFailure failure;

    List<AgentResult> trace;

    Instant startedAt;

    Instant endedAt;

    public boolean isCompleted() {
        return status == RunStatus.COMPLETED;
    }
}
