package com.example.kosagent.dto;

import com.example.kosagent.context.WorkflowState;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 非完全成功的运行结果：已合并的状态 + 哪些节点失败 / 超时 / 跳过
 */
@Value
@Builder
public class PartialWorkflowFailure {

    String runId;

    RunStatus status;

    List<String> failedNodes;

    List<String> timedOutNodes;

    List<String> skippedNodes;

    /**
     * 截止到结束时已合并的状态
     */
    WorkflowState partialState;

    String summary;
}
