package com.example.kosagent.agent;

import com.example.kosagent.dto.AgentResult;
import com.example.kosagent.dto.WorkflowResult;

/**
 * 运行过程回调。实现不得抛出异常影响运行
 */
public interface WorkflowListener {

    default void onRunStarted(String runId) {
    }

    default void onNodeFinished(String runId, AgentResult result) {
    }

    default void onRunFinished(WorkflowResult result) {
    }
}
