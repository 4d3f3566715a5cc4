package com.example.kosagent.agent.graph;

import com.example.kosagent.context.WorkflowState;

/**
 * 节点激活条件，基于初始状态（请求参数）求值
 */
@FunctionalInterface
public interface NodeCondition {

    NodeCondition ALWAYS = state -> true;

    boolean isActive(WorkflowState initialState);

    /**
     * 布尔标记为 true 时激活
     */
    static NodeCondition flag(String key) {
        return state -> Boolean.TRUE.equals(state.get(key));
    }
}
