package com.example.kosagent.agent.graph;

import com.example.kosagent.context.NodeContext;
import com.example.kosagent.context.WorkflowState;

import java.util.Collections;
import java.util.Map;
import java.util.Set;

/**
 * Agent 节点接口
 *
 * 节点的职责：
 * 1. 静态声明读取的键（必需 / 可选）和写入的键，引擎据此在运行前校验图
 * 2. 只读取状态快照，返回局部更新，由引擎合并
 * 3. 外部访问只经过 NodeContext（模型网关、检索索引、存储会话）
 */
public interface AgentNode {

    String name();

    /**
     * 缺少任意一个时节点被跳过
     */
    Set<String> requiredReads();

    default Set<String> optionalReads() {
        return Collections.emptySet();
    }

    Set<String> writes();

    /**
     * 产出局部状态更新，key 必须在 {@link #writes()} 之内
     */
    Map<String, Object> produceUpdate(WorkflowState state, NodeContext context);
}
