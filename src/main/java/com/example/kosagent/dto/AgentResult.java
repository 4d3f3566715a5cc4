package com.example.kosagent.dto;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * 单个节点的执行记录，写入后不可变，按执行顺序组成运行轨迹
 */
@Value
@Builder
public class AgentResult {

    String nodeName;

    NodeStatus status;

    /**
     * 节点产出的状态增量（仅 OK 时非空）
     */
    Map<String, Object> partialState;

    String error;

    Instant startedAt;

    Instant endedAt;

    boolean required;

    /**
     * 激活条件不满足而未启用（不影响运行终态）
     */
    boolean disabled;

    /**
     * 所在依赖层级
     */
    int level;

    public long durationMs() {
        if (startedAt == null || endedAt == null) {
            return 0L;
        }
        return Duration.between(startedAt, endedAt).toMillis();
    }

    public boolean isOk() {
        return status == NodeStatus.OK;
    }
}
