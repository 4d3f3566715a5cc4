package com.example.kosagent.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Locale;

/**
 * 单次运行的评估指标
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunMetrics {

    private String runId;

    private RunStatus status;

    private long totalDurationMs;

    private int okNodes;

    private int failedNodes;

    private int timedOutNodes;

    private int skippedNodes;

    private String slowestNode;

    private long slowestNodeDurationMs;

    private int highValueUsers;

    private int generatedContents;

    public String getSummary() {
        return String.format(Locale.ROOT, "run=%s, status=%s, 耗时=%dms, 节点[ok=%d, failed=%d, timed_out=%d, skipped=%d], " +
                "最慢节点=%s(%dms), 高价值用户=%d, 生成内容=%d",
            runId, status, totalDurationMs, okNodes, failedNodes, timedOutNodes, skippedNodes,
            slowestNode, slowestNodeDurationMs, highValueUsers, generatedContents);
    }
}
