package com.example.kosagent.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 推送给前端的运行进度事件
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowEvent {

    public enum Type {
        RUN_STARTED,
        NODE_FINISHED,
        RUN_FINISHED
    }

    private String runId;

    private Type type;

    private String nodeName;

    private NodeStatus nodeStatus;

    private RunStatus runStatus;

    private String message;

    private long timestamp;
}
