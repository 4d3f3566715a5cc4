package com.example.kosagent.exception;

import lombok.Getter;

import java.util.List;

/**
 * 工作流请求或图定义不合法，在任何节点执行前拒绝
 */
@Getter
public class WorkflowValidationException extends KosAgentException {

    private final List<String> violations;

    public WorkflowValidationException(List<String> violations) {
        super("工作流校验失败: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public WorkflowValidationException(String violation) {
        this(List.of(violation));
    }
}
