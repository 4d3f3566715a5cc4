package com.example.kosagent.dto;

/**
 * 运行状态
 */
public enum RunStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    PARTIAL,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == PARTIAL || this == FAILED;
    }
}
