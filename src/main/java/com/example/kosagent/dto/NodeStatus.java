package com.example.kosagent.dto;

/**
 * 节点执行状态
 */
public enum NodeStatus {
    OK,
    FAILED,
    TIMED_OUT,
    SKIPPED
}
