package com.example.kosagent.exception;

/**
 * 运行截止时间已到，节点在检查点被取消
 */
public class NodeTimeoutException extends KosAgentException {

    public NodeTimeoutException(String message) {
        super(message);
    }
}
