package com.example.kosagent.service;

import com.example.kosagent.agent.WorkflowListener;
import com.example.kosagent.dto.AgentResult;
import com.example.kosagent.dto.WorkflowEvent;
import com.example.kosagent.dto.WorkflowResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

/**
 * 通过 WebSocket 推送运行进度，前端订阅 /topic/workflow/{runId}
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WorkflowProgressPublisher implements WorkflowListener {

    private static final String DESTINATION_PREFIX = "/topic/workflow/";

    private final SimpMessagingTemplate messagingTemplate;

    @Override
    public void onRunStarted(String runId) {
        send(WorkflowEvent.builder()
            .runId(runId)
            .type(WorkflowEvent.Type.RUN_STARTED)
            .message("开始执行工作流")
            .timestamp(System.currentTimeMillis())
            .build());
    }

    @Override
    public void onNodeFinished(String runId, AgentResult result) {
        send(WorkflowEvent.builder()
            .runId(runId)
            .type(WorkflowEvent.Type.NODE_FINISHED)
            .nodeName(result.getNodeName())
            .nodeStatus(result.getStatus())
            .message(result.getError())
            .timestamp(System.currentTimeMillis())
            .build());
    }

    @Override
    public void onRunFinished(WorkflowResult result) {
        send(WorkflowEvent.builder()
            .runId(result.getRunId())
            .type(WorkflowEvent.Type.RUN_FINISHED)
            .runStatus(result.getStatus())
            .message(result.getFailure() != null ? result.getFailure().getSummary() : "工作流执行完成")
            .timestamp(System.currentTimeMillis())
            .build());
    }

    private void send(WorkflowEvent event) {
        messagingTemplate.convertAndSend(DESTINATION_PREFIX + event.getRunId(), event);
        log.debug("[Progress] {} {} {}", event.getRunId(), event.getType(),
            event.getNodeName() != null ? event.getNodeName() : "");
    }
}
