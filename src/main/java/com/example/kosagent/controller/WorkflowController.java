package com.example.kosagent.controller;

import com.example.kosagent.agent.WorkflowEngine;
import com.example.kosagent.dto.AgentResult;
import com.example.kosagent.dto.RunStatus;
import com.example.kosagent.dto.WorkflowRequest;
import com.example.kosagent.dto.WorkflowResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 工作流 REST 接口
 *
 * 提交后立即返回 runId，进度通过 /topic/workflow/{runId} 推送，结果通过轮询获取
 */
@RestController
@RequestMapping("/api/workflows")
@RequiredArgsConstructor
@Slf4j
public class WorkflowController {

    private final WorkflowEngine workflowEngine;

    @PostMapping
    public ResponseEntity<Map<String, Object>> submit(@Valid @RequestBody WorkflowRequest request) {
        log.info("[REST API] 收到工作流请求：{} (aiEnhanced={})", request.getTask(), request.isAiEnhanced());
        String runId = workflowEngine.submit(request);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("runId", runId);
        body.put("status", RunStatus.PENDING);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
    }

    @GetMapping("/{runId}/status")
    public ResponseEntity<Map<String, Object>> status(@PathVariable String runId) {
        return workflowEngine.getStatus(runId)
            .map(status -> {
                Map<String, Object> body = new LinkedHashMap<>();
                body.put("runId", runId);
                body.put("status", status);
                return ResponseEntity.ok(body);
            })
            .orElse(ResponseEntity.notFound().build());
    }

    /**
     * 运行未结束时返回 202
     */
    @GetMapping("/{runId}")
    public ResponseEntity<WorkflowResult> result(@PathVariable String runId) {
        if (workflowEngine.getStatus(runId).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return workflowEngine.getResult(runId)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.status(HttpStatus.ACCEPTED).build());
    }

    @GetMapping("/{runId}/trace")
    public ResponseEntity<List<AgentResult>> trace(@PathVariable String runId) {
        if (workflowEngine.getStatus(runId).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(workflowEngine.getTrace(runId));
    }

    @GetMapping("/graph")
    public ResponseEntity<String> graph() {
        return ResponseEntity.ok(workflowEngine.describeGraph());
    }
}
