package com.example.kosagent.controller;

import com.example.kosagent.index.GroundedAnswer;
import com.example.kosagent.index.IndexStats;
import com.example.kosagent.index.RebuildReport;
import com.example.kosagent.index.RetrievalIndex;
import com.example.kosagent.index.RetrievalResult;
import com.example.kosagent.index.SourceType;
import com.example.kosagent.index.UserInsights;
import com.example.kosagent.llm.LlmGateway;
import com.example.kosagent.llm.ProviderStatus;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * 检索索引与模型网关的运维接口
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class RetrievalController {

    private final RetrievalIndex retrievalIndex;
    private final LlmGateway llmGateway;

    @GetMapping("/index/search")
    public ResponseEntity<List<RetrievalResult>> search(@RequestParam String query,
                                                        @RequestParam(defaultValue = "5") int topK,
                                                        @RequestParam(defaultValue = "0.5") double threshold,
                                                        @RequestParam(required = false) List<SourceType> types) {
        Set<SourceType> filter = types == null || types.isEmpty() ? null : EnumSet.copyOf(types);
        return ResponseEntity.ok(retrievalIndex.search(query, topK, threshold, filter));
    }

    @PostMapping("/index/answer")
    public ResponseEntity<GroundedAnswer> answer(@Valid @RequestBody AnswerRequest request) {
        log.info("[REST API] 检索问答：{}", request.getQuestion());
        return ResponseEntity.ok(retrievalIndex.answer(request.getQuestion(), request.getContextBudget()));
    }

    @PostMapping("/index/rebuild/{sourceType}")
    public ResponseEntity<RebuildReport> rebuild(@PathVariable SourceType sourceType,
                                                 @RequestParam(defaultValue = "1000") int limit) {
        return ResponseEntity.ok(retrievalIndex.rebuild(sourceType, limit));
    }

    @PostMapping("/index/rebuild")
    public ResponseEntity<List<RebuildReport>> rebuildAll(@RequestParam(defaultValue = "1000") int limit) {
        log.info("[REST API] 全量重建索引：limit={}", limit);
        return ResponseEntity.ok(retrievalIndex.rebuildAll(limit));
    }

    @GetMapping("/index/stats")
    public ResponseEntity<IndexStats> stats() {
        return ResponseEntity.ok(retrievalIndex.stats());
    }

    @GetMapping("/index/users/{userId}")
    public ResponseEntity<UserInsights> userInsights(@PathVariable String userId) {
        return ResponseEntity.ok(retrievalIndex.userInsights(userId));
    }

    @GetMapping("/llm/providers")
    public ResponseEntity<List<ProviderStatus>> providers() {
        return ResponseEntity.ok(llmGateway.providerSnapshots());
    }

    @Data
    public static class AnswerRequest {

        @NotBlank
        private String question;

        private int contextBudget = 2000;
    }
}
