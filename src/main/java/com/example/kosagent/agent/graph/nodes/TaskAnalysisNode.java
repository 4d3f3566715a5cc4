package com.example.kosagent.agent.graph.nodes;

import com.example.kosagent.agent.StateKeys;
import com.example.kosagent.agent.graph.AgentNode;
import com.example.kosagent.context.NodeContext;
import com.example.kosagent.context.WorkflowState;
import com.example.kosagent.dto.TaskAnalysis;
import com.example.kosagent.dto.WorkflowRequest;
import com.example.kosagent.llm.LlmConstraints;
import com.example.kosagent.llm.LlmResponse;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 任务分析节点（AI 增强时启用）
 *
 * 把自然语言任务拆成运营目标、目标类型和关键词，供策略节点参考。
 */
@Slf4j
public class TaskAnalysisNode implements AgentNode {

    public static final String NAME = "task_analysis";

    private static final String SYSTEM_PROMPT =
        "你是小红书运营分析师。请分析运营任务，严格按以下格式逐行输出：\n" +
        "目标: 一句话概括的运营目标\n" +
        "类型: ACQUISITION / ENGAGEMENT / CONVERSION 三选一\n" +
        "关键词: 用逗号分隔的 3-6 个关键词";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Set<String> requiredReads() {
        return Set.of(StateKeys.REQUEST);
    }

    @Override
    public Set<String> optionalReads() {
        return Set.of(StateKeys.BUSINESS_GOALS);
    }

    @Override
    public Set<String> writes() {
        return Set.of(StateKeys.TASK_ANALYSIS);
    }

    @Override
    @SuppressWarnings("unchecked")
    public Map<String, Object> produceUpdate(WorkflowState state, NodeContext context) {
        WorkflowRequest request = state.get(StateKeys.REQUEST, WorkflowRequest.class);
        List<String> goals = state.find(StateKeys.BUSINESS_GOALS, List.class).orElse(List.of());
        log.info("[TaskAnalysisNode] 分析任务: {}", request.getTask());

        StringBuilder prompt = new StringBuilder();
        prompt.append("运营任务：").append(request.getTask()).append("\n");
        if (!goals.isEmpty()) {
            prompt.append("业务目标：").append(String.join("；", goals)).append("\n");
        }

        LlmResponse response = context.getGateway().invoke(prompt.toString(),
            LlmConstraints.system(SYSTEM_PROMPT, context.getToken()));
        String text = response.getContent();

        String objective = ResponseFields.field(text, "目标");
        String type = normalizeType(ResponseFields.field(text, "类型"));
        List<String> keywords = ResponseFields.list(text, "关键词");

        TaskAnalysis analysis = TaskAnalysis.builder()
            .objective(objective != null ? objective : request.getTask())
            .objectiveType(type)
            .keywords(keywords)
            .rawAnalysis(text)
            .build();
        log.info("[TaskAnalysisNode] 目标类型={}, 关键词={}", type, keywords);
        return Map.of(StateKeys.TASK_ANALYSIS, analysis);
    }

    static String normalizeType(String raw) {
        if (raw == null) {
            return "ENGAGEMENT";
        }
        String upper = raw.toUpperCase();
        if (upper.contains("ACQUISITION") || raw.contains("拉新")) {
            return "ACQUISITION";
        }
        if (upper.contains("CONVERSION") || raw.contains("转化")) {
            return "CONVERSION";
        }
        return "ENGAGEMENT";
    }
}
