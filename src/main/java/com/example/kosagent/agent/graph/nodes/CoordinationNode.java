package com.example.kosagent.agent.graph.nodes;

import com.example.kosagent.agent.StateKeys;
import com.example.kosagent.agent.graph.AgentNode;
import com.example.kosagent.context.NodeContext;
import com.example.kosagent.context.WorkflowState;
import com.example.kosagent.dto.ContentStrategy;
import com.example.kosagent.dto.CoordinationSummary;
import com.example.kosagent.dto.GeneratedContent;
import com.example.kosagent.dto.InsightReport;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 协同汇总节点
 *
 * 不调用模型：根据生成结果计算预期效果，汇总优化建议。
 */
@Slf4j
public class CoordinationNode implements AgentNode {

    public static final String NAME = "coordination";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Set<String> requiredReads() {
        return Set.of(StateKeys.GENERATED_CONTENT, StateKeys.CONTENT_STRATEGY);
    }

    @Override
    public Set<String> optionalReads() {
        return Set.of(StateKeys.HIGH_VALUE_USERS, StateKeys.INSIGHTS);
    }

    @Override
    public Set<String> writes() {
        return Set.of(StateKeys.COORDINATION_SUMMARY, StateKeys.OPTIMIZATION_NOTES);
    }

    @Override
    @SuppressWarnings("unchecked")
    public Map<String, Object> produceUpdate(WorkflowState state, NodeContext context) {
        List<GeneratedContent> contents = state.get(StateKeys.GENERATED_CONTENT, List.class);
        ContentStrategy strategy = state.get(StateKeys.CONTENT_STRATEGY, ContentStrategy.class);
        InsightReport insights = state.get(StateKeys.INSIGHTS, InsightReport.class);

        List<GeneratedContent> succeeded = contents.stream()
            .filter(GeneratedContent::isSuccess)
            .collect(Collectors.toList());
        int persisted = (int) succeeded.stream().filter(GeneratedContent::isPersisted).count();
        double avgQuality = succeeded.stream().mapToDouble(GeneratedContent::getQualityScore).average().orElse(0.0);
        int targets = strategy.getTargetUserIds().size();

        Map<String, Double> outcomes = expectedOutcomes(strategy.getObjectiveType(), succeeded.size());

        CoordinationSummary summary = CoordinationSummary.builder()
            .strategyId(strategy.getStrategyId())
            .targetUsers(targets)
            .generated(succeeded.size())
            .failed(contents.size() - succeeded.size())
            .persisted(persisted)
            .averageQuality(avgQuality)
            .expectedOutcomes(outcomes)
            .summary(String.format(Locale.ROOT, "策略 %s：目标用户 %d 个，生成 %d 篇（失败 %d），平均质量 %.2f",
                strategy.getStrategyId(), targets, succeeded.size(), contents.size() - succeeded.size(), avgQuality))
            .build();

        List<String> notes = optimizationNotes(contents, insights);
        log.info("[CoordinationNode] {}，优化建议 {} 条", summary.getSummary(), notes.size());

        Map<String, Object> update = new LinkedHashMap<>();
        update.put(StateKeys.COORDINATION_SUMMARY, summary);
        update.put(StateKeys.OPTIMIZATION_NOTES, notes);
        return update;
    }

    /**
     * 按运营目标类型估算预期效果，n 为成功生成的内容数
     */
    static Map<String, Double> expectedOutcomes(String objectiveType, int n) {
        Map<String, Double> outcomes = new LinkedHashMap<>();
        String type = objectiveType == null ? "ENGAGEMENT" : objectiveType;
        switch (type) {
            case "ACQUISITION":
                outcomes.put("expected_new_followers", n * 0.1);
                break;
            case "CONVERSION":
                outcomes.put("expected_clicks", n * 0.3);
                outcomes.put("expected_purchases", n * 0.05);
                break;
            default:
                outcomes.put("expected_comments", n * 2.0);
                outcomes.put("expected_likes", n * 10.0);
                break;
        }
        return outcomes;
    }

    static List<String> optimizationNotes(List<GeneratedContent> contents, InsightReport insights) {
        Set<String> notes = new LinkedHashSet<>();
        for (GeneratedContent content : contents) {
            if (content.isSuccess()) {
                if (content.getRecommendations() != null) {
                    notes.addAll(content.getRecommendations());
                }
            } else {
                notes.add("用户 " + content.getUserId() + " 的内容生成失败，建议稍后重试: " + content.getError());
            }
        }
        if (insights == null) {
            notes.add("未启用语义洞察，开启 AI 增强可获得基于评论原文的个性化内容");
        } else if (!insights.isGrounded()) {
            notes.add("索引中缺少相关评论，建议先重建检索索引");
        }
        return new ArrayList<>(notes);
    }
}
