package com.example.kosagent.agent.graph.nodes;

import com.example.kosagent.agent.StateKeys;
import com.example.kosagent.agent.graph.AgentNode;
import com.example.kosagent.context.NodeContext;
import com.example.kosagent.context.WorkflowState;
import com.example.kosagent.dto.InsightReport;
import com.example.kosagent.dto.UserInsight;
import com.example.kosagent.index.GroundedAnswer;
import com.example.kosagent.index.RetrievalIndex;
import com.example.kosagent.index.RetrievalResult;
import com.example.kosagent.index.UserInsights;
import com.example.kosagent.scoring.RankedUser;
import com.example.kosagent.storage.UserRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 语义洞察节点（AI 增强时启用）
 *
 * 为排名靠前的用户汇总索引中的相关原文，并对整个群体做一次检索增强问答。
 */
@Slf4j
public class SemanticInsightNode implements AgentNode {

    public static final String NAME = "semantic_insight";

    private static final int MAX_USERS = 5;
    private static final int SNIPPET_LENGTH = 120;

    private final int contextBudget;

    public SemanticInsightNode(int contextBudget) {
        this.contextBudget = contextBudget;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Set<String> requiredReads() {
        return Set.of(StateKeys.HIGH_VALUE_USERS);
    }

    @Override
    public Set<String> optionalReads() {
        return Set.of(StateKeys.CRITERIA);
    }

    @Override
    public Set<String> writes() {
        return Set.of(StateKeys.INSIGHTS);
    }

    @Override
    @SuppressWarnings("unchecked")
    public Map<String, Object> produceUpdate(WorkflowState state, NodeContext context) {
        RetrievalIndex index = context.getIndex();
        if (index == null) {
            throw new IllegalStateException("检索索引不可用");
        }
        List<RankedUser> ranked = state.get(StateKeys.HIGH_VALUE_USERS, List.class);
        List<RankedUser> top = ranked.stream().limit(MAX_USERS).collect(Collectors.toList());
        log.info("[SemanticInsightNode] 为 {} 个用户生成语义洞察", top.size());

        List<UserInsight> insights = context.getPool().mapBounded(top, r -> insightFor(r.getUser(), index, context));

        GroundedAnswer overview = top.isEmpty()
            ? GroundedAnswer.noInformation("")
            : index.answer(groupQuestion(top), contextBudget, context.getToken());

        InsightReport report = InsightReport.builder()
            .overview(overview.getAnswer())
            .grounded(overview.isGrounded())
            .users(insights)
            .build();
        return Map.of(StateKeys.INSIGHTS, report);
    }

    private UserInsight insightFor(UserRecord user, RetrievalIndex index, NodeContext context) {
        UserInsights indexed = index.userInsights(user.getUserId());
        List<RetrievalResult> hits = index.searchForUser(user.getUserId(),
            UserAnalysisNode.evidenceQuery(user), 3, 0.0, context.getToken());

        List<String> evidence = hits.stream()
            .map(h -> snippet(h.getDocument().getContent()))
            .collect(Collectors.toList());

        return UserInsight.builder()
            .userId(user.getUserId())
            .nickname(user.getNickname())
            .indexedDocuments(indexed.total())
            .evidence(evidence)
            .averageSimilarity(hits.stream().mapToDouble(RetrievalResult::getSimilarityScore).average().orElse(0.0))
            .build();
    }

    private static String groupQuestion(List<RankedUser> top) {
        String needs = top.stream()
            .map(r -> r.getUser().getUnmetNeedDesc())
            .filter(d -> d != null && !d.isBlank())
            .limit(3)
            .collect(Collectors.joining("；"));
        if (needs.isEmpty()) {
            return "这些高价值用户最关心的问题和共同需求是什么？";
        }
        return "这些高价值用户提到的需求包括：" + needs + "。他们最关心的问题和共同需求是什么？";
    }

    private static String snippet(String content) {
        if (content == null) {
            return "";
        }
        return content.length() > SNIPPET_LENGTH ? content.substring(0, SNIPPET_LENGTH) + "..." : content;
    }
}
