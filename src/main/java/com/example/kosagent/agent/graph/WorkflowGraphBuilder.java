package com.example.kosagent.agent.graph;

import com.example.kosagent.agent.StateKeys;
import com.example.kosagent.agent.graph.nodes.ContentGenerationNode;
import com.example.kosagent.agent.graph.nodes.ContentStrategyNode;
import com.example.kosagent.agent.graph.nodes.CoordinationNode;
import com.example.kosagent.agent.graph.nodes.SemanticInsightNode;
import com.example.kosagent.agent.graph.nodes.TaskAnalysisNode;
import com.example.kosagent.agent.graph.nodes.UserAnalysisNode;
import com.example.kosagent.scoring.UserValueScorer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * 标准工作流图构建器
 *
 * <pre>
 *   task_analysis (AI 增强) ─────────────────────┐
 *   user_analysis ──┬──────────────────────────────┼─→ content_strategy → content_generation → coordination
 *                   └─→ semantic_insight (AI 增强) ┘
 * </pre>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WorkflowGraphBuilder {

    public static final String GRAPH_NAME = "kos-engagement";

    private final UserValueScorer scorer;

    @Value("${kos.workflow.insight-context-budget:2000}")
    private int insightContextBudget = 2000;

    @Value("${kos.workflow.max-strategy-targets:10}")
    private int maxStrategyTargets = 10;

    public WorkflowGraph build() {
        WorkflowGraph graph = new WorkflowGraph(GRAPH_NAME);

        // 1. 节点
        NodeCondition aiEnhanced = NodeCondition.flag(StateKeys.AI_ENHANCED);
        graph.addOptionalNode(new TaskAnalysisNode(), aiEnhanced);
        graph.addNode(new UserAnalysisNode(scorer));
        graph.addOptionalNode(new SemanticInsightNode(insightContextBudget), aiEnhanced);
        graph.addNode(new ContentStrategyNode(maxStrategyTargets));
        graph.addNode(new ContentGenerationNode());
        graph.addOptionalNode(new CoordinationNode(), NodeCondition.ALWAYS);

        // 2. 依赖边
        graph.addEdge(UserAnalysisNode.NAME, SemanticInsightNode.NAME);
        graph.addEdge(UserAnalysisNode.NAME, ContentStrategyNode.NAME);
        graph.addEdge(SemanticInsightNode.NAME, ContentStrategyNode.NAME);
        graph.addEdge(TaskAnalysisNode.NAME, ContentStrategyNode.NAME);
        graph.addEdge(ContentStrategyNode.NAME, ContentGenerationNode.NAME);
        graph.addEdge(ContentGenerationNode.NAME, CoordinationNode.NAME);

        log.info("[GraphBuilder] 工作流图构建完成: {}", GRAPH_NAME);
        log.debug("[GraphBuilder] 图结构:\n{}", graph.visualize());
        return graph;
    }
}
