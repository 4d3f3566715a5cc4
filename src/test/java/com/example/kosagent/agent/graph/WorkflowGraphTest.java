package com.example.kosagent.agent.graph;

import com.example.kosagent.agent.StateKeys;
import com.example.kosagent.agent.graph.nodes.ContentGenerationNode;
import com.example.kosagent.agent.graph.nodes.ContentStrategyNode;
import com.example.kosagent.agent.graph.nodes.CoordinationNode;
import com.example.kosagent.agent.graph.nodes.SemanticInsightNode;
import com.example.kosagent.agent.graph.nodes.TaskAnalysisNode;
import com.example.kosagent.agent.graph.nodes.UserAnalysisNode;
import com.example.kosagent.exception.WorkflowValidationException;
import com.example.kosagent.scoring.ScoringPolicy;
import com.example.kosagent.scoring.UserValueScorer;
import com.example.kosagent.support.StubNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkflowGraphTest {

    private static StubNode node(String name, Set<String> reads, Set<String> writes) {
        return new StubNode(name, reads, writes, (s, c) -> Map.of());
    }

    @Test
    @DisplayName("执行顺序为 (依赖层级, 注册顺序)")
    void ordersByLevelThenRegistration() {
        WorkflowGraph graph = new WorkflowGraph("t")
            .addNode(node("c", Set.of(), Set.of("c")))
            .addNode(node("a", Set.of(), Set.of("a")))
            .addNode(node("b", Set.of("a"), Set.of("b")))
            .addEdge("a", "b");

        WorkflowPlan plan = graph.compile(Set.of());

        assertThat(plan.executionOrder()).containsExactly("c", "a", "b");
        assertThat(plan.levels()).hasSize(2);
        assertThat(plan.levels().get(0)).extracting(WorkflowPlan.Step::getName).containsExactly("c", "a");
        assertThat(plan.getSteps().get(2).getDependsOn()).containsExactly("a");
    }

    @Test
    @DisplayName("存在环时拒绝编译")
    void rejectsCycles() {
        WorkflowGraph graph = new WorkflowGraph("t")
            .addNode(node("a", Set.of(), Set.of("a")))
            .addNode(node("b", Set.of(), Set.of("b")))
            .addNode(node("c", Set.of(), Set.of("c")))
            .addEdge("a", "b")
            .addEdge("b", "c")
            .addEdge("c", "a");

        assertThatThrownBy(() -> graph.compile(Set.of()))
            .isInstanceOf(WorkflowValidationException.class)
            .hasMessageContaining("环");
    }

    @Test
    void rejectsSelfLoop() {
        WorkflowGraph graph = new WorkflowGraph("t")
            .addNode(node("a", Set.of(), Set.of("a")))
            .addEdge("a", "a");

        assertThatThrownBy(() -> graph.compile(Set.of()))
            .isInstanceOf(WorkflowValidationException.class)
            .hasMessageContaining("依赖自身");
    }

    @Test
    @DisplayName("重复注册与未知节点都会报告")
    void reportsDuplicateAndUnknownNodes() {
        WorkflowGraph graph = new WorkflowGraph("t")
            .addNode(node("a", Set.of(), Set.of("a")))
            .addNode(node("a", Set.of(), Set.of("a")))
            .addEdge("ghost", "a");

        assertThatThrownBy(() -> graph.compile(Set.of()))
            .isInstanceOfSatisfying(WorkflowValidationException.class, e -> assertThat(e.getViolations())
                .anyMatch(v -> v.contains("重复注册"))
                .anyMatch(v -> v.contains("ghost")));
    }

    @Test
    @DisplayName("必需键既不在初始状态也没有上游写入时拒绝")
    void rejectsUnsatisfiableReads() {
        WorkflowGraph graph = new WorkflowGraph("t")
            .addNode(node("producer", Set.of(), Set.of("x")))
            .addNode(node("consumer", Set.of("x", "y"), Set.of("z")));

        assertThatThrownBy(() -> graph.compile(Set.of()))
            .isInstanceOfSatisfying(WorkflowValidationException.class, e -> assertThat(e.getViolations())
                .hasSize(2)
                .allMatch(v -> v.contains("consumer")));

        // 初始状态提供 y 且加上依赖边后可以编译
        graph.addEdge("producer", "consumer");
        assertThat(graph.compile(Set.of("y")).executionOrder()).containsExactly("producer", "consumer");
    }

    @Test
    @DisplayName("标准工作流图的拓扑")
    void standardTopology() {
        WorkflowGraph graph = new WorkflowGraphBuilder(new UserValueScorer(ScoringPolicy.defaults())).build();

        WorkflowPlan plan = graph.compile(Set.of(StateKeys.REQUEST, StateKeys.TASK, StateKeys.CRITERIA,
            StateKeys.AI_ENHANCED, StateKeys.BUSINESS_GOALS));

        assertThat(plan.executionOrder()).containsExactly(
            TaskAnalysisNode.NAME,
            UserAnalysisNode.NAME,
            SemanticInsightNode.NAME,
            ContentStrategyNode.NAME,
            ContentGenerationNode.NAME,
            CoordinationNode.NAME);
        List<String> required = plan.getSteps().stream()
            .filter(WorkflowPlan.Step::isRequired)
            .map(WorkflowPlan.Step::getName)
            .collect(Collectors.toList());
        assertThat(required).containsExactly(UserAnalysisNode.NAME, ContentStrategyNode.NAME, ContentGenerationNode.NAME);
        assertThat(graph.visualize()).contains("user_analysis -> content_strategy");
    }
}
