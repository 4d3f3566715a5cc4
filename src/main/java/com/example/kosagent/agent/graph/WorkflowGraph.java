package com.example.kosagent.agent.graph;

import com.example.kosagent.exception.WorkflowValidationException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 工作流有向无环图
 *
 * 节点按注册顺序编号，边 from -> to 表示 to 依赖 from。
 * 编译后的执行顺序固定为 (依赖层级, 注册顺序)：同一层的节点可以并发执行，
 * 但合并顺序始终按这个顺序进行，同一个 key 的多次写入以排在后面的节点为准。
 */
@Slf4j
public class WorkflowGraph {

    private final String name;
    private final Map<String, Registration> nodes = new LinkedHashMap<>();
    private final Map<String, Set<String>> dependencies = new LinkedHashMap<>();
    private final List<String> registrationErrors = new ArrayList<>();

    public WorkflowGraph(String name) {
        this.name = name;
    }

    /**
     * 添加必需节点（始终激活）
     */
    public WorkflowGraph addNode(AgentNode node) {
        return addNode(node, true, NodeCondition.ALWAYS);
    }

    public WorkflowGraph addOptionalNode(AgentNode node, NodeCondition condition) {
        return addNode(node, false, condition);
    }

    public WorkflowGraph addNode(AgentNode node, boolean required, NodeCondition condition) {
        if (nodes.containsKey(node.name())) {
            registrationErrors.add("节点重复注册: " + node.name());
            return this;
        }
        nodes.put(node.name(), new Registration(node, required, condition, nodes.size()));
        dependencies.put(node.name(), new LinkedHashSet<>());
        return this;
    }

    /**
     * 添加依赖边：to 在 from 之后执行
     */
    public WorkflowGraph addEdge(String from, String to) {
        dependencies.computeIfAbsent(to, k -> new LinkedHashSet<>()).add(from);
        return this;
    }

    public String getName() {
        return name;
    }

    /**
     * 校验并生成执行计划
     *
     * @param initialKeys 初始状态中存在的键
     * @throws WorkflowValidationException 重名、未知节点、环、必需键无人提供
     */
    public WorkflowPlan compile(Set<String> initialKeys) {
        List<String> violations = new ArrayList<>(registrationErrors);

        for (Map.Entry<String, Set<String>> entry : dependencies.entrySet()) {
            if (!nodes.containsKey(entry.getKey())) {
                violations.add("边指向未注册的节点: " + entry.getKey());
            }
            for (String from : entry.getValue()) {
                if (!nodes.containsKey(from)) {
                    violations.add("边来自未注册的节点: " + from + " -> " + entry.getKey());
                }
                if (from.equals(entry.getKey())) {
                    violations.add("节点依赖自身: " + from);
                }
            }
        }
        if (!violations.isEmpty()) {
            throw new WorkflowValidationException(violations);
        }

        Map<String, Integer> levels = computeLevels(violations);
        if (!violations.isEmpty()) {
            throw new WorkflowValidationException(violations);
        }

        // 必需读取键：要么在初始状态中，要么由某个上游节点写入
        for (Registration reg : nodes.values()) {
            Set<String> available = new HashSet<>(initialKeys);
            for (String ancestor : ancestorsOf(reg.node.name())) {
                available.addAll(nodes.get(ancestor).node.writes());
            }
            for (String key : reg.node.requiredReads()) {
                if (!available.contains(key)) {
                    violations.add(String.format("节点 %s 的必需键 %s 既不在初始状态中，也没有上游节点写入",
                        reg.node.name(), key));
                }
            }
        }
        if (!violations.isEmpty()) {
            throw new WorkflowValidationException(violations);
        }

        List<WorkflowPlan.Step> steps = new ArrayList<>();
        for (Registration reg : nodes.values()) {
            steps.add(new WorkflowPlan.Step(reg.node, reg.required, reg.condition,
                levels.get(reg.node.name()), reg.order, Set.copyOf(dependencies.get(reg.node.name()))));
        }
        steps.sort(Comparator.comparingInt(WorkflowPlan.Step::getLevel)
            .thenComparingInt(WorkflowPlan.Step::getOrder));
        return new WorkflowPlan(name, steps);
    }

    /**
     * Kahn 拓扑排序计算层级：无依赖为 0，否则为依赖最大层级 + 1
     */
    private Map<String, Integer> computeLevels(List<String> violations) {
        Map<String, Integer> indegree = new HashMap<>();
        Map<String, List<String>> downstream = new HashMap<>();
        for (String node : nodes.keySet()) {
            indegree.put(node, dependencies.get(node).size());
            downstream.put(node, new ArrayList<>());
        }
        dependencies.forEach((to, froms) -> froms.forEach(from -> downstream.get(from).add(to)));

        Map<String, Integer> levels = new HashMap<>();
        Deque<String> ready = new ArrayDeque<>();
        for (String node : nodes.keySet()) {
            if (indegree.get(node) == 0) {
                ready.add(node);
                levels.put(node, 0);
            }
        }
        while (!ready.isEmpty()) {
            String current = ready.poll();
            for (String next : downstream.get(current)) {
                levels.merge(next, levels.get(current) + 1, Math::max);
                if (indegree.merge(next, -1, Integer::sum) == 0) {
                    ready.add(next);
                }
            }
        }
        if (levels.size() < nodes.size() || indegree.values().stream().anyMatch(d -> d > 0)) {
            List<String> cyclic = new ArrayList<>();
            indegree.forEach((node, degree) -> {
                if (degree > 0) {
                    cyclic.add(node);
                }
            });
            violations.add("图中存在环: " + cyclic);
        }
        return levels;
    }

    private Set<String> ancestorsOf(String node) {
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> stack = new ArrayDeque<>(dependencies.getOrDefault(node, Set.of()));
        while (!stack.isEmpty()) {
            String current = stack.pop();
            if (visited.add(current)) {
                stack.addAll(dependencies.getOrDefault(current, Set.of()));
            }
        }
        return visited;
    }

    /**
     * 获取图的可视化表示（用于调试）
     */
    public String visualize() {
        StringBuilder sb = new StringBuilder();
        sb.append(name).append(" 工作流图:\n");
        sb.append("节点列表:\n");
        for (Registration reg : nodes.values()) {
            sb.append("  - ").append(reg.node.name())
                .append(reg.required ? " [必需]" : " [可选]")
                .append(" reads=").append(reg.node.requiredReads())
                .append(" writes=").append(reg.node.writes())
                .append("\n");
        }
        sb.append("\n边列表:\n");
        dependencies.forEach((to, froms) -> froms.forEach(from ->
            sb.append("  ").append(from).append(" -> ").append(to).append("\n")));
        return sb.toString();
    }

    private static final class Registration {
        private final AgentNode node;
        private final boolean required;
        private final NodeCondition condition;
        private final int order;

        private Registration(AgentNode node, boolean required, NodeCondition condition, int order) {
            this.node = node;
            this.required = required;
            this.condition = condition;
            this.order = order;
        }
    }
}
