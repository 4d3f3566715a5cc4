package com.example.kosagent.agent.graph;

import lombok.Value;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 编译后的执行计划，steps 已按 (层级, 注册顺序) 排好
 */
@Value
public class WorkflowPlan {

    String graphName;

    List<Step> steps;

    /**
     * 按层级分组，组内保持合并顺序
     */
    public List<List<Step>> levels() {
        Map<Integer, List<Step>> grouped = steps.stream()
            .collect(Collectors.groupingBy(Step::getLevel, LinkedHashMap::new, Collectors.toList()));
        return new ArrayList<>(grouped.values());
    }

    public List<String> executionOrder() {
        return steps.stream().map(s -> s.getNode().name()).collect(Collectors.toList());
    }

    @Value
    public static class Step {

        AgentNode node;

        boolean required;

        NodeCondition condition;

        int level;

        /**
         * 注册顺序
         */
        int order;

        Set<String> dependsOn;

        public String getName() {
            return node.name();
        }
    }
}
