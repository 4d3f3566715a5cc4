package com.example.kosagent.agent.graph.nodes;

import com.example.kosagent.agent.StateKeys;
import com.example.kosagent.agent.graph.AgentNode;
import com.example.kosagent.context.NodeContext;
import com.example.kosagent.context.WorkflowState;
import com.example.kosagent.dto.ContentStrategy;
import com.example.kosagent.dto.InsightReport;
import com.example.kosagent.dto.TaskAnalysis;
import com.example.kosagent.index.ContentHasher;
import com.example.kosagent.llm.LlmConstraints;
import com.example.kosagent.llm.LlmResponse;
import com.example.kosagent.scoring.RankedUser;
import com.example.kosagent.storage.UserRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 内容策略节点
 *
 * 汇总高价值用户画像、语义洞察和任务分析，请模型给出内容策略。
 * 模型没有给出的字段使用默认策略补齐。
 */
@Slf4j
public class ContentStrategyNode implements AgentNode {

    public static final String NAME = "content_strategy";

    private static final String SYSTEM_PROMPT =
        "你是小红书内容策略专家。根据目标用户画像制定内容策略，严格按以下格式逐行输出：\n" +
        "目标: 一句话策略目标\n" +
        "语气: 内容语气\n" +
        "内容类型: 逗号分隔，例如 种草, 攻略, 故事\n" +
        "核心信息: 逗号分隔的 2-4 条核心信息\n" +
        "互动方式: 逗号分隔，例如 提问, 投票, 评论区抽奖";

    private static final List<String> DEFAULT_CONTENT_TYPES = List.of("种草", "攻略");
    private static final List<String> DEFAULT_TACTICS = List.of("提问", "评论区互动");
    private static final String DEFAULT_TONE = "真诚友好";

    private final int maxTargets;

    public ContentStrategyNode(int maxTargets) {
        this.maxTargets = maxTargets;
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
        return Set.of(StateKeys.INSIGHTS, StateKeys.TASK_ANALYSIS, StateKeys.BUSINESS_GOALS, StateKeys.TASK);
    }

    @Override
    public Set<String> writes() {
        return Set.of(StateKeys.CONTENT_STRATEGY);
    }

    @Override
    @SuppressWarnings("unchecked")
    public Map<String, Object> produceUpdate(WorkflowState state, NodeContext context) {
        List<RankedUser> ranked = state.get(StateKeys.HIGH_VALUE_USERS, List.class);
        String task = state.find(StateKeys.TASK, String.class).orElse("");
        TaskAnalysis analysis = state.get(StateKeys.TASK_ANALYSIS, TaskAnalysis.class);
        InsightReport insights = state.get(StateKeys.INSIGHTS, InsightReport.class);
        List<String> goals = state.find(StateKeys.BUSINESS_GOALS, List.class).orElse(List.of());

        List<RankedUser> targets = ranked.stream().limit(maxTargets).collect(Collectors.toList());
        List<String> targetIds = targets.stream().map(RankedUser::getUserId).collect(Collectors.toList());
        String strategyId = strategyId(task, targetIds);
        log.info("[ContentStrategyNode] 制定策略 {}，目标用户 {} 个", strategyId, targetIds.size());

        String prompt = buildPrompt(task, targets, analysis, insights, goals);
        LlmResponse response = context.getGateway().invoke(prompt,
            LlmConstraints.system(SYSTEM_PROMPT, context.getToken()));
        String text = response.getContent();

        List<String> contentTypes = ResponseFields.list(text, "内容类型");
        List<String> keyMessages = ResponseFields.list(text, "核心信息");
        List<String> tactics = ResponseFields.list(text, "互动方式");
        String tone = ResponseFields.field(text, "语气");
        String objective = ResponseFields.field(text, "目标");

        ContentStrategy strategy = ContentStrategy.builder()
            .strategyId(strategyId)
            .objective(objective != null ? objective
                : analysis != null ? analysis.getObjective() : task)
            .objectiveType(analysis != null ? analysis.getObjectiveType() : "ENGAGEMENT")
            .targetUserIds(targetIds)
            .tone(tone != null ? tone : DEFAULT_TONE)
            .contentTypes(contentTypes.isEmpty() ? DEFAULT_CONTENT_TYPES : contentTypes)
            .keyMessages(keyMessages)
            .engagementTactics(tactics.isEmpty() ? DEFAULT_TACTICS : tactics)
            .rawPlan(text)
            .provider(response.getProvider())
            .build();
        return Map.of(StateKeys.CONTENT_STRATEGY, strategy);
    }

    /**
     * 相同任务 + 相同目标用户得到相同的 strategyId，重复运行不会产生重复草稿
     */
    static String strategyId(String task, List<String> targetIds) {
        String key = task + "|" + targetIds.stream().sorted().collect(Collectors.joining(","));
        return "st-" + ContentHasher.sha256(key).substring(0, 16);
    }

    private String buildPrompt(String task, List<RankedUser> targets, TaskAnalysis analysis,
                               InsightReport insights, List<String> goals) {
        StringBuilder sb = new StringBuilder();
        sb.append("运营任务：").append(task).append("\n");
        if (!goals.isEmpty()) {
            sb.append("业务目标：").append(String.join("；", goals)).append("\n");
        }
        if (analysis != null) {
            sb.append("任务分析：目标=").append(analysis.getObjective())
                .append("，类型=").append(analysis.getObjectiveType())
                .append("，关键词=").append(analysis.getKeywords()).append("\n");
        }
        sb.append("\n").append(summarizeUsers(targets)).append("\n");
        if (insights != null && insights.getOverview() != null) {
            sb.append("\n群体洞察：").append(insights.getOverview()).append("\n");
        }
        return sb.toString();
    }

    static String summarizeUsers(List<RankedUser> targets) {
        if (targets.isEmpty()) {
            return "无目标用户";
        }
        double avg = targets.stream().mapToDouble(r -> r.getScore().getScore()).average().orElse(0.0);
        String needs = targets.stream()
            .map(RankedUser::getUser)
            .map(UserRecord::getUnmetNeedDesc)
            .filter(Objects::nonNull)
            .distinct()
            .limit(5)
            .collect(Collectors.joining("；"));
        StringBuilder sb = new StringBuilder();
        sb.append("目标用户总数: ").append(targets.size()).append("\n");
        sb.append("平均价值分: ").append(String.format(Locale.ROOT, "%.2f", avg)).append("\n");
        sb.append("主要未满足需求: ").append(needs.isEmpty() ? "未知" : needs);
        return sb.toString();
    }
}
