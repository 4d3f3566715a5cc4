package com.example.kosagent.agent.graph.nodes;

import com.example.kosagent.agent.StateKeys;
import com.example.kosagent.agent.graph.AgentNode;
import com.example.kosagent.context.NodeContext;
import com.example.kosagent.context.WorkflowState;
import com.example.kosagent.dto.ContentStrategy;
import com.example.kosagent.dto.GeneratedContent;
import com.example.kosagent.exception.NodeTimeoutException;
import com.example.kosagent.llm.LlmConstraints;
import com.example.kosagent.llm.LlmResponse;
import com.example.kosagent.scoring.RankedUser;
import com.example.kosagent.storage.ContentDraft;
import com.example.kosagent.storage.UserRecord;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 内容生成节点
 *
 * 按策略为每个目标用户生成一篇笔记草稿，做质量检查后以 (userId, strategyId) 幂等落库。
 * 单个用户失败只记录在该条结果中；全部失败时节点失败。
 */
@Slf4j
public class ContentGenerationNode implements AgentNode {

    public static final String NAME = "content_generation";

    private static final int MAX_TARGETS = 5;

    // 小红书平台限制
    private static final int MAX_BODY_CHARS = 1000;
    private static final int MAX_HASHTAGS = 10;

    private static final Pattern HASHTAG = Pattern.compile("#([\\u4e00-\\u9fa5\\w]+)");
    private static final List<String> DEFAULT_HASHTAGS = List.of("内容分享", "生活记录", "今日分享");
    private static final List<String> HOOK_WORDS = List.of("评论区", "留言", "点赞", "收藏", "关注", "分享给");

    private static final String SYSTEM_PROMPT =
        "你是小红书爆款笔记写手。根据内容策略和用户画像写一篇笔记：\n" +
        "第一行以“标题:”开头给出标题，随后是正文，正文末尾附 3-6 个 #话题标签。\n" +
        "正文要口语化，包含提问或引导评论的互动元素。";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Set<String> requiredReads() {
        return Set.of(StateKeys.CONTENT_STRATEGY, StateKeys.HIGH_VALUE_USERS);
    }

    @Override
    public Set<String> writes() {
        return Set.of(StateKeys.GENERATED_CONTENT);
    }

    @Override
    @SuppressWarnings("unchecked")
    public Map<String, Object> produceUpdate(WorkflowState state, NodeContext context) {
        ContentStrategy strategy = state.get(StateKeys.CONTENT_STRATEGY, ContentStrategy.class);
        List<RankedUser> ranked = state.get(StateKeys.HIGH_VALUE_USERS, List.class);

        Map<String, UserRecord> byId = ranked.stream()
            .collect(Collectors.toMap(RankedUser::getUserId, RankedUser::getUser, (a, b) -> a, LinkedHashMap::new));
        List<UserRecord> targets = strategy.getTargetUserIds().stream()
            .map(byId::get)
            .filter(u -> u != null)
            .limit(MAX_TARGETS)
            .collect(Collectors.toList());
        if (targets.isEmpty()) {
            log.info("[ContentGenerationNode] 策略 {} 没有目标用户，跳过生成", strategy.getStrategyId());
            return Map.of(StateKeys.GENERATED_CONTENT, new ArrayList<GeneratedContent>());
        }

        log.info("[ContentGenerationNode] 为 {} 个用户生成内容，策略 {}", targets.size(), strategy.getStrategyId());
        List<GeneratedContent> generated = context.getPool().mapBounded(targets, u -> generateFor(u, strategy, context));

        long succeeded = generated.stream().filter(GeneratedContent::isSuccess).count();
        if (succeeded == 0) {
            throw new IllegalStateException("所有用户的内容生成均失败: " + generated.get(0).getError());
        }
        log.info("[ContentGenerationNode] 生成完成: 成功 {}, 失败 {}", succeeded, generated.size() - succeeded);
        return Map.of(StateKeys.GENERATED_CONTENT, generated);
    }

    private GeneratedContent generateFor(UserRecord user, ContentStrategy strategy, NodeContext context) {
        String contentType = strategy.getContentTypes().isEmpty() ? "种草" : strategy.getContentTypes().get(0);
        try {
            LlmResponse response = context.getGateway().invoke(buildPrompt(user, strategy, contentType),
                LlmConstraints.system(SYSTEM_PROMPT, context.getToken()));
            GeneratedContent draft = parse(response.getContent(), user.getUserId(), strategy.getStrategyId(), contentType);

            context.getStorage().upsertContentDraft(ContentDraft.builder()
                .userId(draft.getUserId())
                .strategyId(draft.getStrategyId())
                .title(draft.getTitle())
                .body(draft.getBody())
                .hashtags(draft.getHashtags())
                .qualityScore(draft.getQualityScore())
                .createdAt(LocalDateTime.now())
                .build());
            return draft.toBuilder().persisted(true).build();
        } catch (NodeTimeoutException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("[ContentGenerationNode] 用户 {} 内容生成失败: {}", user.getUserId(), e.getMessage());
            return GeneratedContent.builder()
                .userId(user.getUserId())
                .strategyId(strategy.getStrategyId())
                .contentType(contentType)
                .error(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                .build();
        }
    }

    private static String buildPrompt(UserRecord user, ContentStrategy strategy, String contentType) {
        StringBuilder sb = new StringBuilder();
        sb.append("内容策略：").append(strategy.getObjective()).append("\n");
        sb.append("内容类型：").append(contentType).append("\n");
        sb.append("语气：").append(strategy.getTone()).append("\n");
        if (!strategy.getKeyMessages().isEmpty()) {
            sb.append("核心信息：").append(String.join("；", strategy.getKeyMessages())).append("\n");
        }
        sb.append("互动方式：").append(String.join("、", strategy.getEngagementTactics())).append("\n\n");
        sb.append("目标用户：\n");
        if (user.getNickname() != null) {
            sb.append("用户昵称: ").append(user.getNickname()).append("\n");
        }
        if (user.getUnmetNeedDesc() != null) {
            sb.append("主要痛点: ").append(user.getUnmetNeedDesc()).append("\n");
        }
        if (user.getContentSummary() != null) {
            sb.append("近期评论: ").append(user.getContentSummary()).append("\n");
        }
        return sb.toString();
    }

    /**
     * 解析模型输出：“标题:”行作为标题（没有时取第一行），其余为正文
     */
    static GeneratedContent parse(String text, String userId, String strategyId, String contentType) {
        String raw = text == null ? "" : text.trim();
        List<String> lines = new ArrayList<>(List.of(raw.split("\\r?\\n")));

        String title = ResponseFields.field(raw, "标题");
        if (title != null) {
            lines.removeIf(l -> ResponseFields.field(l, "标题") != null);
        } else {
            title = lines.isEmpty() || lines.get(0).isBlank() ? "未命名内容" : lines.remove(0).trim();
        }
        String body = String.join("\n", lines).trim();
        if (body.length() > MAX_BODY_CHARS) {
            body = body.substring(0, MAX_BODY_CHARS - 3) + "...";
        }

        List<String> hashtags = extractHashtags(raw);
        List<String> hooks = engagementHooks(body);

        Map<String, Boolean> checks = new LinkedHashMap<>();
        checks.put("length_appropriate", body.length() > 50);
        checks.put("has_hashtags", !hashtags.isEmpty());
        checks.put("engagement_hooks", hooks.size() >= 2);
        checks.put("platform_optimized", body.length() <= MAX_BODY_CHARS && hashtags.size() <= MAX_HASHTAGS);
        double quality = checks.values().stream().filter(Boolean::booleanValue).count() / (double) checks.size();

        return GeneratedContent.builder()
            .userId(userId)
            .strategyId(strategyId)
            .contentType(contentType)
            .title(title)
            .body(body)
            .hashtags(hashtags)
            .qualityScore(quality)
            .qualityChecks(checks)
            .recommendations(recommendations(checks))
            .build();
    }

    /**
     * 提取话题标签，去重保序，最多 10 个；一个都没有时使用默认标签
     */
    static List<String> extractHashtags(String text) {
        Set<String> tags = new LinkedHashSet<>();
        Matcher matcher = HASHTAG.matcher(text == null ? "" : text);
        while (matcher.find() && tags.size() < MAX_HASHTAGS) {
            tags.add(matcher.group(1));
        }
        return tags.isEmpty() ? new ArrayList<>(DEFAULT_HASHTAGS) : new ArrayList<>(tags);
    }

    static List<String> engagementHooks(String body) {
        List<String> hooks = new ArrayList<>();
        for (String sentence : body.split("[。！!\\n]")) {
            String s = sentence.trim();
            if (s.isEmpty()) {
                continue;
            }
            boolean question = s.endsWith("?") || s.endsWith("？") || s.contains("？");
            boolean callToAction = HOOK_WORDS.stream().anyMatch(s::contains);
            if (question || callToAction) {
                hooks.add(s);
            }
        }
        return hooks;
    }

    static List<String> recommendations(Map<String, Boolean> checks) {
        Map<String, String> advice = new LinkedHashMap<>();
        advice.put("length_appropriate", "内容过短，建议增加更多有价值的信息");
        advice.put("has_hashtags", "建议添加相关话题标签以提高发现性");
        advice.put("engagement_hooks", "建议增加更多互动元素以提高用户参与度");
        return advice.entrySet().stream()
            .filter(e -> !checks.getOrDefault(e.getKey(), false))
            .map(Map.Entry::getValue)
            .collect(Collectors.toList());
    }
}
