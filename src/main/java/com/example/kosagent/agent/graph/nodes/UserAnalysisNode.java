package com.example.kosagent.agent.graph.nodes;

import com.example.kosagent.agent.StateKeys;
import com.example.kosagent.agent.graph.AgentNode;
import com.example.kosagent.context.NodeContext;
import com.example.kosagent.context.WorkflowState;
import com.example.kosagent.dto.AnalysisSummary;
import com.example.kosagent.exception.NodeTimeoutException;
import com.example.kosagent.index.RetrievalResult;
import com.example.kosagent.scoring.RankedUser;
import com.example.kosagent.scoring.RetrievalContext;
import com.example.kosagent.scoring.UserValueScorer;
import com.example.kosagent.scoring.ValueScore;
import com.example.kosagent.storage.Sentiment;
import com.example.kosagent.storage.UserCriteria;
import com.example.kosagent.storage.UserRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 用户分析节点
 *
 * 1. 从存储会话读取用户视图，按条件筛选（已到访剔除在打分之前）
 * 2. AI 增强时为每个候选用户检索佐证
 * 3. 在任务池上批量打分，排序并截取前 limit 个
 */
@Slf4j
@RequiredArgsConstructor
public class UserAnalysisNode implements AgentNode {

    public static final String NAME = "user_analysis";

    // 检索佐证参数
    private static final int EVIDENCE_TOP_K = 5;
    private static final double EVIDENCE_THRESHOLD = 0.5;

    private final UserValueScorer scorer;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Set<String> requiredReads() {
        return Set.of(StateKeys.CRITERIA);
    }

    @Override
    public Set<String> optionalReads() {
        return Set.of(StateKeys.AI_ENHANCED);
    }

    @Override
    public Set<String> writes() {
        return Set.of(StateKeys.HIGH_VALUE_USERS, StateKeys.ANALYSIS_SUMMARY);
    }

    @Override
    public Map<String, Object> produceUpdate(WorkflowState state, NodeContext context) {
        UserCriteria criteria = state.get(StateKeys.CRITERIA, UserCriteria.class);
        boolean aiEnhanced = Boolean.TRUE.equals(state.get(StateKeys.AI_ENHANCED));

        List<UserRecord> scanned = context.getStorage().loadUserRecords(criteria.getScanLimit());
        int visitedExcluded = criteria.isExcludeVisited()
            ? (int) scanned.stream().filter(u -> Boolean.TRUE.equals(u.getVisited())).count()
            : 0;
        List<UserRecord> candidates = scanned.stream()
            .filter(criteria::matches)
            .collect(Collectors.toList());
        log.info("[UserAnalysisNode] 扫描 {} 个用户，符合条件 {} 个（剔除已到访 {} 个）",
            scanned.size(), candidates.size(), visitedExcluded);

        boolean enrich = aiEnhanced && context.getIndex() != null && !candidates.isEmpty();
        List<RetrievalContext> evidence = enrich
            ? context.getPool().mapBounded(candidates, u -> retrieve(u, context))
            : null;

        List<ValueScore> scoreList = new ArrayList<>();
        if (!candidates.isEmpty()) {
            List<Integer> positions = new ArrayList<>();
            for (int i = 0; i < candidates.size(); i++) {
                positions.add(i);
            }
            scoreList = context.getPool().mapBounded(positions,
                i -> scorer.score(candidates.get(i), evidence != null ? evidence.get(i) : null));
        }
        context.getToken().throwIfCancelled(NAME + ":scored");

        Map<String, ValueScore> scores = new LinkedHashMap<>();
        scoreList.forEach(s -> scores.put(s.getUserId(), s));

        List<RankedUser> ranked = scorer.rank(candidates, scores).stream()
            .limit(criteria.getLimit())
            .collect(Collectors.toList());

        Map<Sentiment, Long> distribution = new EnumMap<>(Sentiment.class);
        candidates.forEach(u -> distribution.merge(
            u.getSentiment() != null ? u.getSentiment() : Sentiment.UNKNOWN, 1L, Long::sum));

        AnalysisSummary summary = AnalysisSummary.builder()
            .scanned(scanned.size())
            .candidates(candidates.size())
            .excludedVisited(visitedExcluded)
            .selected(ranked.size())
            .averageScore(ranked.stream().mapToDouble(r -> r.getScore().getScore()).average().orElse(0.0))
            .topScore(ranked.isEmpty() ? 0.0 : ranked.get(0).getScore().getScore())
            .sentimentDistribution(distribution)
            .retrievalEnriched(enrich)
            .build();

        if (!ranked.isEmpty()) {
            log.info("[UserAnalysisNode] 选出 {} 个高价值用户，最高分 {} ({})",
                ranked.size(), String.format(Locale.ROOT, "%.2f", summary.getTopScore()), ranked.get(0).getUserId());
        }

        Map<String, Object> update = new LinkedHashMap<>();
        update.put(StateKeys.HIGH_VALUE_USERS, ranked);
        update.put(StateKeys.ANALYSIS_SUMMARY, summary);
        return update;
    }

    /**
     * 检索失败不影响打分，只是没有佐证加分；超时继续向上抛出
     */
    private RetrievalContext retrieve(UserRecord user, NodeContext context) {
        try {
            List<RetrievalResult> hits = context.getIndex().searchForUser(user.getUserId(), evidenceQuery(user),
                EVIDENCE_TOP_K, EVIDENCE_THRESHOLD, context.getToken());
            return RetrievalContext.of(hits);
        } catch (NodeTimeoutException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("[UserAnalysisNode] 用户 {} 检索佐证失败: {}", user.getUserId(), e.getMessage());
            return null;
        }
    }

    static String evidenceQuery(UserRecord user) {
        StringBuilder sb = new StringBuilder();
        if (user.getUnmetNeedDesc() != null) {
            sb.append(user.getUnmetNeedDesc()).append(" ");
        }
        if (user.getContentSummary() != null) {
            sb.append(user.getContentSummary()).append(" ");
        }
        if (sb.length() == 0) {
            sb.append("用户需求 兴趣 评价");
        }
        return sb.toString().trim();
    }
}
