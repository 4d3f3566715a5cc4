package com.example.kosagent.scoring;

import com.example.kosagent.storage.AipsTier;
import com.example.kosagent.storage.Sentiment;
import com.example.kosagent.storage.UserRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 用户价值评分器
 *
 * 纯函数：相同输入永远得到相同分数，不做 I/O。
 * 每个信号映射为有界贡献，缺失字段贡献 0，总分截断到 [0, 10]。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class UserValueScorer {

    public static final double MIN_SCORE = 0.0;
    public static final double MAX_SCORE = 10.0;

    private final ScoringPolicy policy;

    public ValueScore score(UserRecord user) {
        return score(user, null);
    }

    public ValueScore score(UserRecord user, RetrievalContext retrieved) {
        Map<String, Double> components = new LinkedHashMap<>();
        List<String> reasons = new ArrayList<>();

        // 1. 情感倾向
        double sentiment = sentimentWeight(user.getSentiment());
        components.put("sentiment", sentiment);
        if (sentiment > 0) {
            reasons.add(String.format(Locale.ROOT, "情感倾向 %s: +%.2f", user.getSentiment(), sentiment));
        }

        // 2. 未满足需求
        double unmet = Boolean.TRUE.equals(user.getUnmetNeed()) ? policy.getUnmetNeedBonus() : 0.0;
        components.put("unmet_need", unmet);
        if (unmet > 0) {
            reasons.add(String.format(Locale.ROOT, "存在未满足需求: +%.2f", unmet));
        }

        // 3. 互动次数（对数，防止极端值主导）
        double interactions = interactionWeight(user.getInteractionCount());
        components.put("interactions", interactions);
        if (interactions > 0) {
            reasons.add(String.format(Locale.ROOT, "互动 %d 次: +%.2f", user.getInteractionCount(), interactions));
        }

        // 4. AIPS 阶段
        double tier = tierWeight(user.getAipsTier());
        components.put("aips_tier", tier);
        if (tier > 0) {
            reasons.add(String.format(Locale.ROOT, "AIPS %s: +%.2f", user.getAipsTier(), tier));
        }

        // 5. 参与笔记多样性
        double diversity = user.getNotesEngaged() == null || user.getNotesEngaged() <= 0 ? 0.0
            : Math.min(policy.getDiversityCap(), policy.getDiversityPerNote() * user.getNotesEngaged());
        components.put("diversity", diversity);

        // 6. 检索佐证
        double retrieval = retrievalWeight(retrieved);
        components.put("retrieval", retrieval);
        if (retrieval > 0) {
            reasons.add(String.format(Locale.ROOT, "检索佐证 %d 条: +%.2f", retrieved.getHitCount(), retrieval));
        }

        double subtotal = sentiment + unmet + interactions + tier + diversity + retrieval;

        // 7. 已到访
        double visited = 0.0;
        if (Boolean.TRUE.equals(user.getVisited())) {
            switch (policy.getVisitedPolicy()) {
                case PENALIZE:
                    visited = -policy.getVisitedPenalty();
                    reasons.add(String.format(Locale.ROOT, "已到访: %.2f", visited));
                    break;
                case ZERO:
                    visited = -subtotal;
                    reasons.add("已到访: 分数归零");
                    break;
                default:
                    break;
            }
        }
        components.put("visited", visited);

        double score = clamp(subtotal + visited);
        return new ValueScore(user.getUserId(), score, components, reasons);
    }

    /**
     * 分数降序；同分时最近活跃者优先，再按 userId 保证确定性
     */
    public List<RankedUser> rank(List<UserRecord> users, Map<String, ValueScore> scores) {
        List<UserRecord> sorted = new ArrayList<>(users);
        sorted.sort(Comparator
            .comparingDouble((UserRecord u) -> scoreOf(scores, u)).reversed()
            .thenComparing(UserRecord::getLastActivityAt, Comparator.nullsLast(Comparator.<LocalDateTime>reverseOrder()))
            .thenComparing(UserRecord::getUserId, Comparator.nullsLast(Comparator.<String>naturalOrder())));

        List<RankedUser> ranked = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) {
            UserRecord u = sorted.get(i);
            ranked.add(new RankedUser(i + 1, u, scores.get(u.getUserId())));
        }
        return ranked;
    }

    public List<RankedUser> scoreAndRank(List<UserRecord> users) {
        Map<String, ValueScore> scores = new LinkedHashMap<>();
        for (UserRecord u : users) {
            scores.put(u.getUserId(), score(u));
        }
        return rank(users, scores);
    }

    private static double scoreOf(Map<String, ValueScore> scores, UserRecord user) {
        ValueScore s = scores.get(user.getUserId());
        return s == null ? MIN_SCORE : s.getScore();
    }

    private double sentimentWeight(Sentiment sentiment) {
        if (sentiment == null) {
            return 0.0;
        }
        return switch (sentiment) {
            case POSITIVE -> policy.getPositiveWeight();
            case NEUTRAL -> policy.getNeutralWeight();
            case NEGATIVE -> policy.getNegativeWeight();
            case UNKNOWN -> policy.getUnknownWeight();
        };
    }

    private double interactionWeight(Integer count) {
        if (count == null || count <= 0) {
            return 0.0;
        }
        return Math.min(policy.getInteractionCap(), policy.getInteractionCoefficient() * Math.log1p(count));
    }

    private double tierWeight(AipsTier tier) {
        if (tier == null) {
            return 0.0;
        }
        return switch (tier) {
            case AWARENESS -> policy.getAwarenessWeight();
            case INTEREST -> policy.getInterestWeight();
            case PURCHASE -> policy.getPurchaseWeight();
            case SHARE -> policy.getShareWeight();
        };
    }

    private double retrievalWeight(RetrievalContext retrieved) {
        if (retrieved == null || retrieved.getHitCount() <= 0) {
            return 0.0;
        }
        double coverage = Math.min((double) retrieved.getHitCount() / policy.getRetrievalSaturationHits(), 1.0);
        double raw = 0.7 * retrieved.getAverageSimilarity() + 0.3 * coverage;
        return Math.min(policy.getRetrievalCap(), Math.max(0.0, raw * policy.getRetrievalWeight()));
    }

    private static double clamp(double value) {
        return Math.max(MIN_SCORE, Math.min(MAX_SCORE, value));
    }
}
