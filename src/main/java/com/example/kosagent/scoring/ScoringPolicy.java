package com.example.kosagent.scoring;

import lombok.Builder;
import lombok.Value;

/**
 * 打分权重
 *
 * 默认值：正向 2.5 / 中性 1.0 / 未知 0.5 / 负向 0，未满足需求 +3，
 * 互动 min(2, 0.8·ln(1+n))，AIPS 认知 0.5 / 兴趣 1.0 / 购买 2.0 / 分享 1.5，
 * 参与笔记多样性最多 +1，检索佐证最多 +1，已到访扣 2 分。
 */
@Value
@Builder(toBuilder = true)
public class ScoringPolicy {

    @Builder.Default double positiveWeight = 2.5;
    @Builder.Default double neutralWeight = 1.0;
    @Builder.Default double unknownWeight = 0.5;
    @Builder.Default double negativeWeight = 0.0;

    @Builder.Default double unmetNeedBonus = 3.0;

    @Builder.Default double interactionCoefficient = 0.8;
    @Builder.Default double interactionCap = 2.0;

    @Builder.Default double awarenessWeight = 0.5;
    @Builder.Default double interestWeight = 1.0;
    @Builder.Default double purchaseWeight = 2.0;
    @Builder.Default double shareWeight = 1.5;

    @Builder.Default double diversityPerNote = 0.2;
    @Builder.Default double diversityCap = 1.0;

    @Builder.Default double retrievalWeight = 1.0;
    @Builder.Default double retrievalCap = 1.0;
    // 命中数达到该值时命中数部分取满
    @Builder.Default int retrievalSaturationHits = 5;

    @Builder.Default VisitedPolicy visitedPolicy = VisitedPolicy.PENALIZE;
    @Builder.Default double visitedPenalty = 2.0;

    public static ScoringPolicy defaults() {
        return ScoringPolicy.builder().build();
    }
}
