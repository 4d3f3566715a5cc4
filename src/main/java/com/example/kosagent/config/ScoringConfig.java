package com.example.kosagent.config;

import com.example.kosagent.scoring.ScoringPolicy;
import com.example.kosagent.scoring.VisitedPolicy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 打分策略，未配置的权重使用 ScoringPolicy 默认值
 */
@Configuration
public class ScoringConfig {

    @Bean
    public ScoringPolicy scoringPolicy(@Value("${kos.scoring.visited-policy:PENALIZE}") VisitedPolicy visitedPolicy,
                                       @Value("${kos.scoring.visited-penalty:2.0}") double visitedPenalty,
                                       @Value("${kos.scoring.unmet-need-bonus:3.0}") double unmetNeedBonus,
                                       @Value("${kos.scoring.retrieval-weight:1.0}") double retrievalWeight) {
        return ScoringPolicy.builder()
            .visitedPolicy(visitedPolicy)
            .visitedPenalty(visitedPenalty)
            .unmetNeedBonus(unmetNeedBonus)
            .retrievalWeight(retrievalWeight)
            .build();
    }
}
