package com.example.kosagent.dto;

import com.example.kosagent.storage.Sentiment;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * 用户分析汇总
 */
@Value
@Builder
public class AnalysisSummary {

    int scanned;

    int candidates;

    /**
     * 因已到访被剔除的用户数
     */
    int excludedVisited;

    int selected;

    double averageScore;

    double topScore;

    Map<Sentiment, Long> sentimentDistribution;

    /**
     * 是否使用了检索佐证
     */
    boolean retrievalEnriched;
}
