package com.example.kosagent.scoring;

import com.example.kosagent.index.RetrievalResult;
import lombok.Value;

import java.util.List;

/**
 * 用户在索引中的检索佐证（命中数与平均相似度）
 */
@Value
public class RetrievalContext {

    int hitCount;

    double averageSimilarity;

    public static RetrievalContext of(List<RetrievalResult> hits) {
        if (hits == null || hits.isEmpty()) {
            return new RetrievalContext(0, 0.0);
        }
        double avg = hits.stream().mapToDouble(RetrievalResult::getSimilarityScore).average().orElse(0.0);
        return new RetrievalContext(hits.size(), avg);
    }
}
