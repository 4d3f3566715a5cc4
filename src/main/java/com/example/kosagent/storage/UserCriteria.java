package com.example.kosagent.storage;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumSet;
import java.util.Set;

/**
 * 候选用户筛选条件
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserCriteria {

    /**
     * 允许的情感倾向，为空表示不限
     */
    @Builder.Default
    private Set<Sentiment> sentiments = EnumSet.noneOf(Sentiment.class);

    /**
     * 只保留存在未满足需求的用户
     */
    @Builder.Default
    private boolean requireUnmetNeed = false;

    @Builder.Default
    private int minInteractions = 0;

    /**
     * 在打分前剔除已到访用户
     */
    @Builder.Default
    private boolean excludeVisited = false;

    /**
     * 最终返回的高价值用户数量
     */
    @Builder.Default
    private int limit = 20;

    /**
     * 从存储中扫描的最大记录数
     */
    @Builder.Default
    private int scanLimit = 500;

    public static UserCriteria defaults() {
        return UserCriteria.builder().build();
    }

    public boolean matches(UserRecord user) {
        if (sentiments != null && !sentiments.isEmpty()) {
            Sentiment s = user.getSentiment() != null ? user.getSentiment() : Sentiment.UNKNOWN;
            if (!sentiments.contains(s)) {
                return false;
            }
        }
        if (requireUnmetNeed && !Boolean.TRUE.equals(user.getUnmetNeed())) {
            return false;
        }
        int interactions = user.getInteractionCount() != null ? user.getInteractionCount() : 0;
        if (interactions < minInteractions) {
            return false;
        }
        return !(excludeVisited && Boolean.TRUE.equals(user.getVisited()));
    }
}
