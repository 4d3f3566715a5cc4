package com.example.kosagent.scoring;

/**
 * 已到访用户的打分策略
 */
public enum VisitedPolicy {

    /**
     * 不影响分数
     */
    IGNORE,

    /**
     * 扣除固定分值
     */
    PENALIZE,

    /**
     * 分数直接归零
     */
    ZERO
}
