package com.example.kosagent.agent;

/**
 * 工作流状态键
 */
public final class StateKeys {

    private StateKeys() {
    }

    // 初始状态
    public static final String REQUEST = "request";
    public static final String TASK = "task";
    public static final String CRITERIA = "criteria";
    public static final String AI_ENHANCED = "ai_enhanced";
    public static final String BUSINESS_GOALS = "business_goals";

    // 节点产出
    public static final String TASK_ANALYSIS = "task_analysis";
    public static final String HIGH_VALUE_USERS = "high_value_users";
    public static final String ANALYSIS_SUMMARY = "analysis_summary";
    public static final String INSIGHTS = "insights";
    public static final String CONTENT_STRATEGY = "content_strategy";
    public static final String GENERATED_CONTENT = "generated_content";
    public static final String COORDINATION_SUMMARY = "coordination_summary";
    public static final String OPTIMIZATION_NOTES = "optimization_notes";
}
