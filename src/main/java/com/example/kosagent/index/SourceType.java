package com.example.kosagent.index;

/**
 * 可索引的数据来源
 */
public enum SourceType {

    /**
     * 原始评论（xhs_comments）
     */
    COMMENT,

    /**
     * 笔记（xhs_notes）
     */
    NOTE,

    /**
     * 模型对评论的诊断结果（llm_comment_analysis）
     */
    ANALYSIS
}
