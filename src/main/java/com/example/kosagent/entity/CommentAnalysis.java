package com.example.kosagent.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 评论诊断结果实体（模型对单条评论的分析）
 *
 * 标签字段保存的是中文原值，统一在 SourceRecordDecoder 中解码。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@TableName("llm_comment_analysis")
public class CommentAnalysis {

    @TableId(type = IdType.AUTO)
    private Long id;

    private String noteId;

    private String commentUserId;

    private String commentUserNickname;

    /**
     * 情感倾向(正向/中性/负向/未知)
     */
    private String emotionalPreference;

    private String emotionalDesc;

    /**
     * AIPS偏好(A/I/TI/P/S/未知)
     */
    private String aipsPreference;

    /**
     * 是否去过(是/否/未知)
     */
    private String hasVisited;

    /**
     * 未满足需求(是/否/未知)
     */
    private String unmetPreference;

    private String unmetDesc;

    private String gender;

    private String age;

    private String llmAlias;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
