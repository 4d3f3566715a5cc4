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
 * 内容草稿实体，(user_id, strategy_id) 唯一
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@TableName("content_draft")
public class ContentDraftEntity {

    @TableId(type = IdType.AUTO)
    private Long id;

    private String userId;

    private String strategyId;

    private String title;

    private String body;

    /**
     * 逗号分隔的话题标签
     */
    private String hashtags;

    private Double qualityScore;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
