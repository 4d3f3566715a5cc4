package com.example.kosagent.entity;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 评论维度的用户聚合统计（查询结果，不对应表）
 */
@Data
public class UserCommentStats {

    private String userId;

    private Integer interactionCount;

    private Integer notesEngaged;

    private LocalDateTime lastActivityAt;
}
