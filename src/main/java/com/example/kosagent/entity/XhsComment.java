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
 * 小红书评论实体
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@TableName("xhs_comments")
public class XhsComment {

    @TableId(type = IdType.INPUT)
    private String commentId;

    private String noteId;

    /**
     * 父评论ID，顶级评论为 null
     */
    private String parentCommentId;

    private String commentUserId;

    private String commentUserNickname;

    private String commentContent;

    private Integer commentLikeCount;

    private LocalDateTime commentCreateTime;

    private String ipLocation;

    private LocalDateTime updatedAt;
}
