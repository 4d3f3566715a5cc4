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
 * 小红书笔记实体
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@TableName("xhs_notes")
public class XhsNote {

    @TableId(type = IdType.INPUT)
    private String noteId;

    private String noteUrl;

    private String noteDisplayTitle;

    private Integer noteLikedCount;

    private String authorUserId;

    private String authorNickName;

    /**
     * 1 有效 0 无效
     */
    private Integer noteStatus;

    private LocalDateTime updatedAt;
}
