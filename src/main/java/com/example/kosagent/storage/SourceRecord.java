package com.example.kosagent.storage;

import com.example.kosagent.index.SourceType;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * 存储中可被索引的一条原始记录
 */
@Value
@Builder
public class SourceRecord {

    SourceType sourceType;

    String sourceId;

    /**
     * 关联用户（评论者 / 笔记作者）
     */
    String userId;

    String content;

    LocalDateTime updatedAt;
}
