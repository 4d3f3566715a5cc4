package com.example.kosagent.storage;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * 用户聚合视图（只读）
 *
 * 除 userId 外所有字段都可能缺失（null），缺失字段在打分时贡献 0。
 */
@Value
@Builder(toBuilder = true)
public class UserRecord {

    String userId;

    String nickname;

    Sentiment sentiment;

    /**
     * 是否存在未满足需求
     */
    Boolean unmetNeed;

    /**
     * 未满足需求描述，用于生成内容
     */
    String unmetNeedDesc;

    Integer interactionCount;

    AipsTier aipsTier;

    Boolean visited;

    LocalDateTime lastActivityAt;

    /**
     * 参与过的不同笔记数
     */
    Integer notesEngaged;

    /**
     * 评论/诊断摘要，用于提示词
     */
    String contentSummary;
}
