package com.example.kosagent.storage;

import com.example.kosagent.index.SourceType;

import java.util.List;
import java.util.Optional;

/**
 * 一次运行内的存储会话，必须在运行结束时关闭
 */
public interface StorageSession extends AutoCloseable {

    /**
     * 读取用户聚合视图，按最近活跃时间倒序
     */
    List<UserRecord> loadUserRecords(int scanLimit);

    /**
     * 读取单条来源记录的当前内容，用于索引过期校验
     */
    Optional<SourceRecord> loadSource(SourceType type, String sourceId);

    List<SourceRecord> loadSources(SourceType type, int limit);

    /**
     * 以 (userId, strategyId) 为键幂等写入
     */
    void upsertContentDraft(ContentDraft draft);

    @Override
    void close();
}
