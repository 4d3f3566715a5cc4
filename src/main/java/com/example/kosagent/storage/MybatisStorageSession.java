package com.example.kosagent.storage;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.example.kosagent.entity.CommentAnalysis;
import com.example.kosagent.entity.ContentDraftEntity;
import com.example.kosagent.entity.UserCommentStats;
import com.example.kosagent.entity.XhsComment;
import com.example.kosagent.entity.XhsNote;
import com.example.kosagent.index.SourceType;
import com.example.kosagent.mapper.CommentAnalysisMapper;
import com.example.kosagent.mapper.ContentDraftMapper;
import com.example.kosagent.mapper.XhsCommentMapper;
import com.example.kosagent.mapper.XhsNoteMapper;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * MyBatis-Plus 存储会话
 *
 * 连接由 Spring 管理的 SqlSession 按语句获取，会话本身只负责作用域与统计。
 */
@Slf4j
public class MybatisStorageSession implements StorageSession {

    private final CommentAnalysisMapper commentAnalysisMapper;
    private final XhsCommentMapper xhsCommentMapper;
    private final XhsNoteMapper xhsNoteMapper;
    private final ContentDraftMapper contentDraftMapper;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicInteger statements = new AtomicInteger();

    MybatisStorageSession(CommentAnalysisMapper commentAnalysisMapper,
                          XhsCommentMapper xhsCommentMapper,
                          XhsNoteMapper xhsNoteMapper,
                          ContentDraftMapper contentDraftMapper) {
        this.commentAnalysisMapper = commentAnalysisMapper;
        this.xhsCommentMapper = xhsCommentMapper;
        this.xhsNoteMapper = xhsNoteMapper;
        this.contentDraftMapper = contentDraftMapper;
    }

    @Override
    public List<UserRecord> loadUserRecords(int scanLimit) {
        ensureOpen();
        List<CommentAnalysis> rows = commentAnalysisMapper.selectList(new LambdaQueryWrapper<CommentAnalysis>()
            .orderByDesc(CommentAnalysis::getUpdatedAt)
            .last("LIMIT " + Math.max(1, scanLimit)));
        count();
        if (rows.isEmpty()) {
            return Collections.emptyList();
        }

        Map<String, List<CommentAnalysis>> byUser = rows.stream()
            .filter(r -> r.getCommentUserId() != null)
            .collect(Collectors.groupingBy(CommentAnalysis::getCommentUserId, LinkedHashMap::new, Collectors.toList()));
        if (byUser.isEmpty()) {
            // 全部诊断都缺少用户ID，不能拼出 IN ()
            log.debug("[Storage] 扫描 {} 条诊断，均无用户ID", rows.size());
            return Collections.emptyList();
        }

        Map<String, UserCommentStats> stats = xhsCommentMapper.statsByUserIds(byUser.keySet()).stream()
            .collect(Collectors.toMap(UserCommentStats::getUserId, Function.identity(), (a, b) -> a));
        count();

        List<UserRecord> records = new ArrayList<>();
        byUser.forEach((userId, userRows) ->
            records.add(SourceRecordDecoder.toUserRecord(userId, userRows, stats.get(userId))));
        log.debug("[Storage] 扫描 {} 条诊断，聚合出 {} 个用户", rows.size(), records.size());
        return records;
    }

    @Override
    public Optional<SourceRecord> loadSource(SourceType type, String sourceId) {
        ensureOpen();
        count();
        switch (type) {
            case COMMENT:
                return Optional.ofNullable(xhsCommentMapper.selectById(sourceId)).map(SourceRecordDecoder::toSource);
            case NOTE:
                return Optional.ofNullable(xhsNoteMapper.selectById(sourceId)).map(SourceRecordDecoder::toSource);
            case ANALYSIS:
                try {
                    return Optional.ofNullable(commentAnalysisMapper.selectById(Long.parseLong(sourceId)))
                        .map(SourceRecordDecoder::toSource);
                } catch (NumberFormatException e) {
                    log.warn("[Storage] 非法的诊断记录ID: {}", sourceId);
                    return Optional.empty();
                }
            default:
                return Optional.empty();
        }
    }

    @Override
    public List<SourceRecord> loadSources(SourceType type, int limit) {
        ensureOpen();
        count();
        String last = "LIMIT " + Math.max(1, limit);
        switch (type) {
            case COMMENT:
                return xhsCommentMapper.selectList(new LambdaQueryWrapper<XhsComment>()
                        .isNotNull(XhsComment::getCommentContent)
                        .orderByDesc(XhsComment::getCommentCreateTime)
                        .last(last))
                    .stream().map(SourceRecordDecoder::toSource).collect(Collectors.toList());
            case NOTE:
                return xhsNoteMapper.selectList(new LambdaQueryWrapper<XhsNote>()
                        .eq(XhsNote::getNoteStatus, 1)
                        .orderByDesc(XhsNote::getUpdatedAt)
                        .last(last))
                    .stream().map(SourceRecordDecoder::toSource).collect(Collectors.toList());
            case ANALYSIS:
                return commentAnalysisMapper.selectList(new LambdaQueryWrapper<CommentAnalysis>()
                        .orderByDesc(CommentAnalysis::getUpdatedAt)
                        .last(last))
                    .stream().map(SourceRecordDecoder::toSource).collect(Collectors.toList());
            default:
                return Collections.emptyList();
        }
    }

    @Override
    public void upsertContentDraft(ContentDraft draft) {
        ensureOpen();
        LocalDateTime now = LocalDateTime.now();
        ContentDraftEntity entity = ContentDraftEntity.builder()
            .userId(draft.getUserId())
            .strategyId(draft.getStrategyId())
            .title(draft.getTitle())
            .body(draft.getBody())
            .hashtags(draft.getHashtags() == null ? "" : String.join(",", draft.getHashtags()))
            .qualityScore(draft.getQualityScore())
            .createdAt(draft.getCreatedAt() != null ? draft.getCreatedAt() : now)
            .updatedAt(now)
            .build();
        contentDraftMapper.upsert(entity);
        count();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            log.debug("[Storage] 会话关闭，共执行 {} 条语句", statements.get());
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("存储会话已关闭");
        }
    }

    private void count() {
        statements.incrementAndGet();
    }
}
