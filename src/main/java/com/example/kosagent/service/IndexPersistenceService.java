package com.example.kosagent.service;

import com.example.kosagent.index.DocumentKey;
import com.example.kosagent.index.IndexedDocument;
import com.example.kosagent.index.SourceType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RMap;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 索引持久化 - 文档与向量存入 Redis Hash
 *
 * field 为 "SOURCE_TYPE:sourceId"，value 为 JSON。进程重启后从这里恢复索引，避免全量重新向量化。
 * 写失败只记日志，内存中的索引仍然可用。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IndexPersistenceService {

    static final String INDEX_KEY = "kos:index:documents";

    private final RedissonClient redissonClient;
    private final ObjectMapper objectMapper;

    public void save(IndexedDocument doc) {
        try {
            String json = objectMapper.writeValueAsString(PersistedDocument.from(doc));
            documents().fastPut(doc.getKey().toString(), json);
        } catch (JsonProcessingException e) {
            log.warn("[IndexStore] 序列化文档失败: {}, {}", doc.getKey(), e.getMessage());
        } catch (RuntimeException e) {
            log.warn("[IndexStore] 写入文档失败: {}, {}", doc.getKey(), e.getMessage());
        }
    }

    public void delete(DocumentKey key) {
        try {
            documents().fastRemove(key.toString());
        } catch (RuntimeException e) {
            log.warn("[IndexStore] 删除文档失败: {}, {}", key, e.getMessage());
        }
    }

    /**
     * 读出全部已持久化的文档；单条损坏时跳过，Redis 不可用时返回空列表
     */
    public List<IndexedDocument> loadAll() {
        Map<String, String> entries;
        try {
            entries = documents().readAllMap();
        } catch (RuntimeException e) {
            log.warn("[IndexStore] 读取持久化索引失败，从空索引启动: {}", e.getMessage());
            return new ArrayList<>();
        }

        List<IndexedDocument> docs = new ArrayList<>(entries.size());
        for (Map.Entry<String, String> entry : entries.entrySet()) {
            try {
                docs.add(objectMapper.readValue(entry.getValue(), PersistedDocument.class).toDocument());
            } catch (Exception e) {
                log.warn("[IndexStore] 跳过无法解析的文档: {}, {}", entry.getKey(), e.getMessage());
            }
        }
        log.info("[IndexStore] 读取持久化文档 {} 条", docs.size());
        return docs;
    }

    private RMap<String, String> documents() {
        return redissonClient.getMap(INDEX_KEY, StringCodec.INSTANCE);
    }

    /**
     * 存储格式，时间存毫秒避免依赖 JavaTimeModule
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class PersistedDocument {

        private SourceType sourceType;
        private String sourceId;
        private String userId;
        private String content;
        private String contentHash;
        private double[] embedding;
        private long indexedAtMillis;

        static PersistedDocument from(IndexedDocument doc) {
            return new PersistedDocument(doc.getSourceType(), doc.getSourceId(), doc.getUserId(),
                doc.getContent(), doc.getContentHash(), doc.getEmbedding(), doc.getIndexedAt().toEpochMilli());
        }

        IndexedDocument toDocument() {
            return IndexedDocument.builder()
                .sourceType(sourceType)
                .sourceId(sourceId)
                .userId(userId)
                .content(content)
                .contentHash(contentHash)
                .embedding(embedding)
                .indexedAt(Instant.ofEpochMilli(indexedAtMillis))
                .build();
        }
    }
}
