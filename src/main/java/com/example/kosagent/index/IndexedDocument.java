package com.example.kosagent.index;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * 索引中的一条文档，由索引独占持有
 */
@Value
@Builder(toBuilder = true)
public class IndexedDocument {

    SourceType sourceType;

    String sourceId;

    /**
     * 关联用户，可能为空
     */
    String userId;

    /**
     * 建索引时的原文，用于回答时拼接上下文
     */
    String content;

    /**
     * 原文的 SHA-256
     */
    String contentHash;

    double[] embedding;

    Instant indexedAt;

    /**
     * 返回向量副本；对外接口不序列化向量
     */
    @JsonIgnore
    public double[] getEmbedding() {
        return embedding == null ? null : embedding.clone();
    }

    /**
     * 索引内部打分用，不复制
     */
    double[] vector() {
        return embedding;
    }

    @JsonIgnore
    public DocumentKey getKey() {
        return DocumentKey.of(sourceType, sourceId);
    }
}
