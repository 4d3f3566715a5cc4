package com.example.kosagent.exception;

import com.example.kosagent.index.DocumentKey;
import lombok.Getter;

/**
 * 检索过程中发现索引内容哈希与存储内容不一致
 */
@Getter
public class RetrievalStaleException extends KosAgentException {

    private final DocumentKey key;

    public RetrievalStaleException(DocumentKey key, String indexedHash, String currentHash) {
        super(String.format("索引文档已过期: %s (indexed=%s, current=%s)", key, indexedHash, currentHash));
        this.key = key;
    }
}
