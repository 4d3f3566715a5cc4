package com.example.kosagent.index;

import lombok.Value;

import java.time.Instant;

/**
 * 检索命中
 */
@Value
public class RetrievalResult {

    IndexedDocument document;

    double similarityScore;

    /**
     * 本次检索的快照时间
     */
    Instant snapshotTimestamp;
}
