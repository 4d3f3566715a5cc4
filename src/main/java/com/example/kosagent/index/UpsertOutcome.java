package com.example.kosagent.index;

/**
 * upsert 结果
 */
public enum UpsertOutcome {
    INSERTED,
    UPDATED,
    UNCHANGED
}
