package com.example.kosagent.storage;

/**
 * 情感倾向
 */
public enum Sentiment {
    POSITIVE,
    NEUTRAL,
    NEGATIVE,
    UNKNOWN
}
