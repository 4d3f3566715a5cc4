package com.example.kosagent.storage;

/**
 * AIPS 漏斗阶段：认知 → 兴趣 → 购买 → 分享
 */
public enum AipsTier {
    AWARENESS,
    INTEREST,
    PURCHASE,
    SHARE
}
