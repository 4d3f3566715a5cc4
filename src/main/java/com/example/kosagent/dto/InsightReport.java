package com.example.kosagent.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 高价值用户群体的语义洞察
 */
@Value
@Builder
public class InsightReport {

    /**
     * 基于检索上下文的群体概述
     */
    String overview;

    boolean grounded;

    List<UserInsight> users;
}
