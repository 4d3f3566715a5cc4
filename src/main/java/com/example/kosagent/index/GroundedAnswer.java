package com.example.kosagent.index;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.List;

/**
 * 基于检索上下文的回答
 */
@Value
@Builder
public class GroundedAnswer {

    public static final String NO_INFORMATION = "抱歉，没有找到与问题相关的信息。";

    String question;

    String answer;

    /**
     * 实际放入上下文的段落（按相似度降序）
     */
    List<RetrievalResult> sources;

    /**
     * 是否调用了模型
     */
    boolean grounded;

    String provider;

    public static GroundedAnswer noInformation(String question) {
        return GroundedAnswer.builder()
            .question(question)
            .answer(NO_INFORMATION)
            .sources(Collections.emptyList())
            .grounded(false)
            .build();
    }
}
