package com.example.kosagent.storage;

import com.example.kosagent.entity.CommentAnalysis;
import com.example.kosagent.entity.UserCommentStats;
import com.example.kosagent.index.SourceType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SourceRecordDecoderTest {

    @Test
    @DisplayName("中文标签解码为枚举，缺失与无法识别区分开")
    void decodesLabels() {
        assertThat(SourceRecordDecoder.decodeSentiment("正向")).isEqualTo(Sentiment.POSITIVE);
        assertThat(SourceRecordDecoder.decodeSentiment(" 负向 ")).isEqualTo(Sentiment.NEGATIVE);
        assertThat(SourceRecordDecoder.decodeSentiment("说不清")).isEqualTo(Sentiment.UNKNOWN);
        assertThat(SourceRecordDecoder.decodeSentiment("")).isNull();

        assertThat(SourceRecordDecoder.decodeFlag("是")).isTrue();
        assertThat(SourceRecordDecoder.decodeFlag("否")).isFalse();
        assertThat(SourceRecordDecoder.decodeFlag("也许")).isNull();

        assertThat(SourceRecordDecoder.decodeAips("TI")).isEqualTo(AipsTier.INTEREST);
        assertThat(SourceRecordDecoder.decodeAips("p")).isEqualTo(AipsTier.PURCHASE);
        assertThat(SourceRecordDecoder.decodeAips("X")).isNull();
    }

    @Test
    @DisplayName("多条诊断合并为用户视图：情感取最新，AIPS 取最高阶段，任一条“是”即为真")
    void mergesRowsIntoUserRecord() {
        LocalDateTime now = LocalDateTime.of(2024, 5, 1, 12, 0);
        CommentAnalysis latest = CommentAnalysis.builder()
            .commentUserId("U1").commentUserNickname("小林").noteId("n1")
            .emotionalPreference("正向").emotionalDesc("很喜欢营地氛围")
            .aipsPreference("I").hasVisited("否").unmetPreference("是").unmetDesc("不会搭帐篷")
            .updatedAt(now)
            .build();
        CommentAnalysis older = CommentAnalysis.builder()
            .commentUserId("U1").noteId("n2")
            .emotionalPreference("负向").aipsPreference("P").hasVisited("否").unmetPreference("否")
            .createdAt(now.minusDays(3))
            .build();

        UserRecord user = SourceRecordDecoder.toUserRecord("U1", List.of(latest, older), null);

        assertThat(user.getSentiment()).isEqualTo(Sentiment.POSITIVE);
        assertThat(user.getAipsTier()).isEqualTo(AipsTier.PURCHASE);
        assertThat(user.getUnmetNeed()).isTrue();
        assertThat(user.getVisited()).isFalse();
        assertThat(user.getUnmetNeedDesc()).isEqualTo("不会搭帐篷");
        assertThat(user.getNickname()).isEqualTo("小林");
        assertThat(user.getInteractionCount()).isEqualTo(2);
        assertThat(user.getNotesEngaged()).isEqualTo(2);
        assertThat(user.getLastActivityAt()).isEqualTo(now);
    }

    @Test
    @DisplayName("评论统计优先于诊断行数")
    void prefersCommentStats() {
        UserCommentStats stats = new UserCommentStats();
        stats.setUserId("U1");
        stats.setInteractionCount(12);
        stats.setNotesEngaged(4);
        stats.setLastActivityAt(LocalDateTime.of(2024, 6, 1, 0, 0));

        UserRecord user = SourceRecordDecoder.toUserRecord("U1",
            List.of(CommentAnalysis.builder().commentUserId("U1").build()), stats);

        assertThat(user.getInteractionCount()).isEqualTo(12);
        assertThat(user.getNotesEngaged()).isEqualTo(4);
        assertThat(user.getLastActivityAt()).isEqualTo(LocalDateTime.of(2024, 6, 1, 0, 0));
        assertThat(user.getSentiment()).isNull();
        assertThat(user.getUnmetNeed()).isNull();
    }

    @Test
    void rendersAnalysisAsSearchableText() {
        CommentAnalysis analysis = CommentAnalysis.builder()
            .id(7L).commentUserId("U1").emotionalPreference("正向").unmetDesc("想要亲子活动")
            .build();

        SourceRecord record = SourceRecordDecoder.toSource(analysis);

        assertThat(record.getSourceType()).isEqualTo(SourceType.ANALYSIS);
        assertThat(record.getSourceId()).isEqualTo("7");
        assertThat(record.getUserId()).isEqualTo("U1");
        assertThat(record.getContent()).contains("情感倾向: 正向").contains("需求描述: 想要亲子活动");
    }
}
