package com.example.kosagent.storage;

import com.example.kosagent.entity.CommentAnalysis;
import com.example.kosagent.entity.UserCommentStats;
import com.example.kosagent.entity.XhsComment;
import com.example.kosagent.entity.XhsNote;
import com.example.kosagent.index.SourceType;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 存储边界上的标签解码
 *
 * 库中保存的是中文标签（正向/中性/负向、是/否、A/I/TI/P/S），
 * 只在这里转换为枚举与布尔值，内部不再出现原始字符串。
 */
public final class SourceRecordDecoder {

    private SourceRecordDecoder() {
    }

    /**
     * null / 空串视为缺失，其它无法识别的值视为 UNKNOWN
     */
    public static Sentiment decodeSentiment(String label) {
        if (label == null || label.isBlank()) {
            return null;
        }
        return switch (label.trim().toLowerCase(Locale.ROOT)) {
            case "正向", "积极", "positive" -> Sentiment.POSITIVE;
            case "中性", "neutral" -> Sentiment.NEUTRAL;
            case "负向", "消极", "negative" -> Sentiment.NEGATIVE;
            default -> Sentiment.UNKNOWN;
        };
    }

    public static Boolean decodeFlag(String label) {
        if (label == null || label.isBlank()) {
            return null;
        }
        return switch (label.trim().toLowerCase(Locale.ROOT)) {
            case "是", "yes", "true", "1" -> Boolean.TRUE;
            case "否", "no", "false", "0" -> Boolean.FALSE;
            default -> null;
        };
    }

    /**
     * TI（试探性兴趣）归入 INTEREST
     */
    public static AipsTier decodeAips(String label) {
        if (label == null || label.isBlank()) {
            return null;
        }
        return switch (label.trim().toUpperCase(Locale.ROOT)) {
            case "A", "认知", "AWARENESS" -> AipsTier.AWARENESS;
            case "I", "TI", "兴趣", "INTEREST" -> AipsTier.INTEREST;
            case "P", "购买", "PURCHASE" -> AipsTier.PURCHASE;
            case "S", "分享", "SHARE" -> AipsTier.SHARE;
            default -> null;
        };
    }

    /**
     * 将同一用户的多条诊断（最新在前）与评论统计合并为用户视图
     */
    public static UserRecord toUserRecord(String userId, List<CommentAnalysis> rows, UserCommentStats stats) {
        Sentiment sentiment = rows.stream()
            .map(r -> decodeSentiment(r.getEmotionalPreference()))
            .filter(Objects::nonNull)
            .findFirst()
            .orElse(null);

        AipsTier tier = rows.stream()
            .map(r -> decodeAips(r.getAipsPreference()))
            .filter(Objects::nonNull)
            .max(Enum::compareTo)
            .orElse(null);

        String nickname = rows.stream()
            .map(CommentAnalysis::getCommentUserNickname)
            .filter(n -> n != null && !n.isBlank())
            .findFirst()
            .orElse(null);

        String unmetDesc = rows.stream()
            .map(CommentAnalysis::getUnmetDesc)
            .filter(d -> d != null && !d.isBlank())
            .findFirst()
            .orElse(null);

        String summary = rows.stream()
            .map(CommentAnalysis::getEmotionalDesc)
            .filter(d -> d != null && !d.isBlank())
            .limit(2)
            .collect(Collectors.joining("；"));

        Integer interactions = stats != null && stats.getInteractionCount() != null
            ? stats.getInteractionCount() : Integer.valueOf(rows.size());
        Integer notes = stats != null && stats.getNotesEngaged() != null
            ? stats.getNotesEngaged()
            : Integer.valueOf((int) rows.stream().map(CommentAnalysis::getNoteId).filter(Objects::nonNull).distinct().count());

        LocalDateTime lastActivity = rows.stream()
            .map(r -> r.getUpdatedAt() != null ? r.getUpdatedAt() : r.getCreatedAt())
            .filter(Objects::nonNull)
            .max(LocalDateTime::compareTo)
            .orElse(null);
        if (stats != null && stats.getLastActivityAt() != null
            && (lastActivity == null || stats.getLastActivityAt().isAfter(lastActivity))) {
            lastActivity = stats.getLastActivityAt();
        }

        return UserRecord.builder()
            .userId(userId)
            .nickname(nickname)
            .sentiment(sentiment)
            .unmetNeed(anyFlag(rows.stream().map(CommentAnalysis::getUnmetPreference).collect(Collectors.toList())))
            .unmetNeedDesc(unmetDesc)
            .interactionCount(interactions)
            .aipsTier(tier)
            .visited(anyFlag(rows.stream().map(CommentAnalysis::getHasVisited).collect(Collectors.toList())))
            .lastActivityAt(lastActivity)
            .notesEngaged(notes)
            .contentSummary(summary.isEmpty() ? null : summary)
            .build();
    }

    /**
     * 任一为“是”即为 true；全部缺失时为 null
     */
    private static Boolean anyFlag(List<String> labels) {
        Boolean result = null;
        for (String label : labels) {
            Boolean flag = decodeFlag(label);
            if (Boolean.TRUE.equals(flag)) {
                return Boolean.TRUE;
            }
            if (flag != null) {
                result = Boolean.FALSE;
            }
        }
        return result;
    }

    public static SourceRecord toSource(XhsComment comment) {
        return SourceRecord.builder()
            .sourceType(SourceType.COMMENT)
            .sourceId(comment.getCommentId())
            .userId(comment.getCommentUserId())
            .content(comment.getCommentContent() == null ? "" : comment.getCommentContent())
            .updatedAt(comment.getUpdatedAt())
            .build();
    }

    public static SourceRecord toSource(XhsNote note) {
        return SourceRecord.builder()
            .sourceType(SourceType.NOTE)
            .sourceId(note.getNoteId())
            .userId(note.getAuthorUserId())
            .content(note.getNoteDisplayTitle() == null ? "" : note.getNoteDisplayTitle())
            .updatedAt(note.getUpdatedAt())
            .build();
    }

    /**
     * 诊断记录按固定模板拼成可检索文本
     */
    public static SourceRecord toSource(CommentAnalysis analysis) {
        StringBuilder sb = new StringBuilder();
        sb.append("用户: ").append(nullToEmpty(analysis.getCommentUserNickname())).append("\n");
        sb.append("情感倾向: ").append(nullToEmpty(analysis.getEmotionalPreference())).append("\n");
        sb.append("情感描述: ").append(nullToEmpty(analysis.getEmotionalDesc())).append("\n");
        sb.append("AIPS偏好: ").append(nullToEmpty(analysis.getAipsPreference())).append("\n");
        sb.append("是否去过: ").append(nullToEmpty(analysis.getHasVisited())).append("\n");
        sb.append("未满足需求: ").append(nullToEmpty(analysis.getUnmetPreference())).append("\n");
        sb.append("需求描述: ").append(nullToEmpty(analysis.getUnmetDesc()));
        return SourceRecord.builder()
            .sourceType(SourceType.ANALYSIS)
            .sourceId(String.valueOf(analysis.getId()))
            .userId(analysis.getCommentUserId())
            .content(sb.toString())
            .updatedAt(analysis.getUpdatedAt())
            .build();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
