package com.example.kosagent.agent.graph.nodes;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 解析模型按“字段: 值”逐行输出的文本
 */
final class ResponseFields {

    private ResponseFields() {
    }

    /**
     * 取第一个匹配标签的行的值，中英文冒号均可；没有时返回 null
     */
    static String field(String text, String... labels) {
        if (text == null) {
            return null;
        }
        for (String line : text.split("\\r?\\n")) {
            String trimmed = line.trim().replaceFirst("^[-*#\\s]+", "");
            for (String label : labels) {
                if (trimmed.startsWith(label + ":") || trimmed.startsWith(label + "：")) {
                    String value = trimmed.substring(label.length() + 1).trim();
                    if (!value.isEmpty()) {
                        return value;
                    }
                }
            }
        }
        return null;
    }

    /**
     * 字段值按中英文逗号、顿号、分号拆分
     */
    static List<String> list(String text, String... labels) {
        String value = field(text, labels);
        if (value == null) {
            return new ArrayList<>();
        }
        return Arrays.stream(value.split("[,，、;；]"))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .collect(Collectors.toList());
    }
}
