package com.example.kosagent.context;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 工作流共享状态
 *
 * 不可变：节点只读取快照，每个节点产出的局部更新由引擎合并成新的状态对象。
 * 同一个 key 被多次写入时，以合并顺序中最后一次为准（由引擎按拓扑顺序合并）。
 */
public final class WorkflowState {

    private static final WorkflowState EMPTY = new WorkflowState(Collections.emptyMap());

    private final Map<String, Object> values;

    private WorkflowState(Map<String, Object> values) {
        this.values = values;
    }

    public static WorkflowState empty() {
        return EMPTY;
    }

    public static WorkflowState of(Map<String, Object> initial) {
        return EMPTY.merge(initial);
    }

    /**
     * 合并局部更新，返回新的状态；原状态不变
     */
    public WorkflowState merge(Map<String, ?> update) {
        if (update == null || update.isEmpty()) {
            return this;
        }
        Map<String, Object> merged = new LinkedHashMap<>(values);
        merged.putAll(update);
        return new WorkflowState(Collections.unmodifiableMap(merged));
    }

    public boolean contains(String key) {
        return values.get(key) != null;
    }

    public boolean containsAll(Set<String> keys) {
        return keys.stream().allMatch(this::contains);
    }

    public Object get(String key) {
        return values.get(key);
    }

    public <T> T get(String key, Class<T> type) {
        Object value = values.get(key);
        if (value == null) {
            return null;
        }
        if (!type.isInstance(value)) {
            throw new IllegalStateException(String.format("状态字段 %s 类型不匹配: 期望 %s, 实际 %s",
                key, type.getSimpleName(), value.getClass().getSimpleName()));
        }
        return type.cast(value);
    }

    public <T> Optional<T> find(String key, Class<T> type) {
        return Optional.ofNullable(get(key, type));
    }

    public Set<String> keys() {
        return values.keySet();
    }

    @JsonValue
    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return "WorkflowState" + values.keySet();
    }
}
