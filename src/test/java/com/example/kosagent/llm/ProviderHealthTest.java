package com.example.kosagent.llm;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProviderHealthTest {

    @Test
    @DisplayName("没有尝试时健康度为 1.0")
    void neutralWhenEmpty() {
        assertThat(new ProviderHealth(5).score()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("只统计窗口内最近 N 次")
    void rollingWindow() {
        ProviderHealth health = new ProviderHealth(4);
        health.recordFailure("timeout");
        health.recordFailure("timeout");
        health.recordSuccess();
        health.recordSuccess();
        assertThat(health.score()).isEqualTo(0.5);

        health.recordSuccess();
        health.recordSuccess();

        assertThat(health.score()).isEqualTo(1.0);
        assertThat(health.totalAttempts()).isEqualTo(6);
        assertThat(health.totalFailures()).isEqualTo(2);
        assertThat(health.lastFailure()).isEqualTo("timeout");
        assertThat(health.lastFailureAt()).isNotNull();
    }

    @Test
    void rejectsEmptyWindow() {
        assertThatThrownBy(() -> new ProviderHealth(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
