package com.example.kosagent.agent;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * 工作流引擎配置，对应 kos.workflow
 */
@ConfigurationProperties(prefix = "kos.workflow")
public record WorkflowProperties(
        @DefaultValue("4") int concurrency,
        @DefaultValue("120") int defaultDeadlineSeconds,
        @DefaultValue("8") int maxConcurrentRuns,
        @DefaultValue("200") int retainedRuns
) {}
