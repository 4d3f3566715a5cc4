package com.example.kosagent.config;

import com.example.kosagent.agent.TaskPool;
import com.example.kosagent.agent.WorkflowEngine;
import com.example.kosagent.agent.WorkflowListener;
import com.example.kosagent.agent.WorkflowProperties;
import com.example.kosagent.agent.graph.WorkflowGraphBuilder;
import com.example.kosagent.index.RetrievalIndex;
import com.example.kosagent.llm.LlmGateway;
import com.example.kosagent.storage.StorageGateway;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
@EnableConfigurationProperties(WorkflowProperties.class)
public class WorkflowConfig {

    @Bean(destroyMethod = "close")
    public TaskPool taskPool(WorkflowProperties properties) {
        return new TaskPool(properties.concurrency());
    }

    @Bean(destroyMethod = "close")
    public WorkflowEngine workflowEngine(WorkflowGraphBuilder graphBuilder,
                                         LlmGateway llmGateway,
                                         RetrievalIndex retrievalIndex,
                                         StorageGateway storageGateway,
                                         TaskPool taskPool,
                                         WorkflowProperties properties,
                                         List<WorkflowListener> listeners) {
        return new WorkflowEngine(graphBuilder.build(), llmGateway, retrievalIndex, storageGateway,
            taskPool, properties, listeners);
    }
}
