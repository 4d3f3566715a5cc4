package com.example.kosagent.context;

import com.example.kosagent.agent.TaskPool;
import com.example.kosagent.index.RetrievalIndex;
import com.example.kosagent.llm.LlmGateway;
import com.example.kosagent.storage.StorageSession;
import lombok.Builder;
import lombok.Value;

/**
 * 节点可用的外部能力
 *
 * 节点只能通过这里的网关、索引和存储会话访问外部世界，
 * 所有资源的生命周期由引擎管理。
 */
@Value
@Builder
public class NodeContext {

    String runId;

    CancellationToken token;

    LlmGateway gateway;

    RetrievalIndex index;

    StorageSession storage;

    TaskPool pool;
}
