package com.example.kosagent.support;

import com.example.kosagent.exception.PermanentProviderException;
import com.example.kosagent.exception.TransientProviderException;
import com.example.kosagent.llm.LlmProvider;
import com.example.kosagent.llm.LlmRequest;
import com.example.kosagent.llm.ProviderCapability;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * 行为可编程的模型提供方，记录收到的每个请求
 */
public class FakeLlmProvider implements LlmProvider {

    private final String name;
    private final ProviderCapability capability;
    private final Function<LlmRequest, String> behavior;
    private final List<LlmRequest> requests = new CopyOnWriteArrayList<>();

    public FakeLlmProvider(String name, int maxContextChars, int costTier, Function<LlmRequest, String> behavior) {
        this.name = name;
        this.capability = ProviderCapability.builder().maxContextChars(maxContextChars).costTier(costTier).build();
        this.behavior = behavior;
    }

    public static FakeLlmProvider replying(String name, String content) {
        return new FakeLlmProvider(name, 100_000, 1, r -> content);
    }

    public static FakeLlmProvider replying(String name, Function<LlmRequest, String> behavior) {
        return new FakeLlmProvider(name, 100_000, 1, behavior);
    }

    public static FakeLlmProvider transientFailure(String name) {
        return new FakeLlmProvider(name, 100_000, 1, r -> {
            throw new TransientProviderException(name, "HTTP 503");
        });
    }

    public static FakeLlmProvider permanentFailure(String name) {
        return new FakeLlmProvider(name, 100_000, 1, r -> {
            throw new PermanentProviderException(name, "HTTP 401");
        });
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ProviderCapability capability() {
        return capability;
    }

    @Override
    public String complete(LlmRequest request) {
        requests.add(request);
        return behavior.apply(request);
    }

    public int calls() {
        return requests.size();
    }

    public List<LlmRequest> requests() {
        return requests;
    }
}
