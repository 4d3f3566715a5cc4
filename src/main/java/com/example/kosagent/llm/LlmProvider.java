package com.example.kosagent.llm;

/**
 * 模型提供方
 *
 * 实现必须是原子的：要么返回完整内容，要么抛出
 * {@link com.example.kosagent.exception.TransientProviderException} /
 * {@link com.example.kosagent.exception.PermanentProviderException}。
 */
public interface LlmProvider {

    String name();

    ProviderCapability capability();

    String complete(LlmRequest request);
}
