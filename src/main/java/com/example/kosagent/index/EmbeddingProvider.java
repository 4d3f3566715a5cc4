package com.example.kosagent.index;

import com.example.kosagent.context.CancellationToken;

/**
 * 文本向量化
 */
public interface EmbeddingProvider {

    double[] embed(String text, CancellationToken token);
}
