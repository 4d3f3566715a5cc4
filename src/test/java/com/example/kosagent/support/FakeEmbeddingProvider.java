package com.example.kosagent.support;

import com.example.kosagent.context.CancellationToken;
import com.example.kosagent.index.EmbeddingProvider;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 词袋向量：每个维度是一个词在文本中出现的次数，便于构造可预测的相似度
 */
public class FakeEmbeddingProvider implements EmbeddingProvider {

    private final List<String> vocabulary;
    private final AtomicInteger calls = new AtomicInteger();

    public FakeEmbeddingProvider(String... vocabulary) {
        this.vocabulary = List.of(vocabulary);
    }

    @Override
    public double[] embed(String text, CancellationToken token) {
        calls.incrementAndGet();
        double[] vector = new double[vocabulary.size()];
        String value = text == null ? "" : text;
        for (int i = 0; i < vocabulary.size(); i++) {
            String word = vocabulary.get(i);
            int from = 0;
            while ((from = value.indexOf(word, from)) >= 0) {
                vector[i] += 1.0;
                from += word.length();
            }
        }
        return vector;
    }

    public int calls() {
        return calls.get();
    }

    public void reset() {
        calls.set(0);
    }
}
