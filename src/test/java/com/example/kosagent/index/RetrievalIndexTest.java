package com.example.kosagent.index;

import com.example.kosagent.context.CancellationToken;
import com.example.kosagent.llm.LlmGateway;
import com.example.kosagent.llm.LlmProperties;
import com.example.kosagent.service.IndexPersistenceService;
import com.example.kosagent.service.IndexRebuildLockService;
import com.example.kosagent.support.FakeEmbeddingProvider;
import com.example.kosagent.support.FakeLlmProvider;
import com.example.kosagent.support.FakeStorageGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RetrievalIndexTest {

    @Mock
    private IndexRebuildLockService lockService;

    @Mock
    private IndexPersistenceService persistence;

    private FakeEmbeddingProvider embedding;
    private FakeStorageGateway storage;
    private FakeLlmProvider llm;
    private RetrievalIndex index;

    @BeforeEach
    void setUp() {
        embedding = new FakeEmbeddingProvider("露营", "帐篷", "咖啡", "价格", "亲子");
        storage = new FakeStorageGateway();
        llm = FakeLlmProvider.replying("qwen", r -> "基于上下文的回答");
        LlmGateway gateway = new LlmGateway(List.of(llm), new LlmProperties(List.of(), 0, 10, 1.0, 20));
        index = new RetrievalIndex(embedding, storage, gateway, lockService, persistence);
    }

    /**
     * 同时写入存储和索引，保证检索时的过期校验通过
     */
    private void indexFresh(SourceType type, String id, String userId, String content) {
        storage.putSource(type, id, userId, content);
        index.upsert(type, id, userId, content);
    }

    @Test
    @DisplayName("相同内容重复 upsert 不会重新向量化")
    void upsertIsIdempotent() {
        UpsertOutcome first = index.upsert(SourceType.COMMENT, "c1", "u1", "露营 帐篷");
        UpsertOutcome second = index.upsert(SourceType.COMMENT, "c1", "u1", "露营 帐篷");

        assertThat(first).isEqualTo(UpsertOutcome.INSERTED);
        assertThat(second).isEqualTo(UpsertOutcome.UNCHANGED);
        assertThat(embedding.calls()).isEqualTo(1);
        assertThat(index.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("内容变化时重新向量化并保留原用户")
    void upsertReembedsChangedContent() {
        index.upsert(SourceType.COMMENT, "c1", "u1", "露营 帐篷");

        UpsertOutcome outcome = index.upsert(SourceType.COMMENT, "c1", "咖啡");

        assertThat(outcome).isEqualTo(UpsertOutcome.UPDATED);
        assertThat(embedding.calls()).isEqualTo(2);
        assertThat(index.get(SourceType.COMMENT, "c1"))
            .hasValueSatisfying(doc -> {
                assertThat(doc.getContent()).isEqualTo("咖啡");
                assertThat(doc.getUserId()).isEqualTo("u1");
            });
    }

    @Test
    @DisplayName("检索结果按相似度降序，受 topK 和阈值约束")
    void searchRespectsTopKAndThreshold() {
        indexFresh(SourceType.COMMENT, "c1", "u1", "露营 帐篷");
        indexFresh(SourceType.COMMENT, "c2", "u2", "露营 咖啡");
        indexFresh(SourceType.COMMENT, "c3", "u3", "咖啡 价格");

        List<RetrievalResult> all = index.search("露营 帐篷", 10, 0.0, null);
        List<RetrievalResult> aboveHalf = index.search("露营 帐篷", 10, 0.4, null);
        List<RetrievalResult> top1 = index.search("露营 帐篷", 1, 0.0, null);

        assertThat(all).extracting(r -> r.getDocument().getSourceId()).containsExactly("c1", "c2", "c3");
        assertThat(all).extracting(RetrievalResult::getSimilarityScore).isSortedAccordingTo((a, b) -> Double.compare(b, a));
        assertThat(aboveHalf).extracting(r -> r.getDocument().getSourceId()).containsExactly("c1", "c2");
        assertThat(aboveHalf).allMatch(r -> r.getSimilarityScore() >= 0.4);
        assertThat(top1).hasSize(1);
        assertThat(index.search("露营", 0, 0.0, null)).isEmpty();
    }

    @Test
    @DisplayName("来源类型过滤与按用户检索")
    void filtersByTypeAndUser() {
        indexFresh(SourceType.COMMENT, "c1", "u1", "露营 帐篷");
        indexFresh(SourceType.NOTE, "n1", "u1", "露营 帐篷 亲子");
        indexFresh(SourceType.COMMENT, "c2", "u2", "露营 帐篷");

        List<RetrievalResult> notes = index.search("露营", 10, 0.0, EnumSet.of(SourceType.NOTE));
        List<RetrievalResult> forU1 = index.searchForUser("u1", "露营", 10, 0.0,
            CancellationToken.none());

        assertThat(notes).extracting(r -> r.getDocument().getSourceId()).containsExactly("n1");
        assertThat(forU1).extracting(r -> r.getDocument().getUserId()).containsOnly("u1");
        assertThat(forU1).hasSize(2);
    }

    @Test
    @DisplayName("命中的文档在存储中已变化时重新向量化并重新排序")
    void staleHitIsRefreshedBeforeReturning() {
        index.upsert(SourceType.COMMENT, "c1", "u1", "露营 帐篷");
        storage.putSource(SourceType.COMMENT, "c1", "u1", "咖啡 价格");
        indexFresh(SourceType.COMMENT, "c2", "u2", "露营 咖啡");

        List<RetrievalResult> hits = index.search("露营 帐篷", 5, 0.3, null);

        assertThat(hits).extracting(r -> r.getDocument().getSourceId()).containsExactly("c2");
        assertThat(index.get(SourceType.COMMENT, "c1"))
            .hasValueSatisfying(doc -> assertThat(doc.getContent()).isEqualTo("咖啡 价格"));
        assertThat(index.stats().getStaleRefreshes()).isEqualTo(1);
        assertThat(storage.closedSessions()).isEqualTo(storage.openedSessions());
    }

    @Test
    @DisplayName("存储中没有对应记录的文档视为最新，检索不会把它删掉")
    void upsertWithoutStorageRecordStaysSearchable() {
        // given
        index.upsert(SourceType.COMMENT, "c1", "露营 帐篷");

        // when
        List<RetrievalResult> hits = index.search("露营 帐篷", 5, 0.0, null);

        // then
        assertThat(hits).extracting(r -> r.getDocument().getSourceId()).containsExactly("c1");
        assertThat(index.size()).isEqualTo(1);
        assertThat(index.stats().getStaleRefreshes()).isZero();
        verify(persistence, never()).delete(any());
    }

    @Test
    @DisplayName("写入的文档同步持久化")
    void upsertPersistsDocument() {
        index.upsert(SourceType.NOTE, "n1", "u1", "露营 亲子");
        index.upsert(SourceType.NOTE, "n1", "u1", "露营 亲子");

        verify(persistence, times(1)).save(argThat(doc ->
            doc.getKey().equals(DocumentKey.of(SourceType.NOTE, "n1")) && doc.getContent().equals("露营 亲子")));
    }

    @Test
    @DisplayName("启动时恢复持久化的文档，无需重新向量化即可检索")
    void loadPersistedRestoresDocuments() {
        // given
        IndexedDocument persisted = IndexedDocument.builder()
            .sourceType(SourceType.COMMENT).sourceId("c9").userId("u9").content("露营 帐篷")
            .contentHash(ContentHasher.sha256("露营 帐篷"))
            .embedding(embedding.embed("露营 帐篷", CancellationToken.none()))
            .indexedAt(Instant.now()).build();
        embedding.reset();
        when(persistence.loadAll()).thenReturn(List.of(persisted));

        // when
        int restored = index.loadPersisted();
        List<RetrievalResult> hits = index.search("露营 帐篷", 5, 0.0, null);

        // then
        assertThat(restored).isEqualTo(1);
        assertThat(hits).extracting(r -> r.getDocument().getSourceId()).containsExactly("c9");
        assertThat(embedding.calls()).isEqualTo(1);
        assertThat(index.upsert(SourceType.COMMENT, "c9", "露营 帐篷")).isEqualTo(UpsertOutcome.UNCHANGED);
    }

    @Test
    @DisplayName("恢复时不覆盖内存中已有的文档")
    void loadPersistedKeepsNewerInMemoryDocument() {
        index.upsert(SourceType.COMMENT, "c1", "咖啡");
        IndexedDocument stale = IndexedDocument.builder()
            .sourceType(SourceType.COMMENT).sourceId("c1").content("露营")
            .contentHash(ContentHasher.sha256("露营")).embedding(new double[]{1, 0, 0, 0, 0})
            .indexedAt(Instant.EPOCH).build();
        when(persistence.loadAll()).thenReturn(List.of(stale));

        assertThat(index.loadPersisted()).isZero();
        assertThat(index.get(SourceType.COMMENT, "c1"))
            .hasValueSatisfying(doc -> assertThat(doc.getContent()).isEqualTo("咖啡"));
    }

    @Test
    @DisplayName("对外返回的向量是副本")
    void embeddingIsDefensivelyCopied() {
        index.upsert(SourceType.COMMENT, "c1", "露营 帐篷");
        IndexedDocument doc = index.get(SourceType.COMMENT, "c1").orElseThrow();

        doc.getEmbedding()[0] = 42.0;

        assertThat(doc.getEmbedding()[0]).isNotEqualTo(42.0);
        assertThat(index.search("露营 帐篷", 1, 0.99, null)).hasSize(1);
    }

    @Test
    @DisplayName("没有命中时直接返回固定答复，不调用模型")
    void answerWithoutHitsSkipsModel() {
        indexFresh(SourceType.COMMENT, "c3", "u3", "咖啡 价格");

        GroundedAnswer answer = index.answer("露营 帐篷 怎么选", 1000);

        assertThat(answer.getAnswer()).isEqualTo(GroundedAnswer.NO_INFORMATION);
        assertThat(answer.isGrounded()).isFalse();
        assertThat(answer.getSources()).isEmpty();
        assertThat(llm.calls()).isZero();
    }

    @Test
    @DisplayName("上下文超出预算时丢弃相似度最低的段落")
    void answerDropsLeastSimilarPassages() {
        String best = "露营帐篷";
        String second = "露营帐篷帐篷，周末带娃去湖边，天幕和桌椅都是现场租的，体验非常不错";
        indexFresh(SourceType.COMMENT, "best", "u1", best);
        indexFresh(SourceType.COMMENT, "second", "u2", second);

        GroundedAnswer answer = index.answer("露营帐篷", best.length() + 5);

        assertThat(answer.isGrounded()).isTrue();
        assertThat(answer.getProvider()).isEqualTo("qwen");
        assertThat(answer.getSources()).extracting(r -> r.getDocument().getSourceId()).containsExactly("best");
        assertThat(llm.requests()).singleElement()
            .satisfies(r -> {
                assertThat(r.getPrompt()).contains(best);
                assertThat(r.getPrompt()).doesNotContain("天幕");
            });
    }

    @Test
    void fitToBudgetKeepsAtLeastOnePassage() {
        IndexedDocument longDoc = IndexedDocument.builder()
            .sourceType(SourceType.NOTE).sourceId("n1").content("x".repeat(100))
            .contentHash("h").embedding(new double[]{1}).indexedAt(Instant.now()).build();
        RetrievalResult hit = new RetrievalResult(longDoc, 0.9, Instant.now());

        assertThat(RetrievalIndex.fitToBudget(List.of(hit), 10)).containsExactly(hit);
    }

    @Test
    @DisplayName("重建：强制重新向量化并移除存储中已不存在的文档")
    @SuppressWarnings("unchecked")
    void rebuildReembedsAndRemovesObsolete() {
        indexFresh(SourceType.COMMENT, "c1", "u1", "露营 帐篷");
        storage.putSource(SourceType.COMMENT, "c2", "u2", "咖啡");
        index.upsert(SourceType.COMMENT, "obsolete", "u9", "价格");
        index.upsert(SourceType.NOTE, "n1", "u1", "亲子");
        embedding.reset();
        when(lockService.executeWithLock(eq(SourceType.COMMENT), any(Supplier.class), any(RebuildReport.class)))
            .thenAnswer(inv -> ((Supplier<RebuildReport>) inv.getArgument(1)).get());

        RebuildReport report = index.rebuild(SourceType.COMMENT, 100);

        assertThat(report.isSkipped()).isFalse();
        assertThat(report.getLoaded()).isEqualTo(2);
        assertThat(report.getEmbedded()).isEqualTo(2);
        assertThat(report.getRemoved()).isEqualTo(1);
        assertThat(embedding.calls()).isEqualTo(2);
        assertThat(index.get(SourceType.COMMENT, "obsolete")).isEmpty();
        assertThat(index.get(SourceType.NOTE, "n1")).isPresent();
        verify(persistence).delete(DocumentKey.of(SourceType.COMMENT, "obsolete"));
    }

    @Test
    @DisplayName("全量重建依次处理每种来源类型")
    @SuppressWarnings("unchecked")
    void rebuildAllCoversEverySourceType() {
        // given
        storage.putSource(SourceType.COMMENT, "c1", "u1", "露营 帐篷");
        storage.putSource(SourceType.NOTE, "n1", "u1", "亲子 露营");
        when(lockService.executeWithLock(any(SourceType.class), any(Supplier.class), any(RebuildReport.class)))
            .thenAnswer(inv -> ((Supplier<RebuildReport>) inv.getArgument(1)).get());

        // when
        List<RebuildReport> reports = index.rebuildAll(100);

        // then
        assertThat(reports).extracting(RebuildReport::getSourceType).containsExactly(SourceType.values());
        assertThat(reports).noneMatch(RebuildReport::isSkipped);
        assertThat(index.get(SourceType.COMMENT, "c1")).isPresent();
        assertThat(index.get(SourceType.NOTE, "n1")).isPresent();
        assertThat(index.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("其它实例正在重建时跳过")
    void rebuildSkippedWhenLocked() {
        when(lockService.executeWithLock(eq(SourceType.NOTE), any(), any()))
            .thenAnswer(inv -> inv.getArgument(2));

        RebuildReport report = index.rebuild(SourceType.NOTE, 100);

        assertThat(report.isSkipped()).isTrue();
        assertThat(embedding.calls()).isZero();
    }

    @Test
    @DisplayName("按来源类型汇总用户的已索引内容")
    void userInsightsGroupsByType() {
        index.upsert(SourceType.COMMENT, "c1", "u1", "露营");
        index.upsert(SourceType.COMMENT, "c2", "u1", "帐篷");
        index.upsert(SourceType.ANALYSIS, "a1", "u1", "咖啡");
        index.upsert(SourceType.COMMENT, "c3", "u2", "价格");

        UserInsights insights = index.userInsights("u1");

        assertThat(insights.total()).isEqualTo(3);
        assertThat(insights.getDocumentsByType().get(SourceType.COMMENT)).hasSize(2);
        assertThat(insights.getDocumentsByType().get(SourceType.NOTE)).isEmpty();
        assertThat(index.stats().getDocumentsByType()).containsEntry(SourceType.COMMENT, 3L);
        assertThat(index.stats().getTotalDocuments()).isEqualTo(4);
    }
}
