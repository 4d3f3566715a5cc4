package com.example.kosagent.index;

import com.example.kosagent.context.CancellationToken;
import com.example.kosagent.exception.RetrievalStaleException;
import com.example.kosagent.llm.LlmConstraints;
import com.example.kosagent.llm.LlmGateway;
import com.example.kosagent.llm.LlmResponse;
import com.example.kosagent.service.IndexPersistenceService;
import com.example.kosagent.service.IndexRebuildLockService;
import com.example.kosagent.storage.SourceRecord;
import com.example.kosagent.storage.StorageGateway;
import com.example.kosagent.storage.StorageSession;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * 增量向量索引
 *
 * 1. upsert 以内容 SHA-256 判断是否需要重新向量化，同一文档的写入串行
 * 2. search 按余弦相似度排序，返回前校验命中文档是否过期，过期的就地重建后重新打分
 * 3. answer 把检索到的段落作为上下文交给模型网关
 * 4. 文档写入同时落到 Redis，启动时恢复
 *
 * 读操作不加锁，不会因为其它文档的写入而阻塞。写锁按 key 分段，数量固定。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RetrievalIndex {

    private static final String ANSWER_SYSTEM_PROMPT =
        "你是一个社媒内容分析助手。只根据给定的上下文回答问题，" +
        "上下文中没有的信息直接说明不知道，不要编造。使用简体中文，回答简洁。";

    // 过期校验后最多重新打分的轮数
    private static final int MAX_REFRESH_ROUNDS = 2;

    private static final int LOCK_STRIPES = 64;

    private final EmbeddingProvider embeddingProvider;
    private final StorageGateway storageGateway;
    private final LlmGateway llmGateway;
    private final IndexRebuildLockService rebuildLockService;
    private final IndexPersistenceService persistence;

    private final Map<DocumentKey, IndexedDocument> documents = new ConcurrentHashMap<>();
    private final ReentrantLock[] writeLocks = newStripes();
    private final AtomicLong embeddingCalls = new AtomicLong();
    private final AtomicLong staleRefreshes = new AtomicLong();

    @Value("${kos.index.answer-top-k:3}")
    private int answerTopK = 3;

    @Value("${kos.index.answer-threshold:0.6}")
    private double answerThreshold = 0.6;

    // ==================== 写入 ====================

    public UpsertOutcome upsert(SourceType sourceType, String sourceId, String content) {
        return upsert(sourceType, sourceId, null, content);
    }

    public UpsertOutcome upsert(SourceRecord record) {
        return upsert(record.getSourceType(), record.getSourceId(), record.getUserId(), record.getContent());
    }

    public UpsertOutcome upsert(SourceType sourceType, String sourceId, String userId, String content) {
        return write(DocumentKey.of(sourceType, sourceId), userId, content, false);
    }

    private UpsertOutcome write(DocumentKey key, String userId, String content, boolean force) {
        String hash = ContentHasher.sha256(content);

        IndexedDocument existing = documents.get(key);
        if (!force && existing != null && existing.getContentHash().equals(hash)) {
            return UpsertOutcome.UNCHANGED;
        }

        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            existing = documents.get(key);
            if (!force && existing != null && existing.getContentHash().equals(hash)) {
                return UpsertOutcome.UNCHANGED;
            }

            double[] vector = embeddingProvider.embed(content, CancellationToken.none());
            embeddingCalls.incrementAndGet();

            IndexedDocument doc = IndexedDocument.builder()
                .sourceType(key.getSourceType())
                .sourceId(key.getSourceId())
                .userId(userId != null ? userId : existing != null ? existing.getUserId() : null)
                .content(content)
                .contentHash(hash)
                .embedding(vector)
                .indexedAt(Instant.now())
                .build();
            documents.put(key, doc);
            persistence.save(doc);

            log.debug("[Index] {} 文档: {}", existing == null ? "新增" : "更新", key);
            return existing == null ? UpsertOutcome.INSERTED : UpsertOutcome.UPDATED;
        } finally {
            lock.unlock();
        }
    }

    private void removeDocument(DocumentKey key) {
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            if (documents.remove(key) != null) {
                persistence.delete(key);
            }
        } finally {
            lock.unlock();
        }
    }

    private ReentrantLock lockFor(DocumentKey key) {
        return writeLocks[Math.floorMod(key.hashCode(), LOCK_STRIPES)];
    }

    private static ReentrantLock[] newStripes() {
        ReentrantLock[] stripes = new ReentrantLock[LOCK_STRIPES];
        for (int i = 0; i < stripes.length; i++) {
            stripes[i] = new ReentrantLock();
        }
        return stripes;
    }

    // ==================== 检索 ====================

    public List<RetrievalResult> search(String query, int topK, double threshold, Set<SourceType> filter) {
        return search(query, topK, threshold, filter, CancellationToken.none());
    }

    public List<RetrievalResult> search(String query, int topK, double threshold,
                                        Set<SourceType> filter, CancellationToken token) {
        return doSearch(query, topK, threshold, filter, null, token);
    }

    /**
     * 只在指定用户的文档中检索
     */
    public List<RetrievalResult> searchForUser(String userId, String query, int topK, double threshold,
                                               CancellationToken token) {
        return doSearch(query, topK, threshold, null, userId, token);
    }

    private List<RetrievalResult> doSearch(String query, int topK, double threshold,
                                           Set<SourceType> filter, String userId, CancellationToken token) {
        if (topK <= 0 || documents.isEmpty()) {
            return Collections.emptyList();
        }
        Set<SourceType> types = filter == null || filter.isEmpty() ? EnumSet.allOf(SourceType.class) : filter;

        token.throwIfCancelled("index:embed-query");
        double[] queryVector = embeddingProvider.embed(query, token);
        embeddingCalls.incrementAndGet();

        List<Scored> hits = rank(queryVector, types, userId, threshold, topK);
        if (hits.isEmpty()) {
            return Collections.emptyList();
        }

        try (StorageSession session = storageGateway.openSession()) {
            Set<DocumentKey> verified = new HashSet<>();
            for (int round = 0; round < MAX_REFRESH_ROUNDS; round++) {
                boolean refreshed = false;
                for (Scored hit : hits) {
                    DocumentKey key = hit.document.getKey();
                    if (!verified.add(key)) {
                        continue;
                    }
                    token.throwIfCancelled("index:verify");
                    try {
                        verifyFresh(hit.document, session);
                    } catch (RetrievalStaleException e) {
                        log.info("[Index] 命中文档已过期，重新向量化: {}", e.getKey());
                        refresh(e.getKey(), session);
                        refreshed = true;
                    }
                }
                if (!refreshed) {
                    break;
                }
                hits = rank(queryVector, types, userId, threshold, topK);
            }
        }

        Instant snapshot = Instant.now();
        return hits.stream()
            .map(h -> new RetrievalResult(h.document, h.similarity, snapshot))
            .collect(Collectors.toList());
    }

    private List<Scored> rank(double[] queryVector, Set<SourceType> types, String userId,
                              double threshold, int topK) {
        return documents.values().stream()
            .filter(d -> types.contains(d.getSourceType()))
            .filter(d -> userId == null || userId.equals(d.getUserId()))
            .map(d -> new Scored(d, VectorMath.cosine(queryVector, d.vector())))
            .filter(s -> s.similarity >= threshold)
            .sorted(Comparator.comparingDouble((Scored s) -> s.similarity).reversed()
                .thenComparing((Scored s) -> s.document.getIndexedAt(), Comparator.reverseOrder())
                .thenComparing(s -> s.document.getKey().toString()))
            .limit(topK)
            .collect(Collectors.toList());
    }

    /**
     * 与存储中的当前内容比对，存储中有记录且内容不一致时抛出 RetrievalStaleException
     *
     * 存储中没有对应记录的文档（直接 upsert 进来的）视为最新；已删除来源的清理交给 rebuild。
     */
    private void verifyFresh(IndexedDocument doc, StorageSession session) {
        Optional<SourceRecord> current = session.loadSource(doc.getSourceType(), doc.getSourceId());
        if (current.isEmpty()) {
            return;
        }
        String currentHash = ContentHasher.sha256(current.get().getContent());
        if (!doc.getContentHash().equals(currentHash)) {
            throw new RetrievalStaleException(doc.getKey(), doc.getContentHash(), currentHash);
        }
    }

    private void refresh(DocumentKey key, StorageSession session) {
        staleRefreshes.incrementAndGet();
        session.loadSource(key.getSourceType(), key.getSourceId()).ifPresent(this::upsert);
    }

    // ==================== 问答 ====================

    public GroundedAnswer answer(String question, int contextBudget) {
        return answer(question, contextBudget, CancellationToken.none());
    }

    /**
     * 检索 → 按预算裁剪（先丢相似度最低的段落）→ 交给模型回答
     */
    public GroundedAnswer answer(String question, int contextBudget, CancellationToken token) {
        List<RetrievalResult> hits = search(question, answerTopK, answerThreshold,
            EnumSet.allOf(SourceType.class), token);
        if (hits.isEmpty()) {
            log.info("[Index] 没有检索到相关内容，直接返回: {}", question);
            return GroundedAnswer.noInformation(question);
        }

        List<RetrievalResult> passages = fitToBudget(hits, contextBudget);

        StringBuilder context = new StringBuilder();
        for (int i = 0; i < passages.size(); i++) {
            String content = passages.get(i).getDocument().getContent();
            if (content.length() > contextBudget) {
                content = content.substring(0, Math.max(0, contextBudget));
            }
            context.append("[").append(i + 1).append("] ").append(content).append("\n\n");
        }

        String prompt = "上下文：\n" + context + "问题：" + question;
        LlmResponse response = llmGateway.invoke(prompt, LlmConstraints.system(ANSWER_SYSTEM_PROMPT, token));

        return GroundedAnswer.builder()
            .question(question)
            .answer(response.getContent())
            .sources(passages)
            .grounded(true)
            .provider(response.getProvider())
            .build();
    }

    /**
     * hits 已按相似度降序；从尾部丢弃直到总长度不超过预算，至少保留最相似的一段
     */
    static List<RetrievalResult> fitToBudget(List<RetrievalResult> hits, int contextBudget) {
        List<RetrievalResult> passages = new ArrayList<>(hits);
        int total = passages.stream().mapToInt(r -> r.getDocument().getContent().length()).sum();
        while (passages.size() > 1 && total > contextBudget) {
            RetrievalResult dropped = passages.remove(passages.size() - 1);
            total -= dropped.getDocument().getContent().length();
        }
        return passages;
    }

    // ==================== 持久化 / 重建 / 状态 ====================

    @PostConstruct
    void restoreOnStartup() {
        loadPersisted();
    }

    /**
     * 从 Redis 恢复索引，内存中已有的文档不覆盖
     *
     * @return 恢复的文档数
     */
    public int loadPersisted() {
        int restored = 0;
        for (IndexedDocument doc : persistence.loadAll()) {
            if (documents.putIfAbsent(doc.getKey(), doc) == null) {
                restored++;
            }
        }
        log.info("[Index] 从持久化存储恢复文档 {} 条", restored);
        return restored;
    }

    /**
     * 依次重建全部来源类型，每类各自加锁
     */
    public List<RebuildReport> rebuildAll(int limit) {
        List<RebuildReport> reports = new ArrayList<>();
        for (SourceType type : SourceType.values()) {
            reports.add(rebuild(type, limit));
        }
        return reports;
    }

    /**
     * 从存储全量重新向量化某类来源，分布式锁保证同类来源只有一个重建
     */
    public RebuildReport rebuild(SourceType sourceType, int limit) {
        return rebuildLockService.executeWithLock(sourceType,
            () -> doRebuild(sourceType, limit),
            RebuildReport.skipped(sourceType));
    }

    private RebuildReport doRebuild(SourceType sourceType, int limit) {
        long start = System.currentTimeMillis();
        log.info("[Index] 开始重建索引: sourceType={}, limit={}", sourceType, limit);

        List<SourceRecord> records;
        try (StorageSession session = storageGateway.openSession()) {
            records = session.loadSources(sourceType, limit);
        }

        Set<DocumentKey> live = new HashSet<>();
        int embedded = 0;
        for (SourceRecord record : records) {
            DocumentKey key = DocumentKey.of(sourceType, record.getSourceId());
            live.add(key);
            write(key, record.getUserId(), record.getContent(), true);
            embedded++;
        }

        List<DocumentKey> obsolete = documents.keySet().stream()
            .filter(k -> k.getSourceType() == sourceType && !live.contains(k))
            .collect(Collectors.toList());
        obsolete.forEach(this::removeDocument);

        RebuildReport report = RebuildReport.builder()
            .sourceType(sourceType)
            .loaded(records.size())
            .embedded(embedded)
            .removed(obsolete.size())
            .durationMs(System.currentTimeMillis() - start)
            .build();
        log.info("[Index] 重建完成: {}", report);
        return report;
    }

    /**
     * 按来源类型分组返回某个用户的已索引文档，各组按索引时间倒序
     */
    public UserInsights userInsights(String userId) {
        Map<SourceType, List<IndexedDocument>> grouped = new EnumMap<>(SourceType.class);
        for (SourceType type : SourceType.values()) {
            List<IndexedDocument> docs = documents.values().stream()
                .filter(d -> d.getSourceType() == type && userId.equals(d.getUserId()))
                .sorted(Comparator.comparing(IndexedDocument::getIndexedAt).reversed())
                .collect(Collectors.toList());
            grouped.put(type, docs);
        }
        return new UserInsights(userId, grouped);
    }

    public Optional<IndexedDocument> get(SourceType sourceType, String sourceId) {
        return Optional.ofNullable(documents.get(DocumentKey.of(sourceType, sourceId)));
    }

    public int size() {
        return documents.size();
    }

    public IndexStats stats() {
        Map<SourceType, Long> byType = new EnumMap<>(SourceType.class);
        for (SourceType type : SourceType.values()) {
            byType.put(type, documents.values().stream().filter(d -> d.getSourceType() == type).count());
        }
        return IndexStats.builder()
            .totalDocuments(documents.size())
            .documentsByType(byType)
            .embeddingCalls(embeddingCalls.get())
            .staleRefreshes(staleRefreshes.get())
            .build();
    }

    private static final class Scored {
        private final IndexedDocument document;
        private final double similarity;

        private Scored(IndexedDocument document, double similarity) {
            this.document = document;
            this.similarity = similarity;
        }
    }
}
