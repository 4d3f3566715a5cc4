package com.example.kosagent.agent;

import com.example.kosagent.agent.graph.WorkflowGraphBuilder;
import com.example.kosagent.dto.AgentResult;
import com.example.kosagent.dto.AnalysisSummary;
import com.example.kosagent.dto.ContentStrategy;
import com.example.kosagent.dto.CoordinationSummary;
import com.example.kosagent.dto.GeneratedContent;
import com.example.kosagent.dto.InsightReport;
import com.example.kosagent.dto.NodeStatus;
import com.example.kosagent.dto.RunStatus;
import com.example.kosagent.dto.TaskAnalysis;
import com.example.kosagent.dto.WorkflowRequest;
import com.example.kosagent.dto.WorkflowResult;
import com.example.kosagent.index.RetrievalIndex;
import com.example.kosagent.index.SourceType;
import com.example.kosagent.llm.LlmGateway;
import com.example.kosagent.llm.LlmProperties;
import com.example.kosagent.llm.LlmRequest;
import com.example.kosagent.scoring.RankedUser;
import com.example.kosagent.scoring.ScoringPolicy;
import com.example.kosagent.scoring.UserValueScorer;
import com.example.kosagent.service.IndexPersistenceService;
import com.example.kosagent.service.IndexRebuildLockService;
import com.example.kosagent.storage.Sentiment;
import com.example.kosagent.storage.UserRecord;
import com.example.kosagent.support.FakeEmbeddingProvider;
import com.example.kosagent.support.FakeLlmProvider;
import com.example.kosagent.support.FakeStorageGateway;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

/**
 * 标准工作流端到端：真实节点 + 内存存储 + 假模型
 */
class StandardWorkflowTest {

    private static final String NOTE = "标题: 新手也能搭好帐篷\n"
        + "第一次露营总担心搭不好帐篷？其实跟着三步走，十分钟就能搞定，营地还提供装备租赁和教练指导。\n"
        + "你第一次露营遇到过什么麻烦？\n"
        + "评论区聊聊，收藏起来下次用！\n"
        + "#露营 #新手露营";

    private TaskPool pool;
    private FakeStorageGateway storage;
    private FakeLlmProvider llm;
    private LlmGateway gateway;
    private WorkflowEngine engine;

    @BeforeEach
    void setUp() {
        pool = new TaskPool(4);
        storage = new FakeStorageGateway().withUsers(
            UserRecord.builder().userId("U1").nickname("小林").sentiment(Sentiment.POSITIVE)
                .unmetNeed(true).unmetNeedDesc("不会搭帐篷").interactionCount(10).build(),
            UserRecord.builder().userId("U2").nickname("阿杰").sentiment(Sentiment.NEGATIVE)
                .unmetNeed(false).interactionCount(1).build(),
            UserRecord.builder().userId("U3").nickname("May").sentiment(Sentiment.POSITIVE)
                .unmetNeed(false).interactionCount(5).build());
        llm = FakeLlmProvider.replying("qwen", StandardWorkflowTest::reply);
        gateway = new LlmGateway(List.of(llm), new LlmProperties(List.of(), 0, 10, 1.0, 20));
    }

    @AfterEach
    void tearDown() {
        if (engine != null) {
            engine.close();
        }
        pool.close();
    }

    private static String reply(LlmRequest request) {
        String system = request.getSystemPrompt() == null ? "" : request.getSystemPrompt();
        if (system.contains("运营分析师")) {
            return "目标: 提升新手露营转化\n类型: CONVERSION\n关键词: 露营, 新手, 帐篷";
        }
        if (system.contains("内容策略专家")) {
            return "目标: 打消新手顾虑\n语气: 真诚\n内容类型: 攻略\n核心信息: 装备可租, 有教练\n互动方式: 提问";
        }
        if (system.contains("爆款笔记写手")) {
            return NOTE;
        }
        return "用户普遍担心搭帐篷太难";
    }

    private WorkflowEngine engine(RetrievalIndex index) {
        UserValueScorer scorer = new UserValueScorer(ScoringPolicy.defaults());
        engine = new WorkflowEngine(new WorkflowGraphBuilder(scorer).build(), gateway, index, storage, pool,
            new WorkflowProperties(4, 30, 2, 10), List.of());
        return engine;
    }

    private static WorkflowResult await(WorkflowEngine engine, String runId) {
        return engine.awaitCompletion(runId, Duration.ofSeconds(20)).orElseThrow();
    }

    @SuppressWarnings("unchecked")
    private static <T> List<T> list(WorkflowResult result, String key) {
        return (List<T>) result.getState().get(key);
    }

    @Test
    @DisplayName("未开启 AI 增强：跳过任务分析和语义洞察，完整生成并落库")
    void runsBaseWorkflow() {
        WorkflowEngine engine = engine(null);

        WorkflowResult result = await(engine, engine.submit(WorkflowRequest.builder().task("推广露营地").build()));

        assertThat(result.getStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(result.getTrace()).extracting(AgentResult::getNodeName).containsExactly(
            "task_analysis", "user_analysis", "semantic_insight", "content_strategy", "content_generation", "coordination");
        assertThat(result.getTrace().get(0).isDisabled()).isTrue();
        assertThat(result.getTrace().get(2).isDisabled()).isTrue();

        List<RankedUser> users = list(result, StateKeys.HIGH_VALUE_USERS);
        assertThat(users).extracting(RankedUser::getUserId).containsExactly("U1", "U3", "U2");

        ContentStrategy strategy = (ContentStrategy) result.getState().get(StateKeys.CONTENT_STRATEGY);
        assertThat(strategy.getObjectiveType()).isEqualTo("ENGAGEMENT");
        assertThat(strategy.getTargetUserIds()).containsExactly("U1", "U3", "U2");

        List<GeneratedContent> contents = list(result, StateKeys.GENERATED_CONTENT);
        assertThat(contents).hasSize(3).allMatch(GeneratedContent::isPersisted);
        assertThat(storage.drafts()).hasSize(3);

        CoordinationSummary summary = (CoordinationSummary) result.getState().get(StateKeys.COORDINATION_SUMMARY);
        assertThat(summary.getGenerated()).isEqualTo(3);
        assertThat(summary.getFailed()).isZero();
        assertThat(list(result, StateKeys.OPTIMIZATION_NOTES)).anyMatch(n -> n.toString().contains("语义洞察"));

        assertThat(storage.openedSessions()).isEqualTo(1);
        assertThat(storage.closedSessions()).isEqualTo(1);
    }

    @Test
    @DisplayName("重复运行同一任务不会产生重复草稿")
    void rerunIsIdempotent() {
        WorkflowEngine engine = engine(null);
        WorkflowRequest request = WorkflowRequest.builder().task("推广露营地").build();

        await(engine, engine.submit(request));
        await(engine, engine.submit(request));

        assertThat(storage.draftWrites()).isEqualTo(6);
        assertThat(storage.drafts()).hasSize(3);
    }

    @Test
    @DisplayName("开启 AI 增强：任务分析、检索佐证与语义洞察都参与运行")
    void runsAiEnhancedWorkflow() {
        RetrievalIndex index = new RetrievalIndex(new FakeEmbeddingProvider("露营", "帐篷", "咖啡"),
            storage, gateway, mock(IndexRebuildLockService.class), mock(IndexPersistenceService.class));
        storage.putSource(SourceType.COMMENT, "c1", "U1", "帐篷 太难搭了，第一次露营很狼狈");
        index.upsert(SourceType.COMMENT, "c1", "U1", "帐篷 太难搭了，第一次露营很狼狈");
        storage.putSource(SourceType.COMMENT, "c2", "U3", "营地的咖啡不错");
        index.upsert(SourceType.COMMENT, "c2", "U3", "营地的咖啡不错");
        WorkflowEngine engine = engine(index);

        WorkflowResult result = await(engine, engine.submit(WorkflowRequest.builder()
            .task("推广露营地")
            .aiEnhanced(true)
            .businessGoals(List.of("提升周末预订"))
            .build()));

        assertThat(result.getStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(result.getTrace()).extracting(AgentResult::getStatus).containsOnly(NodeStatus.OK);

        TaskAnalysis analysis = (TaskAnalysis) result.getState().get(StateKeys.TASK_ANALYSIS);
        assertThat(analysis.getObjectiveType()).isEqualTo("CONVERSION");

        AnalysisSummary summary = (AnalysisSummary) result.getState().get(StateKeys.ANALYSIS_SUMMARY);
        assertThat(summary.isRetrievalEnriched()).isTrue();
        List<RankedUser> users = list(result, StateKeys.HIGH_VALUE_USERS);
        assertThat(users.get(0).getUserId()).isEqualTo("U1");
        assertThat(users.get(0).getScore().getComponents().get("retrieval")).isGreaterThan(0.0);

        InsightReport insights = (InsightReport) result.getState().get(StateKeys.INSIGHTS);
        assertThat(insights.isGrounded()).isTrue();
        assertThat(insights.getOverview()).isEqualTo("用户普遍担心搭帐篷太难");
        assertThat(insights.getUsers()).hasSize(3);

        ContentStrategy strategy = (ContentStrategy) result.getState().get(StateKeys.CONTENT_STRATEGY);
        assertThat(strategy.getObjectiveType()).isEqualTo("CONVERSION");
        assertThat(storage.openedSessions()).isEqualTo(storage.closedSessions());
    }
}
