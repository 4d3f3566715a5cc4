package com.example.kosagent.agent.graph.nodes;

import com.example.kosagent.agent.StateKeys;
import com.example.kosagent.agent.TaskPool;
import com.example.kosagent.context.CancellationToken;
import com.example.kosagent.context.NodeContext;
import com.example.kosagent.context.WorkflowState;
import com.example.kosagent.dto.AnalysisSummary;
import com.example.kosagent.scoring.RankedUser;
import com.example.kosagent.scoring.ScoringPolicy;
import com.example.kosagent.scoring.UserValueScorer;
import com.example.kosagent.storage.Sentiment;
import com.example.kosagent.storage.UserCriteria;
import com.example.kosagent.storage.UserRecord;
import com.example.kosagent.support.FakeStorageGateway;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class UserAnalysisNodeTest {

    private final TaskPool pool = new TaskPool(2);
    private final FakeStorageGateway storage = new FakeStorageGateway().withUsers(
        UserRecord.builder().userId("U1").sentiment(Sentiment.POSITIVE).unmetNeed(true).interactionCount(10).build(),
        UserRecord.builder().userId("U2").sentiment(Sentiment.NEGATIVE).unmetNeed(false).interactionCount(1).build(),
        UserRecord.builder().userId("U3").sentiment(Sentiment.POSITIVE).unmetNeed(false).interactionCount(5).build(),
        UserRecord.builder().userId("U4").sentiment(Sentiment.POSITIVE).unmetNeed(true).interactionCount(20)
            .visited(true).build());

    private final UserAnalysisNode node = new UserAnalysisNode(new UserValueScorer(ScoringPolicy.defaults()));

    @AfterEach
    void tearDown() {
        pool.close();
    }

    private NodeContext context() {
        return NodeContext.builder()
            .runId("test")
            .token(CancellationToken.none())
            .storage(storage.openSession())
            .pool(pool)
            .build();
    }

    @SuppressWarnings("unchecked")
    private static List<RankedUser> ranked(Map<String, Object> update) {
        return (List<RankedUser>) update.get(StateKeys.HIGH_VALUE_USERS);
    }

    @Test
    @DisplayName("已到访用户在打分前剔除，其余按价值分排序")
    void excludesVisitedBeforeScoring() {
        UserCriteria criteria = UserCriteria.builder().excludeVisited(true).build();

        Map<String, Object> update = node.produceUpdate(
            WorkflowState.of(Map.of(StateKeys.CRITERIA, criteria)), context());

        assertThat(ranked(update)).extracting(RankedUser::getUserId).containsExactly("U1", "U3", "U2");
        AnalysisSummary summary = (AnalysisSummary) update.get(StateKeys.ANALYSIS_SUMMARY);
        assertThat(summary.getScanned()).isEqualTo(4);
        assertThat(summary.getCandidates()).isEqualTo(3);
        assertThat(summary.getExcludedVisited()).isEqualTo(1);
        assertThat(summary.getSentimentDistribution()).containsEntry(Sentiment.POSITIVE, 2L);
        assertThat(summary.isRetrievalEnriched()).isFalse();
    }

    @Test
    @DisplayName("按未满足需求筛选并截取前 limit 个，未剔除的已到访用户被扣分")
    void filtersAndLimits() {
        UserCriteria criteria = UserCriteria.builder()
            .requireUnmetNeed(true)
            .limit(1)
            .build();

        Map<String, Object> update = node.produceUpdate(
            WorkflowState.of(Map.of(StateKeys.CRITERIA, criteria)), context());

        // U4 互动更多，但已到访扣 2 分后低于 U1
        assertThat(ranked(update)).extracting(RankedUser::getUserId).containsExactly("U1");
        assertThat(ranked(update).get(0).getRank()).isEqualTo(1);
        assertThat(((AnalysisSummary) update.get(StateKeys.ANALYSIS_SUMMARY)).getCandidates()).isEqualTo(2);
        assertThat(((AnalysisSummary) update.get(StateKeys.ANALYSIS_SUMMARY)).getSelected()).isEqualTo(1);
    }

    @Test
    void noCandidatesYieldsEmptyRanking() {
        UserCriteria criteria = UserCriteria.builder().minInteractions(100).build();

        Map<String, Object> update = node.produceUpdate(
            WorkflowState.of(Map.of(StateKeys.CRITERIA, criteria)), context());

        assertThat(ranked(update)).isEmpty();
        assertThat(((AnalysisSummary) update.get(StateKeys.ANALYSIS_SUMMARY)).getTopScore()).isZero();
    }
}
