package com.croppulse.decision.engine.credit;

import com.croppulse.decision.config.DecisionConfig;
import com.croppulse.decision.engine.WeightedAggregator;
import com.croppulse.decision.exception.InsufficientEvidenceException;
import com.croppulse.decision.model.CompositeScore;
import com.croppulse.decision.model.CreditGrade;
import com.croppulse.decision.model.EvidenceDetail;
import com.croppulse.decision.model.EvidenceItem;
import com.croppulse.decision.model.FactorNames;
import com.croppulse.decision.model.SourceKind;
import com.croppulse.decision.model.SubScore;
import com.croppulse.decision.testutil.TestDataFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static com.croppulse.decision.testutil.TestDataFactory.TODAY;
import static com.croppulse.decision.testutil.TestDataFactory.availableItem;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CompositeCreditScorerTest {

    private static final String SUBJECT = "FARMER-001";

    private ExecutorService executor;
    private DecisionConfig config;
    private TraditionalFactorAdapter traditionalAdapter;
    private ActionHistoryAdapter actionAdapter;
    private GroundTruthHistoryAdapter groundTruthAdapter;
    private CompositeCreditScorer scorer;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(3);
        config = TestDataFactory.validatedConfig();
        traditionalAdapter = mock(TraditionalFactorAdapter.class);
        actionAdapter = mock(ActionHistoryAdapter.class);
        groundTruthAdapter = mock(GroundTruthHistoryAdapter.class);
        scorer = new CompositeCreditScorer(traditionalAdapter, actionAdapter, groundTruthAdapter,
                TestDataFactory.evidenceFetcher(executor, config, TestDataFactory.metrics()),
                new WeightedAggregator(), config, TestDataFactory.fixedClock());
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private void givenTraditional(double value) {
        List<EvidenceItem> items = config.traditionalWeights().factorNames().stream()
                .map(f -> availableItem(SourceKind.TRADITIONAL_FACTOR, f, value))
                .collect(Collectors.toList());
        when(traditionalAdapter.collect(anyString(), any())).thenReturn(items);
    }

    private void givenNoTraditional() {
        List<EvidenceItem> items = config.traditionalWeights().factorNames().stream()
                .map(f -> EvidenceItem.unavailable(SourceKind.TRADITIONAL_FACTOR, f, "No registry record"))
                .collect(Collectors.toList());
        when(traditionalAdapter.collect(anyString(), any())).thenReturn(items);
    }

    private void givenAction(Double value) {
        when(actionAdapter.collect(anyString(), any())).thenReturn(value == null
                ? EvidenceItem.unavailable(SourceKind.ACTION, FactorNames.ACTION, "No actions")
                : availableItem(SourceKind.ACTION, FactorNames.ACTION, value));
    }

    private void givenGroundTruth(Double value) {
        when(groundTruthAdapter.collect(anyString(), any())).thenReturn(value == null
                ? EvidenceItem.unavailable(SourceKind.GROUND_TRUTH, FactorNames.GROUND_TRUTH, "No reports")
                : availableItem(SourceKind.GROUND_TRUTH, FactorNames.GROUND_TRUTH, value));
    }

    private void givenNoActions() {
        when(actionAdapter.collect(anyString(), any())).thenReturn(
                availableItem(SourceKind.ACTION, FactorNames.ACTION, 0.0).toBuilder()
                        .detail(new EvidenceDetail.ActionHistory(0, 0, 0, 0, 0.0, 0.0, 0.0))
                        .build());
    }

    private void givenNoReports() {
        when(groundTruthAdapter.collect(anyString(), any())).thenReturn(
                availableItem(SourceKind.GROUND_TRUTH, FactorNames.GROUND_TRUTH, 0.0).toBuilder()
                        .detail(new EvidenceDetail.GroundTruthHistory(0, 0, 0.0, 0.0))
                        .build());
    }

    @Test
    void score_allSubScoresAvailable_weightedComposite() {
        givenTraditional(80.0);
        givenAction(60.0);
        givenGroundTruth(50.0);

        CompositeScore score = scorer.score(SUBJECT);

        // 1000 * (0.4*80 + 0.3*60 + 0.3*50) / 100
        assertThat(score.getValue()).isEqualTo(650);
        assertThat(score.getGrade()).isEqualTo(CreditGrade.C);
        assertThat(score.getInterestRatePct()).isEqualTo(12.0);
        assertThat(score.isEligible()).isTrue();
        assertThat(score.getSubjectId()).isEqualTo(SUBJECT);
        assertThat(score.getScoreId()).isNotBlank();
        assertThat(score.getSubScores()).extracting(SubScore::getName)
                .containsExactly(FactorNames.TRADITIONAL, FactorNames.ACTION, FactorNames.GROUND_TRUTH);
        assertThat(score.getEffectiveWeights())
                .containsEntry(FactorNames.TRADITIONAL, 0.40)
                .containsEntry(FactorNames.ACTION, 0.30)
                .containsEntry(FactorNames.GROUND_TRUTH, 0.30);
    }

    @Test
    void score_noActionHistory_countsAsZero() {
        givenTraditional(80.0);
        givenNoActions();
        givenGroundTruth(50.0);

        CompositeScore score = scorer.score(SUBJECT);

        // 1000 * (0.4*80 + 0.3*0 + 0.3*50) / 100
        assertThat(score.getValue()).isEqualTo(470);
        assertThat(score.getGrade()).isEqualTo(CreditGrade.F);
        assertThat(score.getEffectiveWeights()).containsEntry(FactorNames.ACTION, 0.30);
        assertThat(score.getSubScores()).extracting(SubScore::getName).contains(FactorNames.ACTION);
    }

    @Test
    void score_hidingAllActivity_neverBeatsSubmittingWork() {
        givenTraditional(80.0);
        givenNoActions();
        givenNoReports();

        CompositeScore silent = scorer.score(SUBJECT);

        // one unverified action scores 0, the same as no actions
        when(actionAdapter.collect(anyString(), any())).thenReturn(
                availableItem(SourceKind.ACTION, FactorNames.ACTION, 0.0).toBuilder()
                        .detail(new EvidenceDetail.ActionHistory(1, 0, 0, 0, 0.0, 0.0, 0.0))
                        .build());
        CompositeScore active = scorer.score(SUBJECT);

        // 1000 * 0.4 * 80 / 100
        assertThat(silent.getValue()).isEqualTo(320);
        assertThat(silent.getGrade()).isEqualTo(CreditGrade.F);
        assertThat(active.getValue()).isEqualTo(silent.getValue());
    }

    @Test
    void score_historyStoreFailure_redistributesOverTheOthers() {
        givenTraditional(80.0);
        givenAction(null);
        givenGroundTruth(50.0);

        CompositeScore score = scorer.score(SUBJECT);

        // 1000 * (0.4*80 + 0.3*50) / 0.7 / 100 = 671.43
        assertThat(score.getValue()).isEqualTo(671);
        assertThat(score.getEffectiveWeights().get(FactorNames.ACTION)).isEqualTo(0.0);
        assertThat(score.getEffectiveWeights().get(FactorNames.TRADITIONAL)).isCloseTo(4.0 / 7.0, within(1e-12));
        assertThat(score.getSubScores()).extracting(SubScore::getName)
                .doesNotContain(FactorNames.ACTION);
    }

    @Test
    void score_noTraditionalRecord_stillScoresFromHistory() {
        givenNoTraditional();
        givenAction(90.0);
        givenGroundTruth(70.0);

        CompositeScore score = scorer.score(SUBJECT);

        assertThat(score.getValue()).isEqualTo(800);
        assertThat(score.getGrade()).isEqualTo(CreditGrade.A);
        assertThat(score.getEffectiveWeights().get(FactorNames.TRADITIONAL)).isEqualTo(0.0);
    }

    @Test
    void score_noEvidenceAtAll_insufficientEvidence() {
        givenNoTraditional();
        givenAction(null);
        givenGroundTruth(null);

        assertThatThrownBy(() -> scorer.score(SUBJECT))
                .isInstanceOf(InsufficientEvidenceException.class)
                .hasMessageContaining(SUBJECT)
                .satisfies(e -> assertThat(((InsufficientEvidenceException) e).getMissing())
                        .containsExactly(FactorNames.TRADITIONAL, FactorNames.ACTION, FactorNames.GROUND_TRUTH));
    }

    @Test
    void score_noRecordAndEmptyHistories_insufficientEvidence() {
        givenNoTraditional();
        givenNoActions();
        givenNoReports();

        assertThatThrownBy(() -> scorer.score(SUBJECT))
                .isInstanceOf(InsufficientEvidenceException.class)
                .satisfies(e -> assertThat(((InsufficientEvidenceException) e).getMissing())
                        .containsExactly(FactorNames.TRADITIONAL, FactorNames.ACTION, FactorNames.GROUND_TRUTH));
    }

    @Test
    void score_adapterFailure_treatedAsUnavailable() {
        givenTraditional(70.0);
        when(actionAdapter.collect(anyString(), any())).thenThrow(new IllegalStateException("store offline"));
        givenGroundTruth(70.0);

        CompositeScore score = scorer.score(SUBJECT);

        assertThat(score.getValue()).isEqualTo(700);
        assertThat(score.getEffectiveWeights().get(FactorNames.ACTION)).isEqualTo(0.0);
    }

    @Test
    void score_validityWindowFromComputationTime() {
        givenTraditional(50.0);
        givenAction(50.0);
        givenGroundTruth(50.0);

        CompositeScore score = scorer.score(SUBJECT);

        assertThat(score.getComputedAt()).isEqualTo(TestDataFactory.fixedClock().millis());
        assertThat(score.getValidUntil() - score.getComputedAt()).isEqualTo(TimeUnit.DAYS.toMillis(30));
        assertThat(score.getGrade()).isEqualTo(CreditGrade.D);
    }

    @Test
    void score_betterActionHistoryNeverLowersTheScore() {
        givenTraditional(65.0);
        givenGroundTruth(40.0);

        int previous = -1;
        for (double action = 0.0; action <= 100.0; action += 10.0) {
            givenAction(action);
            int value = scorer.score(SUBJECT).getValue();
            assertThat(value).isGreaterThanOrEqualTo(previous).isBetween(0, 1000);
            previous = value;
        }
    }

    @Test
    void score_usesTheClockDateForLookback() {
        givenTraditional(60.0);
        givenAction(60.0);
        givenGroundTruth(60.0);

        scorer.score(SUBJECT);

        verify(actionAdapter).collect(SUBJECT, TODAY);
        verify(groundTruthAdapter).collect(SUBJECT, TODAY);
    }
}
