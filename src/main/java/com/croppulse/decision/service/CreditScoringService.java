package com.croppulse.decision.service;

import com.croppulse.decision.config.MetricsConfig;
import com.croppulse.decision.engine.credit.CompositeCreditScorer;
import com.croppulse.decision.exception.MalformedInputException;
import com.croppulse.decision.model.CompositeScore;
import com.croppulse.decision.model.PagedResponse;
import com.croppulse.decision.repository.CreditScoreRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Issues credit scores and serves the frozen score history.
 * Every call to {@link #computeScore} appends a new record; issued records are never updated.
 */
@Service
public class CreditScoringService {

    private static final Logger log = LoggerFactory.getLogger(CreditScoringService.class);

    static final int MAX_PAGE_SIZE = 100;

    private final CompositeCreditScorer scorer;
    private final CreditScoreRepository creditScoreRepository;
    private final MetricsConfig metricsConfig;

    public CreditScoringService(CompositeCreditScorer scorer,
                                CreditScoreRepository creditScoreRepository,
                                MetricsConfig metricsConfig) {
        this.scorer = scorer;
        this.creditScoreRepository = creditScoreRepository;
        this.metricsConfig = metricsConfig;
    }

    @Observed(name = "credit.compute", contextualName = "compute-and-freeze-score")
    public CompositeScore computeScore(String subjectId) {
        if (subjectId == null || subjectId.isBlank()) {
            throw new MalformedInputException("subjectId", "subjectId is required");
        }

        CompositeScore score = scorer.score(subjectId);
        creditScoreRepository.save(score);

        metricsConfig.recordCreditScore(score.getGrade().name(), score.getValue());
        log.info("Issued credit score {} for {}: {} ({})",
                score.getScoreId(), subjectId, score.getValue(), score.getGrade());
        return score;
    }

    public PagedResponse<CompositeScore> getHistory(String subjectId, int limit, Long before) {
        int pageSize = Math.max(1, Math.min(MAX_PAGE_SIZE, limit));
        return creditScoreRepository.findBySubjectId(subjectId, pageSize, before);
    }

    public CompositeScore getScore(String scoreId) {
        return creditScoreRepository.findByScoreId(scoreId);
    }
}
