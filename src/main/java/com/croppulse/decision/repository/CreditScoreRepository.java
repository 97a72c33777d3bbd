package com.croppulse.decision.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.croppulse.decision.config.AerospikeConfig;
import com.croppulse.decision.exception.RecordFrozenException;
import com.croppulse.decision.model.CompositeScore;
import com.croppulse.decision.model.CreditGrade;
import com.croppulse.decision.model.PagedResponse;
import com.croppulse.decision.model.SubScore;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Append-only store of issued credit scores. Writes use CREATE_ONLY so an issued
 * score can never be replaced.
 */
@Repository
public class CreditScoreRepository {

    private static final Logger log = LoggerFactory.getLogger(CreditScoreRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy createOnlyPolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public CreditScoreRepository(AerospikeClient client,
                                 @Qualifier("aerospikeNamespace") String namespace,
                                 @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                 @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.createOnlyPolicy = new WritePolicy(writePolicy);
        this.createOnlyPolicy.recordExistsAction = RecordExistsAction.CREATE_ONLY;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
    }

    public void save(CompositeScore score) {
        Key key = new Key(namespace, AerospikeConfig.SET_CREDIT_SCORES, score.getScoreId());

        Bin scoreIdBin = new Bin("scoreId", score.getScoreId());
        Bin subjectIdBin = new Bin("subjectId", score.getSubjectId());
        Bin valueBin = new Bin("value", score.getValue());
        Bin gradeBin = new Bin("grade", score.getGrade().name());
        Bin weightsBin = new Bin("weights", toJson(score.getEffectiveWeights()));
        Bin subScoresBin = new Bin("subScores", toJson(score.getSubScores()));
        Bin computedAtBin = new Bin("computedAt", score.getComputedAt());
        Bin validUntilBin = new Bin("validUntil", score.getValidUntil());

        try {
            client.put(createOnlyPolicy, key,
                    scoreIdBin, subjectIdBin, valueBin, gradeBin,
                    weightsBin, subScoresBin, computedAtBin, validUntilBin);
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.KEY_EXISTS_ERROR) {
                throw new RecordFrozenException("Credit score", score.getScoreId(), e);
            }
            throw e;
        }
    }

    public CompositeScore findByScoreId(String scoreId) {
        Key key = new Key(namespace, AerospikeConfig.SET_CREDIT_SCORES, scoreId);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return mapRecord(record);
    }

    /**
     * Score history of a subject, newest first. {@code before} is an exclusive
     * computedAt cursor taken from a previous page.
     */
    public PagedResponse<CompositeScore> findBySubjectId(String subjectId, int limit, Long before) {
        List<CompositeScore> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_CREDIT_SCORES,
                (key, record) -> {
                    try {
                        if (!subjectId.equals(record.getString("subjectId"))) return;
                        if (before != null && record.getLong("computedAt") >= before) return;
                        synchronized (results) {
                            results.add(mapRecord(record));
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read credit score record: {}", e.getMessage());
                    }
                });

        results.sort(Comparator.comparingLong(CompositeScore::getComputedAt).reversed());
        boolean hasMore = results.size() > limit;
        List<CompositeScore> page = hasMore ? new ArrayList<>(results.subList(0, limit)) : results;
        String nextCursor = hasMore ? String.valueOf(page.get(page.size() - 1).getComputedAt()) : null;
        return new PagedResponse<>(page, hasMore, nextCursor);
    }

    private CompositeScore mapRecord(Record record) {
        CreditGrade grade = CreditGrade.valueOf(record.getString("grade"));
        return CompositeScore.builder()
                .scoreId(record.getString("scoreId"))
                .subjectId(record.getString("subjectId"))
                .value(record.getInt("value"))
                .grade(grade)
                .interestRatePct(grade.getInterestRatePct())
                .eligible(grade.isEligible())
                .effectiveWeights(fromJson(record.getString("weights"), new TypeReference<Map<String, Double>>() {},
                        Collections.emptyMap()))
                .subScores(fromJson(record.getString("subScores"), new TypeReference<List<SubScore>>() {},
                        Collections.emptyList()))
                .computedAt(record.getLong("computedAt"))
                .validUntil(record.getLong("validUntil"))
                .build();
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (Exception e) {
            // A score that cannot be stored in full must not be stored at all
            log.error("Failed to serialize credit score field", e);
            throw new IllegalStateException("Failed to serialize credit score", e);
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type, T fallback) {
        if (json == null || json.isEmpty()) return fallback;
        try {
            return objectMapper.readValue(json, type);
        } catch (Exception e) {
            log.error("Failed to deserialize credit score field", e);
            return fallback;
        }
    }
}
