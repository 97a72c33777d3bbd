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
import com.croppulse.decision.model.ClaimRecommendation;
import com.croppulse.decision.model.ClaimType;
import com.croppulse.decision.model.ClaimVerdict;
import com.croppulse.decision.model.EvidenceItem;
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
import java.util.Optional;

/**
 * Append-only store of claim verdicts. A re-verification adds a verdict; earlier
 * verdicts of the claim stay readable.
 */
@Repository
public class ClaimVerdictRepository {

    private static final Logger log = LoggerFactory.getLogger(ClaimVerdictRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy createOnlyPolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public ClaimVerdictRepository(AerospikeClient client,
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

    public void save(ClaimVerdict verdict) {
        Key key = new Key(namespace, AerospikeConfig.SET_CLAIM_VERDICTS, verdict.getVerdictId());

        List<Bin> bins = new ArrayList<>();
        bins.add(new Bin("verdictId", verdict.getVerdictId()));
        bins.add(new Bin("claimId", verdict.getClaimId()));
        bins.add(new Bin("subjectId", verdict.getSubjectId()));
        bins.add(new Bin("farmId", verdict.getFarmId()));
        bins.add(new Bin("claimDate", RecordBins.dateString(verdict.getClaimDate())));
        bins.add(new Bin("claimType", verdict.getClaimType().name()));
        bins.add(new Bin("confidence", verdict.getConfidence()));
        bins.add(new Bin("recommendation", verdict.getRecommendation().name()));
        bins.add(new Bin("weights", toJson(verdict.getEffectiveWeights())));
        bins.add(new Bin("evidence", toJson(verdict.getEvidence())));
        bins.add(new Bin("supersedes", verdict.getSupersedesVerdictId()));
        bins.add(new Bin("verifiedAt", verdict.getVerifiedAt()));

        try {
            client.put(createOnlyPolicy, key, bins.toArray(new Bin[0]));
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.KEY_EXISTS_ERROR) {
                throw new RecordFrozenException("Claim verdict", verdict.getVerdictId(), e);
            }
            throw e;
        }
    }

    public ClaimVerdict findByVerdictId(String verdictId) {
        Key key = new Key(namespace, AerospikeConfig.SET_CLAIM_VERDICTS, verdictId);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return mapRecord(record);
    }

    /**
     * All verdicts of a claim, newest first.
     */
    public List<ClaimVerdict> findByClaimId(String claimId) {
        List<ClaimVerdict> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_CLAIM_VERDICTS,
                (key, record) -> {
                    try {
                        if (!claimId.equals(record.getString("claimId"))) return;
                        synchronized (results) {
                            results.add(mapRecord(record));
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read claim verdict record: {}", e.getMessage());
                    }
                });

        results.sort(Comparator.comparingLong(ClaimVerdict::getVerifiedAt).reversed());
        return results;
    }

    public Optional<ClaimVerdict> findLatestByClaimId(String claimId) {
        List<ClaimVerdict> verdicts = findByClaimId(claimId);
        return verdicts.isEmpty() ? Optional.empty() : Optional.of(verdicts.get(0));
    }

    private ClaimVerdict mapRecord(Record record) {
        ClaimRecommendation recommendation = ClaimRecommendation.valueOf(record.getString("recommendation"));
        return ClaimVerdict.builder()
                .verdictId(record.getString("verdictId"))
                .claimId(record.getString("claimId"))
                .subjectId(record.getString("subjectId"))
                .farmId(record.getString("farmId"))
                .claimDate(RecordBins.date(record, "claimDate"))
                .claimType(ClaimType.valueOf(record.getString("claimType")))
                .confidence(record.getDouble("confidence"))
                .recommendation(recommendation)
                .verified(recommendation.isApproval())
                .effectiveWeights(fromJson(record.getString("weights"),
                        new TypeReference<Map<String, Double>>() {}, Collections.emptyMap()))
                .evidence(fromJson(record.getString("evidence"),
                        new TypeReference<List<EvidenceItem>>() {}, Collections.emptyList()))
                .supersedesVerdictId(record.getString("supersedes"))
                .verifiedAt(record.getLong("verifiedAt"))
                .build();
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (Exception e) {
            log.error("Failed to serialize claim verdict field", e);
            throw new IllegalStateException("Failed to serialize claim verdict", e);
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type, T fallback) {
        if (json == null || json.isEmpty()) return fallback;
        try {
            return objectMapper.readValue(json, type);
        } catch (Exception e) {
            log.error("Failed to deserialize claim verdict field", e);
            return fallback;
        }
    }
}
