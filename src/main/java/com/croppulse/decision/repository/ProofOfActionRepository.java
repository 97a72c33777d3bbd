package com.croppulse.decision.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Record;
import com.aerospike.client.policy.ScanPolicy;
import com.croppulse.decision.config.AerospikeConfig;
import com.croppulse.decision.engine.evidence.ActionStore;
import com.croppulse.decision.model.ActionType;
import com.croppulse.decision.model.ProofOfAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Repository
public class ProofOfActionRepository implements ActionStore {

    private static final Logger log = LoggerFactory.getLogger(ProofOfActionRepository.class);

    private final AerospikeClient client;
    private final String namespace;

    public ProofOfActionRepository(AerospikeClient client,
                                   @Qualifier("aerospikeNamespace") String namespace) {
        this.client = client;
        this.namespace = namespace;
    }

    @Override
    public List<ProofOfAction> findByFarmer(String farmerId, LocalDate from, LocalDate to) {
        List<ProofOfAction> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_PROOF_OF_ACTIONS,
                (key, record) -> {
                    try {
                        if (!farmerId.equals(record.getString("farmerId"))) return;
                        ProofOfAction action = mapRecord(record);
                        if (RecordBins.inRange(action.getActionDate(), from, to)) {
                            synchronized (results) {
                                results.add(action);
                            }
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read proof-of-action record: {}", e.getMessage());
                    }
                });

        results.sort(Comparator.comparing(ProofOfAction::getActionDate));
        return results;
    }

    private ProofOfAction mapRecord(Record record) {
        String type = record.getString("actionType");
        return ProofOfAction.builder()
                .actionId(record.getString("actionId"))
                .farmerId(record.getString("farmerId"))
                .farmId(record.getString("farmId"))
                .actionType(type == null ? ActionType.OTHER : ActionType.valueOf(type))
                .actionDate(RecordBins.date(record, "actionDate"))
                .verified(Boolean.TRUE.equals(RecordBins.nullableBoolean(record, "verified")))
                .build();
    }
}
