package com.croppulse.decision.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Record;
import com.aerospike.client.policy.ScanPolicy;
import com.croppulse.decision.config.AerospikeConfig;
import com.croppulse.decision.engine.evidence.SatelliteIndexStore;
import com.croppulse.decision.model.SatelliteScan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

@Repository
public class SatelliteScanRepository implements SatelliteIndexStore {

    private static final Logger log = LoggerFactory.getLogger(SatelliteScanRepository.class);

    private final AerospikeClient client;
    private final String namespace;

    public SatelliteScanRepository(AerospikeClient client,
                                   @Qualifier("aerospikeNamespace") String namespace) {
        this.client = client;
        this.namespace = namespace;
    }

    @Override
    public Optional<SatelliteScan> findLatestCompletedScan(String farmId, LocalDate from, LocalDate to) {
        List<SatelliteScan> scans = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_SATELLITE_SCANS,
                (key, record) -> {
                    try {
                        if (!farmId.equals(record.getString("farmId"))) return;
                        SatelliteScan scan = mapRecord(record);
                        if (scan.isCompleted() && RecordBins.inRange(scan.getScanDate(), from, to)) {
                            synchronized (scans) {
                                scans.add(scan);
                            }
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read satellite scan record: {}", e.getMessage());
                    }
                });

        return scans.stream().max(Comparator.comparing(SatelliteScan::getScanDate));
    }

    private SatelliteScan mapRecord(Record record) {
        return SatelliteScan.builder()
                .scanId(record.getString("scanId"))
                .farmId(record.getString("farmId"))
                .scanDate(RecordBins.date(record, "scanDate"))
                .status(record.getString("status"))
                .ndviMean(RecordBins.nullableDouble(record, "ndviMean"))
                .sarVvMeanDb(RecordBins.nullableDouble(record, "sarVvMeanDb"))
                .build();
    }
}
