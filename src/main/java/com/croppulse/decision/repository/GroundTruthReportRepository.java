package com.croppulse.decision.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Record;
import com.aerospike.client.policy.ScanPolicy;
import com.croppulse.decision.config.AerospikeConfig;
import com.croppulse.decision.engine.evidence.GroundTruthReportStore;
import com.croppulse.decision.model.GroundTruthReport;
import com.croppulse.decision.model.TemperatureFeel;
import com.croppulse.decision.model.WeatherCondition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

@Repository
public class GroundTruthReportRepository implements GroundTruthReportStore {

    private static final Logger log = LoggerFactory.getLogger(GroundTruthReportRepository.class);

    private final AerospikeClient client;
    private final String namespace;

    public GroundTruthReportRepository(AerospikeClient client,
                                       @Qualifier("aerospikeNamespace") String namespace) {
        this.client = client;
        this.namespace = namespace;
    }

    @Override
    public List<GroundTruthReport> findByFarmer(String farmerId, LocalDate from, LocalDate to) {
        return scan(record -> farmerId.equals(record.getString("farmerId")), from, to);
    }

    @Override
    public List<GroundTruthReport> findByFarms(Collection<String> farmIds, LocalDate from, LocalDate to) {
        if (farmIds.isEmpty()) return List.of();
        Set<String> ids = new HashSet<>(farmIds);
        return scan(record -> ids.contains(record.getString("farmId")), from, to);
    }

    private List<GroundTruthReport> scan(Predicate<Record> filter, LocalDate from, LocalDate to) {
        List<GroundTruthReport> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_GROUND_TRUTH_REPORTS,
                (key, record) -> {
                    try {
                        if (!filter.test(record)) return;
                        GroundTruthReport report = mapRecord(record);
                        if (RecordBins.inRange(report.getObservedOn(), from, to)) {
                            synchronized (results) {
                                results.add(report);
                            }
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read ground-truth report record: {}", e.getMessage());
                    }
                });

        // Scan order is not stable across nodes
        results.sort(Comparator.comparing(GroundTruthReport::getObservedOn)
                .thenComparing(GroundTruthReport::getReportId, Comparator.nullsLast(Comparator.naturalOrder())));
        return results;
    }

    private GroundTruthReport mapRecord(Record record) {
        String weather = record.getString("weather");
        String feel = record.getString("tempFeel");
        return GroundTruthReport.builder()
                .reportId(record.getString("reportId"))
                .farmerId(record.getString("farmerId"))
                .farmId(record.getString("farmId"))
                .weatherCondition(weather == null ? null : WeatherCondition.valueOf(weather))
                .temperatureFeel(feel == null ? null : TemperatureFeel.valueOf(feel))
                .observedOn(RecordBins.date(record, "observedOn"))
                .verified(Boolean.TRUE.equals(RecordBins.nullableBoolean(record, "verified")))
                .satelliteCorroborated(Boolean.TRUE.equals(RecordBins.nullableBoolean(record, "satCorroborated")))
                .build();
    }
}
