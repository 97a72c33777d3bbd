package com.croppulse.decision.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.croppulse.decision.config.AerospikeConfig;
import com.croppulse.decision.engine.evidence.FarmRegistry;
import com.croppulse.decision.model.Farm;
import com.croppulse.decision.model.FarmerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Read-only access to the {@code farmers} and {@code farms} sets.
 */
@Repository
public class FarmRegistryRepository implements FarmRegistry {

    private static final Logger log = LoggerFactory.getLogger(FarmRegistryRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final Policy readPolicy;

    public FarmRegistryRepository(AerospikeClient client,
                                  @Qualifier("aerospikeNamespace") String namespace,
                                  @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.readPolicy = readPolicy;
    }

    @Override
    public Optional<FarmerRecord> findFarmer(String farmerId) {
        Key key = new Key(namespace, AerospikeConfig.SET_FARMERS, farmerId);
        Record record = client.get(readPolicy, key);
        if (record == null) return Optional.empty();

        return Optional.of(FarmerRecord.builder()
                .farmerId(farmerId)
                .primaryFarmId(record.getString("primaryFarmId"))
                .farmSizeAcres(RecordBins.nullableDouble(record, "farmSizeAcres"))
                .latestNdvi(RecordBins.nullableDouble(record, "latestNdvi"))
                .ndviObservedOn(RecordBins.date(record, "ndviObservedOn"))
                .climateRiskScore(RecordBins.nullableDouble(record, "climateRisk"))
                .totalPayments(record.getInt("paymentsTotal"))
                .onTimePayments(record.getInt("paymentsOnTime"))
                .latePaidPayments(record.getInt("paymentsLate"))
                .deforestationDetected(RecordBins.nullableBoolean(record, "deforested"))
                .deforestationCheckedOn(RecordBins.date(record, "deforestCheckOn"))
                .build());
    }

    @Override
    public Optional<Farm> findFarm(String farmId) {
        Key key = new Key(namespace, AerospikeConfig.SET_FARMS, farmId);
        Record record = client.get(readPolicy, key);
        if (record == null) return Optional.empty();
        return Optional.of(mapFarm(record));
    }

    @Override
    public List<Farm> findNearestFarms(Farm origin, int limit) {
        List<Farm> farms = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_FARMS,
                (key, record) -> {
                    try {
                        Farm farm = mapFarm(record);
                        if (Objects.equals(farm.getFarmId(), origin.getFarmId())
                                || Objects.equals(farm.getFarmerId(), origin.getFarmerId())) {
                            return;
                        }
                        synchronized (farms) {
                            farms.add(farm);
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read farm record: {}", e.getMessage());
                    }
                });

        return farms.stream()
                .sorted(Comparator.comparingDouble(origin::distanceKmTo))
                .limit(limit)
                .collect(Collectors.toList());
    }

    private Farm mapFarm(Record record) {
        return Farm.builder()
                .farmId(record.getString("farmId"))
                .farmerId(record.getString("farmerId"))
                .county(record.getString("county"))
                .latitude(record.getDouble("latitude"))
                .longitude(record.getDouble("longitude"))
                .cropType(record.getString("cropType"))
                .build();
    }
}
