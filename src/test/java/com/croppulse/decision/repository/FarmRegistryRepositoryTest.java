package com.croppulse.decision.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ScanCallback;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.croppulse.decision.model.Farm;
import com.croppulse.decision.model.FarmerRecord;
import com.croppulse.decision.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class FarmRegistryRepositoryTest {

    private AerospikeClient client;
    private FarmRegistryRepository repository;

    @BeforeEach
    void setUp() {
        client = mock(AerospikeClient.class);
        repository = new FarmRegistryRepository(client, "croppulse", new Policy());
    }

    private static Record farmRecord(String farmId, String farmerId, double lat, double lon) {
        return AerospikeRecords.fromBins(
                new Bin("farmId", farmId),
                new Bin("farmerId", farmerId),
                new Bin("county", "Nakuru"),
                new Bin("latitude", lat),
                new Bin("longitude", lon),
                new Bin("cropType", "maize"));
    }

    @Test
    void findNearestFarms_closestFirstExcludingTheClaimant() {
        List<Record> records = List.of(
                farmRecord("FARM-FAR", "FARMER-7", -0.40, 36.20),
                farmRecord("FARM-NEAR", "FARMER-2", -0.301, 36.07),
                farmRecord("FARM-MID", "FARMER-3", -0.32, 36.09),
                farmRecord("FARM-001", "FARMER-001", -0.30, 36.07),
                farmRecord("FARM-002", "FARMER-001", -0.30, 36.071));
        doAnswer(inv -> {
            ScanCallback callback = inv.getArgument(3);
            for (Record record : records) {
                callback.scanCallback(null, record);
            }
            return null;
        }).when(client).scanAll(any(ScanPolicy.class), anyString(), anyString(), any(ScanCallback.class));

        Farm origin = TestDataFactory.createFarm("FARM-001", "FARMER-001", -0.30, 36.07);
        List<Farm> nearest = repository.findNearestFarms(origin, 2);

        assertThat(nearest).extracting(Farm::getFarmId).containsExactly("FARM-NEAR", "FARM-MID");
    }

    @Test
    void findFarmer_unobservedIndicatorsStayNull() {
        Record record = AerospikeRecords.fromBins(
                new Bin("primaryFarmId", "FARM-001"),
                new Bin("farmSizeAcres", 2.5),
                new Bin("paymentsTotal", 4),
                new Bin("paymentsOnTime", 3),
                new Bin("paymentsLate", 1));
        when(client.get(any(Policy.class), any(Key.class))).thenReturn(record);

        Optional<FarmerRecord> farmer = repository.findFarmer("FARMER-001");

        assertThat(farmer).isPresent();
        assertThat(farmer.get().getFarmSizeAcres()).isEqualTo(2.5);
        assertThat(farmer.get().getLatestNdvi()).isNull();
        assertThat(farmer.get().getClimateRiskScore()).isNull();
        assertThat(farmer.get().getDeforestationDetected()).isNull();
        assertThat(farmer.get().getTotalPayments()).isEqualTo(4);
    }

    @Test
    void findFarm_missing_empty() {
        when(client.get(any(Policy.class), any(Key.class))).thenReturn(null);

        assertThat(repository.findFarm("FARM-404")).isEmpty();
    }
}
