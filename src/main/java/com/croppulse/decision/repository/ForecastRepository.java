package com.croppulse.decision.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.croppulse.decision.config.AerospikeConfig;
import com.croppulse.decision.engine.evidence.ForecastStore;
import com.croppulse.decision.model.ForecastDay;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Daily forecasts keyed by farm id; the {@code days} bin holds the series as JSON.
 */
@Repository
public class ForecastRepository implements ForecastStore {

    private static final Logger log = LoggerFactory.getLogger(ForecastRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public ForecastRepository(AerospikeClient client,
                              @Qualifier("aerospikeNamespace") String namespace,
                              @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
    }

    @Override
    public List<ForecastDay> findForecast(String farmId, LocalDate from) {
        Key key = new Key(namespace, AerospikeConfig.SET_FORECASTS, farmId);
        Record record = client.get(readPolicy, key);
        if (record == null) return Collections.emptyList();

        return deserializeDays(record.getString("days")).stream()
                .filter(day -> day.getDate() != null && !day.getDate().isBefore(from))
                .sorted(Comparator.comparing(ForecastDay::getDate))
                .collect(Collectors.toList());
    }

    private List<ForecastDay> deserializeDays(String json) {
        if (json == null || json.isEmpty()) return Collections.emptyList();
        try {
            return objectMapper.readValue(json, new TypeReference<List<ForecastDay>>() {});
        } catch (Exception e) {
            log.error("Failed to deserialize forecast days", e);
            return Collections.emptyList();
        }
    }
}
