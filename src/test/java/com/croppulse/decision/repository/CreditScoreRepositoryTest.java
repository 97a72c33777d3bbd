package com.croppulse.decision.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.ScanCallback;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.croppulse.decision.config.AerospikeConfig;
import com.croppulse.decision.exception.RecordFrozenException;
import com.croppulse.decision.model.CompositeScore;
import com.croppulse.decision.model.PagedResponse;
import com.croppulse.decision.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class CreditScoreRepositoryTest {

    private AerospikeClient client;
    private CreditScoreRepository repository;
    private final List<Record> stored = new ArrayList<>();

    @BeforeEach
    void setUp() {
        client = mock(AerospikeClient.class);
        repository = new CreditScoreRepository(client, "croppulse", new WritePolicy(), new Policy());

        doAnswer(inv -> {
            Bin[] bins = (Bin[]) inv.getRawArguments()[2];
            stored.add(AerospikeRecords.fromBins(bins));
            return null;
        }).when(client).put(any(WritePolicy.class), any(Key.class), any(Bin[].class));

        doAnswer(inv -> {
            ScanCallback callback = inv.getArgument(3);
            for (Record record : stored) {
                callback.scanCallback(null, record);
            }
            return null;
        }).when(client).scanAll(any(ScanPolicy.class), anyString(), anyString(), any(ScanCallback.class));
    }

    @Test
    void save_usesCreateOnlyPolicy() {
        repository.save(TestDataFactory.createCompositeScore("S-1", "FARMER-001", 650, 1_000L));

        ArgumentCaptor<WritePolicy> policy = ArgumentCaptor.forClass(WritePolicy.class);
        ArgumentCaptor<Key> key = ArgumentCaptor.forClass(Key.class);
        verify(client).put(policy.capture(), key.capture(), any(Bin[].class));
        assertThat(policy.getValue().recordExistsAction).isEqualTo(RecordExistsAction.CREATE_ONLY);
        assertThat(key.getValue().setName).isEqualTo(AerospikeConfig.SET_CREDIT_SCORES);
        assertThat(key.getValue().userKey.getObject()).isEqualTo("S-1");
    }

    @Test
    void save_existingScoreId_recordFrozen() {
        doThrow(new AerospikeException(ResultCode.KEY_EXISTS_ERROR))
                .when(client).put(any(WritePolicy.class), any(Key.class), any(Bin[].class));

        assertThatThrownBy(() -> repository.save(TestDataFactory.createCompositeScore("S-1", "FARMER-001", 650, 1L)))
                .isInstanceOf(RecordFrozenException.class)
                .hasMessageContaining("S-1");
    }

    @Test
    void save_otherAerospikeFailure_propagates() {
        doThrow(new AerospikeException(ResultCode.TIMEOUT))
                .when(client).put(any(WritePolicy.class), any(Key.class), any(Bin[].class));

        assertThatThrownBy(() -> repository.save(TestDataFactory.createCompositeScore("S-1", "FARMER-001", 650, 1L)))
                .isInstanceOf(AerospikeException.class)
                .isNotInstanceOf(RecordFrozenException.class);
    }

    @Test
    void findBySubjectId_newestFirstWithCursor() {
        repository.save(TestDataFactory.createCompositeScore("S-1", "FARMER-001", 610, 1_000L));
        repository.save(TestDataFactory.createCompositeScore("S-2", "FARMER-001", 640, 3_000L));
        repository.save(TestDataFactory.createCompositeScore("S-3", "FARMER-001", 700, 2_000L));
        repository.save(TestDataFactory.createCompositeScore("S-4", "FARMER-002", 820, 4_000L));

        PagedResponse<CompositeScore> first = repository.findBySubjectId("FARMER-001", 2, null);

        assertThat(first.data()).extracting(CompositeScore::getScoreId).containsExactly("S-2", "S-3");
        assertThat(first.hasMore()).isTrue();
        assertThat(first.nextCursor()).isEqualTo("2000");

        PagedResponse<CompositeScore> second = repository.findBySubjectId("FARMER-001", 2,
                Long.parseLong(first.nextCursor()));

        assertThat(second.data()).extracting(CompositeScore::getScoreId).containsExactly("S-1");
        assertThat(second.hasMore()).isFalse();
        assertThat(second.nextCursor()).isNull();
    }

    @Test
    void findBySubjectId_restoresGradeTermsAndSubScores() {
        repository.save(TestDataFactory.createCompositeScore("S-1", "FARMER-001", 720, 1_000L));

        CompositeScore score = repository.findBySubjectId("FARMER-001", 10, null).data().get(0);

        assertThat(score.getValue()).isEqualTo(720);
        assertThat(score.getInterestRatePct()).isEqualTo(10.0);
        assertThat(score.isEligible()).isTrue();
        assertThat(score.getEffectiveWeights()).containsEntry("traditional", 0.4);
        assertThat(score.getSubScores()).hasSize(1);
        assertThat(score.getSubScores().get(0).getContributingEvidence()).hasSize(1);
    }

    @Test
    void findByScoreId_missing_returnsNull() {
        when(client.get(any(Policy.class), any(Key.class))).thenReturn(null);

        assertThat(repository.findByScoreId("S-404")).isNull();
    }
}
