package com.croppulse.decision.engine.credit;

import com.croppulse.decision.engine.evidence.GroundTruthReportStore;
import com.croppulse.decision.model.EvidenceDetail;
import com.croppulse.decision.model.EvidenceItem;
import com.croppulse.decision.model.GroundTruthReport;
import com.croppulse.decision.model.WeatherCondition;
import com.croppulse.decision.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.croppulse.decision.testutil.TestDataFactory.TODAY;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class GroundTruthHistoryAdapterTest {

    private GroundTruthReportStore reportStore;
    private GroundTruthHistoryAdapter adapter;

    @BeforeEach
    void setUp() {
        reportStore = mock(GroundTruthReportStore.class);
        adapter = new GroundTruthHistoryAdapter(reportStore, TestDataFactory.validatedConfig());
    }

    private static List<GroundTruthReport> reports(int count, int corroborated) {
        List<GroundTruthReport> reports = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            reports.add(TestDataFactory.createReport("GTR-" + i, "F1", "FARM-F1", WeatherCondition.LIGHT_RAIN,
                    TODAY.minusDays(10L * i), i < corroborated));
        }
        return reports;
    }

    @Test
    void collect_halfCorroborated_blendsFrequencyAndAccuracy() {
        when(reportStore.findByFarmer("F1", TODAY.minusDays(365), TODAY)).thenReturn(reports(6, 3));

        EvidenceItem item = adapter.collect("F1", TODAY);

        // 0.4 * (100 * 6/12) + 0.6 * 50
        assertThat(item.getValue()).isCloseTo(50.0, within(1e-9));
        assertThat(item.getObservedAt()).isEqualTo(TODAY);
    }

    @Test
    void collect_frequencyCreditCapped() {
        when(reportStore.findByFarmer("F1", TODAY.minusDays(365), TODAY)).thenReturn(reports(30, 30));

        assertThat(adapter.collect("F1", TODAY).getValue()).isCloseTo(100.0, within(1e-9));
    }

    @Test
    void collect_satelliteCorroborationCounts() {
        List<GroundTruthReport> reports = reports(2, 0);
        reports.get(1).setSatelliteCorroborated(true);
        when(reportStore.findByFarmer("F1", TODAY.minusDays(365), TODAY)).thenReturn(reports);

        // 0.4 * (100 * 2/12) + 0.6 * 50
        assertThat(adapter.collect("F1", TODAY).getValue()).isCloseTo(0.4 * 100.0 / 6.0 + 30.0, within(1e-9));
    }

    @Test
    void collect_noReports_availableAtZero() {
        when(reportStore.findByFarmer("F9", TODAY.minusDays(365), TODAY)).thenReturn(List.of());

        EvidenceItem item = adapter.collect("F9", TODAY);

        assertThat(item.isAvailable()).isTrue();
        assertThat(item.getValue()).isEqualTo(0.0);
        assertThat(item.getDetail()).isInstanceOfSatisfying(EvidenceDetail.GroundTruthHistory.class,
                d -> assertThat(d.reportsSubmitted()).isZero());
        assertThat(item.getReason()).contains("No ground-truth reports");
    }
}
