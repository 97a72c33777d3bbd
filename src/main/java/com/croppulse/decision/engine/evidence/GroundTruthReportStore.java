package com.croppulse.decision.engine.evidence;

import com.croppulse.decision.model.GroundTruthReport;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

public interface GroundTruthReportStore {

    /** Reports submitted by a farmer and observed in [from, to]. */
    List<GroundTruthReport> findByFarmer(String farmerId, LocalDate from, LocalDate to);

    /** Reports filed for any of the given farms and observed in [from, to]. */
    List<GroundTruthReport> findByFarms(Collection<String> farmIds, LocalDate from, LocalDate to);
}
