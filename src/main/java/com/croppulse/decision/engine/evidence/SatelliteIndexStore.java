package com.croppulse.decision.engine.evidence;

import com.croppulse.decision.model.SatelliteScan;

import java.time.LocalDate;
import java.util.Optional;

public interface SatelliteIndexStore {

    /**
     * Most recent completed scan of the farm with a scan date in [from, to], or empty.
     */
    Optional<SatelliteScan> findLatestCompletedScan(String farmId, LocalDate from, LocalDate to);
}
