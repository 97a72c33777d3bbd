package com.croppulse.decision.engine.evidence;

import com.croppulse.decision.model.Farm;
import com.croppulse.decision.model.FarmerRecord;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the farm/record registry.
 */
public interface FarmRegistry {

    Optional<FarmerRecord> findFarmer(String farmerId);

    Optional<Farm> findFarm(String farmId);

    /**
     * Nearest registered farms to {@code origin}, closest first, excluding the origin
     * and any other farm of the same farmer.
     */
    List<Farm> findNearestFarms(Farm origin, int limit);
}
