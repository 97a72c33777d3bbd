package com.croppulse.decision.engine.evidence;

import com.croppulse.decision.model.ProofOfAction;

import java.time.LocalDate;
import java.util.List;

public interface ActionStore {

    /** Submitted proof-of-action records of a farmer with an action date in [from, to]. */
    List<ProofOfAction> findByFarmer(String farmerId, LocalDate from, LocalDate to);
}
