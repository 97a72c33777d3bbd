package com.croppulse.decision.engine.claim;

import com.croppulse.decision.model.ClaimType;
import com.croppulse.decision.model.Farm;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Validated claim passed to every evidence collector. The farm is resolved from the
 * registry before any evidence is fetched.
 */
@Value
@Builder
public class ClaimContext {
    String claimId;
    String subjectId;
    Farm farm;
    LocalDate claimDate;
    ClaimType claimType;
}
