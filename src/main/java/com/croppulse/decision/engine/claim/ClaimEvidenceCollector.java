package com.croppulse.decision.engine.claim;

import com.croppulse.decision.model.EvidenceItem;
import com.croppulse.decision.model.SourceKind;

/**
 * One independent evidence source for claim verification.
 * Each implementation handles a specific SourceKind.
 */
public interface ClaimEvidenceCollector {

    /**
     * The source this collector queries.
     */
    SourceKind getSourceKind();

    /**
     * Claim weight-set factor the produced item feeds.
     */
    String getFactor();

    /**
     * Query the source for the claim. An item that is available carries value 100 when
     * it supports the claim and 0 when it does not; a source with nothing to say returns
     * an unavailable item.
     *
     * @throws com.croppulse.decision.exception.SourceUnavailableException when the backing store fails
     */
    EvidenceItem collect(ClaimContext context);
}
