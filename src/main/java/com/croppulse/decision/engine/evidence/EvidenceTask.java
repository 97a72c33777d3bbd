package com.croppulse.decision.engine.evidence;

import com.croppulse.decision.model.EvidenceItem;
import com.croppulse.decision.model.SourceKind;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * One independent evidence query. {@code factors} names the items the call is expected
 * to produce, so the fetcher can report each of them unavailable if the call fails.
 */
public record EvidenceTask(SourceKind source, List<String> factors, Callable<List<EvidenceItem>> call) {

    public static EvidenceTask single(SourceKind source, String factor, Callable<EvidenceItem> call) {
        return new EvidenceTask(source, List.of(factor), () -> List.of(call.call()));
    }
}
