package com.medassist.service;

import com.medassist.model.EvidenceHit;
import com.medassist.model.RawPatientFacts;

import java.util.List;

/**
 * What the fan-out collected: facts from every patient source that answered (in source
 * order), evidence hits, and the names of sources that failed or timed out.
 */
public record SourceFetchResult(List<RawPatientFacts> facts, List<EvidenceHit> evidence, List<String> degradedSources) {

    public SourceFetchResult {
        facts = List.copyOf(facts);
        evidence = List.copyOf(evidence);
        degradedSources = List.copyOf(degradedSources);
    }

    public boolean isDegraded() {
        return !degradedSources.isEmpty();
    }
}
