package com.medassist.model;

/**
 * Ranked hit returned by the retrieval collaborator.
 */
public record EvidenceHit(String content, EvidenceRef source, double score) {
}
