package com.entity.reconciliation.api;

import com.entity.reconciliation.core.model.Candidate;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Candidates of one query within a reconciliation batch.
 */
public record QueryResult(@JsonProperty("result") List<Candidate> result) {
}
