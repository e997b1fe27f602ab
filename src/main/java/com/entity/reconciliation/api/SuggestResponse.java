package com.entity.reconciliation.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Result list of a suggest call.
 */
public record SuggestResponse<T>(@JsonProperty("result") List<T> result) {
}
