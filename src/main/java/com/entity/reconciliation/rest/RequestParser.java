package com.entity.reconciliation.rest;

import com.entity.reconciliation.api.ExtendRequest;
import com.entity.reconciliation.core.model.QueryRequest;
import com.entity.reconciliation.store.InputSanitizer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * JSON handling of the REST resource: parses the {@code queries} and {@code extend}
 * parameters and renders response bodies, optionally wrapped for JSONP.
 */
public class RequestParser {

    private static final TypeReference<LinkedHashMap<String, QueryRequest>> QUERIES = new TypeReference<>() {};
    private static final Pattern CALLBACK = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$.]{0,127}");

    private final ObjectMapper mapper;

    public RequestParser() {
        this(new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false));
    }

    public RequestParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Parses a query batch: an object mapping query ids to queries.
     *
     * @throws IllegalArgumentException if the JSON is malformed or a query text is longer
     *                                  than {@link InputSanitizer#MAX_QUERY_LENGTH}
     */
    public Map<String, QueryRequest> parseQueries(String json) {
        try {
            Map<String, QueryRequest> queries = mapper.readValue(json, QUERIES);
            if (queries == null) {
                throw new IllegalArgumentException("Invalid queries: null");
            }
            for (QueryRequest query : queries.values()) {
                if (query != null) {
                    InputSanitizer.checkRequestLength(query.text());
                }
            }
            return queries;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid queries: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * @throws IllegalArgumentException if the JSON is malformed
     */
    public ExtendRequest parseExtend(String json) {
        try {
            ExtendRequest request = mapper.readValue(json, ExtendRequest.class);
            if (request == null) {
                throw new IllegalArgumentException("Invalid extend request: null");
            }
            return request;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid extend request: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Serializes a payload, wrapped as {@code /**}{@code /callback(...);} when a callback is given.
     *
     * @throws IllegalArgumentException if the callback is not a plain JavaScript identifier path
     */
    public String render(Object payload, String callback) {
        String json;
        try {
            json = mapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + payload.getClass().getSimpleName(), e);
        }
        if (!isJsonp(callback)) {
            return json;
        }
        if (!CALLBACK.matcher(callback).matches()) {
            throw new IllegalArgumentException("Invalid JSONP callback name");
        }
        return "/**/" + callback + "(" + json + ");";
    }

    public static boolean isJsonp(String callback) {
        return callback != null && !callback.isEmpty();
    }
}
