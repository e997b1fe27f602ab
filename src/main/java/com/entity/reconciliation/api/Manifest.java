package com.entity.reconciliation.api;

import com.entity.reconciliation.core.model.EntityType;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Service manifest returned when the reconciliation endpoint is called without a query.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Manifest(
        @JsonProperty("versions") List<String> versions,
        @JsonProperty("name") String name,
        @JsonProperty("identifierSpace") String identifierSpace,
        @JsonProperty("schemaSpace") String schemaSpace,
        @JsonProperty("defaultTypes") List<EntityType> defaultTypes,
        @JsonProperty("view") View view,
        @JsonProperty("suggest") Suggest suggest,
        @JsonProperty("extend") Extend extend
) {

    public static final List<String> VERSIONS = List.of("0.1", "0.2");

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public record ServiceDefinition(
            @JsonProperty("service_url") String serviceUrl,
            @JsonProperty("service_path") String servicePath
    ) {
    }

    public record Suggest(
            @JsonProperty("entity") ServiceDefinition entity,
            @JsonProperty("type") ServiceDefinition type,
            @JsonProperty("property") ServiceDefinition property
    ) {
    }

    public record Extend(@JsonProperty("propose_properties") ServiceDefinition proposeProperties) {
    }

    public record View(@JsonProperty("url") String url) {
    }
}
