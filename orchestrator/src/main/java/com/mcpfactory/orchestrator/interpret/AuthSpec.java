package com.mcpfactory.orchestrator.interpret;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Set;

/**
 * How the generated server authenticates against the upstream API.
 *
 * @param type       none | bearer | api_key | oauth2
 * @param envVar     environment variable holding the credential
 * @param headerName header used for api_key auth (X-API-Key when absent)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AuthSpec(String type, String envVar, String headerName) {

    public static final String NONE    = "none";
    public static final String BEARER  = "bearer";
    public static final String API_KEY = "api_key";
    public static final String OAUTH2  = "oauth2";

    public static final Set<String> TYPES = Set.of(NONE, BEARER, API_KEY, OAUTH2);

    public AuthSpec {
        if (type == null || type.isBlank()) type = NONE;
    }

    public static AuthSpec none() {
        return new AuthSpec(NONE, null, null);
    }

    public boolean required() {
        return !NONE.equals(type);
    }

    public boolean hasEnvVar() {
        return envVar != null && !envVar.isBlank();
    }

    public String headerNameOrDefault() {
        return headerName == null || headerName.isBlank() ? "X-API-Key" : headerName;
    }
}
