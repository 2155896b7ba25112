package com.mcpfactory.orchestrator.interpret;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * A read-only resource, addressed by a URI template such as
 * {@code weather://{city}/current}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ResourceSpec(
        String name,
        String uriTemplate,
        String description,
        String mimeType
) {
    public static final String DEFAULT_MIME_TYPE = "application/json";

    public String mimeTypeOrDefault() {
        return mimeType == null || mimeType.isBlank() ? DEFAULT_MIME_TYPE : mimeType;
    }
}
