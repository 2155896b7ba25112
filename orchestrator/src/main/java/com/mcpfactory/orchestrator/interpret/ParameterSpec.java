package com.mcpfactory.orchestrator.interpret;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One input parameter of a tool.
 *
 * @param type         string | number | boolean | array | object
 * @param enumValues   allowed values, or null when unrestricted
 * @param defaultValue default used when the caller omits the parameter
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ParameterSpec(
        String       name,
        String       type,
        boolean      required,
        String       description,
        @JsonProperty("enum")    List<String> enumValues,
        @JsonProperty("default") Object       defaultValue
) {
    public ParameterSpec {
        if (type == null || type.isBlank()) type = "string";
    }
}
