package com.mcpfactory.orchestrator.interpret;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mcpfactory.orchestrator.claude.ClaudeClient;
import com.mcpfactory.orchestrator.claude.ClaudeClient.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * {@link SpecInterpreter} backed by the Anthropic Messages API.
 *
 * One request per job: the extraction prompt plus the user's description.
 * The reply is parsed as JSON, defaulted and validated before it leaves here.
 */
@Component
public class ClaudeSpecInterpreter implements SpecInterpreter {

    private static final Logger log = LoggerFactory.getLogger(ClaudeSpecInterpreter.class);

    static final String EXTRACTION_PROMPT = """
            You are an MCP (Model Context Protocol) specification expert. Extract a structured \
            specification from the user's description.

            Output ONLY valid JSON matching this schema:
            {
              "name": "kebab-case-name",
              "description": "One sentence description",
              "version": "1.0.0",
              "runtime": "typescript",
              "auth": {
                "type": "bearer|api_key|none",
                "env_var": "ENV_VAR_NAME"
              },
              "tools": [
                {
                  "name": "snake_case_name",
                  "description": "What this tool does",
                  "parameters": [
                    {
                      "name": "param_name",
                      "type": "string|number|boolean|array|object",
                      "required": true,
                      "description": "Parameter description",
                      "enum": ["optional", "values"],
                      "default": "optional_default"
                    }
                  ],
                  "returns": "Description of return value"
                }
              ],
              "resources": [
                {
                  "name": "resource_name",
                  "uri_template": "protocol://{param}/path",
                  "description": "What this resource provides",
                  "mime_type": "application/json"
                }
              ]
            }

            Rules:
            1. Infer auth type from API mentions (GitHub/Notion = bearer, etc.)
            2. Generate sensible parameter types and names
            3. Include common CRUD operations if implied
            4. Resources are optional - only include if data retrieval is mentioned
            5. Use snake_case for tool/resource names, kebab-case for package name
            """;

    private final ClaudeClient  claude;
    private final ObjectMapper  objectMapper;
    private final SpecValidator validator;

    public ClaudeSpecInterpreter(ClaudeClient claude,
                                 ObjectMapper objectMapper,
                                 SpecValidator validator) {
        this.claude       = claude;
        this.objectMapper = objectMapper;
        this.validator    = validator;
    }

    @Override
    public ServerSpec interpret(String description, String runtime) {
        if (!claude.isConfigured()) {
            throw new SpecInterpretationException("ANTHROPIC_API_KEY is not configured");
        }

        String prompt = EXTRACTION_PROMPT
                + "\nUser Description:\n" + description
                + "\n\nPreferred runtime: " + runtime;
        String reply = claude.complete(List.of(new Message("user", prompt)));

        ServerSpec spec;
        try {
            spec = objectMapper.readValue(ResponseParser.extractJson(reply), ServerSpec.class);
        } catch (JsonProcessingException e) {
            throw new SpecInterpretationException(
                    "Failed to parse interpreter response as JSON: " + e.getOriginalMessage(), e);
        }
        if (spec == null) {
            throw new SpecInterpretationException("Interpreter returned an empty response");
        }
        spec = spec.withRuntime(runtime);

        List<String> errors = validator.validate(spec);
        if (!errors.isEmpty()) {
            throw new SpecInterpretationException("Spec validation failed: " + String.join(", ", errors));
        }

        log.info("Interpreted spec '{}' v{} with {} tool(s) and {} resource(s)",
                spec.name(), spec.version(), spec.tools().size(), spec.resources().size());
        return spec;
    }
}
