package com.mcpfactory.orchestrator.generator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mcpfactory.orchestrator.interpret.AuthSpec;
import com.mcpfactory.orchestrator.interpret.ParameterSpec;
import com.mcpfactory.orchestrator.interpret.ResourceSpec;
import com.mcpfactory.orchestrator.interpret.ServerSpec;
import com.mcpfactory.orchestrator.interpret.ToolSpec;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Source templates for a TypeScript MCP server.
 *
 * Placeholders are {@code {{UPPER_CASE}}} and are filled in a single pass, so
 * user text that happens to contain a placeholder is never expanded again.
 * Every user-supplied string goes through {@link #tsString} before it lands
 * inside a TypeScript literal.
 */
class TypeScriptTemplates {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{([A-Z_]+)}}");
    private static final Pattern IDENTIFIER  = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*");
    private static final Pattern URI_PARAM   = Pattern.compile("\\{(\\w+)}");

    private final ObjectMapper json;

    TypeScriptTemplates(ObjectMapper json) {
        this.json = json;
    }

    // ------------------------------------------------------------------
    // src/index.ts
    // ------------------------------------------------------------------

    private static final String INDEX = """
            import { Server } from '@modelcontextprotocol/sdk/server/index.js';
            import { StdioServerTransport } from '@modelcontextprotocol/sdk/server/stdio.js';
            import {
              CallToolRequestSchema,
              ListToolsRequestSchema,{{RESOURCE_SCHEMAS}}
            } from '@modelcontextprotocol/sdk/types.js';
            import { ApiClient } from './client';
            {{IMPORTS}}
            const server = new Server(
              { name: '{{PACKAGE}}', version: '{{VERSION}}' },
              { capabilities: { tools: {}, resources: {} } }
            );

            const client = new ApiClient();

            // List available tools
            server.setRequestHandler(ListToolsRequestSchema, async () => ({
              tools: [
            {{TOOL_DEFINITIONS}}
              ]
            }));

            // Handle tool calls
            server.setRequestHandler(CallToolRequestSchema, async (request) => {
              const { name, arguments: args } = request.params;

              switch (name) {
            {{TOOL_CASES}}
                default:
                  throw new Error(`Unknown tool: ${name}`);
              }
            });
            {{RESOURCE_HANDLERS}}
            async function main() {
              const transport = new StdioServerTransport();
              await server.connect(transport);
              console.error('{{PACKAGE}} running on stdio');
            }

            main().catch((error) => {
              console.error(error);
              process.exit(1);
            });
            """;

    private static final String RESOURCE_HANDLERS = """

            // List resource templates
            server.setRequestHandler(ListResourceTemplatesRequestSchema, async () => ({
              resourceTemplates: [
            {{TEMPLATES}}
              ]
            }));

            const resourceReaders = [{{READERS}}];

            // Read a resource: the first reader whose URI pattern matches wins
            server.setRequestHandler(ReadResourceRequestSchema, async (request) => {
              const uri = request.params.uri;
              for (const read of resourceReaders) {
                const result = await read(client, uri);
                if (result) return result;
              }
              throw new Error(`Unknown resource: ${uri}`);
            });
            """;

    String index(ServerSpec spec) {
        StringBuilder imports = new StringBuilder();
        for (ToolSpec t : spec.tools()) {
            imports.append("import { ").append(t.name()).append("Tool } from './tools/")
                   .append(t.name()).append("';\n");
        }
        for (ResourceSpec r : spec.resources()) {
            imports.append("import { ").append(r.name()).append("Resource } from './resources/")
                   .append(r.name()).append("';\n");
        }

        String toolDefinitions = spec.tools().stream()
                .map(this::toolDefinition)
                .collect(Collectors.joining(",\n"));

        String toolCases = spec.tools().stream()
                .map(t -> "    case '" + t.name() + "':\n      return " + t.name() + "Tool(client, args);")
                .collect(Collectors.joining("\n"));

        boolean hasResources = !spec.resources().isEmpty();
        String resourceHandlers = hasResources ? fill(RESOURCE_HANDLERS, Map.of(
                "TEMPLATES", spec.resources().stream()
                        .map(TypeScriptTemplates::resourceTemplate)
                        .collect(Collectors.joining(",\n")),
                "READERS", spec.resources().stream()
                        .map(r -> r.name() + "Resource")
                        .collect(Collectors.joining(", "))
        )) : "";

        return fill(INDEX, Map.of(
                "RESOURCE_SCHEMAS", hasResources
                        ? "\n  ListResourceTemplatesRequestSchema,\n  ReadResourceRequestSchema," : "",
                "IMPORTS",           imports.toString(),
                "PACKAGE",           tsString(spec.packageName()),
                "VERSION",           tsString(spec.version()),
                "TOOL_DEFINITIONS",  toolDefinitions,
                "TOOL_CASES",        toolCases,
                "RESOURCE_HANDLERS", resourceHandlers
        ));
    }

    private String toolDefinition(ToolSpec tool) {
        String properties = tool.parameters().stream()
                .map(this::schemaProperty)
                .collect(Collectors.joining(",\n"));
        String required = tool.parameters().stream()
                .filter(ParameterSpec::required)
                .map(p -> "'" + tsString(p.name()) + "'")
                .collect(Collectors.joining(", "));

        return "    {\n"
             + "      name: '" + tool.name() + "',\n"
             + "      description: '" + tsString(tool.description()) + "',\n"
             + "      inputSchema: {\n"
             + "        type: 'object',\n"
             + "        properties: {\n"
             + (properties.isEmpty() ? "" : properties + "\n")
             + "        },\n"
             + "        required: [" + required + "]\n"
             + "      }\n"
             + "    }";
    }

    private String schemaProperty(ParameterSpec p) {
        StringBuilder sb = new StringBuilder("          ")
                .append(propertyKey(p.name()))
                .append(": { type: '").append(tsString(p.type())).append("'");
        if (p.description() != null && !p.description().isBlank()) {
            sb.append(", description: '").append(tsString(p.description())).append("'");
        }
        if (p.enumValues() != null && !p.enumValues().isEmpty()) {
            sb.append(", enum: [").append(quotedList(p.enumValues())).append("]");
        }
        return sb.append(" }").toString();
    }

    private static String resourceTemplate(ResourceSpec r) {
        return "    {\n"
             + "      uriTemplate: '" + tsString(r.uriTemplate()) + "',\n"
             + "      name: '" + tsString(r.name()) + "',\n"
             + "      description: '" + tsString(r.description()) + "',\n"
             + "      mimeType: '" + tsString(r.mimeTypeOrDefault()) + "'\n"
             + "    }";
    }

    // ------------------------------------------------------------------
    // src/schemas.ts
    // ------------------------------------------------------------------

    String schemas(ServerSpec spec) {
        String body = spec.tools().stream()
                .map(this::toolSchema)
                .collect(Collectors.joining("\n\n"));
        return "import { z } from 'zod';\n\n" + body + "\n";
    }

    private String toolSchema(ToolSpec tool) {
        String props = tool.parameters().stream()
                .map(p -> "  " + propertyKey(p.name()) + ": " + zodType(p))
                .collect(Collectors.joining(",\n"));
        return "export const " + tool.name() + "Schema = z.object({\n"
             + (props.isEmpty() ? "" : props + "\n")
             + "});\n\n"
             + "export type " + pascalCase(tool.name()) + "Input = z.infer<typeof " + tool.name() + "Schema>;";
    }

    private String zodType(ParameterSpec p) {
        String zod;
        if (p.enumValues() != null && !p.enumValues().isEmpty()) {
            zod = "z.enum([" + quotedList(p.enumValues()) + "])";
        } else {
            zod = switch (p.type().toLowerCase(Locale.ROOT)) {
                case "number", "integer" -> "z.number()";
                case "boolean"           -> "z.boolean()";
                case "array"             -> "z.array(z.unknown())";
                case "object"            -> "z.record(z.unknown())";
                default                  -> "z.string()";
            };
        }
        if (!p.required()) zod += ".optional()";
        if (p.defaultValue() != null) zod += ".default(" + jsonLiteral(p.defaultValue()) + ")";
        return zod;
    }

    // ------------------------------------------------------------------
    // src/client.ts
    // ------------------------------------------------------------------

    private static final String CLIENT = """
            export class ApiClient {
              private baseUrl: string;
              private headers: Record<string, string>;

              constructor(baseUrl?: string) {
                this.baseUrl = baseUrl || process.env.API_BASE_URL || '';
                this.headers = { 'Content-Type': 'application/json' };{{AUTH}}
              }

              async get<T>(path: string): Promise<T> {
                return this.request<T>('GET', path);
              }

              async post<T>(path: string, body: unknown): Promise<T> {
                return this.request<T>('POST', path, body);
              }

              async put<T>(path: string, body: unknown): Promise<T> {
                return this.request<T>('PUT', path, body);
              }

              async delete<T>(path: string): Promise<T> {
                return this.request<T>('DELETE', path);
              }

              private async request<T>(method: string, path: string, body?: unknown): Promise<T> {
                const res = await fetch(`${this.baseUrl}${path}`, {
                  method,
                  headers: this.headers,
                  body: body === undefined ? undefined : JSON.stringify(body)
                });
                if (!res.ok) throw new Error(`API error: ${res.status}`);
                return (await res.json()) as T;
              }
            }
            """;

    String client(ServerSpec spec) {
        AuthSpec auth = spec.auth();
        String setup = "";
        if (auth.hasEnvVar()) {
            String env = auth.envVar();
            setup = switch (auth.type()) {
                case AuthSpec.BEARER, AuthSpec.OAUTH2 ->
                        "\n    this.headers['Authorization'] = `Bearer ${process.env." + env + " ?? ''}`;";
                case AuthSpec.API_KEY ->
                        "\n    this.headers['" + tsString(auth.headerNameOrDefault()) + "'] = process.env." + env + " ?? '';";
                default -> "";
            };
        }
        return fill(CLIENT, Map.of("AUTH", setup));
    }

    // ------------------------------------------------------------------
    // src/tools/<tool>.ts and src/resources/<resource>.ts
    // ------------------------------------------------------------------

    private static final String TOOL = """
            import { ApiClient } from '../client';
            import { {{NAME}}Schema } from '../schemas';

            export async function {{NAME}}Tool(client: ApiClient, args: unknown) {
              const input = {{NAME}}Schema.parse(args);

              // Replace with the upstream call, e.g. await client.get(`/endpoint`)
              return {
                content: [
                  {
                    type: 'text',
                    text: JSON.stringify({ success: true, tool: '{{NAME}}', input })
                  }
                ]
              };
            }
            """;

    private static final String RESOURCE = """
            import { ApiClient } from '../client';

            // {{TEMPLATE}}
            const URI_PATTERN = /^{{PATTERN}}$/;

            export async function {{NAME}}Resource(client: ApiClient, uri: string) {
              const match = uri.match(URI_PATTERN);
              if (!match) return null;
              const params = match.groups ?? {};

              // Replace with the upstream fetch, e.g. await client.get(`/path/${params.id}`)
              return {
                contents: [
                  {
                    uri,
                    mimeType: '{{MIME}}',
                    text: JSON.stringify({ resource: '{{NAME}}', params })
                  }
                ]
              };
            }
            """;

    String tool(ToolSpec tool) {
        return fill(TOOL, Map.of("NAME", tool.name()));
    }

    String resource(ResourceSpec resource) {
        return fill(RESOURCE, Map.of(
                "NAME",     resource.name(),
                "TEMPLATE", resource.uriTemplate().replace("\n", " "),
                "PATTERN",  uriPattern(resource.uriTemplate()),
                "MIME",     tsString(resource.mimeTypeOrDefault())
        ));
    }

    // ------------------------------------------------------------------
    // README.md and Dockerfile
    // ------------------------------------------------------------------

    String readme(ServerSpec spec, String indexJsPath, String clientConfigJson) {
        StringBuilder sb = new StringBuilder();
        sb.append("# MCP ").append(spec.name()).append("\n\n")
          .append(spec.description()).append("\n\n")
          .append("## Installation\n\n```bash\nnpm install\nnpm run build\n```\n\n")
          .append("## Configuration\n\n");
        if (spec.auth().hasEnvVar()) {
            sb.append("Set the `").append(spec.auth().envVar())
              .append("` environment variable with your API credential.\n\n");
        } else {
            sb.append("No authentication required.\n\n");
        }
        sb.append("## Claude Desktop Setup\n\n")
          .append("Add to your Claude Desktop config. The server entry point is `")
          .append(indexJsPath).append("`.\n\n")
          .append("```json\n").append(clientConfigJson.strip()).append("\n```\n\n")
          .append("## Available Tools\n\n");
        for (ToolSpec t : spec.tools()) {
            sb.append("### ").append(t.name()).append("\n").append(t.description()).append("\n\n");
        }
        sb.append("## Resources\n\n");
        if (spec.resources().isEmpty()) {
            sb.append("None\n");
        }
        for (ResourceSpec r : spec.resources()) {
            sb.append("### ").append(r.name()).append("\n")
              .append("URI: `").append(r.uriTemplate()).append("`\n");
            if (r.description() != null) sb.append(r.description()).append("\n");
            sb.append("\n");
        }
        return sb.toString();
    }

    String dockerfile(ServerSpec spec) {
        StringBuilder sb = new StringBuilder()
                .append("FROM node:20-alpine\n")
                .append("WORKDIR /app\n")
                .append("COPY package*.json ./\n")
                .append("RUN npm ci --omit=dev\n")
                .append("COPY dist/ ./dist/\n");
        if (spec.auth().hasEnvVar()) {
            sb.append("ENV ").append(spec.auth().envVar()).append("=\"\"\n");
        }
        return sb.append("CMD [\"node\", \"dist/index.js\"]\n").toString();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    static String fill(String template, Map<String, String> values) {
        Matcher m = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            String value = values.get(m.group(1));
            if (value == null) {
                throw new IllegalArgumentException("No value for placeholder " + m.group());
            }
            m.appendReplacement(out, Matcher.quoteReplacement(value));
        }
        m.appendTail(out);
        return out.toString();
    }

    /** Escape for a single-quoted TypeScript string literal. */
    static String tsString(String s) {
        if (s == null) return "";
        return s.replace("\\", "\\\\")
                .replace("'", "\\'")
                .replace("\r", "\\r")
                .replace("\n", "\\n");
    }

    /** {@code weather://{city}/now} becomes {@code weather:\/\/(?<city>[^/]+)\/now}. */
    static String uriPattern(String uriTemplate) {
        StringBuilder out = new StringBuilder();
        Matcher m = URI_PARAM.matcher(uriTemplate);
        int last = 0;
        while (m.find()) {
            out.append(escapeJsRegex(uriTemplate.substring(last, m.start())));
            out.append("(?<").append(m.group(1)).append(">[^/]+)");
            last = m.end();
        }
        out.append(escapeJsRegex(uriTemplate.substring(last)));
        return out.toString();
    }

    static String pascalCase(String snake) {
        return Arrays.stream(snake.split("_"))
                .filter(s -> !s.isEmpty())
                .map(s -> Character.toUpperCase(s.charAt(0)) + s.substring(1))
                .collect(Collectors.joining());
    }

    private static String escapeJsRegex(String literal) {
        StringBuilder sb = new StringBuilder();
        for (char c : literal.toCharArray()) {
            if ("\\^$.|?*+()[]{}/".indexOf(c) >= 0) sb.append('\\');
            sb.append(c);
        }
        return sb.toString();
    }

    private static String propertyKey(String name) {
        return IDENTIFIER.matcher(name).matches() ? name : "'" + tsString(name) + "'";
    }

    private static String quotedList(List<String> values) {
        return values.stream()
                .map(v -> "'" + tsString(v) + "'")
                .collect(Collectors.joining(", "));
    }

    private String jsonLiteral(Object value) {
        try {
            return json.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new GenerationException("Cannot render default value " + value, e);
        }
    }
}
