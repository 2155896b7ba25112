package com.mcpfactory.orchestrator.interpret;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Structured description of the server to build: the interpreter's output and
 * the generator's input.
 *
 * Missing optional fields are defaulted here (version 1.0.0, runtime
 * typescript, no auth, no resources). Required fields are left as parsed so
 * {@link SpecValidator} can report them.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ServerSpec(
        String             name,
        String             description,
        String             version,
        String             runtime,
        AuthSpec           auth,
        List<ToolSpec>     tools,
        List<ResourceSpec> resources
) {
    public static final String DEFAULT_VERSION = "1.0.0";
    public static final String DEFAULT_RUNTIME = "typescript";

    public ServerSpec {
        if (version == null || version.isBlank()) version = DEFAULT_VERSION;
        if (runtime == null || runtime.isBlank()) runtime = DEFAULT_RUNTIME;
        if (auth == null) auth = AuthSpec.none();
        tools     = tools == null ? List.of() : List.copyOf(tools);
        resources = resources == null ? List.of() : List.copyOf(resources);
    }

    /** The requested runtime always wins over whatever the model put in the reply. */
    public ServerSpec withRuntime(String runtime) {
        return new ServerSpec(name, description, version, runtime, auth, tools, resources);
    }

    /** Package / directory name of the generated server. */
    public String packageName() {
        return "mcp-" + name;
    }
}
