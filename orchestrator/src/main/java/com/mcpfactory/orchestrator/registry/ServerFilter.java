package com.mcpfactory.orchestrator.registry;

/**
 * Criteria for {@link ServerRegistry#enumerate}. Null fields do not filter.
 *
 * @param nameContains substring of the server name
 * @param version      exact version
 * @param limit        maximum rows, or null for all
 */
public record ServerFilter(String nameContains, String version, Integer limit) {

    public static ServerFilter all() {
        return new ServerFilter(null, null, null);
    }
}
