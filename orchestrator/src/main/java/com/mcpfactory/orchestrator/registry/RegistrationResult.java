package com.mcpfactory.orchestrator.registry;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Outcome of {@link ServerRegistry#registerOrUpdate}.
 *
 * @param id registry id of the row; stable across updates
 */
public record RegistrationResult(String id, String name, String version, Action action) {

    public enum Action {
        CREATED,
        UPDATED;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
