package com.mcpfactory.orchestrator.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mcpfactory.orchestrator.registry.ServerEntry;
import com.mcpfactory.orchestrator.registry.ServerFilter;
import com.mcpfactory.orchestrator.registry.ServerRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ServerController.class)
class ServerControllerTest {

    @Autowired MockMvc          mockMvc;
    @MockitoBean ServerRegistry registry;

    private final ObjectMapper json = new ObjectMapper();

    @Test
    void list_passesFiltersAndReturnsCount() throws Exception {
        when(registry.enumerate(new ServerFilter("wea", "1.0.0", 5))).thenReturn(List.of(weather()));

        mockMvc.perform(get("/api/servers")
                        .param("name", "wea")
                        .param("version", "1.0.0")
                        .param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.servers[0].name").value("weather"))
                .andExpect(jsonPath("$.servers[0].package_path").value("/packages/mcp-weather-1.0.0.tgz"));
    }

    @Test
    void list_noFilters_enumeratesEverything() throws Exception {
        when(registry.enumerate(ServerFilter.all())).thenReturn(List.of());

        mockMvc.perform(get("/api/servers"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(0));
        verify(registry).enumerate(ServerFilter.all());
    }

    @Test
    void get_existing_returnsClientConfig() throws Exception {
        when(registry.find("weather", null)).thenReturn(Optional.of(weather()));

        mockMvc.perform(get("/api/servers/{name}", "weather"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.spec.name").value("weather"))
                .andExpect(jsonPath("$.claude_config.weather.command").value("node"));
    }

    @Test
    void get_unknown_returns404() throws Exception {
        when(registry.find("nope", "2.0.0")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/servers/{name}", "nope").param("version", "2.0.0"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Server not found: nope"));
    }

    @Test
    void delete_existing_returnsSuccess() throws Exception {
        when(registry.remove("weather")).thenReturn(true);

        mockMvc.perform(delete("/api/servers/{name}", "weather"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.name").value("weather"));
    }

    @Test
    void delete_unknown_returns404() throws Exception {
        when(registry.remove("nope")).thenReturn(false);

        mockMvc.perform(delete("/api/servers/{name}", "nope"))
                .andExpect(status().isNotFound());
    }

    private ServerEntry weather() throws Exception {
        return new ServerEntry("3f0c", "weather", "1.0.0", "Weather lookups",
                json.readTree("{\"name\":\"weather\"}"),
                "/packages/mcp-weather-1.0.0.tgz", null,
                json.readTree("{\"weather\":{\"command\":\"node\",\"args\":[\"dist/index.js\"]}}"),
                Instant.parse("2026-03-01T10:00:00Z"), Instant.parse("2026-03-01T10:00:00Z"));
    }
}
