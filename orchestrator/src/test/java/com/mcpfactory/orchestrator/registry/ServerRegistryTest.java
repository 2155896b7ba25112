package com.mcpfactory.orchestrator.registry;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mcpfactory.orchestrator.TestSpecs;
import com.mcpfactory.orchestrator.registry.RegistrationResult.Action;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for ServerRegistry against a mocked repository.
 */
@ExtendWith(MockitoExtension.class)
class ServerRegistryTest {

    @Mock RegisteredServerRepository repo;

    ServerRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ServerRegistry(repo, new ObjectMapper());
    }

    // ------------------------------------------------------------------
    // registerOrUpdate
    // ------------------------------------------------------------------

    @Test
    void registerOrUpdate_newName_createsRow() {
        UUID id = UUID.randomUUID();
        when(repo.findByName("weather")).thenReturn(Optional.empty());
        when(repo.save(any(RegisteredServer.class))).thenAnswer(inv -> withId(inv.getArgument(0), id));

        RegistrationResult result = registry.registerOrUpdate(request("weather", "1.0.0"));

        assertThat(result.action()).isEqualTo(Action.CREATED);
        assertThat(result.id()).isEqualTo(id.toString());
        assertThat(result.name()).isEqualTo("weather");

        ArgumentCaptor<RegisteredServer> saved = ArgumentCaptor.forClass(RegisteredServer.class);
        verify(repo).save(saved.capture());
        assertThat(saved.getValue().getSpecJson()).contains("\"get_forecast\"");
        assertThat(saved.getValue().getClientConfigJson()).contains("\"command\":\"node\"");
    }

    @Test
    void registerOrUpdate_existingName_updatesInPlaceAndKeepsId() {
        UUID id = UUID.randomUUID();
        RegisteredServer row = withId(new RegisteredServer("weather"), id);
        row.setVersion("1.0.0");
        when(repo.findByName("weather")).thenReturn(Optional.of(row));
        when(repo.save(row)).thenReturn(row);

        RegistrationResult result = registry.registerOrUpdate(request("weather", "1.1.0"));

        assertThat(result.action()).isEqualTo(Action.UPDATED);
        assertThat(result.id()).isEqualTo(id.toString());
        assertThat(result.version()).isEqualTo("1.1.0");
        assertThat(row.getVersion()).isEqualTo("1.1.0");
        verify(repo, times(1)).save(any());
    }

    @Test
    void registerOrUpdate_blankName_isRejected() {
        assertThatThrownBy(() -> registry.registerOrUpdate(request(" ", "1.0.0")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("name is required");
        verify(repo, never()).save(any());
    }

    @Test
    void registrationRequest_defaultsVersion() {
        assertThat(request("weather", null).version()).isEqualTo("1.0.0");
    }

    // ------------------------------------------------------------------
    // remove / find
    // ------------------------------------------------------------------

    @Test
    void remove_existing_returnsTrue() {
        RegisteredServer row = new RegisteredServer("weather");
        when(repo.findByName("weather")).thenReturn(Optional.of(row));

        assertThat(registry.remove("weather")).isTrue();
        verify(repo).delete(row);
    }

    @Test
    void remove_unknown_returnsFalse() {
        when(repo.findByName("nope")).thenReturn(Optional.empty());

        assertThat(registry.remove("nope")).isFalse();
        verify(repo, never()).delete(any(RegisteredServer.class));
    }

    @Test
    void find_withoutVersion_looksUpByName() {
        RegisteredServer row = withId(new RegisteredServer("weather"), UUID.randomUUID());
        row.setVersion("1.0.0");
        row.setSpecJson("{\"name\":\"weather\"}");
        row.setClientConfigJson("{\"weather\":{\"command\":\"node\"}}");
        when(repo.findByName("weather")).thenReturn(Optional.of(row));

        ServerEntry entry = registry.find("weather", null).orElseThrow();

        assertThat(entry.spec().path("name").asText()).isEqualTo("weather");
        assertThat(entry.claudeConfig().path("weather").path("command").asText()).isEqualTo("node");
        verify(repo, never()).findByNameAndVersion(any(), any());
    }

    @Test
    void find_withVersion_pinsVersion() {
        when(repo.findByNameAndVersion("weather", "2.0.0")).thenReturn(Optional.empty());

        assertThat(registry.find("weather", "2.0.0")).isEmpty();
    }

    @Test
    void find_unreadableStoredJson_isReturnedAsText() {
        RegisteredServer row = new RegisteredServer("weather");
        row.setSpecJson("{not json");
        when(repo.findByName("weather")).thenReturn(Optional.of(row));

        ServerEntry entry = registry.find("weather", "").orElseThrow();

        assertThat(entry.spec().isTextual()).isTrue();
        assertThat(entry.claudeConfig().isEmpty()).isTrue();
    }

    // ------------------------------------------------------------------
    // enumerate
    // ------------------------------------------------------------------

    @Test
    @SuppressWarnings("unchecked")
    void enumerate_withLimit_usesPage() {
        RegisteredServer row = new RegisteredServer("weather");
        when(repo.findAll(any(Specification.class), any(Pageable.class)))
                .thenReturn(new PageImpl<>(List.of(row)));

        List<ServerEntry> entries = registry.enumerate(new ServerFilter("wea", null, 10));

        assertThat(entries).extracting(ServerEntry::name).containsExactly("weather");
        ArgumentCaptor<Pageable> page = ArgumentCaptor.forClass(Pageable.class);
        verify(repo).findAll(any(Specification.class), page.capture());
        assertThat(page.getValue().getPageSize()).isEqualTo(10);
        assertThat(page.getValue().getSort().getOrderFor("updatedAt")).isNotNull();
    }

    @Test
    @SuppressWarnings("unchecked")
    void enumerate_withoutLimit_returnsAllSorted() {
        when(repo.findAll(any(Specification.class), any(Sort.class))).thenReturn(List.of());

        assertThat(registry.enumerate(ServerFilter.all())).isEmpty();
        verify(repo).findAll(any(Specification.class), any(Sort.class));
    }

    @Test
    void escapeLike_escapesWildcardsAndEscapeChar() {
        assertThat(ServerRegistry.escapeLike("100%_done\\x")).isEqualTo("100\\%\\_done\\\\x");
        assertThat(ServerRegistry.escapeLike("weather")).isEqualTo("weather");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static RegistrationRequest request(String name, String version) {
        return new RegistrationRequest(name, version, "Weather lookups", TestSpecs.weather(),
                "/packages/mcp-weather-1.0.0.tgz", null,
                Map.of("weather", Map.of("command", "node", "args", List.of("dist/index.js"))));
    }

    private static RegisteredServer withId(RegisteredServer server, UUID id) {
        ReflectionTestUtils.setField(server, "id", id);
        return server;
    }
}
