package com.mcpfactory.orchestrator.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mcpfactory.orchestrator.registry.RegistrationResult.Action;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Persistent catalogue of generated servers, keyed by unique name.
 *
 * The schema is owned by Flyway and exists before this bean is created;
 * there is no lazy initialisation here.
 */
@Service
@Profile("!standalone")
public class ServerRegistry {

    private static final Logger log = LoggerFactory.getLogger(ServerRegistry.class);

    private static final Sort MOST_RECENTLY_UPDATED = Sort.by(Sort.Direction.DESC, "updatedAt");
    private static final char LIKE_ESCAPE           = '\\';

    private final RegisteredServerRepository repo;
    private final ObjectMapper               json;

    public ServerRegistry(RegisteredServerRepository repo, ObjectMapper objectMapper) {
        this.repo = repo;
        this.json = objectMapper;
    }

    // ------------------------------------------------------------------
    // Writes
    // ------------------------------------------------------------------

    /**
     * Insert a new server or update the existing row with the same name.
     * The row id is kept on update.
     */
    @Transactional
    public RegistrationResult registerOrUpdate(RegistrationRequest request) {
        if (request.name() == null || request.name().isBlank()) {
            throw new IllegalArgumentException("Server name is required");
        }

        Optional<RegisteredServer> existing = repo.findByName(request.name());
        RegisteredServer server = existing.orElseGet(() -> new RegisteredServer(request.name()));
        server.setVersion(request.version());
        server.setDescription(request.description());
        server.setSpecJson(toJson(request.spec()));
        server.setPackagePath(request.packagePath());
        server.setDockerImage(request.dockerImage());
        server.setClientConfigJson(toJson(request.clientConfig()));
        RegisteredServer saved = repo.save(server);

        Action action = existing.isPresent() ? Action.UPDATED : Action.CREATED;
        log.info("{} server {}@{}", action == Action.CREATED ? "Registered" : "Updated",
                saved.getName(), saved.getVersion());
        return new RegistrationResult(idOf(saved), saved.getName(), saved.getVersion(), action);
    }

    /** @return false if no server with this name exists */
    @Transactional
    public boolean remove(String name) {
        Optional<RegisteredServer> existing = repo.findByName(name);
        if (existing.isEmpty()) {
            return false;
        }
        repo.delete(existing.get());
        log.info("Removed server {}", name);
        return true;
    }

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    /** Look up by name, optionally pinned to a version. */
    @Transactional(readOnly = true)
    public Optional<ServerEntry> find(String name, String version) {
        Optional<RegisteredServer> server = (version == null || version.isBlank())
                ? repo.findByName(name)
                : repo.findByNameAndVersion(name, version);
        return server.map(this::toEntry);
    }

    /** Servers matching the filter, most recently updated first. */
    @Transactional(readOnly = true)
    public List<ServerEntry> enumerate(ServerFilter filter) {
        Specification<RegisteredServer> spec = (root, query, cb) -> cb.conjunction();
        if (filter.nameContains() != null && !filter.nameContains().isBlank()) {
            String pattern = "%" + escapeLike(filter.nameContains()) + "%";
            spec = spec.and((root, query, cb) -> cb.like(root.get("name"), pattern, LIKE_ESCAPE));
        }
        if (filter.version() != null && !filter.version().isBlank()) {
            String version = filter.version();
            spec = spec.and((root, query, cb) -> cb.equal(root.get("version"), version));
        }

        List<RegisteredServer> rows = (filter.limit() != null && filter.limit() > 0)
                ? repo.findAll(spec, PageRequest.of(0, filter.limit(), MOST_RECENTLY_UPDATED)).getContent()
                : repo.findAll(spec, MOST_RECENTLY_UPDATED);
        return rows.stream().map(this::toEntry).toList();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    // Search terms match literally; % and _ are not wildcards.
    static String escapeLike(String term) {
        StringBuilder out = new StringBuilder(term.length());
        for (char c : term.toCharArray()) {
            if (c == LIKE_ESCAPE || c == '%' || c == '_') {
                out.append(LIKE_ESCAPE);
            }
            out.append(c);
        }
        return out.toString();
    }

    private ServerEntry toEntry(RegisteredServer s) {
        return new ServerEntry(
                idOf(s),
                s.getName(),
                s.getVersion(),
                s.getDescription(),
                fromJson(s.getSpecJson()),
                s.getPackagePath(),
                s.getDockerImage(),
                fromJson(s.getClientConfigJson()),
                s.getCreatedAt(),
                s.getUpdatedAt());
    }

    private String toJson(Object value) {
        if (value == null) return null;
        try {
            return json.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize registry payload: " + e.getOriginalMessage(), e);
        }
    }

    private JsonNode fromJson(String value) {
        if (value == null || value.isBlank()) {
            return json.createObjectNode();
        }
        try {
            return json.readTree(value);
        } catch (JsonProcessingException e) {
            log.warn("Stored JSON is unreadable, returning it as text: {}", e.getOriginalMessage());
            return json.getNodeFactory().textNode(value);
        }
    }

    private static String idOf(RegisteredServer s) {
        return s.getId() == null ? null : s.getId().toString();
    }
}
