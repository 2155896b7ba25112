package com.mcpfactory.orchestrator.registry;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + lookups for the registered_servers table.
 * Filtered listing goes through {@link JpaSpecificationExecutor}.
 */
public interface RegisteredServerRepository
        extends JpaRepository<RegisteredServer, UUID>, JpaSpecificationExecutor<RegisteredServer> {

    Optional<RegisteredServer> findByName(String name);

    Optional<RegisteredServer> findByNameAndVersion(String name, String version);
}
