package com.mcpfactory.orchestrator.registry;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * A generated server that made it through the whole pipeline.
 *
 * One row per server name: registering the same name again updates the row
 * in place (see {@link ServerRegistry#registerOrUpdate}).
 *
 * DB table: registered_servers  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "registered_servers")
public class RegisteredServer {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, unique = true)
    private String name;

    @Column(nullable = false)
    private String version;

    @Column(columnDefinition = "TEXT")
    private String description;

    // Interpreted spec, serialized as JSON.
    @Column(name = "spec_json", columnDefinition = "TEXT")
    private String specJson;

    @Column(name = "package_path")
    private String packagePath;

    @Column(name = "docker_image")
    private String dockerImage;

    // Claude Desktop mcpServers entry, serialized as JSON.
    @Column(name = "client_config_json", columnDefinition = "TEXT")
    private String clientConfigJson;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    // Called automatically by JPA before every UPDATE.
    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected RegisteredServer() {}   // required by JPA

    public RegisteredServer(String name) {
        this.name = name;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID    getId()               { return id; }
    public String  getName()             { return name; }
    public String  getVersion()          { return version; }
    public String  getDescription()      { return description; }
    public String  getSpecJson()         { return specJson; }
    public String  getPackagePath()      { return packagePath; }
    public String  getDockerImage()      { return dockerImage; }
    public String  getClientConfigJson() { return clientConfigJson; }
    public Instant getCreatedAt()        { return createdAt; }
    public Instant getUpdatedAt()        { return updatedAt; }

    public void setVersion(String version)                   { this.version = version; }
    public void setDescription(String description)           { this.description = description; }
    public void setSpecJson(String specJson)                 { this.specJson = specJson; }
    public void setPackagePath(String packagePath)           { this.packagePath = packagePath; }
    public void setDockerImage(String dockerImage)           { this.dockerImage = dockerImage; }
    public void setClientConfigJson(String clientConfigJson) { this.clientConfigJson = clientConfigJson; }
}
