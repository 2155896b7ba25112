package com.mcpfactory.orchestrator.api;

import com.mcpfactory.orchestrator.api.dto.ServerListResponse;
import com.mcpfactory.orchestrator.registry.ServerEntry;
import com.mcpfactory.orchestrator.registry.ServerFilter;
import com.mcpfactory.orchestrator.registry.ServerRegistry;
import org.springframework.context.annotation.Profile;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

/**
 * REST API over the server registry.
 *
 * GET    /api/servers          list, filtered by name substring / version
 * GET    /api/servers/{name}   one server with its client config
 * DELETE /api/servers/{name}   unregister
 */
@RestController
@Profile("!standalone")
@RequestMapping("/api/servers")
public class ServerController {

    private final ServerRegistry registry;

    public ServerController(ServerRegistry registry) {
        this.registry = registry;
    }

    @GetMapping
    public ServerListResponse list(@RequestParam(required = false) String name,
                                   @RequestParam(required = false) String version,
                                   @RequestParam(required = false) Integer limit) {
        List<ServerEntry> servers = registry.enumerate(new ServerFilter(name, version, limit));
        return new ServerListResponse(servers, servers.size());
    }

    @GetMapping("/{name}")
    public ServerEntry get(@PathVariable String name,
                           @RequestParam(required = false) String version) {
        return registry.find(name, version)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Server not found: " + name));
    }

    @DeleteMapping("/{name}")
    public Map<String, Object> delete(@PathVariable String name) {
        if (!registry.remove(name)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Server not found: " + name);
        }
        return Map.of("success", true, "name", name);
    }
}
