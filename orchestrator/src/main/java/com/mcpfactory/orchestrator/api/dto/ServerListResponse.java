package com.mcpfactory.orchestrator.api.dto;

import com.mcpfactory.orchestrator.registry.ServerEntry;

import java.util.List;

public record ServerListResponse(List<ServerEntry> servers, int count) {}
