package com.mcpfactory.orchestrator.api;

import com.mcpfactory.orchestrator.api.dto.SpecCheckResponse;
import com.mcpfactory.orchestrator.api.dto.ValidateRequest;
import com.mcpfactory.orchestrator.interpret.SpecValidator;
import com.mcpfactory.orchestrator.validation.ServerValidator;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.nio.file.Path;

/**
 * POST /api/validate: check a generated server directory or a bare spec
 * without running the pipeline.
 */
@RestController
@RequestMapping("/api")
public class ValidationController {

    private final ServerValidator serverValidator;
    private final SpecValidator   specValidator;

    public ValidationController(ServerValidator serverValidator, SpecValidator specValidator) {
        this.serverValidator = serverValidator;
        this.specValidator   = specValidator;
    }

    /**
     * Directory → {@link com.mcpfactory.orchestrator.validation.ValidationReport};
     * spec → {@link SpecCheckResponse}. 400 if neither is given.
     */
    @PostMapping("/validate")
    public Object validate(@RequestBody ValidateRequest req) {
        if (req.serverDir() != null && !req.serverDir().isBlank()) {
            return serverValidator.validate(Path.of(req.serverDir()));
        }
        if (req.spec() != null) {
            return SpecCheckResponse.of(specValidator.validate(req.spec()));
        }
        throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Provide either serverDir or spec");
    }
}
