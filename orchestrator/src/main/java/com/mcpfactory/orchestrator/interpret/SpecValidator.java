package com.mcpfactory.orchestrator.interpret;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Structural checks on a {@link ServerSpec}.
 *
 * Returns every problem found rather than stopping at the first one, so a
 * single error message can list them all.
 */
@Component
public class SpecValidator {

    private static final Pattern KEBAB_CASE = Pattern.compile("^[a-z][a-z0-9-]*$");
    private static final Pattern SNAKE_CASE = Pattern.compile("^[a-z][a-z0-9_]*$");

    public List<String> validate(ServerSpec spec) {
        List<String> errors = new ArrayList<>();
        if (spec == null) {
            errors.add("Spec is empty");
            return errors;
        }

        if (isBlank(spec.name()))        errors.add("Missing required field: name");
        if (isBlank(spec.description())) errors.add("Missing required field: description");
        if (spec.tools().isEmpty())      errors.add("At least one tool is required");

        if (!isBlank(spec.name()) && !KEBAB_CASE.matcher(spec.name()).matches()) {
            errors.add("Name must be kebab-case starting with letter");
        }

        for (int i = 0; i < spec.tools().size(); i++) {
            ToolSpec tool = spec.tools().get(i);
            if (isBlank(tool.name()))        errors.add("Tool " + i + ": missing name");
            if (isBlank(tool.description())) errors.add("Tool " + i + ": missing description");
            if (!isBlank(tool.name()) && !SNAKE_CASE.matcher(tool.name()).matches()) {
                errors.add("Tool " + tool.name() + ": must be snake_case");
            }
        }

        for (int i = 0; i < spec.resources().size(); i++) {
            ResourceSpec resource = spec.resources().get(i);
            if (isBlank(resource.name()))        errors.add("Resource " + i + ": missing name");
            if (isBlank(resource.uriTemplate())) errors.add("Resource " + i + ": missing uri_template");
            if (!isBlank(resource.name()) && !SNAKE_CASE.matcher(resource.name()).matches()) {
                errors.add("Resource " + resource.name() + ": must be snake_case");
            }
        }

        AuthSpec auth = spec.auth();
        if (!AuthSpec.TYPES.contains(auth.type())) {
            errors.add("Unsupported auth type: " + auth.type());
        } else if (auth.required() && !auth.hasEnvVar()) {
            errors.add("Auth requires env_var when type is not \"none\"");
        }

        return errors;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
