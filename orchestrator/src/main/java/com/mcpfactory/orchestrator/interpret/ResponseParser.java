package com.mcpfactory.orchestrator.interpret;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the JSON document out of an interpreter reply.
 *
 * The model is asked for bare JSON but often wraps it in a markdown fence.
 * Lookup order:
 *   1. ```json ... ```
 *   2. ``` ... ```  (any or no language label)
 *   3. the whole reply
 */
public class ResponseParser {

    private static final Pattern JSON_BLOCK = Pattern.compile(
            "```json\\s*(.*?)\\s*```",
            Pattern.DOTALL
    );

    private static final Pattern ANY_BLOCK = Pattern.compile(
            "```[a-zA-Z]*\\s*(.*?)\\s*```",
            Pattern.DOTALL
    );

    private ResponseParser() {}

    /** Returns the JSON text (stripped); empty string for a null or blank reply. */
    public static String extractJson(String response) {
        if (response == null || response.isBlank()) {
            return "";
        }
        Matcher m = JSON_BLOCK.matcher(response);
        if (m.find()) {
            return m.group(1).strip();
        }
        m = ANY_BLOCK.matcher(response);
        if (m.find()) {
            return m.group(1).strip();
        }
        return response.strip();
    }
}
